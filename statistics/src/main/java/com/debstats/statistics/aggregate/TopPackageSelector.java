package com.debstats.statistics.aggregate;

import com.debstats.statistics.model.PackageCount;
import com.debstats.statistics.model.Selection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Selects the packages owning the most files without sorting the whole
 * mapping: the entries are heapified in O(N) and the top K are popped in
 * O(K log N).
 */
public final class TopPackageSelector {

    /** Most files first, then package name ascending. */
    public static final Comparator<PackageCount> BY_FILES_DESCENDING =
            Comparator.comparingInt(PackageCount::count).reversed()
                    .thenComparing(PackageCount::name);

    private TopPackageSelector() {
    }

    public static List<PackageCount> topK(Map<String, Integer> counts, Selection selection) {
        if (counts.isEmpty()) {
            return Collections.emptyList();
        }

        PackageCount[] heap = new PackageCount[counts.size()];
        int size = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            heap[size++] = new PackageCount(entry.getKey(), entry.getValue());
        }
        heapify(heap, size);

        int limit = selection.limit(size);
        List<PackageCount> result = new ArrayList<>(limit);
        while (result.size() < limit) {
            result.add(heap[0]);
            size--;
            heap[0] = heap[size];
            heap[size] = null;
            siftDown(heap, 0, size);
        }
        return result;
    }

    private static void heapify(PackageCount[] heap, int size) {
        for (int i = (size >>> 1) - 1; i >= 0; i--) {
            siftDown(heap, i, size);
        }
    }

    // Root holds the entry that BY_FILES_DESCENDING orders first.
    private static void siftDown(PackageCount[] heap, int index, int size) {
        PackageCount item = heap[index];
        int half = size >>> 1;
        while (index < half) {
            int child = 2 * index + 1;
            int right = child + 1;
            if (right < size && BY_FILES_DESCENDING.compare(heap[right], heap[child]) < 0) {
                child = right;
            }
            if (BY_FILES_DESCENDING.compare(item, heap[child]) <= 0) {
                break;
            }
            heap[index] = heap[child];
            index = child;
        }
        if (size > 0) {
            heap[index] = item;
        }
    }
}
