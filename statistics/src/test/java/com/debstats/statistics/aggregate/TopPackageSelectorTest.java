package com.debstats.statistics.aggregate;

import com.debstats.statistics.model.PackageCount;
import com.debstats.statistics.model.Selection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TopPackageSelector}.
 */
class TopPackageSelectorTest {

    private static final Map<String, Integer> SAMPLE = Map.of("pkgX", 2, "pkgY", 1, "pkgZ", 1);

    @Test
    @DisplayName("Top 2 puts the strictly larger count first and breaks ties by name")
    void topTwo() {
        assertEquals(List.of(new PackageCount("pkgX", 2), new PackageCount("pkgY", 1)),
                TopPackageSelector.topK(SAMPLE, Selection.top(2)));
    }

    @Test
    @DisplayName("All returns every entry in non-increasing count order")
    void all() {
        List<PackageCount> result = TopPackageSelector.topK(SAMPLE, Selection.all());

        assertEquals(List.of(new PackageCount("pkgX", 2), new PackageCount("pkgY", 1),
                new PackageCount("pkgZ", 1)), result);
    }

    @Test
    @DisplayName("K larger than the number of packages equals All")
    void kBeyondSize() {
        assertEquals(TopPackageSelector.topK(SAMPLE, Selection.all()),
                TopPackageSelector.topK(SAMPLE, Selection.top(50)));
        assertEquals(TopPackageSelector.topK(SAMPLE, Selection.all()),
                TopPackageSelector.topK(SAMPLE, Selection.top(3)));
    }

    @Test
    @DisplayName("Empty mapping yields an empty result for any selection")
    void emptyMapping() {
        assertTrue(TopPackageSelector.topK(Map.of(), Selection.all()).isEmpty());
        assertTrue(TopPackageSelector.topK(Map.of(), Selection.top(5)).isEmpty());
    }

    @Test
    @DisplayName("Single package is returned for top 1")
    void singleEntry() {
        assertEquals(List.of(new PackageCount("only", 7)),
                TopPackageSelector.topK(Map.of("only", 7), Selection.top(1)));
    }

    @Test
    @DisplayName("Equal counts are ordered by package name ascending")
    void tieBreakByName() {
        Map<String, Integer> counts = Map.of("delta", 3, "alpha", 3, "charlie", 3, "bravo", 3);

        List<String> names = TopPackageSelector.topK(counts, Selection.all()).stream()
                .map(PackageCount::name)
                .toList();

        assertEquals(List.of("alpha", "bravo", "charlie", "delta"), names);
    }

    @Test
    @DisplayName("Matches a full sort on a large random mapping")
    void matchesFullSort() {
        Random random = new Random(42);
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < 5_000; i++) {
            counts.put("pkg" + i, random.nextInt(200));
        }

        List<PackageCount> expected = counts.entrySet().stream()
                .map(e -> new PackageCount(e.getKey(), e.getValue()))
                .sorted(TopPackageSelector.BY_FILES_DESCENDING)
                .toList();

        assertEquals(expected.subList(0, 25), TopPackageSelector.topK(counts, Selection.top(25)));
        assertEquals(expected, TopPackageSelector.topK(counts, Selection.all()));
    }

    @Test
    @DisplayName("Local fixture yields packages A to E with counts 5 to 1")
    void fixture() throws IOException {
        String text;
        try (InputStream in = getClass().getResourceAsStream("/contents/test_contents")) {
            text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        List<PackageCount> result = TopPackageSelector.topK(PackageFileCounter.countFiles(text), Selection.all());

        assertEquals(List.of(
                new PackageCount("packageA", 5),
                new PackageCount("packageB", 4),
                new PackageCount("packageC", 3),
                new PackageCount("packageD", 2),
                new PackageCount("packageE", 1)), result);
    }
}
