package com.debstats.statistics.orchestrator;

import com.debstats.statistics.aggregate.PackageFileCounter;
import com.debstats.statistics.aggregate.TopPackageSelector;
import com.debstats.statistics.cache.ContentsCache;
import com.debstats.statistics.model.PackageCount;
import com.debstats.statistics.model.Selection;
import com.debstats.statistics.parser.ContentsDecompressor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Coordinates the statistics pipeline: cache/download -> decompress -> count -> select.
 */
public class PackageStatistics {

    private static final Logger logger = LoggerFactory.getLogger(PackageStatistics.class);

    private final ContentsCache cache;
    private final ContentsDecompressor decompressor;

    public PackageStatistics(ContentsCache cache, ContentsDecompressor decompressor) {
        this.cache = cache;
        this.decompressor = decompressor;
    }

    /**
     * Returns the packages owning the most files for {@code architecture},
     * which the caller has already checked against the supported set.
     *
     * @throws IOException if the index cannot be downloaded or inflated
     */
    public List<PackageCount> getTopPackages(String architecture, Selection selection)
            throws IOException, InterruptedException {
        logger.info("Computing package statistics for {} (selection: {})", architecture, selection);

        long stepStart = System.currentTimeMillis();
        Path contents = cache.maybeDownload(architecture);
        logger.info("Contents index ready in {}ms", System.currentTimeMillis() - stepStart);

        stepStart = System.currentTimeMillis();
        String text = decompressor.decompress(contents);
        logger.info("Decompressed {} in {}ms", contents.getFileName(), System.currentTimeMillis() - stepStart);

        stepStart = System.currentTimeMillis();
        Map<String, Integer> counts = PackageFileCounter.countFiles(text);
        List<PackageCount> top = TopPackageSelector.topK(counts, selection);
        logger.info("Selected {} of {} packages in {}ms",
                top.size(), counts.size(), System.currentTimeMillis() - stepStart);

        return top;
    }
}
