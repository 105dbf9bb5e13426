package com.debstats.statistics.aggregate;

import com.debstats.statistics.parser.ContentsLineParser;
import com.debstats.statistics.parser.MalformedLineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Counts how many files each package owns in a decompressed Contents index.
 */
public final class PackageFileCounter {

    private static final Logger logger = LoggerFactory.getLogger(PackageFileCounter.class);

    static final String HEADER_PACKAGE_COLUMN = "LOCATION";
    static final String HEADER_FILE_COLUMN = "FILE";

    private PackageFileCounter() {
    }

    /**
     * Maps every package in {@code text} to the number of lines that list it.
     * An optional {@code FILE ... LOCATION} header on the first line is skipped.
     *
     * @throws MalformedLineException for the first non-header line that has no
     *                                whitespace separator
     */
    public static Map<String, Integer> countFiles(String text) {
        Map<String, Integer> counts = new HashMap<>();
        Iterator<String> lines = text.lines().iterator();

        int lineNumber = 0;
        while (lines.hasNext()) {
            String line = lines.next();
            lineNumber++;

            if (lineNumber == 1 && isHeader(line)) {
                logger.debug("Skipping header line: {}", line);
                continue;
            }

            List<String> packages;
            try {
                packages = ContentsLineParser.parsePackages(line);
            } catch (MalformedLineException e) {
                throw e.atLine(lineNumber);
            }
            for (String name : packages) {
                counts.merge(name, 1, Integer::sum);
            }
        }

        logger.debug("Counted {} packages over {} lines", counts.size(), lineNumber);
        return counts;
    }

    static boolean isHeader(String line) {
        if (!line.contains(HEADER_FILE_COLUMN)) {
            return false;
        }
        try {
            return ContentsLineParser.parsePackages(line).equals(List.of(HEADER_PACKAGE_COLUMN));
        } catch (MalformedLineException e) {
            // reported as malformed data by countFiles
            return false;
        }
    }
}
