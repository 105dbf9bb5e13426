package com.debstats.statistics.orchestrator;

import com.debstats.statistics.cache.ContentsCache;
import com.debstats.statistics.client.ContentsClient;
import com.debstats.statistics.config.AppConfig;
import com.debstats.statistics.config.Architectures;
import com.debstats.statistics.model.PackageCount;
import com.debstats.statistics.model.Selection;
import com.debstats.statistics.parser.ContentsDecompressor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Main entry point for the package statistics tool.
 * Parses CLI arguments, initializes components, runs the pipeline,
 * and exits with appropriate status codes.
 *
 * <p>Usage:
 * <pre>
 *   java -jar statistics.jar amd64           # top 10 packages for amd64
 *   java -jar statistics.jar arm64 25        # top 25
 *   java -jar statistics.jar source all      # every package
 *   java -jar statistics.jar i386 5 --json   # JSON output
 * </pre>
 */
public class PackageStatisticsApp {

    private static final Logger logger = LoggerFactory.getLogger(PackageStatisticsApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String JSON_FLAG = "--json";

    public static void main(String[] args) {
        Set<String> architectures = Architectures.SUPPORTED;

        AppConfig config;
        try {
            config = new AppConfig();
        } catch (IllegalStateException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(EXIT_FAILURE);
            return;
        }

        Arguments arguments;
        try {
            arguments = parseArguments(args, config.getDefaultTopCount(), architectures);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println();
            System.err.println(usageMessage(architectures));
            System.exit(EXIT_USAGE);
            return;
        }

        ContentsClient client = new ContentsClient(config.getMirrorUrl(), config.getHttpTimeoutSeconds());
        ContentsCache cache = new ContentsCache(config.getDownloadsDir(), client);
        PackageStatistics statistics = new PackageStatistics(cache, new ContentsDecompressor());

        System.exit(run(arguments, statistics, new ReportFormatter(), System.out));
    }

    /**
     * Runs the pipeline for already validated arguments and prints the report.
     */
    static int run(Arguments arguments, PackageStatistics statistics, ReportFormatter formatter, PrintStream out) {
        try {
            List<PackageCount> packages = statistics.getTopPackages(arguments.architecture(), arguments.selection());
            out.print(arguments.json() ? formatter.json(packages) + System.lineSeparator() : formatter.table(packages));
            out.flush();
            logger.info("Package statistics for {} finished successfully.", arguments.architecture());
            return EXIT_OK;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while computing statistics for {}", arguments.architecture(), e);
            return EXIT_FAILURE;
        } catch (Exception e) {
            logger.error("Failed to compute package statistics for {}", arguments.architecture(), e);
            return EXIT_FAILURE;
        }
    }

    /**
     * Parses {@code ARCHITECTURE [COUNT|all] [--json]} against the given
     * supported architectures. Extra positional arguments are ignored.
     *
     * @throws IllegalArgumentException if the architecture is missing or
     *                                  unsupported, or COUNT is invalid
     */
    static Arguments parseArguments(String[] args, int defaultCount, Set<String> supportedArchitectures) {
        boolean json = false;
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            if (JSON_FLAG.equals(arg)) {
                json = true;
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            } else {
                positional.add(arg);
            }
        }

        if (positional.isEmpty()) {
            throw new IllegalArgumentException("Missing architecture argument.");
        }
        String architecture = positional.get(0);
        if (!supportedArchitectures.contains(architecture)) {
            throw new UnsupportedArchitectureException(architecture);
        }

        Selection selection = positional.size() > 1
                ? Selection.parse(positional.get(1))
                : Selection.top(defaultCount);
        if (positional.size() > 2) {
            logger.warn("Ignoring extra arguments: {}", positional.subList(2, positional.size()));
        }

        return new Arguments(architecture, selection, json);
    }

    static String usageMessage(Set<String> supportedArchitectures) {
        return "Usage: package-statistics ARCHITECTURE [COUNT|all] [" + JSON_FLAG + "]\n\n"
                + "Supported architectures: " + String.join(" ", supportedArchitectures);
    }

    record Arguments(String architecture, Selection selection, boolean json) {}
}
