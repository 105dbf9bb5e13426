package com.debstats.statistics.cache;

import com.debstats.statistics.client.ContentsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Flat on-disk cache of downloaded Contents indices, keyed by architecture.
 * Entries are never refreshed; delete the file to force a new download.
 */
public class ContentsCache {

    private static final Logger logger = LoggerFactory.getLogger(ContentsCache.class);

    private final Path directory;
    private final ContentsClient client;

    public ContentsCache(Path directory, ContentsClient client) {
        this.directory = directory;
        this.client = client;
    }

    public Path pathFor(String architecture) {
        return directory.resolve(ContentsClient.contentsFileName(architecture));
    }

    public boolean contains(String architecture) {
        return Files.isRegularFile(pathFor(architecture));
    }

    /**
     * Returns the cached Contents index for {@code architecture}, downloading
     * it first if it is not cached yet.
     */
    public Path maybeDownload(String architecture) throws IOException, InterruptedException {
        Files.createDirectories(directory);

        Path path = pathFor(architecture);
        if (Files.isRegularFile(path)) {
            logger.info("Using cached {}", path);
            return path;
        }

        client.download(architecture, path);
        return path;
    }
}
