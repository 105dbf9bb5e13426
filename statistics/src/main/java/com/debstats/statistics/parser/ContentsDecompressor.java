package com.debstats.statistics.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Inflates a gzip-compressed Contents index into text.
 */
public class ContentsDecompressor {

    private static final Logger logger = LoggerFactory.getLogger(ContentsDecompressor.class);

    public String decompress(Path gzFile) throws IOException {
        try (InputStream in = Files.newInputStream(gzFile)) {
            String text = decompress(in);
            logger.debug("Decompressed {} into {} characters", gzFile, text.length());
            return text;
        }
    }

    public String decompress(InputStream gzStream) throws IOException {
        try (GZIPInputStream gis = new GZIPInputStream(gzStream)) {
            return new String(gis.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
