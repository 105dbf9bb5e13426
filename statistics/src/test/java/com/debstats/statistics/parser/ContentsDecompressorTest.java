package com.debstats.statistics.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ContentsDecompressor}.
 */
class ContentsDecompressorTest {

    private final ContentsDecompressor decompressor = new ContentsDecompressor();

    @Test
    @DisplayName("Inflates a gzip file from disk")
    void decompressFile() throws Exception {
        String text = decompressor.decompress(resource("/contents/Contents-amd64.gz"));

        assertEquals("/bin/a   pkgX,pkgY\n/bin/b   pkgX\n/bin/c   pkgZ\n", text);
    }

    @Test
    @DisplayName("Inflates UTF-8 text from a stream")
    void decompressStream() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(bytes)) {
            gzip.write("usr/share/doc/café/README pkg\n".getBytes(StandardCharsets.UTF_8));
        }

        String text = decompressor.decompress(new ByteArrayInputStream(bytes.toByteArray()));

        assertEquals("usr/share/doc/café/README pkg\n", text);
    }

    @Test
    @DisplayName("Throws IOException for data that is not gzip")
    void corruptInput_throws() {
        assertThrows(IOException.class, () -> decompressor.decompress(resource("/contents/corrupt.gz")));
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(ContentsDecompressorTest.class.getResource(name).toURI());
    }
}
