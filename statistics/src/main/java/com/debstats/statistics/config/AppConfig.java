package com.debstats.statistics.config;

import io.github.cdimascio.dotenv.Dotenv;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Every setting has a default,
 * but values that are present are validated on startup; the mirror must be
 * an http(s) URL.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    public static final String DEFAULT_MIRROR = "http://ftp.uk.debian.org/debian/dists/stable/main/";
    public static final String DEFAULT_DOWNLOADS_DIR = "./downloads/";
    public static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 60;
    public static final int DEFAULT_TOP_COUNT = 10;

    private final String mirrorUrl;
    private final Path downloadsDir;
    private final int httpTimeoutSeconds;
    private final int defaultTopCount;

    public AppConfig() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        String mirror = resolve(dotenv, "DEBIAN_MIRROR", DEFAULT_MIRROR);
        String downloads = resolve(dotenv, "DOWNLOADS_DIR", DEFAULT_DOWNLOADS_DIR);
        String timeout = resolve(dotenv, "HTTP_TIMEOUT_SECONDS", String.valueOf(DEFAULT_HTTP_TIMEOUT_SECONDS));
        String topCount = resolve(dotenv, "DEFAULT_TOP_COUNT", String.valueOf(DEFAULT_TOP_COUNT));

        StringBuilder invalid = new StringBuilder();
        this.httpTimeoutSeconds = parsePositive(timeout, "HTTP_TIMEOUT_SECONDS", invalid);
        this.defaultTopCount = parsePositive(topCount, "DEFAULT_TOP_COUNT", invalid);
        if (!invalid.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid environment variables: " + invalid.toString().trim());
        }
        this.mirrorUrl = mirror;
        this.downloadsDir = Path.of(downloads);

        validate();

        logger.info("Configuration loaded: mirror={}, downloadsDir={}", mirrorUrl, downloadsDir);
    }

    /**
     * Constructor for testing — accepts values directly.
     */
    public AppConfig(String mirrorUrl, Path downloadsDir, int httpTimeoutSeconds, int defaultTopCount) {
        this.mirrorUrl = mirrorUrl;
        this.downloadsDir = downloadsDir;
        this.httpTimeoutSeconds = httpTimeoutSeconds;
        this.defaultTopCount = defaultTopCount;

        validate();
    }

    private void validate() {
        StringBuilder invalid = new StringBuilder();
        if (isBlank(mirrorUrl) || HttpUrl.parse(mirrorUrl) == null) invalid.append("DEBIAN_MIRROR ");
        if (downloadsDir == null || downloadsDir.toString().isBlank()) invalid.append("DOWNLOADS_DIR ");
        if (httpTimeoutSeconds <= 0) invalid.append("HTTP_TIMEOUT_SECONDS ");
        if (defaultTopCount <= 0) invalid.append("DEFAULT_TOP_COUNT ");

        if (!invalid.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid environment variables: " + invalid.toString().trim());
        }
    }

    private static String resolve(Dotenv dotenv, String key, String defaultValue) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        String dotenvValue = dotenv.get(key);
        return dotenvValue != null && !dotenvValue.isBlank() ? dotenvValue : defaultValue;
    }

    private static int parsePositive(String value, String key, StringBuilder invalid) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                return parsed;
            }
        } catch (NumberFormatException ignored) {
            // reported below
        }
        invalid.append(key).append(' ');
        return -1;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getMirrorUrl() {
        return mirrorUrl;
    }

    public Path getDownloadsDir() {
        return downloadsDir;
    }

    public int getHttpTimeoutSeconds() {
        return httpTimeoutSeconds;
    }

    public int getDefaultTopCount() {
        return defaultTopCount;
    }
}
