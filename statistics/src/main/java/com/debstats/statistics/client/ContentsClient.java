package com.debstats.statistics.client;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.TimeUnit;

/**
 * Downloads Contents indices from a Debian mirror, with exponential backoff
 * retry on 429/503 responses.
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient} is thread-safe and this
 * class holds no mutable per-request state.</p>
 */
public class ContentsClient {

    private static final Logger logger = LoggerFactory.getLogger(ContentsClient.class);

    private static final long INITIAL_BACKOFF_MS = 1_000;
    private static final long MAX_BACKOFF_MS = 30_000;
    private static final int MAX_RETRIES = 4; // 1s, 2s, 4s, 8s

    private final OkHttpClient httpClient;
    private final HttpUrl mirrorUrl;

    public ContentsClient(String mirrorUrl, int timeoutSeconds) {
        this(mirrorUrl, defaultHttpClient(timeoutSeconds));
    }

    public ContentsClient(String mirrorUrl, OkHttpClient httpClient) {
        HttpUrl parsed = HttpUrl.parse(mirrorUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid mirror URL: " + mirrorUrl);
        }
        this.mirrorUrl = parsed;
        this.httpClient = httpClient;
    }

    private static OkHttpClient defaultHttpClient(int timeoutSeconds) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Returns the file name of the Contents index for an architecture,
     * e.g. {@code Contents-amd64.gz}.
     */
    public static String contentsFileName(String architecture) {
        return "Contents-" + architecture + ".gz";
    }

    /**
     * Downloads the Contents index for {@code architecture} into {@code target}.
     * The body is streamed to a sibling temporary file and moved into place
     * once complete, so {@code target} never holds a partial download.
     *
     * @throws IOException on network failure, a non-2xx status, or after
     *                     exhausting retries
     */
    public void download(String architecture, Path target) throws IOException, InterruptedException {
        HttpUrl url = contentsUrl(architecture);
        Request request = new Request.Builder().url(url).get().build();
        logger.info("Downloading {} to {}", url, target);

        Path temp = Files.createTempFile(target.toAbsolutePath().getParent(), target.getFileName().toString(), ".part");
        try {
            long bytes = executeWithRetry(request, temp);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.info("Downloaded {} bytes for {}", bytes, architecture);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    HttpUrl contentsUrl(String architecture) {
        return mirrorUrl.newBuilder()
                .addPathSegment(contentsFileName(architecture))
                .build();
    }

    /**
     * Executes a request, retrying on 429/503, and streams a successful body
     * into {@code destination}.
     *
     * @return the number of bytes written
     */
    long executeWithRetry(Request request, Path destination) throws IOException, InterruptedException {
        long backoffMs = INITIAL_BACKOFF_MS;

        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                int statusCode = response.code();
                logger.debug("GET {} -> {}", request.url(), statusCode);

                if (statusCode == 429 || statusCode == 503) {
                    if (attempt == MAX_RETRIES) {
                        throw new IOException("Max retries exceeded for " + request.url()
                                + " (last status: " + statusCode + ")");
                    }
                    long waitMs = getRetryWaitMs(response, backoffMs);
                    logger.warn("Received {} from {}. Retrying in {}ms (attempt {}/{})",
                            statusCode, request.url(), waitMs, attempt + 1, MAX_RETRIES);
                    Thread.sleep(waitMs);
                    backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
                    continue;
                }

                if (statusCode < 200 || statusCode >= 300) {
                    throw new IOException("Mirror error: " + statusCode + " for " + request.url());
                }

                ResponseBody body = response.body();
                if (body == null) {
                    throw new IOException("Empty response body for " + request.url());
                }
                try (InputStream in = body.byteStream()) {
                    return Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }

        throw new IOException("Exhausted retries for " + request.url());
    }

    /**
     * Determines wait time for retries. Uses Retry-After header if present,
     * otherwise falls back to exponential backoff.
     */
    long getRetryWaitMs(Response response, long backoffMs) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            try {
                return Long.parseLong(retryAfter.trim()) * 1_000;
            } catch (NumberFormatException ignored) {
                // fall through to backoff
            }
        }
        return backoffMs;
    }
}
