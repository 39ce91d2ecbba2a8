package com.example.webcrawler;

import org.apache.tika.Tika;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * {@link PageFetcher} on top of jsoup's HTTP connection. When the server sends no Content-Type,
 * the type is sniffed from the body with Tika so link extraction can still decide on HTML.
 */
public final class JsoupPageFetcher implements PageFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsoupPageFetcher.class);
    private static final int DEFAULT_MAX_BODY_BYTES = 10 * 1024 * 1024;

    private final boolean followRedirects;
    private final int maxBodyBytes;
    private final Tika tika;

    public JsoupPageFetcher(boolean followRedirects) {
        this(followRedirects, DEFAULT_MAX_BODY_BYTES, new Tika());
    }

    public JsoupPageFetcher(boolean followRedirects, int maxBodyBytes, Tika tika) {
        this.followRedirects = followRedirects;
        this.maxBodyBytes = maxBodyBytes;
        this.tika = tika;
    }

    @Override
    public FetchResult fetch(String url, Duration timeout, String userAgent) {
        long started = System.nanoTime();
        try {
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                    .followRedirects(followRedirects)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .maxBodySize(maxBodyBytes)
                    .execute();
            byte[] bytes = response.bodyAsBytes();
            String body = response.body();
            String contentType = response.contentType();
            if (contentType == null || contentType.isBlank()) {
                contentType = tika.detect(bytes, response.url().getPath());
            }
            return FetchResult.success(
                    response.statusCode(),
                    body,
                    contentType,
                    response.url().toString(),
                    response.header("Location"),
                    elapsedSince(started)
            );
        } catch (SocketTimeoutException ex) {
            LOGGER.debug("Timed out fetching {}", url, ex);
            return FetchResult.timeout(ex.getMessage(), elapsedSince(started));
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.debug("Transport error fetching {}", url, ex);
            return FetchResult.transportError(ex.getClass().getSimpleName() + ": " + ex.getMessage(), elapsedSince(started));
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
