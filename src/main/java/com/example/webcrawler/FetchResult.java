package com.example.webcrawler;

import java.time.Duration;
import java.util.Locale;

/**
 * Outcome of one fetch attempt. HTTP error statuses are still {@link Outcome#SUCCESS}: the
 * transport worked and the status code tells the rest.
 */
public record FetchResult(
        Outcome outcome,
        int statusCode,
        String body,
        String contentType,
        String finalUrl,
        String location,
        String error,
        Duration elapsed
) {
    public enum Outcome {
        SUCCESS,
        TIMEOUT,
        TRANSPORT_ERROR
    }

    public static FetchResult success(int statusCode,
                                      String body,
                                      String contentType,
                                      String finalUrl,
                                      String location,
                                      Duration elapsed) {
        return new FetchResult(Outcome.SUCCESS, statusCode, body, contentType, finalUrl, location, null, elapsed);
    }

    public static FetchResult timeout(String error, Duration elapsed) {
        return new FetchResult(Outcome.TIMEOUT, 0, null, null, null, null, error, elapsed);
    }

    public static FetchResult transportError(String error, Duration elapsed) {
        return new FetchResult(Outcome.TRANSPORT_ERROR, 0, null, null, null, null, error, elapsed);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isHttpError() {
        return isSuccess() && statusCode >= 400;
    }

    public boolean isRedirect() {
        return isSuccess() && statusCode >= 300 && statusCode < 400 && location != null;
    }

    public boolean isHtml() {
        if (contentType == null) {
            return false;
        }
        String type = contentType.toLowerCase(Locale.ROOT);
        return type.startsWith("text/html") || type.startsWith("application/xhtml+xml");
    }
}
