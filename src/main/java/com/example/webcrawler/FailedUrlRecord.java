package com.example.webcrawler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public class FailedUrlRecord {
    public enum Reason {
        TIMEOUT,
        TRANSPORT_ERROR,
        HTTP_ERROR
    }

    private final String url;
    private final int depth;
    private final Reason reason;
    private final int statusCode;
    private final String message;
    private final int attempts;
    private final Instant failedAt;

    @JsonCreator
    public FailedUrlRecord(@JsonProperty("url") String url,
                           @JsonProperty("depth") int depth,
                           @JsonProperty("reason") Reason reason,
                           @JsonProperty("statusCode") int statusCode,
                           @JsonProperty("message") String message,
                           @JsonProperty("attempts") int attempts,
                           @JsonProperty("failedAt") Instant failedAt) {
        this.url = url;
        this.depth = depth;
        this.reason = reason;
        this.statusCode = statusCode;
        this.message = message;
        this.attempts = attempts;
        this.failedAt = failedAt;
    }

    /**
     * Builds the record for a fetch that did not produce a usable page.
     */
    public static FailedUrlRecord of(FrontierEntry entry, FetchResult result, int attempts, Instant failedAt) {
        return switch (result.outcome()) {
            case TIMEOUT -> new FailedUrlRecord(entry.url(), entry.depth(), Reason.TIMEOUT, 0,
                    result.error(), attempts, failedAt);
            case TRANSPORT_ERROR -> new FailedUrlRecord(entry.url(), entry.depth(), Reason.TRANSPORT_ERROR, 0,
                    result.error(), attempts, failedAt);
            case SUCCESS -> new FailedUrlRecord(entry.url(), entry.depth(), Reason.HTTP_ERROR, result.statusCode(),
                    "HTTP " + result.statusCode(), attempts, failedAt);
        };
    }

    public String getUrl() {
        return url;
    }

    public int getDepth() {
        return depth;
    }

    public Reason getReason() {
        return reason;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getMessage() {
        return message;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getFailedAt() {
        return failedAt;
    }
}
