package com.example.webcrawler;

import java.time.Duration;

/**
 * HTTP transport used by the fetch workers. Implementations must not throw for network failures;
 * they report them as {@link FetchResult.Outcome#TIMEOUT} or {@link FetchResult.Outcome#TRANSPORT_ERROR}.
 */
@FunctionalInterface
public interface PageFetcher {
    FetchResult fetch(String url, Duration timeout, String userAgent);
}
