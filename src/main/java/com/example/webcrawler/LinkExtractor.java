package com.example.webcrawler;

import java.util.List;

/**
 * Pulls outbound links from a fetched page. Returned strings are raw and may be malformed;
 * the coordinator normalizes and filters them.
 */
@FunctionalInterface
public interface LinkExtractor {
    List<String> extractLinks(String body, String baseUrl);
}
