package com.example.webcrawler.report;

import java.time.Instant;

/**
 * Serialized description of one fetched page. {@code bodyFile} names the saved body
 * in the output directory and is null unless page saving is on.
 */
public record PageRecord(
        String url,
        int depth,
        String parent,
        int statusCode,
        String contentType,
        PageType pageType,
        String domain,
        long responseTimeMillis,
        int linksFound,
        int linksAdmitted,
        boolean keywordMatched,
        String userAgent,
        String bodyFile,
        Instant fetchedAt
) {
}
