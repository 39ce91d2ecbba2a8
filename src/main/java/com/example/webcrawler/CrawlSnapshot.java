package com.example.webcrawler;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Serializable checkpoint payload for resuming a crawl.
 */
public record CrawlSnapshot(
        int formatVersion,
        ConfigFingerprint fingerprint,
        Instant createdAt,
        List<VisitedRecord> visited,
        List<FrontierEntry> frontier,
        Map<String, PathTracker.PathNode> paths,
        List<FailedUrlRecord> failed,
        List<String> keywordMatches,
        long pagesFetched,
        int nextSequence
) {
    public static final int FORMAT_VERSION = 1;
}
