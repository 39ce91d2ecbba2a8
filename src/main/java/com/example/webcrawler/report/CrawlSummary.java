package com.example.webcrawler.report;

import com.example.webcrawler.CrawlState;
import com.example.webcrawler.FailedUrlRecord;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Final report of a crawl run. The longest-path fields are only set in exfiltration mode.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CrawlSummary(
        CrawlState state,
        Instant startedAt,
        Instant finishedAt,
        List<String> seeds,
        long pagesFetched,
        int visitedCount,
        int maxDepthReached,
        int pendingCount,
        List<FailedUrlRecord> failed,
        List<String> keywordMatches,
        Integer longestPathLength,
        List<String> longestPath
) {
    public int failedCount() {
        return failed.size();
    }
}
