package com.example.webcrawler;

/**
 * Decides when a crawl pauses early. A paused crawl leaves a checkpoint and can be resumed.
 */
public interface ProcessingLimiter {
    boolean shouldStop(long pagesFetched);

    ProcessingLimiter NO_LIMIT = pagesFetched -> false;

    /**
     * Pauses once {@code maxPages} fetch results have been processed, counting those of earlier runs.
     */
    static ProcessingLimiter maxPages(long maxPages) {
        return pagesFetched -> pagesFetched >= maxPages;
    }
}
