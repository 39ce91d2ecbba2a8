package com.example.webcrawler;

import java.time.Instant;

/**
 * Ledger entry for a claimed URL key.
 */
public record VisitedRecord(
        String url,
        Instant firstSeen,
        int depth
) {
}
