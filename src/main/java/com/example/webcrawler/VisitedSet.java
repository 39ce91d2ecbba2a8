package com.example.webcrawler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deduplication ledger of every URL key that has been enqueued during one logical crawl.
 * Entries are never evicted.
 */
public final class VisitedSet {
    private final ConcurrentHashMap<String, VisitedRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public VisitedSet() {
        this(Clock.systemUTC());
    }

    VisitedSet(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records {@code key} if it is not present yet. Exactly one caller per key ever sees {@code true}.
     */
    public boolean tryClaim(String key, int depth) {
        return records.putIfAbsent(key, new VisitedRecord(key, clock.instant(), depth)) == null;
    }

    public boolean contains(String key) {
        return records.containsKey(key);
    }

    public int size() {
        return records.size();
    }

    /**
     * Returns a copy of the ledger ordered by depth, then by first-seen time.
     */
    public List<VisitedRecord> records() {
        List<VisitedRecord> copy = new ArrayList<>(records.values());
        copy.sort(Comparator.comparingInt(VisitedRecord::depth)
                .thenComparing(VisitedRecord::firstSeen)
                .thenComparing(VisitedRecord::url));
        return copy;
    }

    /**
     * Loads checkpointed records. Keys already present are kept.
     */
    public void restore(Collection<VisitedRecord> snapshot) {
        for (VisitedRecord record : snapshot) {
            records.putIfAbsent(record.url(), record);
        }
    }
}
