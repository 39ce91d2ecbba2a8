package com.example.webcrawler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Depth-ordered work queue. Entries are FIFO within a depth and shallower depths are handed out
 * first. Entries that have been taken stay "in flight" until {@link #complete(FrontierEntry)},
 * so an empty queue with outstanding fetches is not mistaken for the end of the crawl.
 */
public final class Frontier {
    private final int maxDepth;
    private final NavigableMap<Integer, Deque<FrontierEntry>> queues = new TreeMap<>();
    private final Map<String, FrontierEntry> inFlight = new LinkedHashMap<>();
    private int queued;
    private boolean closed;

    public Frontier(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Queues an entry. Returns {@code false} without queueing when the entry is deeper than the
     * configured maximum or the frontier has been closed.
     */
    public synchronized boolean push(FrontierEntry entry) {
        if (closed || entry.depth() > maxDepth) {
            return false;
        }
        queues.computeIfAbsent(entry.depth(), ignored -> new ArrayDeque<>()).addLast(entry);
        queued++;
        notifyAll();
        return true;
    }

    /**
     * Blocks until an entry is available. Returns empty once the frontier is drained
     * (nothing queued and nothing in flight) or closed.
     */
    public synchronized Optional<FrontierEntry> take() throws InterruptedException {
        while (true) {
            if (closed) {
                return Optional.empty();
            }
            Optional<FrontierEntry> next = poll();
            if (next.isPresent() || inFlight.isEmpty()) {
                return next;
            }
            wait();
        }
    }

    /**
     * Non-blocking variant of {@link #take()}.
     */
    public synchronized Optional<FrontierEntry> poll() {
        if (closed || queued == 0) {
            return Optional.empty();
        }
        Map.Entry<Integer, Deque<FrontierEntry>> shallowest = queues.firstEntry();
        FrontierEntry entry = shallowest.getValue().removeFirst();
        if (shallowest.getValue().isEmpty()) {
            queues.remove(shallowest.getKey());
        }
        queued--;
        inFlight.put(entry.url(), entry);
        return Optional.of(entry);
    }

    /**
     * Releases an entry handed out by {@link #take()}. Called after its children were pushed.
     */
    public synchronized void complete(FrontierEntry entry) {
        if (inFlight.remove(entry.url()) != null) {
            notifyAll();
        }
    }

    public synchronized boolean isDrained() {
        return queued == 0 && inFlight.isEmpty();
    }

    /**
     * Stops handing out work and wakes every blocked {@link #take()}.
     */
    public synchronized void close() {
        closed = true;
        notifyAll();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int size() {
        return queued;
    }

    public synchronized int inFlightCount() {
        return inFlight.size();
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Copies the outstanding work: in-flight entries first (their results may never be processed),
     * then queued entries in dequeue order.
     */
    public synchronized List<FrontierEntry> snapshot() {
        List<FrontierEntry> copy = new ArrayList<>(inFlight.size() + queued);
        copy.addAll(inFlight.values());
        for (Deque<FrontierEntry> queue : queues.values()) {
            copy.addAll(queue);
        }
        return copy;
    }
}
