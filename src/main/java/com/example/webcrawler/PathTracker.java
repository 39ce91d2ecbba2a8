package com.example.webcrawler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks, for every claimed URL, the length of the chain of first-discovering parents back to a
 * seed, and the longest such chain seen so far.
 *
 * <p>Chain lengths follow first-discovery-wins: a node keeps the parent that claimed it first,
 * which under concurrent fetching is decided by completion order, not by the shortest path.
 * Only the coordinator thread mutates a tracker.
 */
public final class PathTracker {
    private final Map<String, PathNode> nodes = new HashMap<>();
    private String deepest;
    private int longest = -1;

    public record PathNode(int chainLength, String predecessor) {
    }

    public void recordSeed(String key) {
        record(key, new PathNode(0, null));
    }

    /**
     * Records a node first discovered from {@code parent}. Returns its chain length.
     */
    public int recordDiscovery(String key, String parent) {
        PathNode parentNode = nodes.get(parent);
        int chainLength = parentNode == null ? 1 : parentNode.chainLength() + 1;
        record(key, new PathNode(chainLength, parent));
        return chainLength;
    }

    public int longestPathLength() {
        return Math.max(longest, 0);
    }

    /**
     * Keys from the seed to the deepest node, or an empty list before anything was recorded.
     */
    public List<String> longestPath() {
        List<String> path = new ArrayList<>();
        String current = deepest;
        while (current != null) {
            path.add(current);
            PathNode node = nodes.get(current);
            current = node == null ? null : node.predecessor();
        }
        Collections.reverse(path);
        return path;
    }

    public int chainLength(String key) {
        PathNode node = nodes.get(key);
        return node == null ? -1 : node.chainLength();
    }

    public Map<String, PathNode> nodes() {
        return new HashMap<>(nodes);
    }

    public void restore(Map<String, PathNode> snapshot) {
        snapshot.forEach(this::record);
    }

    private void record(String key, PathNode node) {
        if (nodes.putIfAbsent(key, node) != null) {
            return;
        }
        if (node.chainLength() > longest) {
            longest = node.chainLength();
            deepest = key;
        }
    }
}
