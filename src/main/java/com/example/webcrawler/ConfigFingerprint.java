package com.example.webcrawler;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * The settings a checkpoint is only valid for: seeds, depth and sampling percentage.
 */
public record ConfigFingerprint(
        List<String> seeds,
        int maxDepth,
        int percentage
) {
    public static ConfigFingerprint of(List<String> seeds, CrawlerConfig config) {
        return new ConfigFingerprint(new ArrayList<>(new TreeSet<>(seeds)), config.maxDepth(), config.percentage());
    }

    /**
     * Human-readable list of the fields that differ from {@code other}.
     */
    public String describeDifferences(ConfigFingerprint other) {
        List<String> differences = new ArrayList<>();
        if (!seeds.equals(other.seeds)) {
            differences.add("seeds " + other.seeds + " vs " + seeds);
        }
        if (maxDepth != other.maxDepth) {
            differences.add("depth " + other.maxDepth + " vs " + maxDepth);
        }
        if (percentage != other.percentage) {
            differences.add("percentage " + other.percentage + " vs " + percentage);
        }
        return String.join(", ", differences);
    }
}
