package com.example.webcrawler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Reduces each page's extracted links to a percentage of the batch.
 *
 * <p>Keeps {@code floor(n * percentage / 100)} links chosen uniformly at random with reservoir
 * sampling, returned in their original order. The count is exact per page; only membership is random.
 */
public final class LinkSampler {
    private final Random random;

    public LinkSampler() {
        this(new Random());
    }

    public LinkSampler(Random random) {
        this.random = random;
    }

    public <T> List<T> admit(List<T> candidates, int percentage) {
        if (percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("percentage must be within 0..100: " + percentage);
        }
        int n = candidates.size();
        if (percentage == 100 || n == 0) {
            return List.copyOf(candidates);
        }
        int k = (int) ((long) n * percentage / 100);
        if (k == 0) {
            return List.of();
        }

        int[] reservoir = new int[k];
        for (int i = 0; i < k; i++) {
            reservoir[i] = i;
        }
        for (int i = k; i < n; i++) {
            int j;
            synchronized (random) {
                j = random.nextInt(i + 1);
            }
            if (j < k) {
                reservoir[j] = i;
            }
        }
        Arrays.sort(reservoir);

        List<T> admitted = new ArrayList<>(k);
        for (int index : reservoir) {
            admitted.add(candidates.get(index));
        }
        return admitted;
    }
}
