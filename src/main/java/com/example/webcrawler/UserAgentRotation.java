package com.example.webcrawler;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Round-robin selection over the configured user agents, shared by all workers.
 */
public final class UserAgentRotation {
    private final List<String> userAgents;
    private final AtomicLong counter = new AtomicLong();

    public UserAgentRotation(List<String> userAgents) {
        if (userAgents.isEmpty()) {
            throw new IllegalArgumentException("At least one user agent is required");
        }
        this.userAgents = List.copyOf(userAgents);
    }

    public String next() {
        return userAgents.get((int) (counter.getAndIncrement() % userAgents.size()));
    }
}
