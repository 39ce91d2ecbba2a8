package com.example.webcrawler;

public enum CrawlState {
    SEEDING,
    RUNNING,
    DRAINING,
    COMPLETED,
    PAUSED,
    ABORTED
}
