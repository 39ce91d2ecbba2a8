package com.example.webcrawler;

/**
 * Thrown when a resume is requested against a checkpoint written for a different crawl.
 */
public class IncompatibleSnapshotException extends CrawlerException {
    public IncompatibleSnapshotException(String message) {
        super(message);
    }
}
