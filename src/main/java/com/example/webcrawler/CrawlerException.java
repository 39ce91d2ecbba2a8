package com.example.webcrawler;

/**
 * Base type for the crawler's own failure conditions.
 */
public abstract class CrawlerException extends RuntimeException {
    protected CrawlerException(String message) {
        super(message);
    }

    protected CrawlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
