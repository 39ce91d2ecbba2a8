package com.example.webcrawler;

/**
 * Invalid settings or seed source. Always fatal: the crawl never starts.
 */
public class ConfigException extends CrawlerException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
