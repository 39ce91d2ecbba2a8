package com.example.webcrawler;

public class InvalidUrlException extends CrawlerException {
    private final String url;

    public InvalidUrlException(String url, String reason) {
        super("Invalid URL '" + url + "': " + reason);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
