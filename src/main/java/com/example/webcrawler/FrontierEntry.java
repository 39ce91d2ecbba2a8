package com.example.webcrawler;

/**
 * A URL waiting to be fetched. {@code parent} is {@code null} for seeds.
 */
public record FrontierEntry(
        String url,
        int depth,
        String parent
) {
    public static FrontierEntry seed(String url) {
        return new FrontierEntry(url, 0, null);
    }

    public FrontierEntry child(String childUrl) {
        return new FrontierEntry(childUrl, depth + 1, url);
    }
}
