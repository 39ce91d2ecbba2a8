package com.example.webcrawler.report;

import java.util.Locale;

/**
 * Coarse page category derived from the URL alone.
 */
public enum PageType {
    YOUTUBE,
    BLOG,
    NEWS,
    OTHER;

    public static PageType classify(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains("youtube.com")) {
            return YOUTUBE;
        }
        if (lower.contains("blog")) {
            return BLOG;
        }
        if (lower.contains("news")) {
            return NEWS;
        }
        return OTHER;
    }
}
