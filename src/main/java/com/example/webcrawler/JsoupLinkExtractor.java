package com.example.webcrawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects {@code a[href]} targets resolved against the page URL.
 */
public final class JsoupLinkExtractor implements LinkExtractor {
    @Override
    public List<String> extractLinks(String body, String baseUrl) {
        Document document = Jsoup.parse(body, baseUrl);
        List<String> links = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (!href.isBlank()) {
                links.add(href);
            }
        }
        return links;
    }
}
