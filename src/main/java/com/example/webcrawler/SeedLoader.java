package com.example.webcrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads seed URLs from a URL file (one per line, {@code #} comments, {@code -} for stdin)
 * and/or a single URL, returning them normalized and deduplicated in input order.
 */
public final class SeedLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(SeedLoader.class);
    private static final String STDIN = "-";

    private final InputStream stdin;

    public SeedLoader() {
        this(System.in);
    }

    SeedLoader(InputStream stdin) {
        this.stdin = stdin;
    }

    public List<String> load(CrawlerConfig config) {
        return load(config.urlFile(), config.url());
    }

    public List<String> load(Optional<String> urlFile, Optional<String> url) {
        if (urlFile.isEmpty() && url.isEmpty()) {
            throw new ConfigException("No seeds given: pass a URL file or --url");
        }
        List<String> lines = new ArrayList<>();
        if (urlFile.isPresent()) {
            lines.addAll(readLines(urlFile.get()));
        }
        url.ifPresent(lines::add);

        Set<String> seeds = new LinkedHashSet<>();
        int rejected = 0;
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            try {
                seeds.add(UrlNormalizer.normalize(UrlNormalizer.withDefaultScheme(trimmed)));
            } catch (InvalidUrlException ex) {
                rejected++;
                LOGGER.warn("Ignoring seed: {}", ex.getMessage());
            }
        }
        if (seeds.isEmpty()) {
            String source = urlFile.map(file -> "URL file " + file).orElse("--url");
            throw new ConfigException(rejected == 0
                    ? "No URLs given in " + source
                    : "None of the " + rejected + " URLs in " + source + " is valid");
        }
        LOGGER.info("Loaded {} seed URLs", seeds.size());
        return List.copyOf(seeds);
    }

    private List<String> readLines(String urlFile) {
        if (urlFile.equals(STDIN)) {
            try {
                BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
                return reader.lines().toList();
            } catch (RuntimeException ex) {
                throw new ConfigException("Unable to read URLs from stdin: " + ex.getMessage(), ex);
            }
        }
        Path path = Path.of(urlFile);
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("URL file not found: " + path);
        }
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ConfigException("Unable to read URL file " + path + ": " + ex.getMessage(), ex);
        }
    }
}
