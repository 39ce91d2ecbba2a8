package com.example.webcrawler;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Immutable runtime settings for the crawler, validated once by {@link ConfigLoader}.
 */
public record CrawlerConfig(
        Optional<String> urlFile,
        Optional<String> url,
        Path outputDirectory,
        Path outputFile,
        Path checkpointFile,
        int connections,
        Duration timeout,
        boolean searchLinks,
        int maxDepth,
        int percentage,
        boolean exfiltrate,
        boolean followRedirects,
        boolean sameDomain,
        boolean resume,
        List<String> userAgents,
        Optional<String> keyword,
        boolean savePages,
        int checkpointInterval,
        int bufferEntryThreshold,
        Optional<Integer> maxPages
) {
}
