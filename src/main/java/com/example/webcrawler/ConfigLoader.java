package com.example.webcrawler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a {@link CrawlerConfig} from an optional JSON settings file overlaid with command-line
 * values. Settings use the snake_case keys of the crawler's {@code settings.json}.
 */
public class ConfigLoader {
    static final int DEFAULT_CONNECTIONS = 10;
    static final int DEFAULT_TIMEOUT_SECONDS = 10;
    static final int DEFAULT_DEPTH = 3;
    static final int DEFAULT_PERCENTAGE = 100;
    static final int DEFAULT_CHECKPOINT_INTERVAL = 25;
    static final int DEFAULT_BUFFER_THRESHOLD = 100;
    static final int MAX_CONNECTIONS = 10_000;
    static final String DEFAULT_OUTPUT_DIRECTORY = "crawler_output";
    static final List<String> DEFAULT_USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/14.1.1 Safari/605.1.15",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/92.0.4515.107 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:90.0) Gecko/20100101 Firefox/90.0",
            "Mozilla/5.0 (iPhone; CPU iPhone OS 14_6 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/14.1.1 Mobile/15E148 Safari/604.1"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
        mapper.coercionConfigFor(LogicalType.Boolean)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
    }

    /**
     * Loads a settings file with no command-line overrides.
     */
    public CrawlerConfig load(Path settingsFile) {
        return load(Optional.of(settingsFile), new Settings());
    }

    public CrawlerConfig load(Optional<Path> settingsFile, Settings overrides) {
        Settings raw = settingsFile.map(this::readSettings).orElseGet(Settings::new);
        raw.overlay(overrides);
        return validate(raw);
    }

    public Settings readSettings(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Settings file not found: " + path);
        }
        try {
            return mapper.readValue(path.toFile(), Settings.class);
        } catch (JsonProcessingException ex) {
            throw new ConfigException("Invalid settings file " + path + ": " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new ConfigException("Unable to read settings file " + path + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Writes the effective settings so a later run can reuse them with {@code --settings}.
     */
    public void save(CrawlerConfig config, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), Settings.from(config));
    }

    private CrawlerConfig validate(Settings raw) {
        int connections = raw.connections != null ? raw.connections
                : raw.threads != null ? raw.threads : DEFAULT_CONNECTIONS;
        if (connections < 1 || connections > MAX_CONNECTIONS) {
            throw new ConfigException("connections must be between 1 and " + MAX_CONNECTIONS + ", got " + connections);
        }
        int timeout = orDefault(raw.timeout, DEFAULT_TIMEOUT_SECONDS);
        if (timeout <= 0) {
            throw new ConfigException("timeout must be a positive number of seconds, got " + timeout);
        }
        int depth = orDefault(raw.depth, DEFAULT_DEPTH);
        if (depth < 0) {
            throw new ConfigException("depth must not be negative, got " + depth);
        }
        int percentage = orDefault(raw.percentage, DEFAULT_PERCENTAGE);
        if (percentage < 0 || percentage > 100) {
            throw new ConfigException("percentage must be between 0 and 100, got " + percentage);
        }
        int checkpointInterval = orDefault(raw.checkpointInterval, DEFAULT_CHECKPOINT_INTERVAL);
        if (checkpointInterval <= 0) {
            throw new ConfigException("checkpoint_interval must be positive, got " + checkpointInterval);
        }
        int bufferThreshold = orDefault(raw.bufferEntryThreshold, DEFAULT_BUFFER_THRESHOLD);
        if (bufferThreshold <= 0) {
            throw new ConfigException("buffer_entry_threshold must be positive, got " + bufferThreshold);
        }
        Optional<Integer> maxPages = Optional.ofNullable(raw.maxPages);
        if (maxPages.isPresent() && maxPages.get() <= 0) {
            throw new ConfigException("max_pages must be positive, got " + maxPages.get());
        }

        List<String> userAgents = raw.userAgents == null
                ? DEFAULT_USER_AGENTS
                : raw.userAgents.stream().filter(value -> value != null && !value.isBlank()).map(String::trim).toList();
        if (userAgents.isEmpty()) {
            throw new ConfigException("At least one user agent is required");
        }

        Path outputDirectory = Path.of(optionalString(raw.outputDir, DEFAULT_OUTPUT_DIRECTORY));
        Path outputFile = Optional.ofNullable(optionalString(raw.outputFile, null))
                .map(Path::of)
                .orElse(outputDirectory.resolve("crawl-summary.json"));
        Path checkpointFile = Optional.ofNullable(optionalString(raw.checkpointFile, null))
                .map(Path::of)
                .orElse(outputDirectory.resolve("checkpoint.json"));

        return new CrawlerConfig(
                Optional.ofNullable(optionalString(raw.urlFile, null)),
                Optional.ofNullable(optionalString(raw.url, null)),
                outputDirectory,
                outputFile,
                checkpointFile,
                connections,
                Duration.ofSeconds(timeout),
                orDefault(raw.searchLinks, true),
                depth,
                percentage,
                orDefault(raw.exfiltrate, false),
                orDefault(raw.followRedirects, true),
                orDefault(raw.sameDomain, false),
                orDefault(raw.resume, false),
                userAgents,
                Optional.ofNullable(optionalString(raw.keywordSearch, null)),
                orDefault(raw.savePages, false),
                checkpointInterval,
                bufferThreshold,
                maxPages
        );
    }

    private static <T> T orDefault(T value, T fallback) {
        return value == null ? fallback : value;
    }

    private static String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    /**
     * Unvalidated settings. A {@code null} field means "not set" and falls back to the default.
     */
    public static class Settings {
        public String urlFile;
        public String url;
        public String outputDir;
        public String outputFile;
        public String checkpointFile;
        public Integer connections;
        public Integer threads;
        public Integer timeout;
        public Boolean searchLinks;
        public Integer depth;
        public Integer percentage;
        public Boolean exfiltrate;
        public Boolean followRedirects;
        public Boolean sameDomain;
        public Boolean resume;
        public List<String> userAgents;
        public String keywordSearch;
        public Boolean savePages;
        public Integer checkpointInterval;
        public Integer bufferEntryThreshold;
        public Integer maxPages;

        /**
         * Copies every field {@code overrides} has set onto this instance.
         */
        public void overlay(Settings overrides) {
            urlFile = pick(overrides.urlFile, urlFile);
            url = pick(overrides.url, url);
            outputDir = pick(overrides.outputDir, outputDir);
            outputFile = pick(overrides.outputFile, outputFile);
            checkpointFile = pick(overrides.checkpointFile, checkpointFile);
            connections = pick(overrides.connections, connections);
            threads = pick(overrides.threads, threads);
            timeout = pick(overrides.timeout, timeout);
            searchLinks = pick(overrides.searchLinks, searchLinks);
            depth = pick(overrides.depth, depth);
            percentage = pick(overrides.percentage, percentage);
            exfiltrate = pick(overrides.exfiltrate, exfiltrate);
            followRedirects = pick(overrides.followRedirects, followRedirects);
            sameDomain = pick(overrides.sameDomain, sameDomain);
            resume = pick(overrides.resume, resume);
            userAgents = pick(overrides.userAgents, userAgents);
            keywordSearch = pick(overrides.keywordSearch, keywordSearch);
            savePages = pick(overrides.savePages, savePages);
            checkpointInterval = pick(overrides.checkpointInterval, checkpointInterval);
            bufferEntryThreshold = pick(overrides.bufferEntryThreshold, bufferEntryThreshold);
            maxPages = pick(overrides.maxPages, maxPages);
        }

        static Settings from(CrawlerConfig config) {
            Settings settings = new Settings();
            settings.urlFile = config.urlFile().orElse(null);
            settings.url = config.url().orElse(null);
            settings.outputDir = config.outputDirectory().toString();
            settings.outputFile = config.outputFile().toString();
            settings.checkpointFile = config.checkpointFile().toString();
            settings.connections = config.connections();
            settings.timeout = (int) config.timeout().toSeconds();
            settings.searchLinks = config.searchLinks();
            settings.depth = config.maxDepth();
            settings.percentage = config.percentage();
            settings.exfiltrate = config.exfiltrate();
            settings.followRedirects = config.followRedirects();
            settings.sameDomain = config.sameDomain();
            settings.resume = config.resume();
            settings.userAgents = new ArrayList<>(config.userAgents());
            settings.keywordSearch = config.keyword().orElse(null);
            settings.savePages = config.savePages();
            settings.checkpointInterval = config.checkpointInterval();
            settings.bufferEntryThreshold = config.bufferEntryThreshold();
            settings.maxPages = config.maxPages().orElse(null);
            return settings;
        }

        private static <T> T pick(T override, T current) {
            return override != null ? override : current;
        }
    }
}
