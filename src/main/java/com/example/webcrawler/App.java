package com.example.webcrawler;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import com.example.webcrawler.report.CrawlSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

@Command(name = "web-crawler", mixinStandardHelpOptions = true,
        description = "Crawls outward from seed URLs up to a bounded depth, with checkpoint and resume.")
public final class App implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    static final int EXIT_FATAL = 1;
    static final String LOG_FILE_APPENDER = "crawl-log-file";

    @Parameters(index = "0", arity = "0..1", paramLabel = "URL_FILE",
            description = "File with one seed URL per line, or - for stdin.")
    String urlFile;

    @Option(names = "--url", description = "Single seed URL.")
    String url;

    @Option(names = "--settings", paramLabel = "FILE", description = "JSON settings file; command-line options override it.")
    Path settingsFile;

    @Option(names = "--save-settings", paramLabel = "FILE", description = "Write the effective settings to FILE.")
    Path saveSettingsFile;

    @Option(names = "--percentage", description = "Percentage (0-100) of each page's links to follow.")
    Integer percentage;

    @Option(names = "--exfiltrate", description = "Track the longest chain of first-discovered links.")
    Boolean exfiltrate;

    @Option(names = "--depth", description = "Maximum link hops from a seed (default: 3).")
    Integer depth;

    @Option(names = {"-c", "--connections", "--threads"}, description = "Concurrent fetches (default: 10).")
    Integer connections;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Crawl summary file.")
    String outputFile;

    @Option(names = "--output-dir", paramLabel = "DIR", description = "Directory for page records, log and checkpoint.")
    String outputDir;

    @Option(names = {"-t", "--timeout"}, description = "Seconds per fetch (default: 10).")
    Integer timeout;

    @Option(names = "--follow-redirects", negatable = true, description = "Follow HTTP redirects (default: true).")
    Boolean followRedirects;

    @Option(names = {"-s", "--search-links"}, negatable = true, description = "Extract and follow links (default: true).")
    Boolean searchLinks;

    @Option(names = "--user-agent", description = "Use this single user agent instead of the rotation.")
    String userAgent;

    @Option(names = "--log-level", description = "TRACE, DEBUG, INFO, WARN or ERROR.")
    String logLevel;

    @Option(names = "--resume", description = "Continue from the checkpoint of an interrupted crawl.")
    Boolean resume;

    @Option(names = "--keyword", description = "Report pages whose content contains this keyword.")
    String keyword;

    @Option(names = "--save-pages", description = "Save each fetched body as doc_NNNNNN.dat in the output directory.")
    Boolean savePages;

    @Option(names = "--same-domain", description = "Only follow links on the host of the page they appear on.")
    Boolean sameDomain;

    @Option(names = "--max-pages", description = "Pause with a checkpoint after this many pages.")
    Integer maxPages;

    @Option(names = "--checkpoint-interval", description = "Pages between checkpoints (default: 25).")
    Integer checkpointInterval;

    @Option(names = "--checkpoint-file", paramLabel = "FILE", description = "Checkpoint location.")
    String checkpointFile;

    public static void main(String[] args) {
        System.exit(new CommandLine(new App()).execute(args));
    }

    @Override
    public Integer call() {
        try {
            if (logLevel != null) {
                setLogLevel(logLevel);
            }
            CrawlerConfig config = new ConfigLoader().load(Optional.ofNullable(settingsFile), overrides());
            Files.createDirectories(config.outputDirectory());
            startLogFile(config.outputDirectory().resolve("crawler.log"));
            if (saveSettingsFile != null) {
                new ConfigLoader().save(config, saveSettingsFile);
                LOGGER.info("Settings saved to {}", saveSettingsFile);
            }

            List<String> seeds = new SeedLoader().load(config);
            CheckpointManager checkpointManager = new CheckpointManager(config.checkpointFile());
            Optional<CrawlSnapshot> snapshot = Optional.empty();
            if (config.resume()) {
                snapshot = checkpointManager.loadIfResuming(ConfigFingerprint.of(seeds, config));
                if (snapshot.isEmpty()) {
                    LOGGER.info("No checkpoint at {}; starting a fresh crawl", checkpointManager.path());
                }
            }

            CrawlCoordinator coordinator = new CrawlCoordinator(config, seeds, checkpointManager, snapshot,
                    new JsoupPageFetcher(config.followRedirects()), new JsoupLinkExtractor());
            long graceSeconds = config.timeout().toSeconds() + 30;
            Thread hook = new Thread(() -> {
                coordinator.requestStop();
                try {
                    coordinator.awaitFinished(graceSeconds, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }, "shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);

            CrawlSummary summary = coordinator.run();
            removeShutdownHook(hook);
            LOGGER.info("{}: {} pages fetched, {} visited, {} failed, {} pending",
                    summary.state(), summary.pagesFetched(), summary.visitedCount(), summary.failedCount(), summary.pendingCount());
            if (summary.longestPathLength() != null) {
                LOGGER.info("Longest path ({} links): {}", summary.longestPathLength(), String.join(" -> ", summary.longestPath()));
            }
            return exitCode(summary);
        } catch (ConfigException | IncompatibleSnapshotException | StorageException ex) {
            LOGGER.error(ex.getMessage());
            return EXIT_FATAL;
        } catch (IOException ex) {
            LOGGER.error("Unable to prepare output: {}", ex.getMessage());
            return EXIT_FATAL;
        }
    }

    static int exitCode(CrawlSummary summary) {
        return summary.state() == CrawlState.ABORTED ? EXIT_FATAL : 0;
    }

    private ConfigLoader.Settings overrides() {
        ConfigLoader.Settings settings = new ConfigLoader.Settings();
        settings.urlFile = urlFile;
        settings.url = url;
        settings.percentage = percentage;
        settings.exfiltrate = exfiltrate;
        settings.depth = depth;
        settings.connections = connections;
        settings.outputFile = outputFile;
        settings.outputDir = outputDir;
        settings.timeout = timeout;
        settings.followRedirects = followRedirects;
        settings.searchLinks = searchLinks;
        settings.userAgents = userAgent == null ? null : List.of(userAgent);
        settings.resume = resume;
        settings.keywordSearch = keyword;
        settings.savePages = savePages;
        settings.sameDomain = sameDomain;
        settings.maxPages = maxPages;
        settings.checkpointInterval = checkpointInterval;
        settings.checkpointFile = checkpointFile;
        return settings;
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOGGER.debug("JVM already shutting down");
        }
    }

    private static void setLogLevel(String level) {
        Level parsed = Level.toLevel(level, null);
        if (parsed == null) {
            throw new ConfigException("Invalid log level: " + level);
        }
        ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(parsed);
    }

    private static void startLogFile(Path file) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss} [%thread] %-5level %logger{36} - %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName(LOG_FILE_APPENDER);
        fileAppender.setFile(file.toString());
        fileAppender.start();

        ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        // one crawl log per process: the previous run's file stops receiving events
        Appender<ILoggingEvent> previous = root.getAppender(LOG_FILE_APPENDER);
        if (previous != null) {
            root.detachAppender(previous);
            previous.stop();
        }
        root.addAppender(fileAppender);
    }
}
