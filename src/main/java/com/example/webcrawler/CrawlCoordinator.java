package com.example.webcrawler;

import com.example.webcrawler.report.CrawlSummary;
import com.example.webcrawler.report.PageRecord;
import com.example.webcrawler.report.PageType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates the crawl lifecycle: seeding (or restoring a checkpoint), dispatching fetches to a
 * fixed pool of workers, admitting discovered links, periodic checkpointing and the final summary.
 *
 * <p>The thread calling {@link #run()} is the only writer of the visited set, path tracker and
 * result lists. Workers take entries from the {@link Frontier} and hand their results back through
 * a single intake queue.
 */
public final class CrawlCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(CrawlCoordinator.class);
    private static final long INTAKE_POLL_MILLIS = 200;
    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final CrawlerConfig config;
    private final List<String> seeds;
    private final ConfigFingerprint fingerprint;
    private final CheckpointManager checkpointManager;
    private final Optional<CrawlSnapshot> resumeFrom;
    private final PageFetcher fetcher;
    private final LinkExtractor extractor;
    private final LinkSampler sampler;
    private final ProcessingLimiter limiter;
    private final RetryPolicy retryPolicy;
    private final UserAgentRotation userAgents;
    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private final VisitedSet visited = new VisitedSet();
    private final Frontier frontier;
    private final PathTracker pathTracker = new PathTracker();
    private final List<FailedUrlRecord> failed = new ArrayList<>();
    private final List<String> keywordMatches = new ArrayList<>();
    private final BlockingQueue<FetchOutcome> intake = new LinkedBlockingQueue<>();
    private final AtomicBoolean checkpointRunning = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile boolean stopRequested;
    private volatile CrawlState state = CrawlState.SEEDING;
    private long pagesFetched;
    private int maxDepthReached;

    public CrawlCoordinator(CrawlerConfig config,
                            List<String> seeds,
                            CheckpointManager checkpointManager,
                            Optional<CrawlSnapshot> resumeFrom,
                            PageFetcher fetcher,
                            LinkExtractor extractor) {
        this(config, seeds, checkpointManager, resumeFrom, fetcher, extractor, new LinkSampler(),
                config.maxPages().map(ProcessingLimiter::maxPages).orElse(ProcessingLimiter.NO_LIMIT),
                RetryPolicy.NO_RETRY);
    }

    CrawlCoordinator(CrawlerConfig config,
                     List<String> seeds,
                     CheckpointManager checkpointManager,
                     Optional<CrawlSnapshot> resumeFrom,
                     PageFetcher fetcher,
                     LinkExtractor extractor,
                     LinkSampler sampler,
                     ProcessingLimiter limiter,
                     RetryPolicy retryPolicy) {
        this.config = config;
        this.seeds = List.copyOf(seeds);
        this.fingerprint = ConfigFingerprint.of(seeds, config);
        this.checkpointManager = checkpointManager;
        this.resumeFrom = resumeFrom;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.sampler = sampler;
        this.limiter = limiter;
        this.retryPolicy = retryPolicy;
        this.userAgents = new UserAgentRotation(config.userAgents());
        this.frontier = new Frontier(config.maxDepth());
    }

    /**
     * Executes a crawl run and returns its summary, which is also written to the configured output file.
     * A run that was stopped or hit the page limit ends {@link CrawlState#PAUSED} with a checkpoint;
     * a run that exhausted the frontier ends {@link CrawlState#COMPLETED} and removes the checkpoint.
     */
    public CrawlSummary run() {
        try {
            return runCrawl();
        } finally {
            finished.countDown();
        }
    }

    private CrawlSummary runCrawl() {
        Instant startedAt = Instant.now();
        ExecutorService checkpointWriter = Executors.newSingleThreadExecutor(new NamedThreadFactory("checkpoint-writer"));
        ExecutorService workers = null;
        JsonBuffer<PageRecord> buffer = null;
        boolean interrupted = false;
        try {
            int startingSequence = seed();
            buffer = new JsonBuffer<>(mapper, config.outputDirectory(), config.bufferEntryThreshold(), startingSequence);

            state = CrawlState.RUNNING;
            LOGGER.info("Crawling {} seeds to depth {} with {} connections", seeds.size(), config.maxDepth(), config.connections());
            workers = Executors.newFixedThreadPool(config.connections(), new NamedThreadFactory("fetch-worker"));
            for (int i = 0; i < config.connections(); i++) {
                workers.execute(this::workerLoop);
            }

            boolean drained;
            try {
                drained = coordinate(buffer, checkpointWriter);
            } catch (InterruptedException ex) {
                LOGGER.info("Interrupted; pausing crawl");
                interrupted = true;
                drained = false;
            }
            stopWorkers(workers);
            flush(buffer);
            awaitCheckpointWriter(checkpointWriter);

            if (drained) {
                discardCheckpoint();
                state = CrawlState.COMPLETED;
                LOGGER.info("Crawl completed: {} pages fetched, {} failed", pagesFetched, failed.size());
            } else {
                saveCheckpoint(buffer);
                state = CrawlState.PAUSED;
                LOGGER.info("Crawl paused with checkpoint at {}", checkpointManager.path());
            }
        } catch (InterruptedException ex) {
            interrupted = true;
            abort(workers, buffer, ex);
        } catch (RuntimeException ex) {
            abort(workers, buffer, ex);
            throw ex;
        } finally {
            checkpointWriter.shutdownNow();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        CrawlSummary summary = summarize(startedAt);
        writeSummary(summary);
        return summary;
    }

    /**
     * Asks a running crawl to stop. Results of fetches still in flight are discarded and their
     * entries stay in the checkpoint.
     */
    public void requestStop() {
        stopRequested = true;
    }

    /**
     * Waits for {@link #run()} to return. Used by the shutdown hook.
     */
    public boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    public CrawlState state() {
        return state;
    }

    private int seed() {
        if (resumeFrom.isPresent()) {
            CrawlSnapshot snapshot = resumeFrom.get();
            visited.restore(snapshot.visited());
            snapshot.frontier().forEach(frontier::push);
            pathTracker.restore(snapshot.paths());
            failed.addAll(snapshot.failed());
            keywordMatches.addAll(snapshot.keywordMatches());
            pagesFetched = snapshot.pagesFetched();
            Set<String> pending = new HashSet<>();
            snapshot.frontier().forEach(entry -> pending.add(entry.url()));
            for (VisitedRecord record : snapshot.visited()) {
                if (!pending.contains(record.url())) {
                    maxDepthReached = Math.max(maxDepthReached, record.depth());
                }
            }
            LOGGER.info("Resuming from checkpoint: {} URLs visited, {} pending", visited.size(), frontier.size());
            return snapshot.nextSequence();
        }
        for (String seed : seeds) {
            if (visited.tryClaim(seed, 0)) {
                frontier.push(FrontierEntry.seed(seed));
                if (config.exfiltrate()) {
                    pathTracker.recordSeed(seed);
                }
            }
        }
        return 1;
    }

    /**
     * Processes worker results until the frontier drains (returns true) or the crawl is stopped (returns false).
     */
    private boolean coordinate(JsonBuffer<PageRecord> buffer, ExecutorService checkpointWriter) throws InterruptedException {
        long sinceCheckpoint = 0;
        while (true) {
            if (stopRequested) {
                LOGGER.info("Stop requested after {} pages", pagesFetched);
                return false;
            }
            if (frontier.isDrained()) {
                state = CrawlState.DRAINING;
                return true;
            }
            if (limiter.shouldStop(pagesFetched)) {
                LOGGER.info("Stopping early after {} pages", pagesFetched);
                return false;
            }
            FetchOutcome outcome = intake.poll(INTAKE_POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (outcome == null || stopRequested) {
                continue;
            }
            process(outcome, buffer);
            if (++sinceCheckpoint >= config.checkpointInterval()) {
                sinceCheckpoint = 0;
                checkpointAsync(buffer, checkpointWriter);
            }
        }
    }

    private void process(FetchOutcome outcome, JsonBuffer<PageRecord> buffer) {
        FrontierEntry entry = outcome.entry();
        FetchResult result = outcome.result();
        pagesFetched++;
        maxDepthReached = Math.max(maxDepthReached, entry.depth());

        if (!result.isSuccess() || result.isHttpError()) {
            FailedUrlRecord record = FailedUrlRecord.of(entry, result, outcome.attempts(), Instant.now());
            failed.add(record);
            LOGGER.warn("Failed {} ({}: {})", entry.url(), record.getReason(), record.getMessage());
            frontier.complete(entry);
            return;
        }

        List<String> candidates = crawlableLinks(entry, outcome.links());
        List<String> sampled = sampler.admit(candidates, config.percentage());
        int admitted = 0;
        for (String key : sampled) {
            if (admit(entry, key)) {
                admitted++;
            }
        }
        if (outcome.keywordMatched()) {
            keywordMatches.add(entry.url());
            LOGGER.info("Keyword '{}' found in {}", config.keyword().orElse(""), entry.url());
        }
        LOGGER.info("Fetched {} [{}] depth {} in {} ms, {} of {} links admitted", entry.url(), result.statusCode(),
                entry.depth(), result.elapsed().toMillis(), admitted, outcome.links().size());

        PageRecord record = new PageRecord(
                entry.url(),
                entry.depth(),
                entry.parent(),
                result.statusCode(),
                result.contentType(),
                PageType.classify(entry.url()),
                UrlNormalizer.host(entry.url()),
                result.elapsed().toMillis(),
                outcome.links().size(),
                admitted,
                outcome.keywordMatched(),
                outcome.userAgent(),
                savePage(result.body()),
                Instant.now()
        );
        try {
            buffer.add(record);
        } catch (IOException ex) {
            throw new StorageException("Unable to write page records", config.outputDirectory(), ex);
        }
        // children are queued before the parent leaves flight, so the frontier never looks drained in between
        frontier.complete(entry);
    }

    /**
     * Normalizes extracted links, dropping malformed, non-http(s) and (optionally) off-site ones.
     */
    private List<String> crawlableLinks(FrontierEntry entry, List<String> links) {
        String pageHost = UrlNormalizer.host(entry.url());
        Set<String> keys = new LinkedHashSet<>();
        for (String raw : links) {
            try {
                String key = UrlNormalizer.normalize(raw);
                if (config.sameDomain() && !pageHost.equals(UrlNormalizer.host(key))) {
                    LOGGER.debug("Skipping off-site link {} on {}", key, entry.url());
                    continue;
                }
                keys.add(key);
            } catch (InvalidUrlException ex) {
                LOGGER.debug("Dropping link on {}: {}", entry.url(), ex.getMessage());
            }
        }
        return new ArrayList<>(keys);
    }

    /**
     * Writes the body to {@code doc_NNNNNN.dat} in the output directory when page saving is on.
     * Files are numbered by fetch count, which carries over a resume. Returns the file name, or null.
     */
    private String savePage(String body) {
        if (!config.savePages() || body == null) {
            return null;
        }
        String fileName = String.format("doc_%06d.dat", pagesFetched);
        Path file = config.outputDirectory().resolve(fileName);
        try {
            Files.createDirectories(config.outputDirectory());
            Files.writeString(file, body, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new StorageException("Unable to save page body", file, ex);
        }
        return fileName;
    }

    private boolean admit(FrontierEntry parent, String key) {
        FrontierEntry child = parent.child(key);
        if (child.depth() > config.maxDepth() || !visited.tryClaim(key, child.depth())) {
            return false;
        }
        frontier.push(child);
        if (config.exfiltrate()) {
            int chainLength = pathTracker.recordDiscovery(key, parent.url());
            LOGGER.debug("Discovered {} via {} (chain length {})", key, parent.url(), chainLength);
        } else {
            LOGGER.debug("Discovered {} via {}", key, parent.url());
        }
        return true;
    }

    private void workerLoop() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Optional<FrontierEntry> next = frontier.take();
                if (next.isEmpty()) {
                    return;
                }
                intake.put(fetchIsolated(next.get()));
            }
        } catch (InterruptedException ex) {
            LOGGER.debug("Fetch worker interrupted");
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs {@link #fetchPage} so that whatever it throws still yields an outcome. An entry without
     * an outcome would stay in flight and the frontier would never drain.
     */
    private FetchOutcome fetchIsolated(FrontierEntry entry) {
        try {
            return fetchPage(entry);
        } catch (StackOverflowError ex) {
            return unexpectedFailure(entry, ex);
        } catch (VirtualMachineError ex) {
            intake.add(unexpectedFailure(entry, ex));
            throw ex;
        } catch (Throwable ex) {
            return unexpectedFailure(entry, ex);
        }
    }

    private static FetchOutcome unexpectedFailure(FrontierEntry entry, Throwable cause) {
        LOGGER.error("Fetching {} failed unexpectedly", entry.url(), cause);
        return new FetchOutcome(entry, FetchResult.transportError(cause.toString(), Duration.ZERO),
                List.of(), false, null, 1);
    }

    private FetchOutcome fetchPage(FrontierEntry entry) {
        String userAgent = userAgents.next();
        FetchResult result;
        int attempts = 0;
        do {
            attempts++;
            result = fetchOnce(entry.url(), userAgent);
        } while (!Thread.currentThread().isInterrupted() && retryPolicy.shouldRetry(result, attempts));

        List<String> links = List.of();
        boolean keywordMatched = false;
        if (result.isSuccess() && !result.isHttpError()) {
            if (config.searchLinks() && entry.depth() < config.maxDepth()) {
                links = extractLinks(entry, result);
            }
            keywordMatched = matchesKeyword(result.body());
        }
        return new FetchOutcome(entry, result, links, keywordMatched, userAgent, attempts);
    }

    private FetchResult fetchOnce(String url, String userAgent) {
        try {
            return fetcher.fetch(url, config.timeout(), userAgent);
        } catch (RuntimeException ex) {
            LOGGER.warn("Fetcher failed unexpectedly for {}", url, ex);
            return FetchResult.transportError(ex.toString(), Duration.ZERO);
        }
    }

    private List<String> extractLinks(FrontierEntry entry, FetchResult result) {
        String base = result.finalUrl() == null ? entry.url() : result.finalUrl();
        try {
            if (result.isRedirect() && !config.followRedirects()) {
                return List.of(URI.create(base).resolve(result.location().trim()).toString());
            }
            if (!result.isHtml() || result.body() == null) {
                return List.of();
            }
            return extractor.extractLinks(result.body(), base);
        } catch (RuntimeException ex) {
            LOGGER.warn("Unable to extract links from {}: {}", entry.url(), ex.toString());
            return List.of();
        }
    }

    private boolean matchesKeyword(String body) {
        if (config.keyword().isEmpty() || body == null) {
            return false;
        }
        return body.toLowerCase(Locale.ROOT).contains(config.keyword().get().toLowerCase(Locale.ROOT));
    }

    private void stopWorkers(ExecutorService workers) throws InterruptedException {
        frontier.close();
        workers.shutdownNow();
        long graceSeconds = config.timeout().toSeconds() + SHUTDOWN_GRACE_SECONDS;
        if (!workers.awaitTermination(graceSeconds, TimeUnit.SECONDS)) {
            LOGGER.warn("Fetch workers did not stop within {} s; abandoning their results", graceSeconds);
        }
    }

    private void checkpointAsync(JsonBuffer<PageRecord> buffer, ExecutorService checkpointWriter) {
        if (!checkpointRunning.compareAndSet(false, true)) {
            LOGGER.debug("Previous checkpoint still being written; skipping");
            return;
        }
        flush(buffer);
        CrawlSnapshot snapshot = snapshot(buffer);
        checkpointWriter.execute(() -> {
            try {
                checkpointManager.save(snapshot);
                LOGGER.info("Checkpoint saved: {} visited, {} pending", snapshot.visited().size(), snapshot.frontier().size());
            } catch (StorageException ex) {
                LOGGER.warn("Checkpoint failed, continuing without a fresh checkpoint: {}", ex.getMessage());
            } finally {
                checkpointRunning.set(false);
            }
        });
    }

    private void awaitCheckpointWriter(ExecutorService checkpointWriter) throws InterruptedException {
        checkpointWriter.shutdown();
        if (!checkpointWriter.awaitTermination(1, TimeUnit.MINUTES)) {
            LOGGER.warn("Background checkpoint write did not finish in time");
        }
    }

    private void saveCheckpoint(JsonBuffer<PageRecord> buffer) {
        try {
            checkpointManager.save(snapshot(buffer));
        } catch (StorageException ex) {
            LOGGER.warn("Final checkpoint failed: {}", ex.getMessage());
        }
    }

    private void discardCheckpoint() {
        try {
            checkpointManager.discard();
        } catch (StorageException ex) {
            LOGGER.warn("Unable to remove checkpoint: {}", ex.getMessage());
        }
    }

    private CrawlSnapshot snapshot(JsonBuffer<PageRecord> buffer) {
        return new CrawlSnapshot(
                CrawlSnapshot.FORMAT_VERSION,
                fingerprint,
                Instant.now(),
                visited.records(),
                frontier.snapshot(),
                config.exfiltrate() ? pathTracker.nodes() : Map.of(),
                List.copyOf(failed),
                List.copyOf(keywordMatches),
                pagesFetched,
                buffer.nextSequence()
        );
    }

    private void abort(ExecutorService workers, JsonBuffer<PageRecord> buffer, Exception cause) {
        state = CrawlState.ABORTED;
        LOGGER.error("Crawl aborted", cause);
        frontier.close();
        if (workers != null) {
            workers.shutdownNow();
        }
        if (buffer != null) {
            saveCheckpoint(buffer);
        }
    }

    private void flush(JsonBuffer<PageRecord> buffer) {
        try {
            buffer.flush();
        } catch (IOException ex) {
            throw new StorageException("Unable to write page records", config.outputDirectory(), ex);
        }
    }

    private CrawlSummary summarize(Instant startedAt) {
        boolean exfiltrate = config.exfiltrate();
        return new CrawlSummary(
                state,
                startedAt,
                Instant.now(),
                seeds,
                pagesFetched,
                visited.size(),
                maxDepthReached,
                state == CrawlState.COMPLETED ? 0 : frontier.snapshot().size(),
                List.copyOf(failed),
                List.copyOf(keywordMatches),
                exfiltrate ? pathTracker.longestPathLength() : null,
                exfiltrate ? pathTracker.longestPath() : null
        );
    }

    private void writeSummary(CrawlSummary summary) {
        Path file = config.outputFile();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), summary);
            LOGGER.info("Summary written to {}", file);
        } catch (IOException ex) {
            throw new StorageException("Unable to write crawl summary", file, ex);
        }
    }

    private record FetchOutcome(
            FrontierEntry entry,
            FetchResult result,
            List<String> links,
            boolean keywordMatched,
            String userAgent,
            int attempts
    ) {
    }
}
