package com.example.webcrawler;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckpointManagerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30.123456Z");

    @Test
    void savedSnapshotLoadsBack() throws Exception {
        Path dir = Files.createTempDirectory("checkpoint-test");
        CheckpointManager manager = new CheckpointManager(dir.resolve("checkpoint.json"));
        CrawlSnapshot snapshot = snapshot(3);

        manager.save(snapshot);
        CrawlSnapshot loaded = manager.load().orElseThrow();

        assertEquals(snapshot.fingerprint(), loaded.fingerprint());
        assertEquals(snapshot.visited(), loaded.visited());
        assertEquals(snapshot.frontier(), loaded.frontier());
        assertEquals(snapshot.paths(), loaded.paths());
        assertEquals(snapshot.keywordMatches(), loaded.keywordMatches());
        assertEquals(4, loaded.pagesFetched());
        assertEquals(2, loaded.nextSequence());
        assertEquals(1, loaded.failed().size());
        assertEquals(FailedUrlRecord.Reason.HTTP_ERROR, loaded.failed().get(0).getReason());
        assertEquals(NOW, loaded.failed().get(0).getFailedAt());
        assertFalse(Files.exists(dir.resolve("checkpoint.json.tmp")));
    }

    @Test
    void refusesSnapshotWrittenForAnotherDepth() throws Exception {
        Path dir = Files.createTempDirectory("checkpoint-test");
        CheckpointManager manager = new CheckpointManager(dir.resolve("checkpoint.json"));
        manager.save(snapshot(2));

        ConfigFingerprint current = new ConfigFingerprint(List.of("http://a.test/"), 3, 100);

        IncompatibleSnapshotException ex = assertThrows(IncompatibleSnapshotException.class,
                () -> manager.loadIfResuming(current));
        assertTrue(ex.getMessage().contains("depth 2 vs 3"));
    }

    @Test
    void missingCheckpointMeansFreshStart() throws Exception {
        Path dir = Files.createTempDirectory("checkpoint-test");
        CheckpointManager manager = new CheckpointManager(dir.resolve("checkpoint.json"));

        assertTrue(manager.load().isEmpty());
        assertTrue(manager.loadIfResuming(new ConfigFingerprint(List.of("http://a.test/"), 3, 100)).isEmpty());
    }

    @Test
    void discardRemovesTheFile() throws Exception {
        Path dir = Files.createTempDirectory("checkpoint-test");
        CheckpointManager manager = new CheckpointManager(dir.resolve("checkpoint.json"));
        manager.save(snapshot(3));

        manager.discard();

        assertFalse(Files.exists(manager.path()));
        manager.discard();
    }

    @Test
    void unreadableCheckpointIsAStorageError() throws Exception {
        Path dir = Files.createTempDirectory("checkpoint-test");
        Path file = dir.resolve("checkpoint.json");
        Files.writeString(file, "{not json");

        assertThrows(StorageException.class, () -> new CheckpointManager(file).load());
    }

    private static CrawlSnapshot snapshot(int depth) {
        FrontierEntry seed = FrontierEntry.seed("http://a.test/");
        return new CrawlSnapshot(
                CrawlSnapshot.FORMAT_VERSION,
                new ConfigFingerprint(List.of("http://a.test/"), depth, 100),
                NOW,
                List.of(new VisitedRecord("http://a.test/", NOW, 0), new VisitedRecord("http://a.test/b", NOW, 1)),
                List.of(seed.child("http://a.test/b")),
                Map.of("http://a.test/", new PathTracker.PathNode(0, null),
                        "http://a.test/b", new PathTracker.PathNode(1, "http://a.test/")),
                List.of(new FailedUrlRecord("http://a.test/gone", 1, FailedUrlRecord.Reason.HTTP_ERROR, 404,
                        "HTTP 404", 1, NOW)),
                List.of("http://a.test/"),
                4,
                2
        );
    }
}
