package com.example.webcrawler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

public final class CheckpointManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(CheckpointManager.class);

    private final ObjectMapper mapper;
    private final Path checkpointPath;

    /**
     * Manages persistence of crawl snapshots to a single JSON file.
     */
    public CheckpointManager(Path checkpointPath) {
        this.mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        this.checkpointPath = checkpointPath;
    }

    /**
     * Returns the last saved snapshot if the checkpoint file exists.
     */
    public Optional<CrawlSnapshot> load() {
        if (!Files.exists(checkpointPath)) {
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(checkpointPath)) {
            return Optional.of(mapper.readValue(reader, CrawlSnapshot.class));
        } catch (IOException ex) {
            throw new StorageException("Unable to read checkpoint", checkpointPath, ex);
        }
    }

    /**
     * Loads the snapshot for a resumed crawl. Refuses a snapshot written for other seeds, depth or percentage.
     */
    public Optional<CrawlSnapshot> loadIfResuming(ConfigFingerprint current) {
        Optional<CrawlSnapshot> snapshot = load();
        if (snapshot.isPresent() && !current.equals(snapshot.get().fingerprint())) {
            throw new IncompatibleSnapshotException("Checkpoint " + checkpointPath
                    + " was written for a different crawl (" + current.describeDifferences(snapshot.get().fingerprint())
                    + "). Delete it or rerun with the original settings.");
        }
        return snapshot;
    }

    /**
     * Writes the snapshot next to the checkpoint and moves it into place, so a crash mid-write
     * leaves the previous checkpoint intact.
     */
    public void save(CrawlSnapshot snapshot) {
        Path temp = checkpointPath.resolveSibling(checkpointPath.getFileName() + ".tmp");
        try {
            Path parent = checkpointPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, checkpointPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, checkpointPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new StorageException("Unable to write checkpoint", checkpointPath, ex);
        }
    }

    /**
     * Removes the checkpoint after a crawl that ran to completion.
     */
    public void discard() {
        try {
            if (Files.deleteIfExists(checkpointPath)) {
                LOGGER.debug("Removed checkpoint {}", checkpointPath);
            }
        } catch (IOException ex) {
            throw new StorageException("Unable to delete checkpoint", checkpointPath, ex);
        }
    }

    /**
     * Exposes the underlying checkpoint file path.
     */
    public Path path() {
        return checkpointPath;
    }
}
