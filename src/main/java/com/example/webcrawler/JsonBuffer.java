package com.example.webcrawler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collects records and writes each batch to its own numbered JSON file ({@code pages_000001.json},
 * {@code pages_000002.json}, ...). The starting number comes from the checkpoint on resume so
 * earlier batches are never overwritten.
 */
public class JsonBuffer<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonBuffer.class);
    private static final String PREFIX = "pages_";

    private final ObjectMapper mapper;
    private final Path outputDirectory;
    private final int threshold;
    private final List<T> pending;
    private int sequence;
    private long written;

    public JsonBuffer(ObjectMapper mapper, Path outputDirectory, int threshold, int startingSequence) {
        if (threshold <= 0 || startingSequence <= 0) {
            throw new IllegalArgumentException("threshold and starting sequence must be positive");
        }
        this.mapper = mapper;
        this.outputDirectory = outputDirectory;
        this.threshold = threshold;
        this.pending = new ArrayList<>(Math.min(threshold, 1024));
        this.sequence = startingSequence;
    }

    public synchronized void add(T record) throws IOException {
        pending.add(record);
        if (pending.size() >= threshold) {
            flush();
        }
    }

    /**
     * Writes the pending batch, if any, and returns the file it went to.
     */
    public synchronized Optional<Path> flush() throws IOException {
        if (pending.isEmpty()) {
            return Optional.empty();
        }
        Files.createDirectories(outputDirectory);
        Path file = outputDirectory.resolve(String.format("%s%06d.json", PREFIX, sequence));
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), pending);
        sequence++;
        written += pending.size();
        LOGGER.debug("Wrote {} records to {}", pending.size(), file);
        pending.clear();
        return Optional.of(file);
    }

    public synchronized int pending() {
        return pending.size();
    }

    /**
     * Records written to files by this buffer, not counting earlier runs.
     */
    public synchronized long written() {
        return written;
    }

    public synchronized int nextSequence() {
        return sequence;
    }
}
