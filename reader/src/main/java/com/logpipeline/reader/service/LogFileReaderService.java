package com.logpipeline.reader.service;

import com.logpipeline.common.model.QueueMessage;
import com.logpipeline.common.queue.LogQueuePublisher;
import com.logpipeline.reader.config.ReaderProperties;
import com.logpipeline.reader.progress.FileCursor;
import com.logpipeline.reader.progress.FileProgress;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Sweeps the log directory and publishes every non-blank line of each new log file
 * to the queue, in file order. Files are tracked by name in {@link FileProgress};
 * a file is marked complete only after its last line has been enqueued, and is read
 * again only if it is replaced or truncated.
 */
@Slf4j
@Service
public class LogFileReaderService {

    private final LogQueuePublisher queue;
    private final FileProgress progress;
    private final ReaderProperties properties;

    private final Counter linesPublishedCounter;
    private final Counter filesCompletedCounter;
    private final Timer publishLatencyTimer;

    private boolean announced;

    public LogFileReaderService(LogQueuePublisher queue,
                                FileProgress progress,
                                ReaderProperties properties,
                                MeterRegistry meterRegistry) {
        this.queue = queue;
        this.progress = progress;
        this.properties = properties;

        this.linesPublishedCounter = Counter.builder("logs.published")
            .description("Total number of log lines published to the queue")
            .register(meterRegistry);
        this.filesCompletedCounter = Counter.builder("logs.files.completed")
            .description("Total number of log files fully streamed")
            .register(meterRegistry);
        this.publishLatencyTimer = Timer.builder("logs.publish.latency")
            .description("Time taken to publish a batch of lines to the queue")
            .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${pipeline.reader.sweep-interval-ms:1000}")
    public void scheduledSweep() {
        if (!announced) {
            log.info("Watching {} for {} files...", properties.getLogDir(), properties.getFileSuffix());
            announced = true;
        }
        try {
            sweep();
        } catch (DataAccessException e) {
            log.error("Queue unavailable, sweep aborted; unfinished files are retried next sweep", e);
        }
    }

    /**
     * Streams every log file not yet complete, then forgets the cursors of files that
     * have left the directory.
     *
     * @return number of lines enqueued during this sweep
     */
    public long sweep() {
        Optional<List<Path>> files = listLogFiles();
        if (files.isEmpty()) {
            return 0;
        }
        long published = 0;
        for (Path file : files.get()) {
            try {
                published += streamFile(file);
            } catch (IOException | UncheckedIOException e) {
                log.warn("Aborted {} this sweep, will retry: {}", file.getFileName(), e.toString());
            }
        }
        progress.retainOnly(files.get().stream()
            .map(file -> file.getFileName().toString())
            .collect(Collectors.toSet()));
        return published;
    }

    /**
     * @return the log files in name order, or empty if the directory could not be listed
     */
    Optional<List<Path>> listLogFiles() {
        Path dir = properties.getLogDir();
        if (!Files.isDirectory(dir)) {
            log.debug("Log directory {} does not exist yet", dir);
            return Optional.empty();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return Optional.of(entries
                .filter(path -> path.getFileName().toString().endsWith(properties.getFileSuffix()))
                .filter(Files::isRegularFile)
                .sorted()
                .toList());
        } catch (IOException e) {
            log.warn("Failed to list {}: {}", dir, e.toString());
            return Optional.empty();
        }
    }

    /**
     * Streams one file from its stored cursor to the end. A file that is complete is
     * skipped; one that was replaced or truncated since its cursor was taken starts over.
     *
     * @return number of lines enqueued
     */
    long streamFile(Path file) throws IOException {
        String fileName = file.getFileName().toString();
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        String fileKey = attributes.fileKey() == null ? null : attributes.fileKey().toString();

        FileCursor stored = progress.cursor(fileName);
        FileCursor cursor;
        if (stored.sameFile(fileKey, attributes.size())) {
            if (stored.complete()) {
                return 0;
            }
            cursor = stored.resize(attributes.size());
        } else {
            log.info("{} was replaced or truncated since it was last read, streaming it from the start", fileName);
            cursor = FileCursor.start(fileKey, attributes.size());
        }

        long skip = cursor.linesConsumed();
        if (skip > 0) {
            log.info("Resuming {} after line {}", fileName, skip);
        } else {
            log.info("Processing: {}", fileName);
        }

        long lineNumber = 0;
        long pushed = 0;
        List<QueueMessage> batch = new ArrayList<>(properties.getBatchSize());
        try (BufferedReader reader = open(file)) {
            String raw;
            while ((raw = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber <= skip) {
                    continue;
                }
                String line = raw.strip();
                if (line.isEmpty()) {
                    continue;
                }
                batch.add(new QueueMessage(line, fileName));
                if (batch.size() >= properties.getBatchSize()) {
                    pushed += publish(fileName, batch, cursor.advance(lineNumber));
                }
            }
        }
        pushed += publish(fileName, batch, cursor.advance(lineNumber));
        progress.save(fileName, cursor.complete(Math.max(lineNumber, skip)));
        filesCompletedCounter.increment();
        log.info("Done with {}: {} lines pushed to queue.", fileName, pushed);
        return pushed;
    }

    private int publish(String fileName, List<QueueMessage> batch, FileCursor consumed) {
        if (batch.isEmpty()) {
            return 0;
        }
        int size = batch.size();
        publishLatencyTimer.record(() -> queue.enqueueAll(List.copyOf(batch)));
        progress.save(fileName, consumed);
        linesPublishedCounter.increment(size);
        batch.clear();
        return size;
    }

    private static BufferedReader open(Path file) throws IOException {
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file),
            StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)));
    }
}
