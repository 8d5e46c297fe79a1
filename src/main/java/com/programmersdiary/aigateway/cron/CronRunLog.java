package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-job JSON-lines history of runs, kept next to the store under {@code runs/}.
 */
public class CronRunLog {

    private static final Logger log = LoggerFactory.getLogger(CronRunLog.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Path runsDir;
    private final int maxEntries;

    public CronRunLog(Path runsDir, int maxEntries) {
        this.runsDir = runsDir;
        this.maxEntries = Math.max(1, maxEntries);
    }

    public static CronRunLog besideStore(Path storePath, int maxEntries) {
        return new CronRunLog(storePath.toAbsolutePath().getParent().resolve("runs"), maxEntries);
    }

    public synchronized void append(CronRunLogEntry entry) {
        var file = fileFor(entry.jobId());
        try {
            Files.createDirectories(runsDir);
            var line = objectMapper.writeValueAsString(entry) + "\n";
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            prune(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append run log for job " + entry.jobId(), e);
        }
    }

    /**
     * Newest {@code limit} entries for the job, oldest first. Unreadable lines are skipped.
     */
    public synchronized List<CronRunLogEntry> readRuns(String jobId, int limit) {
        var file = fileFor(jobId);
        if (!Files.exists(file) || limit <= 0) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        var entries = new ArrayList<CronRunLogEntry>();
        for (var line : lines.subList(Math.max(0, lines.size() - limit), lines.size())) {
            if (line.isBlank()) continue;
            try {
                entries.add(objectMapper.readValue(line, CronRunLogEntry.class));
            } catch (JsonProcessingException e) {
                log.debug("Skipping unreadable run log line for {}: {}", jobId, e.getOriginalMessage());
            }
        }
        return entries;
    }

    public synchronized void delete(String jobId) {
        try {
            Files.deleteIfExists(fileFor(jobId));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void prune(Path file) throws IOException {
        var lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        if (lines.size() <= maxEntries) return;
        var kept = lines.subList(lines.size() - maxEntries, lines.size());
        Files.write(file, kept, StandardCharsets.UTF_8);
    }

    private Path fileFor(String jobId) {
        var safe = jobId.replaceAll("[^A-Za-z0-9._-]", "_");
        return runsDir.resolve(safe + ".jsonl");
    }
}
