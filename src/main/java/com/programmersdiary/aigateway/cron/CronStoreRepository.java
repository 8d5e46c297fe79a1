package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;

/**
 * File-backed {@link CronStore}. The document is loaded once and then served from memory;
 * every save rewrites the whole file through a temp file and a rename, so readers only ever
 * see a complete document.
 */
public class CronStoreRepository {

    private static final Logger log = LoggerFactory.getLogger(CronStoreRepository.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final Path storePath;
    private CronStore store;

    public CronStoreRepository(Path storePath) {
        this.storePath = storePath;
    }

    public Path storePath() {
        return storePath;
    }

    public synchronized boolean isLoaded() {
        return store != null;
    }

    /**
     * Returns the in-memory store, reading it from disk on first use.
     *
     * @throws CronStoreCorruptException if the file exists but is not a valid store
     * @throws UncheckedIOException      if the file cannot be read
     */
    public synchronized CronStore ensureLoaded() {
        if (store == null) {
            store = read();
            log.debug("Loaded {} cron job(s) from {}", store.jobs().size(), storePath);
        }
        return store;
    }

    public synchronized void persist(CronStore store) {
        this.store = store;
        Path tmp = null;
        try {
            Files.createDirectories(storePath.toAbsolutePath().getParent());
            tmp = Files.createTempFile(storePath.toAbsolutePath().getParent(),
                    storePath.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), store);
            move(tmp, storePath);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed to persist cron store " + storePath, e);
        }
    }

    private CronStore read() {
        if (!Files.exists(storePath)) {
            return CronStore.empty();
        }
        CronStore loaded;
        try {
            var content = Files.readString(storePath);
            if (content.isBlank()) {
                return CronStore.empty();
            }
            loaded = objectMapper.readValue(content, CronStore.class);
        } catch (JsonProcessingException e) {
            throw new CronStoreCorruptException(storePath, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cron store " + storePath, e);
        }
        if (loaded == null) {
            throw new CronStoreCorruptException(storePath, "document is null");
        }
        var ids = new HashSet<String>();
        for (var job : loaded.jobs()) {
            if (job == null || job.id() == null || job.id().isBlank()) {
                throw new CronStoreCorruptException(storePath, "job without id");
            }
            if (!ids.add(job.id())) {
                throw new CronStoreCorruptException(storePath, "duplicate job id '" + job.id() + "'");
            }
        }
        return loaded;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) return;
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", path, e.getMessage());
        }
    }
}
