package com.programmersdiary.aigateway.cron;

import java.nio.file.Path;

/**
 * The persisted store exists but cannot be read as a store document. Never auto-repaired.
 */
public class CronStoreCorruptException extends RuntimeException {

    private final Path storePath;

    public CronStoreCorruptException(Path storePath, Throwable cause) {
        super("Cron store is corrupt: " + storePath + " (" + cause.getMessage() + ")", cause);
        this.storePath = storePath;
    }

    public CronStoreCorruptException(Path storePath, String reason) {
        super("Cron store is corrupt: " + storePath + " (" + reason + ")");
        this.storePath = storePath;
    }

    public Path storePath() {
        return storePath;
    }
}
