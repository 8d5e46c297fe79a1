package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunStatus {
    OK, ERROR, SKIPPED;

    @JsonCreator
    public static RunStatus fromString(String value) {
        if (value == null || value.isBlank()) return null;
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "ok" -> OK;
            case "error" -> ERROR;
            case "skipped" -> SKIPPED;
            default -> throw new IllegalArgumentException("Unknown run status: " + value);
        };
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
