package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionTarget {
    ISOLATED, SHARED;

    @JsonCreator
    public static SessionTarget fromString(String value) {
        if (value == null || value.isBlank()) return ISOLATED;
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "shared", "main" -> SHARED;
            case "isolated" -> ISOLATED;
            default -> throw new IllegalArgumentException("Unknown session target: " + value);
        };
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
