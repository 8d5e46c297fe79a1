package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScheduleKind {
    CRON("cron"), EVERY("every"), AT("at");

    private final String value;

    ScheduleKind(String value) {
        this.value = value;
    }

    @JsonCreator
    public static ScheduleKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Schedule kind is required");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "cron" -> CRON;
            case "every" -> EVERY;
            case "at" -> AT;
            default -> throw new IllegalArgumentException("Unknown schedule kind: " + value);
        };
    }

    @JsonValue
    public String toValue() {
        return value;
    }
}
