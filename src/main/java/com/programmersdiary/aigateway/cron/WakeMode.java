package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WakeMode {
    NOW("now"), NEXT_HEARTBEAT("next-heartbeat");

    private final String value;

    WakeMode(String value) {
        this.value = value;
    }

    @JsonCreator
    public static WakeMode fromString(String value) {
        if (value == null || value.isBlank()) return NEXT_HEARTBEAT;
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "now" -> NOW;
            case "next-heartbeat" -> NEXT_HEARTBEAT;
            default -> throw new IllegalArgumentException("Unknown wake mode: " + value);
        };
    }

    @JsonValue
    public String toValue() {
        return value;
    }
}
