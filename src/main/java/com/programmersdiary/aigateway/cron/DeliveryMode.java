package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DeliveryMode {
    ANNOUNCE, NONE;

    @JsonCreator
    public static DeliveryMode fromString(String value) {
        if (value == null || value.isBlank()) return NONE;
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "announce" -> ANNOUNCE;
            case "none" -> NONE;
            default -> throw new IllegalArgumentException("Unknown delivery mode: " + value);
        };
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
