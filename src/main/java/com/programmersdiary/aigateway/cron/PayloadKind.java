package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PayloadKind {
    AGENT_TURN("agentTurn"), SYSTEM_EVENT("systemEvent");

    private final String value;

    PayloadKind(String value) {
        this.value = value;
    }

    @JsonCreator
    public static PayloadKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Payload kind is required");
        }
        for (var kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown payload kind: " + value);
    }

    @JsonValue
    public String toValue() {
        return value;
    }
}
