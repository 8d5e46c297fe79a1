package com.programmersdiary.aigateway.events;

public record HeartbeatRequestedEvent(String reason, long requestedAtMs) {
}
