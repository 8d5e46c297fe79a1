package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The work a job performs. {@code agentTurn} uses {@code message} plus the optional
 * {@code provider}/{@code model} overrides, {@code systemEvent} uses {@code text}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronPayload(PayloadKind kind, String message, String provider, String model, String text) {

    public static CronPayload agentTurn(String message) {
        return new CronPayload(PayloadKind.AGENT_TURN, message, null, null, null);
    }

    public static CronPayload systemEvent(String text) {
        return new CronPayload(PayloadKind.SYSTEM_EVENT, null, null, null, text);
    }
}
