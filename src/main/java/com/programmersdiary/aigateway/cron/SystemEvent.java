package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * An observability record handed to the next agent heartbeat.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SystemEvent(String source, String jobId, String text, long atMs) {
}
