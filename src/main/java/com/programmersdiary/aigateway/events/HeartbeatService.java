package com.programmersdiary.aigateway.events;

import com.programmersdiary.aigateway.cron.HeartbeatRequester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Turns out-of-band wake requests into {@link HeartbeatRequestedEvent}s. Requests arriving
 * within the coalesce window of the previous published one are folded into it.
 */
@Service
public class HeartbeatService implements HeartbeatRequester {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatService.class);

    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final long coalesceMs;
    private long lastPublishedAtMs = Long.MIN_VALUE;
    private long coalescedRequests;

    public HeartbeatService(ApplicationEventPublisher publisher,
                            Clock clock,
                            @Value("${aigateway.heartbeat.coalesce-ms:250}") long coalesceMs) {
        this.publisher = publisher;
        this.clock = clock;
        this.coalesceMs = Math.max(0, coalesceMs);
    }

    @Override
    public void requestHeartbeatNow(String reason) {
        long now = clock.millis();
        synchronized (this) {
            if (lastPublishedAtMs != Long.MIN_VALUE && now - lastPublishedAtMs < coalesceMs) {
                coalescedRequests++;
                log.debug("Heartbeat request '{}' coalesced", reason);
                return;
            }
            lastPublishedAtMs = now;
        }
        log.info("Heartbeat requested: {}", reason);
        publisher.publishEvent(new HeartbeatRequestedEvent(reason, now));
    }

    public synchronized long coalescedRequests() {
        return coalescedRequests;
    }
}
