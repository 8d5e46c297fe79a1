package com.programmersdiary.aigateway.events;

import com.programmersdiary.aigateway.cron.SystemEvent;
import com.programmersdiary.aigateway.cron.SystemEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded buffer of system events waiting for the next agent heartbeat. When full, the oldest
 * event is dropped.
 */
@Component
public class SystemEventQueue implements SystemEventSink {

    private static final Logger log = LoggerFactory.getLogger(SystemEventQueue.class);

    private final int capacity;
    private final Deque<SystemEvent> events = new ArrayDeque<>();

    public SystemEventQueue(@Value("${aigateway.system-events.capacity:100}") int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public synchronized void enqueueSystemEvent(SystemEvent event) {
        if (event == null || event.text() == null || event.text().isBlank()) return;
        // same event delivered twice
        var last = events.peekLast();
        if (last != null && last.text().equals(event.text()) && last.atMs() == event.atMs()
                && last.jobId() != null && last.jobId().equals(event.jobId())) {
            return;
        }
        if (events.size() >= capacity) {
            var dropped = events.pollFirst();
            log.debug("System event queue full, dropped '{}'", dropped.text());
        }
        events.addLast(event);
        log.debug("Queued system event from {}: {}", event.source(), event.text());
    }

    public synchronized List<SystemEvent> drain() {
        var drained = new ArrayList<>(events);
        events.clear();
        return drained;
    }

    public synchronized List<SystemEvent> peek() {
        return List.copyOf(events);
    }

    public synchronized int size() {
        return events.size();
    }
}
