package com.programmersdiary.aigateway.delivery;

import com.programmersdiary.aigateway.cron.AnnouncementSink;
import com.programmersdiary.aigateway.cron.CronAnnouncement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Outbox of run outcomes for the channel adapters, which drain it. When full, the oldest
 * announcement is dropped.
 */
@Component
public class AnnouncementQueue implements AnnouncementSink {

    private static final Logger log = LoggerFactory.getLogger(AnnouncementQueue.class);

    private final int capacity;
    private final Deque<CronAnnouncement> pending = new ArrayDeque<>();

    public AnnouncementQueue(@Value("${aigateway.announcements.capacity:200}") int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public synchronized void announce(CronAnnouncement announcement) {
        if (pending.size() >= capacity) {
            var dropped = pending.pollFirst();
            log.warn("Announcement outbox full, dropped announcement for job '{}'", dropped.jobName());
        }
        pending.addLast(announcement);
        log.info("Queued announcement for job '{}' ({}) to {}", announcement.jobName(),
                announcement.status().toValue(),
                announcement.channel() != null ? announcement.channel() : "default channel");
    }

    public synchronized List<CronAnnouncement> drain() {
        var drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }

    public synchronized int size() {
        return pending.size();
    }
}
