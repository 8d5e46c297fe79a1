package com.programmersdiary.aigateway.cron;

@FunctionalInterface
public interface AnnouncementSink {

    void announce(CronAnnouncement announcement);
}
