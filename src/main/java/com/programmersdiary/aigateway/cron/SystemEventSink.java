package com.programmersdiary.aigateway.cron;

@FunctionalInterface
public interface SystemEventSink {

    void enqueueSystemEvent(SystemEvent event);
}
