package com.programmersdiary.aigateway.cron;

@FunctionalInterface
public interface HeartbeatRequester {

    void requestHeartbeatNow(String reason);
}
