package com.programmersdiary.aigateway.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronDelivery(DeliveryMode mode, String channel, String to) {

    public static CronDelivery none() {
        return new CronDelivery(DeliveryMode.NONE, null, null);
    }

    public static CronDelivery announce() {
        return new CronDelivery(DeliveryMode.ANNOUNCE, null, null);
    }

    public boolean announces() {
        return mode == DeliveryMode.ANNOUNCE;
    }
}
