package com.programmersdiary.aigateway.cron;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The persisted unit: a format version plus all jobs in store order.
 */
public record CronStore(int version, List<CronJob> jobs) {

    public static final int CURRENT_VERSION = 1;

    public CronStore {
        jobs = jobs != null ? new ArrayList<>(jobs) : new ArrayList<>();
    }

    public static CronStore empty() {
        return new CronStore(CURRENT_VERSION, List.of());
    }

    public Optional<CronJob> findById(String id) {
        return jobs.stream().filter(j -> j.id().equals(id)).findFirst();
    }

    public void replace(CronJob job) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).id().equals(job.id())) {
                jobs.set(i, job);
                return;
            }
        }
        throw new IllegalArgumentException("Cron job not found: " + job.id());
    }

    public boolean remove(String id) {
        return jobs.removeIf(j -> j.id().equals(id));
    }
}
