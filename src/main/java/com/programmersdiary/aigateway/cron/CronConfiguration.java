package com.programmersdiary.aigateway.cron;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class CronConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler cronTaskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("cron-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public CronScheduleEvaluator cronScheduleEvaluator(CronProperties properties) {
        return new CronScheduleEvaluator(properties.defaultTimezone());
    }

    @Bean
    public CronStoreRepository cronStoreRepository(CronProperties properties) {
        return new CronStoreRepository(properties.storePath());
    }

    @Bean
    public CronRunLog cronRunLog(CronProperties properties) {
        return CronRunLog.besideStore(properties.storePath(), properties.runLogMaxEntries());
    }

    @Bean(destroyMethod = "stop")
    public CronService cronService(CronProperties properties,
                                   CronStoreRepository repository,
                                   CronRunLog runLog,
                                   CronScheduleEvaluator evaluator,
                                   CronJobRunner jobRunner,
                                   SystemEventSink systemEvents,
                                   HeartbeatRequester heartbeat,
                                   AnnouncementSink announcements,
                                   TaskScheduler cronTaskScheduler,
                                   Clock clock) {
        return new CronService(properties, repository, runLog, evaluator, jobRunner,
                systemEvents, heartbeat, announcements, cronTaskScheduler, clock);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startCron(ApplicationReadyEvent event) {
        event.getApplicationContext().getBean(CronService.class).start();
    }
}
