package com.example.crosstab.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Runs @Scheduled methods and the election, transfer and recovery fallback timers.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(10);
        scheduler.setThreadNamePrefix("coordination-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Inbound messages and attaches do blocking store calls, so they are moved off the event loop.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler coordinationScheduler(AppProperties appProperties) {
        return Schedulers.newBoundedElastic(
                appProperties.getDispatch().getThreads(),
                appProperties.getDispatch().getQueuedTaskCap(),
                "coordination-");
    }
}
