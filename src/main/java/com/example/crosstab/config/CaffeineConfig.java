package com.example.crosstab.config;

import com.example.crosstab.model.RecoveryRecord;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Scheduler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CaffeineConfig {

    /**
     * Pod-local read-through copy of recovery records, keyed by token. The store stays authoritative.
     */
    @Bean
    public Cache<String, RecoveryRecord> recoveryRecordCache(AppProperties appProperties) {
        AppProperties.Recovery recovery = appProperties.getRecovery();
        return Caffeine.newBuilder()
                .maximumSize(recovery.getLocalCacheMaximumSize())
                .expireAfterWrite(recovery.getTimeout())
                .scheduler(Scheduler.systemScheduler())
                .recordStats()
                .build();
    }
}
