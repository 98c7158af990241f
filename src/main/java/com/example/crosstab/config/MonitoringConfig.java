package com.example.crosstab.config;

import com.example.crosstab.service.connection.LocalConnectionRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    /**
     * Gauges over the connections held by this pod.
     */
    @Bean
    public MeterBinder coordinationMetrics(LocalConnectionRegistry connectionRegistry) {
        return registry -> {
            Gauge.builder("crosstab.connections.active", connectionRegistry, LocalConnectionRegistry::getConnectionCount)
                    .description("SSE connections held by this pod")
                    .register(registry);
            Gauge.builder("crosstab.users.connected", connectionRegistry, r -> r.getLocalUserIds().size())
                    .description("Users with at least one connection on this pod")
                    .register(registry);
            Gauge.builder("crosstab.leaders.local", connectionRegistry, LocalConnectionRegistry::getLocalLeaderCount)
                    .description("Leader connections held by this pod")
                    .register(registry);
        };
    }

    @Bean
    public CoordinationMetricsCollector coordinationMetricsCollector(MeterRegistry registry) {
        return new CoordinationMetricsCollector(registry);
    }

    public static class CoordinationMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, io.micrometer.core.instrument.Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

        public CoordinationMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment();
        }

        public void recordTimer(String name, long duration, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k ->
                    Timer.builder(name).tags(tags).register(registry))
                    .record(duration, TimeUnit.MILLISECONDS);
        }

        public long getCounterValue(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            io.micrometer.core.instrument.Counter counter = counters.get(key);
            return counter != null ? (long) counter.count() : 0;
        }
    }
}
