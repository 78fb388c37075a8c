package com.stator.internal;

import com.stator.StateGraph;
import com.stator.StatorStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

public class StatorMetrics {

    private static final Logger log = LoggerFactory.getLogger(StatorMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final StatorStore store;
    private final StateGraphRegistry registry;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private volatile Map<String, Long> cachedReadyCounts = Map.of();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean snapshotLoaded = false;

    public StatorMetrics(StatorStore store, StateGraphRegistry registry, MeterRegistry meterRegistry) {
        this.store = store;
        this.registry = registry;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering stator gauges...");
        for (StateGraph graph : registry.graphs()) {
            String type = graph.entityType();
            Gauge.builder("stator.records.ready", this, metrics -> metrics.readyCount(type))
                    .description("Records ready for dispatch")
                    .tag("type", type)
                    .register(meterRegistry);
        }
    }

    public void recordAttempt(String entityType, AttemptOutcome outcome) {
        Counter.builder("stator.attempts")
                .description("Handler dispatches by outcome")
                .tag("type", entityType)
                .tag("outcome", outcome.tagValue())
                .register(meterRegistry)
                .increment();
    }

    private double readyCount(String entityType) {
        return snapshot().getOrDefault(entityType, 0L);
    }

    private Map<String, Long> snapshot() {
        long now = System.nanoTime();
        if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedReadyCounts;
        }
        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedReadyCounts;
            }
            cachedReadyCounts = loadSnapshot();
            snapshotCapturedAtNanos = now;
            snapshotLoaded = true;
            return cachedReadyCounts;
        }
    }

    private Map<String, Long> loadSnapshot() {
        try {
            return Map.copyOf(store.countReadyByType());
        } catch (RuntimeException e) {
            log.trace("Failed to query ready counts for metrics: {}", e.getMessage());
            return Map.of();
        }
    }
}
