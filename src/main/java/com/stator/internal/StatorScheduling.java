package com.stator.internal;

import com.stator.config.StatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

/**
 * Periodic readiness pass, independent of the dispatch loop.
 */
@Component
@ConditionalOnProperty(prefix = "stator.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StatorScheduling {

    private static final Logger log = LoggerFactory.getLogger(StatorScheduling.class);

    private final ReadinessPass readinessPass;
    private final StatorRunner runner;
    private final StatorProperties properties;
    private final Clock clock;
    private final StatorWatchdog watchdog;

    @Autowired
    public StatorScheduling(ReadinessPass readinessPass, StatorRunner runner, StatorProperties properties,
            Clock clock, ObjectProvider<StatorWatchdog> watchdog) {
        this(readinessPass, runner, properties, clock, watchdog.getIfAvailable());
    }

    public StatorScheduling(ReadinessPass readinessPass, StatorRunner runner, StatorProperties properties,
            Clock clock, StatorWatchdog watchdog) {
        this.readinessPass = readinessPass;
        this.runner = runner;
        this.properties = properties;
        this.clock = clock;
        this.watchdog = watchdog;
    }

    @Scheduled(fixedDelayString = "${stator.runner.schedule-interval-in-seconds:30}000")
    public void schedule() {
        Map<String, Long> handled = runner.drainHandledCounts();
        if (!handled.isEmpty()) {
            log.info("Handled since last pass: {}", handled);
        }
        try {
            int marked = readinessPass.run();
            log.debug("Readiness pass marked {} record(s) ready", marked);
        } catch (RuntimeException e) {
            log.error("Readiness pass failed", e);
        }
        touchLivenessFile();
        if (watchdog != null) {
            watchdog.passCompleted();
        }
    }

    void touchLivenessFile() {
        Path livenessFile = properties.getRunner().getLivenessFile();
        if (livenessFile == null) {
            return;
        }
        try {
            Files.writeString(livenessFile, Long.toString(clock.instant().getEpochSecond()));
        } catch (IOException e) {
            log.warn("Could not write liveness file {}", livenessFile, e);
        }
    }
}
