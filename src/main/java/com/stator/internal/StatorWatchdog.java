package com.stator.internal;

import com.stator.config.StatorProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Halts the process with {@value #EXIT_MISSED_PASS} when no scheduling pass
 * has completed for twice the schedule interval.
 * <p>
 * Checks run on a dedicated daemon thread; the {@code @Scheduled} thread they
 * watch may be the one that is stuck.
 */
@Component
@ConditionalOnExpression("${stator.runner.enabled:true} and ${stator.runner.watchdog-enabled:false}")
public class StatorWatchdog {

    private static final Logger log = LoggerFactory.getLogger(StatorWatchdog.class);

    static final int EXIT_MISSED_PASS = 2;

    private final Clock clock;
    private final Duration scheduleInterval;
    private final IntConsumer halt;
    private final AtomicBoolean tripped = new AtomicBoolean();

    private volatile Instant lastPass;
    private ScheduledExecutorService checker;

    @Autowired
    public StatorWatchdog(StatorProperties properties, Clock clock) {
        this(clock, Duration.ofSeconds(properties.getRunner().getScheduleIntervalInSeconds()),
                Runtime.getRuntime()::halt);
    }

    StatorWatchdog(Clock clock, Duration scheduleInterval, IntConsumer halt) {
        this.clock = clock;
        this.scheduleInterval = scheduleInterval;
        this.halt = halt;
        this.lastPass = clock.instant();
    }

    @PostConstruct
    void start() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("stator-watchdog-");
        threadFactory.setDaemon(true);
        checker = Executors.newSingleThreadScheduledExecutor(threadFactory);
        long period = Math.max(1L, scheduleInterval.toMillis());
        checker.scheduleWithFixedDelay(this::check, period, period, TimeUnit.MILLISECONDS);
        log.info("Watchdog armed; halting with exit code {} if no scheduling pass completes within {}",
                EXIT_MISSED_PASS, allowedGap());
    }

    @PreDestroy
    void stop() {
        if (checker != null) {
            checker.shutdownNow();
        }
    }

    /**
     * Called at the end of every scheduling pass.
     */
    public void passCompleted() {
        lastPass = clock.instant();
    }

    void check() {
        Duration sinceLastPass = Duration.between(lastPass, clock.instant());
        if (sinceLastPass.compareTo(allowedGap()) <= 0 || !tripped.compareAndSet(false, true)) {
            return;
        }
        log.error("No scheduling pass completed in {} (allowed {}); halting with exit code {}",
                sinceLastPass, allowedGap(), EXIT_MISSED_PASS);
        halt.accept(EXIT_MISSED_PASS);
    }

    private Duration allowedGap() {
        return scheduleInterval.multipliedBy(2);
    }
}
