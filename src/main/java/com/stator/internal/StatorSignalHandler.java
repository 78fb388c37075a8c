package com.stator.internal;

import com.stator.config.StatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import sun.misc.Signal;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * SIGINT/SIGTERM handling for standing worker processes.
 * <p>
 * The first signal drains the runner and exits with {@value #EXIT_CLEAN}, or
 * {@value #EXIT_GRACE_EXPIRED} if handlers were still running when the grace
 * period ran out. A second signal halts immediately with {@value #EXIT_FORCED}.
 */
@Component
@ConditionalOnProperty(prefix = "stator.runner", name = "handle-signals", havingValue = "true")
public class StatorSignalHandler implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(StatorSignalHandler.class);

    static final int EXIT_CLEAN = 0;
    static final int EXIT_GRACE_EXPIRED = 1;
    static final int EXIT_FORCED = 130;

    private final StatorRunner runner;
    private final Duration gracePeriod;
    private final IntConsumer exit;
    private final IntConsumer halt;
    private final AtomicInteger received = new AtomicInteger();

    @Autowired
    public StatorSignalHandler(StatorRunner runner, StatorProperties properties) {
        this(runner, properties.getRunner().getShutdownGracePeriod(), System::exit, Runtime.getRuntime()::halt);
    }

    StatorSignalHandler(StatorRunner runner, Duration gracePeriod, IntConsumer exit, IntConsumer halt) {
        this.runner = runner;
        this.gracePeriod = gracePeriod;
        this.exit = exit;
        this.halt = halt;
    }

    @Override
    public void afterPropertiesSet() {
        Signal.handle(new Signal("INT"), signal -> onSignal(signal.getName()));
        Signal.handle(new Signal("TERM"), signal -> onSignal(signal.getName()));
        log.info("Installed SIGINT/SIGTERM handlers for runner {}", runner.runnerId());
    }

    void onSignal(String name) {
        if (received.incrementAndGet() == 1) {
            log.info("Received SIG{}; draining for up to {} (signal again to stop immediately)", name, gracePeriod);
            Thread drainer = new Thread(() -> {
                boolean finished = runner.drain(gracePeriod);
                exit.accept(finished ? EXIT_CLEAN : EXIT_GRACE_EXPIRED);
            }, "stator-drain");
            drainer.start();
        } else {
            log.warn("Received SIG{} again; stopping without waiting for handlers", name);
            runner.forceStop();
            halt.accept(EXIT_FORCED);
        }
    }
}
