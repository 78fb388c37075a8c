package com.stator.internal;

import com.stator.StateGraph;
import com.stator.StatorRecord;
import com.stator.StatorStore;
import com.stator.config.StatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * The worker loop: selects ready records, leases them and runs their handlers
 * on a bounded pool.
 * <p>
 * In-flight work is capped globally by {@code stator.runner.concurrency} and
 * per entity type by {@code stator.runner.concurrency-per-type}. The order in
 * which entity types are scanned rotates every iteration so a busy type cannot
 * starve the others.
 */
@Component
public class StatorRunner implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StatorRunner.class);

    private final StatorStore store;
    private final StateGraphRegistry registry;
    private final LeaseManager leaseManager;
    private final TransitionAttempt transitionAttempt;
    private final ReadinessPass readinessPass;
    private final StatorProperties.Runner settings;
    private final Clock clock;
    private final StatorMetrics metrics;

    private final String runnerId = "runner-" + UUID.randomUUID();
    private final AtomicReference<RunnerState> state = new AtomicReference<>(RunnerState.STOPPED);
    private final AtomicInteger inFlightTotal = new AtomicInteger();
    private final Map<String, AtomicInteger> inFlightByType = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> handledByType = new ConcurrentHashMap<>();
    private final AtomicInteger rotation = new AtomicInteger();

    private volatile boolean forced;
    private volatile ExecutorService executor;
    private volatile Thread loopThread;

    @Autowired
    public StatorRunner(
            StatorStore store,
            StateGraphRegistry registry,
            LeaseManager leaseManager,
            TransitionAttempt transitionAttempt,
            ReadinessPass readinessPass,
            StatorProperties properties,
            Clock clock,
            ObjectProvider<StatorMetrics> metrics) {
        this(store, registry, leaseManager, transitionAttempt, readinessPass, properties, clock,
                metrics.getIfAvailable());
    }

    public StatorRunner(
            StatorStore store,
            StateGraphRegistry registry,
            LeaseManager leaseManager,
            TransitionAttempt transitionAttempt,
            ReadinessPass readinessPass,
            StatorProperties properties,
            Clock clock,
            StatorMetrics metrics) {
        this.store = store;
        this.registry = registry;
        this.leaseManager = leaseManager;
        this.transitionAttempt = transitionAttempt;
        this.readinessPass = readinessPass;
        this.settings = properties.getRunner();
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public void start() {
        if (!state.compareAndSet(RunnerState.STOPPED, RunnerState.RUNNING)) {
            return;
        }
        forced = false;
        int workers = Math.max(1, settings.getConcurrency());
        executor = new ThreadPoolExecutor(
                workers,
                workers,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(workers),
                new CustomizableThreadFactory("stator-worker-"),
                new ThreadPoolExecutor.AbortPolicy());
        Thread loop = new Thread(this::runLoop, "stator-loop");
        loopThread = loop;
        loop.start();
        log.info("Runner {} started with {} worker(s), {} per entity type, graphs {}",
                runnerId, workers, settings.getConcurrencyPerType(), registry.graphs().size());
    }

    private void runLoop() {
        long minimumDelay = settings.getMinimumLoopDelay().toMillis();
        long maximumDelay = Math.max(minimumDelay, settings.getMaximumLoopDelay().toMillis());
        long delay = minimumDelay;
        while (state.get() == RunnerState.RUNNING) {
            try {
                int dispatched = dispatchReady(executor, null);
                delay = dispatched > 0 ? minimumDelay : Math.min(maximumDelay, (long) (delay * 1.5));
            } catch (RuntimeException e) {
                log.warn("Fetching ready records failed; retrying in {} ms", maximumDelay, e);
                delay = maximumDelay;
            }
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Runner {} loop exited in state {}", runnerId, state.get());
    }

    /**
     * One fetch, lease and dispatch sweep over every entity type.
     *
     * @return number of records handed to {@code target}
     */
    int dispatchReady(ExecutorService target, List<Dispatched> started) {
        List<StateGraph> graphs = new ArrayList<>(registry.graphs());
        if (graphs.isEmpty()) {
            return 0;
        }
        Collections.rotate(graphs, -Math.floorMod(rotation.getAndIncrement(), graphs.size()));

        int dispatched = 0;
        for (StateGraph graph : graphs) {
            if (!acceptingWork()) {
                break;
            }
            int globalSpace = settings.getConcurrency() - inFlightTotal.get();
            if (globalSpace <= 0) {
                break;
            }
            String type = graph.entityType();
            AtomicInteger typeInFlight = inFlightByType.computeIfAbsent(type, key -> new AtomicInteger());
            int limit = Math.min(globalSpace, settings.getConcurrencyPerType() - typeInFlight.get());
            if (limit <= 0) {
                continue;
            }

            List<StatorRecord> batch = store.fetchReadyBatch(type, graph.dispatchableStates(), limit,
                    OffsetDateTime.now(clock));
            for (StatorRecord record : batch) {
                if (!acceptingWork()) {
                    return dispatched;
                }
                UUID recordId = record.getId();
                String leaseOwner = newLeaseOwner();
                if (!leaseManager.tryAcquire(recordId, leaseOwner, settings.getLeaseDuration())) {
                    continue;
                }
                inFlightTotal.incrementAndGet();
                typeInFlight.incrementAndGet();
                try {
                    Future<AttemptOutcome> future = target.submit(
                            () -> runAttempt(recordId, leaseOwner, type, typeInFlight));
                    if (started != null) {
                        started.add(new Dispatched(type, future));
                    }
                    dispatched++;
                } catch (RejectedExecutionException e) {
                    typeInFlight.decrementAndGet();
                    inFlightTotal.decrementAndGet();
                    leaseManager.release(recordId, leaseOwner);
                    log.debug("Worker pool refused {}; lease released", record);
                    return dispatched;
                }
            }
        }
        return dispatched;
    }

    /**
     * Lease owner for one attempt. A later attempt on the same record by this
     * runner gets a different owner, so a stale attempt cannot release or
     * write through the newer lease.
     */
    private String newLeaseOwner() {
        return runnerId + ":" + UUID.randomUUID();
    }

    private AttemptOutcome runAttempt(UUID recordId, String leaseOwner, String type, AtomicInteger typeInFlight) {
        AttemptOutcome outcome = AttemptOutcome.FAILED;
        try {
            outcome = transitionAttempt.attempt(recordId, leaseOwner);
            return outcome;
        } catch (RuntimeException e) {
            log.error("Attempt on record {} of type {} aborted; its lease will expire or be released", recordId,
                    type, e);
            return outcome;
        } finally {
            if (!forced) {
                releaseQuietly(recordId, leaseOwner);
            }
            typeInFlight.decrementAndGet();
            inFlightTotal.decrementAndGet();
            handledByType.computeIfAbsent(type, key -> new LongAdder()).increment();
            if (metrics != null) {
                metrics.recordAttempt(type, outcome);
            }
        }
    }

    private void releaseQuietly(UUID recordId, String leaseOwner) {
        try {
            leaseManager.release(recordId, leaseOwner);
        } catch (RuntimeException e) {
            log.warn("Could not release lease on record {}; it will expire instead", recordId, e);
        }
    }

    private boolean acceptingWork() {
        return !forced && state.get() != RunnerState.DRAINING;
    }

    /**
     * Runs one readiness pass and one dispatch sweep, then waits for every
     * handler it started.
     *
     * @return attempts finished in this cycle per entity type
     */
    public Map<String, Integer> runSingleCycle() {
        if (state.get() == RunnerState.DRAINING) {
            throw new IllegalStateException("Runner " + runnerId + " is draining and accepts no new work");
        }
        readinessPass.run();

        ExecutorService cycleExecutor = Executors.newFixedThreadPool(
                Math.max(1, settings.getConcurrency()), new CustomizableThreadFactory("stator-cycle-"));
        List<Dispatched> started = new ArrayList<>();
        try {
            dispatchReady(cycleExecutor, started);
            Map<String, Integer> handled = new TreeMap<>();
            for (Dispatched dispatched : started) {
                dispatched.future().get();
                handled.merge(dispatched.type(), 1, Integer::sum);
            }
            return handled;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for handlers", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Handler dispatch failed", e.getCause());
        } finally {
            cycleExecutor.shutdown();
        }
    }

    /**
     * Stops taking new work and waits up to {@code gracePeriod} for running
     * handlers.
     *
     * @return true if every in-flight handler finished in time
     */
    public boolean drain(Duration gracePeriod) {
        if (!state.compareAndSet(RunnerState.RUNNING, RunnerState.DRAINING)) {
            return state.get() == RunnerState.STOPPED;
        }
        log.info("Runner {} draining; waiting up to {} for {} in-flight attempt(s)",
                runnerId, gracePeriod, inFlightTotal.get());
        long deadline = System.nanoTime() + gracePeriod.toNanos();

        Thread loop = loopThread;
        ExecutorService workers = executor;
        boolean finished;
        try {
            if (loop != null) {
                loop.interrupt();
                loop.join(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime())));
            }
            workers.shutdown();
            finished = workers.awaitTermination(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = false;
        }
        if (!finished) {
            log.warn("Grace period of {} expired with {} attempt(s) still running; interrupting them",
                    gracePeriod, inFlightTotal.get());
            workers.shutdownNow();
        }
        state.set(RunnerState.STOPPED);
        log.info("Runner {} stopped", runnerId);
        return finished;
    }

    /**
     * Stops immediately. Leases of interrupted attempts are not released and
     * run out on their own.
     */
    public void forceStop() {
        forced = true;
        RunnerState previous = state.getAndSet(RunnerState.STOPPED);
        Thread loop = loopThread;
        if (loop != null) {
            loop.interrupt();
        }
        ExecutorService workers = executor;
        if (workers != null) {
            workers.shutdownNow();
        }
        log.warn("Runner {} force-stopped while {}; {} lease(s) left to expire",
                runnerId, previous, inFlightTotal.get());
    }

    /**
     * Attempts finished per entity type since the previous call.
     */
    public Map<String, Long> drainHandledCounts() {
        Map<String, Long> counts = new TreeMap<>();
        handledByType.forEach((type, adder) -> {
            long count = adder.sumThenReset();
            if (count > 0) {
                counts.put(type, count);
            }
        });
        return counts;
    }

    public String runnerId() {
        return runnerId;
    }

    public RunnerState state() {
        return state.get();
    }

    public int inFlight() {
        return inFlightTotal.get();
    }

    @Override
    public void stop() {
        drain(settings.getShutdownGracePeriod());
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return state.get() == RunnerState.RUNNING;
    }

    @Override
    public boolean isAutoStartup() {
        return settings.isEnabled();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    record Dispatched(String type, Future<AttemptOutcome> future) {
    }
}
