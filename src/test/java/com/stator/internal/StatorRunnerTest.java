package com.stator.internal;

import com.stator.StateGraph;
import com.stator.StateHandler;
import com.stator.StatorRecord;
import com.stator.config.StatorProperties;
import com.stator.testing.InMemoryStatorStore;
import com.stator.testing.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class StatorRunnerTest {

    private MutableClock clock;
    private InMemoryStatorStore store;
    private StatorProperties properties;
    private StatorRunner runner;
    private ReadinessPass readinessPass;
    private final CountDownLatch release = new CountDownLatch(1);
    private final CountDownLatch releaseRetry = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        store = new InMemoryStatorStore();
        properties = new StatorProperties();
        properties.getRunner().setMinimumLoopDelay(Duration.ofMillis(10));
        properties.getRunner().setMaximumLoopDelay(Duration.ofMillis(50));
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        releaseRetry.countDown();
        if (runner != null && runner.isRunning()) {
            runner.drain(Duration.ofSeconds(5));
        }
    }

    private static StateGraph graph(String type, StateHandler handler) {
        return StateGraph.builder(type)
                .initialState("new")
                .state("new", s -> s.tryInterval(Duration.ofSeconds(30)).handler(handler).transitionsTo("active"))
                .state("active", s -> s.externallyProgressed().transitionsTo("done"))
                .state("done")
                .build();
    }

    private StatorRunner runner(StatorMetrics metrics, StateGraph... graphs) {
        StateGraphRegistry registry = new StateGraphRegistry(List.of(graphs));
        LeaseManager leaseManager = new LeaseManager(store, clock);
        readinessPass = new ReadinessPass(store, registry, clock);
        runner = new StatorRunner(store, registry, leaseManager,
                new TransitionAttempt(store, registry, leaseManager, clock),
                readinessPass, properties, clock, metrics);
        return runner;
    }

    private UUID create(String type, String key) {
        return store.create(type, key, "new", OffsetDateTime.now(clock)).getId();
    }

    private StatorRecord reload(UUID id) {
        return store.findById(id).orElseThrow();
    }

    @Test
    void shouldMoveRecordAndReleaseLeaseInSingleCycle() {
        AtomicInteger invocations = new AtomicInteger();
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        StateGraphRegistry metricsRegistry = new StateGraphRegistry(List.of());
        StatorMetrics metrics = new StatorMetrics(store, metricsRegistry, meterRegistry);
        runner(metrics, graph("post", context -> {
            invocations.incrementAndGet();
            return Optional.of("active");
        }));
        UUID id = create("post", "p-1");

        assertThat(runner.runSingleCycle()).containsExactly(Map.entry("post", 1));

        StatorRecord record = reload(id);
        assertThat(record.getState()).isEqualTo("active");
        assertThat(record.isReady()).isTrue();
        assertThat(record.getLeasedBy()).isNull();
        assertThat(record.getLeaseExpiresAt()).isNull();
        assertThat(meterRegistry.get("stator.attempts").tag("type", "post").tag("outcome", "transitioned")
                .counter().count()).isEqualTo(1.0);

        assertThat(runner.runSingleCycle()).isEmpty();
        assertThat(invocations).hasValue(1);
    }

    @Test
    void shouldNeverDispatchExternallyProgressedOrTerminalStates() {
        AtomicInteger invocations = new AtomicInteger();
        runner(null, graph("post", context -> {
            invocations.incrementAndGet();
            return Optional.empty();
        }));
        UUID waiting = create("post", "p-1");
        UUID done = create("post", "p-2");
        store.update(waiting, record -> record.setState("active"));
        store.update(done, record -> record.setState("done"));

        assertThat(runner.runSingleCycle()).isEmpty();
        assertThat(invocations).hasValue(0);
    }

    @Test
    void shouldCountHandledAttemptsPerType() {
        runner(null, graph("post", context -> Optional.empty()), graph("user", context -> Optional.empty()));
        create("post", "p-1");
        create("post", "p-2");
        create("user", "u-1");

        assertThat(runner.runSingleCycle()).containsEntry("post", 2).containsEntry("user", 1);
        assertThat(runner.drainHandledCounts()).containsEntry("post", 2L).containsEntry("user", 1L);
        assertThat(runner.drainHandledCounts()).isEmpty();
    }

    @Test
    void shouldCapInFlightAttemptsPerType() {
        properties.getRunner().setConcurrencyPerType(2);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        runner(null, graph("post", blockingHandler(running, peak)));
        List<UUID> ids = List.of(create("post", "p-1"), create("post", "p-2"), create("post", "p-3"),
                create("post", "p-4"), create("post", "p-5"));

        runner.start();
        await().atMost(5, TimeUnit.SECONDS).until(() -> runner.inFlight() == 2);
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> runner.inFlight() == 2);
        release.countDown();

        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> ids.stream().allMatch(id -> reload(id).getState().equals("active")));
        assertThat(peak).hasValue(2);
    }

    @Test
    void shouldCapInFlightAttemptsAcrossTypes() {
        properties.getRunner().setConcurrency(3);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        StateHandler handler = blockingHandler(running, peak);
        runner(null, graph("post", handler), graph("user", handler));
        for (int i = 0; i < 4; i++) {
            create("post", "p-" + i);
            create("user", "u-" + i);
        }

        runner.start();
        await().atMost(5, TimeUnit.SECONDS).until(() -> runner.inFlight() == 3);
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> runner.inFlight() == 3);
        release.countDown();

        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> store.all().stream().allMatch(record -> record.getState().equals("active")));
        assertThat(peak).hasValue(3);
    }

    @Test
    void shouldKeepLoopRunningWhenFetchFails() {
        runner(null, graph("post", context -> Optional.of("active")));
        UUID id = create("post", "p-1");
        store.failNextFetches(3);

        runner.start();

        await().atMost(5, TimeUnit.SECONDS).until(() -> reload(id).getState().equals("active"));
        assertThat(runner.state()).isEqualTo(RunnerState.RUNNING);
    }

    @Test
    void shouldFinishInFlightWorkWhileDraining() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        runner(null, graph("post", context -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Optional.of("active");
        }));
        UUID first = create("post", "p-1");
        runner.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<Boolean> drained = CompletableFuture.supplyAsync(() -> runner.drain(Duration.ofSeconds(5)));
        await().atMost(5, TimeUnit.SECONDS).until(() -> runner.state() == RunnerState.DRAINING);
        UUID second = create("post", "p-2");
        assertThatThrownBy(runner::runSingleCycle).isInstanceOf(IllegalStateException.class);
        release.countDown();

        assertThat(drained.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(runner.state()).isEqualTo(RunnerState.STOPPED);
        assertThat(reload(first).getState()).isEqualTo("active");
        assertThat(reload(second).getState()).isEqualTo("new");
        assertThat(reload(second).getLeasedBy()).isNull();
    }

    @Test
    void shouldReportExpiredGracePeriod() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        runner(null, graph("post", context -> {
            entered.countDown();
            new CountDownLatch(1).await();
            return Optional.of("active");
        }));
        UUID id = create("post", "p-1");
        runner.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(runner.drain(Duration.ofMillis(100))).isFalse();

        assertThat(runner.state()).isEqualTo(RunnerState.STOPPED);
        await().atMost(5, TimeUnit.SECONDS).until(() -> reload(id).getLeasedBy() == null);
        assertThat(reload(id).getState()).isEqualTo("new");
    }

    @Test
    void shouldLeaveLeaseToExpireAfterForcedStop() throws Exception {
        Duration lease = properties.getRunner().getLeaseDuration();
        CountDownLatch entered = new CountDownLatch(1);
        runner(null, graph("post", context -> {
            entered.countDown();
            new CountDownLatch(1).await();
            return Optional.of("active");
        }));
        UUID id = create("post", "p-1");
        runner.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        runner.forceStop();
        await().atMost(5, TimeUnit.SECONDS).until(() -> runner.inFlight() == 0);

        assertThat(runner.state()).isEqualTo(RunnerState.STOPPED);
        assertThat(reload(id).getLeasedBy()).startsWith(runner.runnerId() + ":");
        LeaseManager otherRunner = new LeaseManager(store, clock);
        assertThat(otherRunner.tryAcquire(id, "runner-other", lease)).isFalse();

        clock.advance(lease);
        assertThat(otherRunner.tryAcquire(id, "runner-other", lease)).isFalse();
        clock.advance(Duration.ofMillis(1));
        assertThat(otherRunner.tryAcquire(id, "runner-other", lease)).isTrue();
    }

    @Test
    void shouldKeepRetryLeaseWhenOverrunAttemptFinishes() throws Exception {
        Duration lease = Duration.ofMinutes(1);
        properties.getRunner().setLeaseDuration(lease);
        AtomicInteger invocations = new AtomicInteger();
        CountDownLatch firstEntered = new CountDownLatch(1);
        CountDownLatch retryEntered = new CountDownLatch(1);
        runner(null, graph("post", context -> {
            if (invocations.incrementAndGet() == 1) {
                firstEntered.countDown();
                release.await(5, TimeUnit.SECONDS);
            } else {
                retryEntered.countDown();
                releaseRetry.await(5, TimeUnit.SECONDS);
            }
            return Optional.of("active");
        }));
        UUID id = create("post", "p-1");
        runner.start();
        assertThat(firstEntered.await(5, TimeUnit.SECONDS)).isTrue();

        clock.advance(lease.multipliedBy(2));
        readinessPass.run();
        assertThat(retryEntered.await(5, TimeUnit.SECONDS)).isTrue();
        String retryOwner = reload(id).getLeasedBy();
        assertThat(retryOwner).startsWith(runner.runnerId() + ":");

        release.countDown();
        await().atMost(5, TimeUnit.SECONDS).until(() -> runner.inFlight() == 1);

        assertThat(reload(id).getLeasedBy()).isEqualTo(retryOwner);
        assertThat(reload(id).getState()).isEqualTo("new");
        assertThat(new LeaseManager(store, clock).tryAcquire(id, "runner-other", lease)).isFalse();

        releaseRetry.countDown();
        await().atMost(5, TimeUnit.SECONDS).until(() -> reload(id).getState().equals("active"));
        assertThat(reload(id).getLeasedBy()).isNull();
        assertThat(invocations).hasValue(2);
    }

    private StateHandler blockingHandler(AtomicInteger running, AtomicInteger peak) {
        return context -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                release.await(5, TimeUnit.SECONDS);
                return Optional.of("active");
            } finally {
                running.decrementAndGet();
            }
        };
    }
}
