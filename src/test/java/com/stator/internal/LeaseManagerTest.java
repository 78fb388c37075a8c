package com.stator.internal;

import com.stator.StatorRecord;
import com.stator.testing.InMemoryStatorStore;
import com.stator.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LeaseManagerTest {

    private static final Duration LEASE = Duration.ofMinutes(5);

    private MutableClock clock;
    private InMemoryStatorStore store;
    private LeaseManager leaseManager;
    private UUID recordId;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        store = new InMemoryStatorStore();
        leaseManager = new LeaseManager(store, clock);
        recordId = store.create("post", "p-1", "new", OffsetDateTime.now(clock)).getId();
    }

    @Test
    void shouldGrantLeaseToExactlyOneConcurrentCaller() throws Exception {
        int contenders = 16;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                String owner = "runner-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return leaseManager.tryAcquire(recordId, owner, LEASE);
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldKeepLeaseHeldUntilExpiryInclusive() {
        assertThat(leaseManager.tryAcquire(recordId, "runner-a", LEASE)).isTrue();

        clock.advance(LEASE.minusMillis(1));
        assertThat(leaseManager.tryAcquire(recordId, "runner-b", LEASE)).isFalse();

        clock.advance(Duration.ofMillis(1));
        assertThat(leaseManager.tryAcquire(recordId, "runner-b", LEASE)).isFalse();

        clock.advance(Duration.ofMillis(1));
        assertThat(leaseManager.tryAcquire(recordId, "runner-b", LEASE)).isTrue();
        assertThat(store.findById(recordId)).get().extracting(StatorRecord::getLeasedBy).isEqualTo("runner-b");
    }

    @Test
    void shouldMakeRecordAcquirableAfterRelease() {
        leaseManager.tryAcquire(recordId, "runner-a", LEASE);

        assertThat(leaseManager.release(recordId, "runner-a")).isTrue();
        assertThat(leaseManager.tryAcquire(recordId, "runner-b", LEASE)).isTrue();
    }

    @Test
    void shouldIgnoreReleaseByNonOwner() {
        leaseManager.tryAcquire(recordId, "runner-a", LEASE);

        assertThat(leaseManager.release(recordId, "runner-b")).isFalse();
        assertThat(leaseManager.tryAcquire(recordId, "runner-b", LEASE)).isFalse();
    }

    @Test
    void shouldExtendOnlyUnexpiredLeaseOfOwner() {
        leaseManager.tryAcquire(recordId, "runner-a", LEASE);
        clock.advance(Duration.ofMinutes(4));

        assertThat(leaseManager.extend(recordId, "runner-b", LEASE)).isFalse();
        assertThat(leaseManager.extend(recordId, "runner-a", LEASE)).isTrue();
        assertThat(store.findById(recordId)).get().extracting(StatorRecord::getLeaseExpiresAt)
                .isEqualTo(OffsetDateTime.now(clock).plus(LEASE));

        clock.advance(LEASE.plusSeconds(1));
        assertThat(leaseManager.extend(recordId, "runner-a", LEASE)).isFalse();
    }
}
