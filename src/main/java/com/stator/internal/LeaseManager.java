package com.stator.internal;

import com.stator.StatorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Time-bounded exclusive claims on records.
 * <p>
 * A lease is held through its expiry instant and becomes acquirable strictly
 * after it. A worker that dies simply lets its lease run out; nothing needs
 * to clean up after it.
 */
@Component
public class LeaseManager {

    private static final Logger log = LoggerFactory.getLogger(LeaseManager.class);

    private final StatorStore store;
    private final Clock clock;

    public LeaseManager(StatorStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public boolean tryAcquire(UUID recordId, String owner, Duration duration) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean acquired = store.tryAcquireLease(recordId, owner, now.plus(duration), now);
        if (!acquired) {
            log.debug("Lease on record {} is held by another owner; skipping", recordId);
        }
        return acquired;
    }

    public boolean release(UUID recordId, String owner) {
        return store.releaseLease(recordId, owner, OffsetDateTime.now(clock));
    }

    /**
     * Pushes the expiry to {@code duration} from now, provided {@code owner}
     * still holds an unexpired lease.
     */
    public boolean extend(UUID recordId, String owner, Duration duration) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean extended = store.extendLease(recordId, owner, now.plus(duration), now);
        if (!extended) {
            log.warn("Could not extend lease on record {} for {}; it expired or changed owner", recordId, owner);
        }
        return extended;
    }
}
