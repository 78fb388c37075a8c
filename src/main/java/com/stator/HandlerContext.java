package com.stator;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * What a {@link StateHandler} receives for one attempt.
 */
public final class HandlerContext {

    private final StatorRecord record;
    private final OffsetDateTime attemptedAt;
    private final LeaseExtension leaseExtension;

    public HandlerContext(StatorRecord record, OffsetDateTime attemptedAt, LeaseExtension leaseExtension) {
        this.record = record;
        this.attemptedAt = attemptedAt;
        this.leaseExtension = leaseExtension;
    }

    /**
     * The record as loaded right before the handler was invoked, with this
     * attempt already stamped ({@code ready} false, {@code attemptedAt} and
     * {@code attemptCount} updated). Changes made to this object are not
     * persisted.
     */
    public StatorRecord record() {
        return record;
    }

    public UUID recordId() {
        return record.getId();
    }

    public String entityKey() {
        return record.getEntityKey();
    }

    public String state() {
        return record.getState();
    }

    public OffsetDateTime attemptedAt() {
        return attemptedAt;
    }

    /**
     * Pushes the lease expiry out to {@code now + duration} for handlers that
     * run longer than the configured lease.
     *
     * @return false if the lease was already lost to expiry
     */
    public boolean extendLease(Duration duration) {
        return leaseExtension.extend(duration);
    }

    @FunctionalInterface
    public interface LeaseExtension {
        boolean extend(Duration duration);
    }
}
