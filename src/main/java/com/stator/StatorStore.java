package com.stator;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage contract the engine coordinates through.
 * <p>
 * Every mutating method is one atomic single-row conditional update, or one
 * simple bulk update, and reports whether its condition held. Implementations
 * never need a transaction spanning more than one record.
 */
public interface StatorStore {

    /**
     * Inserts a new record in {@code initialState}, ready for dispatch.
     * If a record for the same type and key already exists it is returned
     * unchanged.
     */
    StatorRecord create(String entityType, String entityKey, String initialState, OffsetDateTime now);

    Optional<StatorRecord> findById(UUID id);

    Optional<StatorRecord> findByKey(String entityType, String entityKey);

    /**
     * Up to {@code limit} records of the type that are ready, in one of
     * {@code states} and not leased at {@code now}, oldest state change first.
     */
    List<StatorRecord> fetchReadyBatch(String entityType, Collection<String> states, int limit, OffsetDateTime now);

    /**
     * Takes the lease if it is unset or expired strictly before {@code now}.
     */
    boolean tryAcquireLease(UUID id, String owner, OffsetDateTime expiresAt, OffsetDateTime now);

    boolean releaseLease(UUID id, String owner, OffsetDateTime now);

    /**
     * Moves the expiry of a lease still held by {@code owner}.
     */
    boolean extendLease(UUID id, String owner, OffsetDateTime expiresAt, OffsetDateTime now);

    /**
     * Clears readiness, stamps {@code attemptedAt} and bumps the attempt count,
     * provided {@code owner} still holds the lease.
     */
    boolean recordAttempt(UUID id, String owner, OffsetDateTime now);

    /**
     * Moves the record from {@code fromState} to {@code toState}, marks it
     * ready and resets attempt data, provided {@code owner} holds the lease.
     */
    boolean applyTransition(UUID id, String owner, String fromState, String toState, OffsetDateTime now);

    /**
     * Marks not-ready records of the type in {@code state} ready when they were
     * never attempted in that state or last attempted at or before {@code cutoff}.
     *
     * @return number of records changed
     */
    int bulkMarkReady(String entityType, String state, OffsetDateTime cutoff, OffsetDateTime now);

    boolean markReady(UUID id, OffsetDateTime now);

    /**
     * Moves an unleased record from {@code fromState} to {@code toState}.
     * Used for external progression and operator overrides.
     */
    boolean forceTransition(UUID id, String fromState, String toState, OffsetDateTime now);

    int clearExpiredLeases(OffsetDateTime now);

    Map<String, Long> countReadyByType();
}
