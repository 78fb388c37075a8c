package com.stator.internal;

import com.stator.HandlerContext;
import com.stator.StateGraph;
import com.stator.StateHandler;
import com.stator.StatorRecord;
import com.stator.StatorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one handler invocation for a record the caller already holds the lease
 * on. The caller releases the lease afterwards.
 */
@Component
public class TransitionAttempt {

    private static final Logger log = LoggerFactory.getLogger(TransitionAttempt.class);

    private final StatorStore store;
    private final StateGraphRegistry registry;
    private final LeaseManager leaseManager;
    private final Clock clock;

    public TransitionAttempt(StatorStore store, StateGraphRegistry registry, LeaseManager leaseManager, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.leaseManager = leaseManager;
        this.clock = clock;
    }

    public AttemptOutcome attempt(UUID recordId, String owner) {
        // The batch row may be stale by now; decide on what is stored.
        Optional<StatorRecord> loaded = store.findById(recordId);
        if (loaded.isEmpty()) {
            log.debug("Record {} disappeared before it could be attempted", recordId);
            return AttemptOutcome.SKIPPED;
        }
        StatorRecord record = loaded.get();
        Optional<StateGraph> graph = registry.find(record.getEntityType());
        if (graph.isEmpty() || !record.isReady() || !graph.get().isDispatchable(record.getState())) {
            log.debug("Record {} is no longer dispatchable; skipping", record);
            return AttemptOutcome.SKIPPED;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!store.recordAttempt(recordId, owner, now)) {
            log.warn("Lease on {} was lost before the attempt started", record);
            return AttemptOutcome.LEASE_LOST;
        }
        record.setReady(false);
        record.setAttemptedAt(now);
        record.setAttemptCount(record.getAttemptCount() + 1);

        String state = record.getState();
        Optional<StateGraph.StateTimeout> timeout = graph.get().timeoutFor(state);
        if (timeout.isPresent() && !record.getChangedAt().plus(timeout.get().after()).isAfter(now)) {
            String target = timeout.get().targetState();
            log.info("{} spent longer than {} in '{}'; timing out to '{}'", record, timeout.get().after(), state,
                    target);
            return apply(record, owner, target, AttemptOutcome.TIMED_OUT);
        }

        StateHandler handler = graph.get().handlerFor(state).orElseThrow();
        HandlerContext context = new HandlerContext(record, now,
                duration -> leaseManager.extend(recordId, owner, duration));

        Optional<String> result;
        try {
            result = handler.handle(context);
        } catch (Exception e) {
            log.error("Handler for state '{}' failed on {}", state, record, e);
            return AttemptOutcome.FAILED;
        }

        if (result == null || result.isEmpty()) {
            log.debug("{} stays in '{}' until its next retry", record, state);
            return AttemptOutcome.NO_TRANSITION;
        }
        String target = result.get();
        if (!graph.get().isValidTransition(state, target)) {
            log.error("Handler for state '{}' returned '{}', which is not a declared transition of {}", state,
                    target, record.getEntityType());
            return AttemptOutcome.FAILED;
        }
        return apply(record, owner, target, AttemptOutcome.TRANSITIONED);
    }

    private AttemptOutcome apply(StatorRecord record, String owner, String target, AttemptOutcome success) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!store.applyTransition(record.getId(), owner, record.getState(), target, now)) {
            log.warn("Could not move {} to '{}'; the lease or state changed underneath", record, target);
            return AttemptOutcome.LEASE_LOST;
        }
        log.debug("{} -> '{}'", record, target);
        return success;
    }
}
