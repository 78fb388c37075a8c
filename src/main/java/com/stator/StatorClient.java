package com.stator;

import com.stator.internal.StateGraphRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for application code: registers entities with the engine and
 * applies changes that happen outside of handlers.
 */
@Service
public class StatorClient {

    private static final Logger log = LoggerFactory.getLogger(StatorClient.class);

    private final StatorStore store;
    private final StateGraphRegistry registry;
    private final Clock clock;

    public StatorClient(StatorStore store, StateGraphRegistry registry, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Starts tracking {@code entityKey} in the initial state of its graph.
     * Calling this again for the same key returns the existing record.
     */
    public StatorRecord create(String entityType, String entityKey) {
        if (entityKey == null || entityKey.isBlank()) {
            throw new IllegalArgumentException("Entity key must not be blank");
        }
        StateGraph graph = registry.require(entityType);
        StatorRecord record = store.create(entityType, entityKey, graph.initialState(), OffsetDateTime.now(clock));
        log.debug("Tracking {}", record);
        return record;
    }

    public Optional<StatorRecord> find(String entityType, String entityKey) {
        return store.findByKey(entityType, entityKey);
    }

    public Optional<StatorRecord> find(UUID recordId) {
        return store.findById(recordId);
    }

    /**
     * Makes a record eligible for dispatch now instead of after its try
     * interval. This is the only way a manual-only state is retried.
     *
     * @return false if the record was already ready
     */
    public boolean markReady(UUID recordId) {
        StatorRecord record = require(recordId);
        registry.require(record.getEntityType());
        return store.markReady(recordId, OffsetDateTime.now(clock));
    }

    /**
     * Applies a declared transition from outside a handler, typically to
     * move a record out of an externally progressed state.
     *
     * @throws IllegalArgumentException if the transition is not declared
     * @throws IllegalStateException if the record is leased or changed state concurrently
     */
    public StatorRecord transition(UUID recordId, String targetState) {
        StatorRecord record = require(recordId);
        StateGraph graph = registry.require(record.getEntityType());
        if (!graph.isValidTransition(record.getState(), targetState)) {
            throw new IllegalArgumentException(
                    "'" + record.getState() + "' -> '" + targetState + "' is not a transition of "
                            + record.getEntityType());
        }
        return move(record, targetState);
    }

    /**
     * Operator override: moves an unleased record to any declared state,
     * whether or not the graph has an edge to it.
     */
    public StatorRecord forceState(UUID recordId, String targetState) {
        StatorRecord record = require(recordId);
        StateGraph graph = registry.require(record.getEntityType());
        if (!graph.hasState(targetState)) {
            throw new IllegalArgumentException(
                    "State '" + targetState + "' is not declared for " + record.getEntityType());
        }
        log.info("Forcing {} into '{}'", record, targetState);
        return move(record, targetState);
    }

    private StatorRecord move(StatorRecord record, String targetState) {
        if (!store.forceTransition(record.getId(), record.getState(), targetState, OffsetDateTime.now(clock))) {
            throw new IllegalStateException(
                    "Could not move " + record + " to '" + targetState + "': it is leased or changed state");
        }
        return require(record.getId());
    }

    private StatorRecord require(UUID recordId) {
        return store.findById(recordId)
                .orElseThrow(() -> new IllegalArgumentException("No record with id " + recordId));
    }
}
