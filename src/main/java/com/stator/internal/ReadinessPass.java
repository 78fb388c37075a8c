package com.stator.internal;

import com.stator.StateGraph;
import com.stator.StatorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Flips records back to ready once their state's try interval has passed
 * since the last attempt.
 * <p>
 * Only dispatchable states with a try interval are touched. Manual-only states
 * wait for an explicit {@code markReady}; terminal and externally progressed
 * states are never selected.
 */
@Component
public class ReadinessPass {

    private static final Logger log = LoggerFactory.getLogger(ReadinessPass.class);

    private final StatorStore store;
    private final StateGraphRegistry registry;
    private final Clock clock;

    public ReadinessPass(StatorStore store, StateGraphRegistry registry, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * @return number of records made ready
     */
    public int run() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int total = 0;
        for (StateGraph graph : registry.graphs()) {
            for (String state : graph.dispatchableStates()) {
                Duration interval = graph.tryInterval(state).orElse(null);
                if (interval == null) {
                    continue;
                }
                int marked = store.bulkMarkReady(graph.entityType(), state, now.minus(interval), now);
                if (marked > 0) {
                    log.debug("Marked {} {} record(s) in '{}' ready", marked, graph.entityType(), state);
                }
                total += marked;
            }
        }

        int cleared = store.clearExpiredLeases(now);
        if (cleared > 0) {
            log.info("Cleared {} expired lease(s)", cleared);
        }
        return total;
    }
}
