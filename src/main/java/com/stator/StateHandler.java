package com.stator;

import java.util.Optional;

/**
 * Business logic attached to one state of a {@link StateGraph}.
 * <p>
 * Handlers run under at-least-once semantics: a crash or lost lease can cause
 * the same state to be attempted again, so implementations must be idempotent.
 * They must not assume exclusive access to anything other than the record they
 * were invoked for.
 */
@FunctionalInterface
public interface StateHandler {

    /**
     * Attempts to move the record out of its current state.
     *
     * @param context the freshly loaded record plus lease controls
     * @return the name of the state to transition to, or empty to stay in the
     *         current state and retry after the state's try interval
     * @throws Exception any failure; it is logged and treated as an empty result
     */
    Optional<String> handle(HandlerContext context) throws Exception;
}
