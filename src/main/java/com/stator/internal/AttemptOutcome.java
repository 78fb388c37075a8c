package com.stator.internal;

import java.util.Locale;

/**
 * Result of one dispatch of a leased record.
 */
public enum AttemptOutcome {
    /** Handler named a valid next state and it was stored. */
    TRANSITIONED,
    /** The state's timeout had elapsed; moved without running the handler. */
    TIMED_OUT,
    /** Handler returned no transition; retried on the next readiness pass. */
    NO_TRANSITION,
    /** Handler threw or named an undeclared transition. */
    FAILED,
    /** Record was no longer ready or dispatchable once re-read. */
    SKIPPED,
    /** The lease was gone before the result could be written. */
    LEASE_LOST;

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
