package com.marketplace.realtime.throttler;

/**
 * Outcome of offering a value to a {@link Throttler}.
 */
public enum ThrottleResult {
    /** The value was handed to the target immediately. */
    PROCEED,
    /** The value was parked for the trailing invocation, replacing any value parked before it. */
    COALESCED,
    /** The throttler has been shut down and the value was discarded. */
    REJECTED
}
