package com.questrail.relay.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to timestamp audit events.
 *
 * <p>
 * Relay correctness never depends on time: there are no timeouts, expiries or
 * windows anywhere in the protocol. Timestamps exist only so that emitted
 * events can be ordered and correlated by humans.
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
