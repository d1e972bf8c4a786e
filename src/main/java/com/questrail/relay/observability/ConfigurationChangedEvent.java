package com.questrail.relay.observability;

import java.time.Instant;

/**
 * Record of an administrative reconfiguration (fee asset, transport, administrator).
 *
 * @param previous rendered previous value, or {@code "none"}
 * @param current  rendered new value
 */
public record ConfigurationChangedEvent(
    Instant timestamp,
    String setting,
    String previous,
    String current
) {
}
