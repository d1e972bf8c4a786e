package com.questrail.relay.observability;

import com.questrail.relay.core.AllowlistKind;

import java.time.Instant;

/**
 * Record emitted for every allowlist mutation, carrying the identifier and its
 * new membership state.
 */
public record AllowlistChangedEvent(
    Instant timestamp,
    AllowlistKind kind,
    String identifier,
    boolean allowed
) {
}
