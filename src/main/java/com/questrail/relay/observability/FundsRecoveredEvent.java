package com.questrail.relay.observability;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;

import java.time.Instant;

/**
 * Record of an administrative withdrawal of the relay's entire balance of one asset.
 */
public record FundsRecoveredEvent(
    Instant timestamp,
    AssetType asset,
    Address beneficiary,
    long amount
) {
}
