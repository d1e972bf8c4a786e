package com.questrail.relay.observability;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;

import java.time.Instant;

/**
 * Dispatch confirmation: the transport accepted a message and assigned it an id.
 */
public record MessageDispatchedEvent(
    Instant timestamp,
    MessageId id,
    NetworkId destination,
    Address receiver,
    AssetType asset,
    long amount,
    AssetType feeAsset,
    long fee
) {
}
