package com.questrail.relay.observability;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;

import java.time.Instant;

/**
 * Delivery confirmation: an inbound message was applied and custody released
 * to its recipient.
 */
public record MessageDeliveredEvent(
    Instant timestamp,
    MessageId id,
    NetworkId source,
    Address sender,
    Address recipient,
    AssetType asset,
    long amount,
    byte[] payload
) {
    public MessageDeliveredEvent {
        payload = payload == null ? new byte[0] : payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }
}
