package com.questrail.relay.api;

import java.util.Objects;

/**
 * Snapshot of the most recently applied inbound message, kept for external
 * observability.
 *
 * <p>{@code payload} is the opaque memo carried by the message (empty when the
 * sending relay transmits no payload data). The array is copied on the way
 * in and on the way out.</p>
 */
public record ReceivedMessageSnapshot(
        MessageId id,
        NetworkId sourceNetwork,
        Address sender,
        Address recipient,
        AssetType asset,
        long amount,
        byte[] payload
) {
    public ReceivedMessageSnapshot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceNetwork, "sourceNetwork");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(asset, "asset");
        payload = payload == null ? new byte[0] : payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }
}
