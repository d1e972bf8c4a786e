package com.questrail.relay.model;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.FeeSettlement;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;

import java.util.List;
import java.util.Objects;

/**
 * A message built by the sending relay, before the transport has assigned it
 * an id.
 *
 * <p>{@code feeAsset} is the asset the transport is paid in:
 * the configured reserve asset for {@link FeeSettlement#PREFUNDED_RESERVE},
 * {@link AssetType#NATIVE} for {@link FeeSettlement#CALLER_ATTACHED_PAYMENT}.</p>
 */
public record OutboundMessage(
        NetworkId sourceNetwork,
        NetworkId destinationNetwork,
        Address sender,
        Address receiver,
        byte[] data,
        List<AssetTransfer> assetTransfers,
        AssetType feeAsset,
        FeeSettlement feeSettlement
) implements RelayMessage
{
    public OutboundMessage {
        Objects.requireNonNull(sourceNetwork, "sourceNetwork");
        Objects.requireNonNull(destinationNetwork, "destinationNetwork");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(receiver, "receiver");
        Objects.requireNonNull(feeAsset, "feeAsset");
        Objects.requireNonNull(feeSettlement, "feeSettlement");
        data = data == null ? new byte[0] : data.clone();
        assetTransfers = List.copyOf(assetTransfers);
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    /**
     * Returns the delivered form of this message under the given id.
     * <p>
     * Used by transports once the id is known; the relay itself never calls it.
     */
    public DeliveredMessage deliveredAs(MessageId id) {
        return new DeliveredMessage(id, sourceNetwork, destinationNetwork,
                sender, receiver, data, assetTransfers);
    }

    @Override
    public String toString() {
        return "OutboundMessage[" +
                sourceNetwork + " -> " + destinationNetwork +
                ", sender=" + sender +
                ", receiver=" + receiver +
                ", dataLength=" + data.length +
                ", assetTransfers=" + assetTransfers +
                ", feeAsset=" + feeAsset +
                ", feeSettlement=" + feeSettlement +
                ']';
    }
}
