package com.questrail.relay.model;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;

import java.util.List;
import java.util.Objects;

/**
 * A message as handed to the receiving relay by the transport.
 *
 * <p>{@code sender} is the relay that dispatched the message on the source
 * network. It is checked against the sender allowlist; the end recipient is
 * taken from the decoded {@link #data()}, never from {@code receiver}.</p>
 */
public record DeliveredMessage(
        MessageId id,
        NetworkId sourceNetwork,
        NetworkId destinationNetwork,
        Address sender,
        Address receiver,
        byte[] data,
        List<AssetTransfer> assetTransfers
) implements RelayMessage
{
    public DeliveredMessage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceNetwork, "sourceNetwork");
        Objects.requireNonNull(destinationNetwork, "destinationNetwork");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(receiver, "receiver");
        data = data == null ? new byte[0] : data.clone();
        assetTransfers = List.copyOf(assetTransfers);
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public String toString() {
        return "DeliveredMessage[" +
                "id=" + id +
                ", " + sourceNetwork + " -> " + destinationNetwork +
                ", sender=" + sender +
                ", receiver=" + receiver +
                ", dataLength=" + data.length +
                ", assetTransfers=" + assetTransfers +
                ']';
    }
}
