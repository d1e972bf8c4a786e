package com.questrail.relay.model;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.NetworkId;

import java.util.List;

/**
 * Canonical representation of a relay message.
 *
 * <h2>Directionality</h2>
 * <p>
 * The relay protocol is one-way. A message is built by the sending relay and
 * handed to the transport, which assigns it an id; the transport later hands
 * a delivered copy, now carrying that id, to the receiving relay. The two
 * forms are kept apart structurally:
 * </p>
 * <ul>
 *   <li>{@link OutboundMessage} has no id (it does not exist yet)</li>
 *   <li>{@link DeliveredMessage} always has one</li>
 * </ul>
 *
 * <p>
 * {@link #data()} is the encoded transfer instruction. Its layout is owned by
 * {@code TransferInstructionCodec}; nothing else inspects the bytes.
 * </p>
 */
public sealed interface RelayMessage permits OutboundMessage, DeliveredMessage
{
    NetworkId sourceNetwork();

    NetworkId destinationNetwork();

    Address sender();

    Address receiver();

    byte[] data();

    List<AssetTransfer> assetTransfers();
}
