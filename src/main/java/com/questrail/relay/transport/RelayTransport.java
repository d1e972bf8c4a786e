package com.questrail.relay.transport;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.model.OutboundMessage;

/**
 * RelayTransport
 * -----------------------------------------------------------------------------
 * Port to the external, trusted service that carries messages and their asset
 * transfers between networks.
 *
 * <p>The relay consumes exactly two operations from the transport, plus its
 * identity on the local ledger. Consensus, validator sets and cross-network
 * proof verification all live behind this port.</p>
 *
 * <h2>Custody handoff</h2>
 * <p>Before {@link #dispatch} the relay approves {@link #address()} for each
 * carried asset amount, and either approves the fee (reserve settlement) or
 * pushes it to {@link #address()} (attached payment), as described by the
 * {@link FeeAuthorization}. The transport pulls what it needs during
 * {@code dispatch}.</p>
 *
 * <h2>Inbound direction</h2>
 * <p>Deliveries arrive through {@link DeliveryHandler}, registered with the
 * transport by the composition root. The relay never polls.</p>
 */
public interface RelayTransport
{
    /**
     * The transport's holder identity on the local asset ledger.
     */
    Address address();

    /**
     * Returns the fee, in the message's fee asset, for dispatching
     * {@code message} to {@code destination} in the current transport state.
     * <p>
     * Pure query. The result is valid only for the current operation and must
     * never be cached.
     */
    long quote(NetworkId destination, OutboundMessage message);

    /**
     * Queues {@code message} for delivery to {@code destination}.
     *
     * @return the id assigned to the message
     * @throws TransportException if the transport rejects the message; the
     *         calling send fails terminally
     */
    MessageId dispatch(NetworkId destination, OutboundMessage message, FeeAuthorization fee);
}
