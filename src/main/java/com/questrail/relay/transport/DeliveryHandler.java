package com.questrail.relay.transport;

import com.questrail.relay.model.DeliveredMessage;

/**
 * The single inbound entry point a relay exposes to its transport.
 *
 * <p>The transport is implicitly trusted as the invoker: no caller
 * authentication happens beyond the source-network and sender allowlist
 * checks applied to the message itself.</p>
 */
@FunctionalInterface
public interface DeliveryHandler
{
    /**
     * Applies a delivered message.
     *
     * @throws com.questrail.relay.api.RelayException if the message is rejected
     */
    void deliver(DeliveredMessage message);
}
