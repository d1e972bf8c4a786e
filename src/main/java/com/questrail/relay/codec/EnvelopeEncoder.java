package com.questrail.relay.codec;

import com.questrail.relay.model.DeliveredMessage;

/**
 * EnvelopeEncoder
 * -----------------------------------------------------------------------------
 * Encodes a delivered message into one wire-ready datagram payload.
 *
 * <p>The returned bytes must be suitable for immediate transmission by a UDP
 * (or other) datagram adapter without further modification.</p>
 */
public interface EnvelopeEncoder
{
    byte[] encode(DeliveredMessage message);
}
