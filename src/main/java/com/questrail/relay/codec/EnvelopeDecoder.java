package com.questrail.relay.codec;

import com.questrail.relay.model.DeliveredMessage;

/**
 * EnvelopeDecoder
 * -----------------------------------------------------------------------------
 * Decodes exactly one datagram payload into a {@link DeliveredMessage}.
 *
 * <p>The input is treated as a complete unit; accumulation across calls is
 * not supported.</p>
 */
public interface EnvelopeDecoder
{
    /**
     * @throws EnvelopeDecodeException if the datagram is truncated, corrupt or
     *         carries values no message can hold
     */
    DeliveredMessage decode(byte[] datagram);
}
