package com.questrail.relay.codec;

/**
 * Indicates that a received datagram is not a valid relay envelope.
 */
public final class EnvelopeDecodeException extends RuntimeException
{
    public EnvelopeDecodeException(String message) {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
