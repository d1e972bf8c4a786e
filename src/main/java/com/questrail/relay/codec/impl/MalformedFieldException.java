package com.questrail.relay.codec.impl;

/**
 * Raised by {@link WireReader} when a field runs past the end of its input or
 * carries an impossible length.
 */
final class MalformedFieldException extends RuntimeException
{
    MalformedFieldException(String message) {
        super(message);
    }
}
