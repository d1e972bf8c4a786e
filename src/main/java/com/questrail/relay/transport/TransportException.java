package com.questrail.relay.transport;

import com.questrail.relay.api.RelayErrorKind;
import com.questrail.relay.api.RelayException;

/**
 * Raised by a {@link RelayTransport} that rejects a dispatch (malformed
 * message, unsupported destination, unpaid fee, failed custody pull).
 */
public final class TransportException extends RelayException
{
    public TransportException(String message) {
        super(RelayErrorKind.DISPATCH_FAILED, message);
    }

    public TransportException(String message, Throwable cause) {
        super(RelayErrorKind.DISPATCH_FAILED, message, cause);
    }
}
