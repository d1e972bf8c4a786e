package com.questrail.relay.api;

import java.util.Objects;

/**
 * Terminal failure of a relay operation.
 *
 * <p>The enclosing operation has been rolled back by the time this exception
 * reaches the caller (with the single exception of message ids already marked
 * processed, which are never un-marked). Use {@link #kind()} to branch.</p>
 */
public class RelayException extends RuntimeException
{
    private final RelayErrorKind kind;

    public RelayException(RelayErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public RelayException(RelayErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public RelayErrorKind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "RelayException[" + kind + "]: " + getMessage();
    }
}
