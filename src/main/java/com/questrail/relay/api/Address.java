package com.questrail.relay.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Opaque holder identifier on a network's asset ledger.
 *
 * <p>Callers, receivers, the relay itself, the transport and administrative
 * beneficiaries are all addressed this way. The relay never interprets the
 * value; it only compares it. Canonical form is trimmed lower case.</p>
 */
public record Address(String value)
{
    public Address {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Address must not be blank");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
    }

    public static Address of(String value) {
        return new Address(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
