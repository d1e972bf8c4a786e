package com.questrail.relay.api;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Transport-assigned correlation key between an outbound dispatch and its
 * eventual inbound delivery.
 *
 * <p>Rendered as lower-case hexadecimal, optionally prefixed with {@code 0x}
 * on input. The relay never derives ids itself.</p>
 */
public record MessageId(String value)
{
    private static final Pattern HEX = Pattern.compile("[0-9a-f]+");

    public MessageId {
        Objects.requireNonNull(value, "value");
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("0x")) {
            v = v.substring(2);
        }
        if (v.isEmpty() || !HEX.matcher(v).matches()) {
            throw new IllegalArgumentException("MessageId must be hexadecimal (was '" + value + "')");
        }
        value = v;
    }

    public static MessageId of(String value) {
        return new MessageId(value);
    }

    @Override
    public String toString() {
        return "0x" + value;
    }
}
