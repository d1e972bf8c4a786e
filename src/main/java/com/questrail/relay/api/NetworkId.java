package com.questrail.relay.api;

/**
 * Strongly typed identifier of a network participating in cross-network
 * transfers.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * Networks are addressed by a 64-bit selector assigned by the transport. The
 * selector is treated as an unsigned value: selectors in common use exceed
 * {@link Long#MAX_VALUE} when read as unsigned, so the raw {@code long} is
 * stored as-is and only rendered unsigned.
 * </p>
 *
 * <p>
 * A {@code NetworkId} is compared only for set membership and routing. It has
 * no ordering and carries no metadata.
 * </p>
 */
public final class NetworkId
{
    private final long selector;

    private NetworkId(long selector) {
        this.selector = selector;
    }

    /**
     * Creates a {@code NetworkId} for the given raw selector.
     *
     * @param selector raw 64-bit selector (interpreted as unsigned)
     * @return a {@code NetworkId}
     * @throws IllegalArgumentException if the selector is zero (reserved as "unset")
     */
    public static NetworkId of(long selector) {
        if (selector == 0L) {
            throw new IllegalArgumentException("Network selector 0 is reserved");
        }
        return new NetworkId(selector);
    }

    /**
     * Parses an unsigned decimal selector such as {@code "14767482510784806043"}.
     *
     * @throws NumberFormatException if the text is not an unsigned 64-bit value
     */
    public static NetworkId parse(String unsignedSelector) {
        return of(Long.parseUnsignedLong(unsignedSelector.trim()));
    }

    /**
     * Returns the raw selector bits.
     */
    public long selector() {
        return selector;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NetworkId that)) return false;
        return selector == that.selector;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(selector);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(selector);
    }
}
