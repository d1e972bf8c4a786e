package com.questrail.relay.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifier of a fungible asset kind that the relay can hold in custody and
 * release.
 *
 * <p>The identifier is opaque (typically a token contract address). Equality
 * is case-insensitive because ledgers commonly render the same identifier in
 * mixed case; the canonical form is lower case.</p>
 *
 * <p>{@link #NATIVE} names the network's native currency. It is the asset in
 * which caller-attached fee payments are made.</p>
 */
public record AssetType(String id)
{
    public static final AssetType NATIVE = new AssetType("native");

    public AssetType {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Asset id must not be blank");
        }
        id = id.trim().toLowerCase(Locale.ROOT);
    }

    public static AssetType of(String id) {
        return new AssetType(id);
    }

    public boolean isNative() {
        return NATIVE.equals(this);
    }

    @Override
    public String toString() {
        return id;
    }
}
