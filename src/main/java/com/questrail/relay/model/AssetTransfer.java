package com.questrail.relay.model;

import com.questrail.relay.api.AssetType;

import java.util.Objects;

/**
 * One (asset, amount) pair carried by a message.
 */
public record AssetTransfer(AssetType asset, long amount)
{
    public AssetTransfer {
        Objects.requireNonNull(asset, "asset");
        if (amount <= 0) {
            throw new IllegalArgumentException("Transfer amount must be positive (was " + amount + ")");
        }
    }
}
