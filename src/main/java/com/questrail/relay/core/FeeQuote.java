package com.questrail.relay.core;

import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.NetworkId;

import java.util.Objects;

/**
 * The transport's price for one dispatch, valid only for the send it was
 * requested for.
 */
public record FeeQuote(AssetType feeAsset, long amount, NetworkId destination)
{
    public FeeQuote {
        Objects.requireNonNull(feeAsset, "feeAsset");
        Objects.requireNonNull(destination, "destination");
        if (amount < 0) {
            throw new IllegalArgumentException("fee must be non-negative (was " + amount + ")");
        }
    }
}
