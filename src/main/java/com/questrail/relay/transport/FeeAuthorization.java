package com.questrail.relay.transport;

import com.questrail.relay.api.AssetType;

import java.util.Objects;

/**
 * How the transport is paid for one dispatch.
 */
public sealed interface FeeAuthorization
        permits FeeAuthorization.Allowance, FeeAuthorization.AttachedValue
{
    AssetType asset();

    long amount();

    /**
     * The relay has approved the transport to pull {@code amount} of
     * {@code asset} from the relay's custody.
     */
    record Allowance(AssetType asset, long amount) implements FeeAuthorization {
        public Allowance {
            Objects.requireNonNull(asset, "asset");
            if (amount < 0) {
                throw new IllegalArgumentException("amount must be non-negative");
            }
        }
    }

    /**
     * The relay has already pushed {@code amount} of native value to the
     * transport as part of the dispatch call.
     */
    record AttachedValue(long amount) implements FeeAuthorization {
        public AttachedValue {
            if (amount < 0) {
                throw new IllegalArgumentException("amount must be non-negative");
            }
        }

        @Override
        public AssetType asset() {
            return AssetType.NATIVE;
        }
    }
}
