package com.questrail.relay.config;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.NetworkId;

import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for one relay deployment.
 *
 * <p>{@code feeAsset} may be absent: a relay without a fee asset can only
 * settle fees by attached payment until an administrator configures one.</p>
 */
public record RelayConfig(
    NetworkId localNetwork,
    Address relayAddress,
    Optional<AssetType> feeAsset,
    RelayProfile profile,
    FeeReservePolicy feeReservePolicy
) {
    public RelayConfig {
        Objects.requireNonNull(localNetwork, "localNetwork");
        Objects.requireNonNull(relayAddress, "relayAddress");
        Objects.requireNonNull(feeAsset, "feeAsset");
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(feeReservePolicy, "feeReservePolicy");
        if (feeAsset.isPresent() && feeAsset.get().isNative()) {
            throw new IllegalArgumentException("The reserve fee asset cannot be the native asset");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private NetworkId localNetwork;
        private Address relayAddress;
        private AssetType feeAsset;
        private RelayProfile profile = RelayProfile.standard();
        private FeeReservePolicy feeReservePolicy = FeeReservePolicy.SHARED;

        public Builder withLocalNetwork(NetworkId localNetwork) {
            this.localNetwork = localNetwork;
            return this;
        }

        public Builder withRelayAddress(Address relayAddress) {
            this.relayAddress = relayAddress;
            return this;
        }

        public Builder withFeeAsset(AssetType feeAsset) {
            this.feeAsset = feeAsset;
            return this;
        }

        public Builder withProfile(RelayProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder withFeeReservePolicy(FeeReservePolicy policy) {
            this.feeReservePolicy = policy;
            return this;
        }

        public RelayConfig build() {
            return new RelayConfig(localNetwork, relayAddress, Optional.ofNullable(feeAsset),
                profile, feeReservePolicy);
        }
    }
}
