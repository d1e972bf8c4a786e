package com.questrail.relay.config;

import com.questrail.relay.api.NetworkId;

import java.net.SocketAddress;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Routing table for the datagram transport.
 * Maps each reachable destination network to the socket address of the
 * transport peer serving it.
 */
public final class DatagramPeerConfig {
    private final Map<NetworkId, SocketAddress> peers;

    private DatagramPeerConfig(Map<NetworkId, SocketAddress> peers) {
        this.peers = Collections.unmodifiableMap(new HashMap<>(peers));
    }

    /**
     * Resolves a network to its peer address, if one is configured.
     */
    public Optional<SocketAddress> resolve(NetworkId network) {
        return Optional.ofNullable(peers.get(network));
    }

    /**
     * Returns the set of all reachable networks.
     */
    public Set<NetworkId> allNetworks() {
        return peers.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<NetworkId, SocketAddress> peers = new HashMap<>();

        public Builder addPeer(NetworkId network, SocketAddress address) {
            peers.put(Objects.requireNonNull(network, "network"),
                Objects.requireNonNull(address, "address"));
            return this;
        }

        public DatagramPeerConfig build() {
            if (peers.isEmpty()) {
                throw new IllegalStateException("At least one peer required");
            }
            return new DatagramPeerConfig(peers);
        }
    }
}
