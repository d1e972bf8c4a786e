package com.questrail.relay.core;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.observability.AllowlistChangedEvent;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.time.WallClock;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * AllowlistRegistry
 * -----------------------------------------------------------------------------
 * Four independent default-deny membership sets: destination networks, source
 * networks, assets and remote senders.
 *
 * <p>An identifier that was never set is not allowed. Mutators are package
 * private; {@link AdminControl} is the only component that calls them.</p>
 *
 * <p>Each mutation publishes an {@link AllowlistChangedEvent} once its
 * transaction commits, including mutations that leave membership unchanged.</p>
 *
 * <h2>Threading</h2>
 * Not thread-safe. The owning relay serializes all access.
 */
public final class AllowlistRegistry
{
    private final Map<AllowlistKind, Set<String>> members = new EnumMap<>(AllowlistKind.class);
    private final RelayObservabilitySink sink;
    private final WallClock clock;

    public AllowlistRegistry(RelayObservabilitySink sink, WallClock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (AllowlistKind kind : AllowlistKind.values()) {
            members.put(kind, new HashSet<>());
        }
    }

    public boolean isDestinationAllowed(NetworkId network) {
        return contains(AllowlistKind.DESTINATION_NETWORK, network.toString());
    }

    public boolean isSourceAllowed(NetworkId network) {
        return contains(AllowlistKind.SOURCE_NETWORK, network.toString());
    }

    public boolean isAssetAllowed(AssetType asset) {
        return contains(AllowlistKind.ASSET, asset.id());
    }

    public boolean isSenderAllowed(Address sender) {
        return contains(AllowlistKind.SENDER, sender.value());
    }

    /**
     * Current members of one list, rendered as identifiers.
     */
    public Set<String> snapshot(AllowlistKind kind) {
        return Set.copyOf(members.get(Objects.requireNonNull(kind, "kind")));
    }

    void setDestination(RelayTransaction tx, NetworkId network, boolean allowed) {
        set(tx, AllowlistKind.DESTINATION_NETWORK, network.toString(), allowed);
    }

    void setSource(RelayTransaction tx, NetworkId network, boolean allowed) {
        set(tx, AllowlistKind.SOURCE_NETWORK, network.toString(), allowed);
    }

    void setAsset(RelayTransaction tx, AssetType asset, boolean allowed) {
        set(tx, AllowlistKind.ASSET, asset.id(), allowed);
    }

    void setSender(RelayTransaction tx, Address sender, boolean allowed) {
        set(tx, AllowlistKind.SENDER, sender.value(), allowed);
    }

    private boolean contains(AllowlistKind kind, String identifier) {
        return members.get(kind).contains(identifier);
    }

    private void set(RelayTransaction tx, AllowlistKind kind, String identifier, boolean allowed) {
        Set<String> set = members.get(kind);
        boolean wasAllowed = set.contains(identifier);
        if (allowed) {
            set.add(identifier);
        } else {
            set.remove(identifier);
        }
        tx.onRollback(() -> {
            if (wasAllowed) {
                set.add(identifier);
            } else {
                set.remove(identifier);
            }
        });
        tx.afterCommit(() -> sink.onAllowlistChanged(
                new AllowlistChangedEvent(clock.now(), kind, identifier, allowed)));
    }
}
