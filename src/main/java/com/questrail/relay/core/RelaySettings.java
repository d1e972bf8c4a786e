package com.questrail.relay.core;

import com.questrail.relay.api.AssetType;
import com.questrail.relay.transport.RelayTransport;

import java.util.Objects;
import java.util.Optional;

/**
 * The administrator-reconfigurable part of a relay: its reserve fee asset and
 * its outbound transport.
 *
 * <p>Readers always see the current values; the fee quote in particular is
 * taken from whichever transport is current when a send runs.</p>
 */
public final class RelaySettings
{
    private AssetType feeAsset;
    private RelayTransport transport;

    public RelaySettings(Optional<AssetType> feeAsset, RelayTransport transport) {
        this.feeAsset = Objects.requireNonNull(feeAsset, "feeAsset").orElse(null);
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public Optional<AssetType> feeAsset() {
        return Optional.ofNullable(feeAsset);
    }

    public RelayTransport transport() {
        return transport;
    }

    void replaceFeeAsset(RelayTransaction tx, AssetType next) {
        AssetType previous = feeAsset;
        feeAsset = next;
        tx.onRollback(() -> feeAsset = previous);
    }

    void replaceTransport(RelayTransaction tx, RelayTransport next) {
        RelayTransport previous = transport;
        transport = next;
        tx.onRollback(() -> transport = previous);
    }
}
