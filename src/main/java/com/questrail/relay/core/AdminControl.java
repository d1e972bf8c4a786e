package com.questrail.relay.core;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.api.RelayErrorKind;
import com.questrail.relay.api.RelayException;
import com.questrail.relay.observability.ConfigurationChangedEvent;
import com.questrail.relay.observability.FundsRecoveredEvent;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.time.WallClock;
import com.questrail.relay.transport.RelayTransport;

import java.util.Objects;

/**
 * AdminControl
 * -----------------------------------------------------------------------------
 * Capability-gated administrative operations: allowlist maintenance, fee
 * asset and transport reconfiguration, fund recovery and hand-over of
 * administration.
 *
 * <p>Every operation first checks that the presented {@link AdminCapability}
 * is the current one and fails with {@link RelayErrorKind#UNAUTHORIZED}
 * otherwise.</p>
 *
 * <h2>Recovery</h2>
 * <p>{@link #withdrawFeeAsset} and {@link #withdrawAsset} move the relay's
 * entire balance of one asset to a beneficiary. They are meant for
 * emergencies and for retiring a relay; they take custody that may back
 * messages still in flight.</p>
 */
public final class AdminControl
{
    private final AllowlistRegistry registry;
    private final RelaySettings settings;
    private final Custody custody;
    private final RelayObservabilitySink sink;
    private final WallClock clock;

    private AdminCapability current;

    public AdminControl(AdminCapability initial,
                        AllowlistRegistry registry,
                        RelaySettings settings,
                        Custody custody,
                        RelayObservabilitySink sink,
                        WallClock clock) {
        this.current = Objects.requireNonNull(initial, "initial");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.custody = Objects.requireNonNull(custody, "custody");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean isAdministrator(AdminCapability capability) {
        return current.sameAuthorityAs(capability);
    }

    public void setDestinationAllowed(RelayTransaction tx, AdminCapability capability,
                                      NetworkId network, boolean allowed) {
        authorize(capability);
        registry.setDestination(tx, Objects.requireNonNull(network, "network"), allowed);
    }

    public void setSourceAllowed(RelayTransaction tx, AdminCapability capability,
                                 NetworkId network, boolean allowed) {
        authorize(capability);
        registry.setSource(tx, Objects.requireNonNull(network, "network"), allowed);
    }

    public void setAssetAllowed(RelayTransaction tx, AdminCapability capability,
                                AssetType asset, boolean allowed) {
        authorize(capability);
        registry.setAsset(tx, Objects.requireNonNull(asset, "asset"), allowed);
    }

    public void setSenderAllowed(RelayTransaction tx, AdminCapability capability,
                                 Address sender, boolean allowed) {
        authorize(capability);
        registry.setSender(tx, Objects.requireNonNull(sender, "sender"), allowed);
    }

    public void updateFeeAsset(RelayTransaction tx, AdminCapability capability, AssetType feeAsset) {
        authorize(capability);
        Objects.requireNonNull(feeAsset, "feeAsset");
        if (feeAsset.isNative()) {
            throw new IllegalArgumentException("The reserve fee asset cannot be the native asset");
        }
        String previous = settings.feeAsset().map(AssetType::toString).orElse("none");
        settings.replaceFeeAsset(tx, feeAsset);
        publishConfigurationChange(tx, "feeAsset", previous, feeAsset.toString());
    }

    public void updateTransport(RelayTransaction tx, AdminCapability capability, RelayTransport transport) {
        authorize(capability);
        Objects.requireNonNull(transport, "transport");
        String previous = settings.transport().address().toString();
        settings.replaceTransport(tx, transport);
        publishConfigurationChange(tx, "transport", previous, transport.address().toString());
    }

    /**
     * Withdraws the relay's whole balance of the configured fee asset.
     *
     * @return the amount withdrawn
     */
    public long withdrawFeeAsset(RelayTransaction tx, AdminCapability capability, Address beneficiary) {
        authorize(capability);
        AssetType feeAsset = settings.feeAsset().orElseThrow(() -> new RelayException(
                RelayErrorKind.NOTHING_TO_WITHDRAW, "No fee asset configured"));
        return withdrawAll(tx, feeAsset, beneficiary);
    }

    /**
     * Withdraws the relay's whole balance of {@code asset}.
     *
     * @return the amount withdrawn
     */
    public long withdrawAsset(RelayTransaction tx, AdminCapability capability,
                              Address beneficiary, AssetType asset) {
        authorize(capability);
        return withdrawAll(tx, Objects.requireNonNull(asset, "asset"), beneficiary);
    }

    /**
     * Issues a capability for {@code newHolder} and revokes the presented one.
     */
    public AdminCapability transferAdministration(RelayTransaction tx, AdminCapability capability,
                                                  Address newHolder) {
        authorize(capability);
        AdminCapability previous = current;
        AdminCapability next = AdminCapability.issue(newHolder);
        current = next;
        tx.onRollback(() -> current = previous);
        publishConfigurationChange(tx, "administrator",
                previous.holder().toString(), next.holder().toString());
        return next;
    }

    private long withdrawAll(RelayTransaction tx, AssetType asset, Address beneficiary) {
        Objects.requireNonNull(beneficiary, "beneficiary");
        long balance = custody.balance(asset);
        if (balance == 0) {
            throw new RelayException(RelayErrorKind.NOTHING_TO_WITHDRAW,
                    "Relay holds no " + asset);
        }
        custody.transferOut(tx, asset, beneficiary, balance);
        tx.afterCommit(() -> sink.onFundsRecovered(
                new FundsRecoveredEvent(clock.now(), asset, beneficiary, balance)));
        return balance;
    }

    private void authorize(AdminCapability capability) {
        if (!isAdministrator(capability)) {
            throw new RelayException(RelayErrorKind.UNAUTHORIZED,
                    "Caller does not hold the administrator capability");
        }
    }

    private void publishConfigurationChange(RelayTransaction tx, String setting,
                                            String previous, String current) {
        tx.afterCommit(() -> sink.onConfigurationChanged(
                new ConfigurationChangedEvent(clock.now(), setting, previous, current)));
    }
}
