package com.questrail.relay.runtime;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.codec.impl.BinaryTransferInstructionCodec;
import com.questrail.relay.config.FeeReservePolicy;
import com.questrail.relay.config.RelayConfig;
import com.questrail.relay.config.RelayProfile;
import com.questrail.relay.core.AdminCapability;
import com.questrail.relay.ledger.InMemoryAssetLedger;
import com.questrail.relay.model.AssetTransfer;
import com.questrail.relay.model.DeliveredMessage;
import com.questrail.relay.model.TransferInstruction;
import com.questrail.relay.observability.RecordingObservabilitySink;
import com.questrail.relay.transport.ScriptedTransport;

import java.time.Instant;
import java.util.List;

/**
 * One relay on network {@link #LOCAL} wired to a {@link ScriptedTransport},
 * an in-memory ledger and a recording sink.
 */
final class RelayFixture {
    static final NetworkId LOCAL = NetworkId.parse("16015286601757825753");
    static final NetworkId REMOTE = NetworkId.parse("14767482510784806043");

    static final AssetType A1 = AssetType.of("0xa1");
    static final AssetType FEE = AssetType.of("0xfee");

    static final Address RELAY = Address.of("0xrelay");
    static final Address REMOTE_RELAY = Address.of("0xremote-relay");
    static final Address OWNER = Address.of("0xowner");
    static final Address CALLER = Address.of("0xcaller");
    static final Address RECEIVER = Address.of("0xreceiver");
    static final Address R2 = Address.of("0xr2");

    static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    final InMemoryAssetLedger ledger = new InMemoryAssetLedger();
    final ScriptedTransport transport;
    final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    final AdminCapability admin = AdminCapability.issue(OWNER);
    final RelayNode node;

    RelayFixture(long fee) {
        this(fee, RelayProfile.standard(), FeeReservePolicy.SHARED);
    }

    RelayFixture(long fee, RelayProfile profile, FeeReservePolicy policy) {
        this.transport = new ScriptedTransport(fee);
        this.node = RelayNode.builder()
            .withConfig(RelayConfig.builder()
                .withLocalNetwork(LOCAL)
                .withRelayAddress(RELAY)
                .withFeeAsset(FEE)
                .withProfile(profile)
                .withFeeReservePolicy(policy)
                .build())
            .withLedger(ledger)
            .withTransport(transport)
            .withAdministrator(admin)
            .withObservabilitySink(sink)
            .withClock(() -> NOW)
            .build();
    }

    /**
     * Allowlists {@link #REMOTE} both ways, {@link #A1} and {@link #REMOTE_RELAY},
     * then forgets the resulting events.
     */
    RelayFixture allowStandardRoute() {
        node.setDestinationAllowed(admin, REMOTE, true);
        node.setSourceAllowed(admin, REMOTE, true);
        node.setAssetAllowed(admin, A1, true);
        node.setSenderAllowed(admin, REMOTE_RELAY, true);
        sink.clear();
        return this;
    }

    /**
     * Gives {@code holder} {@code amount} of {@code asset} and lets the relay pull all of it.
     */
    void fundCaller(Address holder, AssetType asset, long amount) {
        ledger.mint(asset, holder, amount);
        ledger.approve(asset, holder, RELAY, amount);
    }

    long balance(AssetType asset, Address holder) {
        return ledger.balanceOf(asset, holder);
    }

    static MessageId id(int n) {
        return MessageId.of(String.format("%064x", n));
    }

    static DeliveredMessage inbound(MessageId id, Address sender, TransferInstruction instruction) {
        return inbound(id, sender, new BinaryTransferInstructionCodec().encode(instruction),
            instruction.asset(), instruction.amount());
    }

    static DeliveredMessage inbound(MessageId id, Address sender, byte[] data, AssetType asset, long amount) {
        return new DeliveredMessage(id, REMOTE, LOCAL, sender, RELAY, data,
            List.of(new AssetTransfer(asset, amount)));
    }
}
