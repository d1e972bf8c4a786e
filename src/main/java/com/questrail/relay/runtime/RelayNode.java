package com.questrail.relay.runtime;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.CrossChainRelay;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.api.ReceivedMessageSnapshot;
import com.questrail.relay.api.RelayException;
import com.questrail.relay.api.SendRequest;
import com.questrail.relay.codec.TransferInstructionCodec;
import com.questrail.relay.codec.impl.BinaryTransferInstructionCodec;
import com.questrail.relay.config.RelayConfig;
import com.questrail.relay.config.RelayProfile;
import com.questrail.relay.core.AdminCapability;
import com.questrail.relay.core.AdminControl;
import com.questrail.relay.core.AllowlistKind;
import com.questrail.relay.core.AllowlistRegistry;
import com.questrail.relay.core.Custody;
import com.questrail.relay.core.FeeEscrow;
import com.questrail.relay.core.FeeQuoter;
import com.questrail.relay.core.InboundReceiver;
import com.questrail.relay.core.OutboundDispatcher;
import com.questrail.relay.core.ProcessedMessageLedger;
import com.questrail.relay.core.RelaySettings;
import com.questrail.relay.core.RelayTransaction;
import com.questrail.relay.ledger.AssetLedger;
import com.questrail.relay.model.DeliveredMessage;
import com.questrail.relay.observability.NullObservabilitySink;
import com.questrail.relay.observability.RelayErrorEvent;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.time.SystemWallClock;
import com.questrail.relay.time.WallClock;
import com.questrail.relay.transport.DeliveryHandler;
import com.questrail.relay.transport.RelayTransport;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * RelayNode
 * =============================================================================
 * Composition root of one relay: wires the core components around an asset
 * ledger and a transport, and serializes every operation into one atomic
 * unit.
 *
 * <h2>Atomicity</h2>
 * Each public mutating operation runs under a single private monitor with a
 * fresh {@link RelayTransaction}. On success the transaction commits and its
 * audit events are published; on failure every custody movement, allowance,
 * escrow credit and setting changed by the operation is restored, the failure
 * is reported once to the observability sink and then rethrown. Message ids
 * marked processed stay marked.
 *
 * <h2>Inbound entry point</h2>
 * The node is the {@link DeliveryHandler} its transport calls. Delivery and
 * send are independent operations; a send never waits for a delivery.
 *
 * <h2>Administration</h2>
 * Administrative operations take the {@link AdminCapability} issued when the
 * node was built (or the latest one handed out by
 * {@link #transferAdministration}).
 */
public final class RelayNode implements CrossChainRelay, DeliveryHandler
{
    private final Object lock = new Object();

    private final RelayConfig config;
    private final RelaySettings settings;
    private final AllowlistRegistry registry;
    private final ProcessedMessageLedger processed;
    private final Custody custody;
    private final FeeQuoter feeQuoter;
    private final OutboundDispatcher dispatcher;
    private final InboundReceiver receiver;
    private final AdminControl admin;
    private final RelayObservabilitySink sink;
    private final WallClock clock;

    private RelayNode(Builder b) {
        this.config = b.config;
        this.sink = b.observabilitySink;
        this.clock = b.clock;

        this.settings = new RelaySettings(config.feeAsset(), b.transport);
        this.registry = new AllowlistRegistry(sink, clock);
        this.processed = new ProcessedMessageLedger();
        this.custody = new Custody(b.ledger, config.relayAddress());
        this.feeQuoter = new FeeQuoter(settings, custody, new FeeEscrow(), config.feeReservePolicy());
        this.dispatcher = new OutboundDispatcher(config, registry, settings, custody, feeQuoter,
                b.instructionCodec, sink, clock);
        this.receiver = new InboundReceiver(config.profile(), registry, processed, custody,
                b.instructionCodec, sink, clock);
        this.admin = new AdminControl(b.administrator, registry, settings, custody, sink, clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Address address() {
        return config.relayAddress();
    }

    public NetworkId localNetwork() {
        return config.localNetwork();
    }

    public RelayProfile profile() {
        return config.profile();
    }

    // -------------------------------------------------------------------------
    // Caller operations
    // -------------------------------------------------------------------------

    @Override
    public MessageId send(Address caller, SendRequest request) {
        return atomically("send", tx -> dispatcher.send(tx, caller, request));
    }

    @Override
    public long quoteSend(SendRequest request) {
        synchronized (lock) {
            try {
                return dispatcher.quote(request).amount();
            } catch (RuntimeException e) {
                report("quoteSend", e);
                throw e;
            }
        }
    }

    /**
     * Deposits fee credit for {@code caller}; only available under the
     * per-caller escrow reserve policy.
     */
    public void depositFeeEscrow(Address caller, long amount) {
        run("depositFeeEscrow", tx -> feeQuoter.depositEscrow(tx, caller, amount));
    }

    public long feeEscrowBalance(Address caller) {
        synchronized (lock) {
            return feeQuoter.escrowBalance(caller);
        }
    }

    // -------------------------------------------------------------------------
    // Transport entry point
    // -------------------------------------------------------------------------

    @Override
    public void deliver(DeliveredMessage message) {
        run("deliver", tx -> receiver.deliver(tx, message));
    }

    // -------------------------------------------------------------------------
    // Observability state
    // -------------------------------------------------------------------------

    @Override
    public Optional<ReceivedMessageSnapshot> lastReceived() {
        synchronized (lock) {
            return receiver.lastReceived();
        }
    }

    @Override
    public boolean hasProcessed(MessageId id) {
        synchronized (lock) {
            return processed.hasProcessed(id);
        }
    }

    public int processedCount() {
        synchronized (lock) {
            return processed.size();
        }
    }

    @Override
    public boolean isDestinationAllowed(NetworkId network) {
        synchronized (lock) {
            return registry.isDestinationAllowed(network);
        }
    }

    @Override
    public boolean isSourceAllowed(NetworkId network) {
        synchronized (lock) {
            return registry.isSourceAllowed(network);
        }
    }

    @Override
    public boolean isAssetAllowed(AssetType asset) {
        synchronized (lock) {
            return registry.isAssetAllowed(asset);
        }
    }

    @Override
    public boolean isSenderAllowed(Address sender) {
        synchronized (lock) {
            return registry.isSenderAllowed(sender);
        }
    }

    public Set<String> allowlist(AllowlistKind kind) {
        synchronized (lock) {
            return registry.snapshot(kind);
        }
    }

    @Override
    public long custodyBalance(AssetType asset) {
        return custody.balance(asset);
    }

    @Override
    public Optional<AssetType> feeAsset() {
        synchronized (lock) {
            return settings.feeAsset();
        }
    }

    public RelayTransport transport() {
        synchronized (lock) {
            return settings.transport();
        }
    }

    // -------------------------------------------------------------------------
    // Administration
    // -------------------------------------------------------------------------

    public boolean isAdministrator(AdminCapability capability) {
        synchronized (lock) {
            return admin.isAdministrator(capability);
        }
    }

    public void setDestinationAllowed(AdminCapability capability, NetworkId network, boolean allowed) {
        run("setDestinationAllowed", tx -> admin.setDestinationAllowed(tx, capability, network, allowed));
    }

    public void setSourceAllowed(AdminCapability capability, NetworkId network, boolean allowed) {
        run("setSourceAllowed", tx -> admin.setSourceAllowed(tx, capability, network, allowed));
    }

    public void setAssetAllowed(AdminCapability capability, AssetType asset, boolean allowed) {
        run("setAssetAllowed", tx -> admin.setAssetAllowed(tx, capability, asset, allowed));
    }

    public void setSenderAllowed(AdminCapability capability, Address sender, boolean allowed) {
        run("setSenderAllowed", tx -> admin.setSenderAllowed(tx, capability, sender, allowed));
    }

    public void updateFeeAsset(AdminCapability capability, AssetType feeAsset) {
        run("updateFeeAsset", tx -> admin.updateFeeAsset(tx, capability, feeAsset));
    }

    /**
     * Replaces the outbound transport. Registering this node as the new
     * transport's delivery handler is left to the caller.
     */
    public void updateTransport(AdminCapability capability, RelayTransport transport) {
        run("updateTransport", tx -> admin.updateTransport(tx, capability, transport));
    }

    public long withdrawFeeAsset(AdminCapability capability, Address beneficiary) {
        return atomically("withdrawFeeAsset", tx -> admin.withdrawFeeAsset(tx, capability, beneficiary));
    }

    public long withdrawAsset(AdminCapability capability, Address beneficiary, AssetType asset) {
        return atomically("withdrawAsset", tx -> admin.withdrawAsset(tx, capability, beneficiary, asset));
    }

    public AdminCapability transferAdministration(AdminCapability capability, Address newHolder) {
        return atomically("transferAdministration",
                tx -> admin.transferAdministration(tx, capability, newHolder));
    }

    // -------------------------------------------------------------------------
    // Unit of work
    // -------------------------------------------------------------------------

    private <T> T atomically(String operation, Function<RelayTransaction, T> work) {
        synchronized (lock) {
            RelayTransaction tx = new RelayTransaction();
            final T result;
            try {
                result = work.apply(tx);
            } catch (RuntimeException e) {
                tx.rollback(e);
                report(operation, e);
                throw e;
            }
            tx.commit();
            return result;
        }
    }

    private void run(String operation, Consumer<RelayTransaction> work) {
        atomically(operation, tx -> {
            work.accept(tx);
            return null;
        });
    }

    private void report(String operation, RuntimeException e) {
        sink.onError(new RelayErrorEvent(
                clock.now(),
                operation,
                e instanceof RelayException re ? re.kind() : null,
                e.getMessage(),
                e));
    }

    public static final class Builder {
        private RelayConfig config;
        private AssetLedger ledger;
        private RelayTransport transport;
        private AdminCapability administrator;
        private RelayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;
        private TransferInstructionCodec instructionCodec = new BinaryTransferInstructionCodec();

        public Builder withConfig(RelayConfig config) {
            this.config = config;
            return this;
        }

        public Builder withLedger(AssetLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder withTransport(RelayTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withAdministrator(AdminCapability administrator) {
            this.administrator = administrator;
            return this;
        }

        public Builder withObservabilitySink(RelayObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withInstructionCodec(TransferInstructionCodec codec) {
            this.instructionCodec = codec;
            return this;
        }

        public RelayNode build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(ledger, "ledger");
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(administrator, "administrator");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(instructionCodec, "instructionCodec");
            return new RelayNode(this);
        }
    }
}
