package com.questrail.relay.runtime;

import com.questrail.relay.api.Address;
import com.questrail.relay.codec.impl.DefaultEnvelopeDecoder;
import com.questrail.relay.codec.impl.DefaultEnvelopeEncoder;
import com.questrail.relay.config.DatagramPeerConfig;
import com.questrail.relay.config.RelayConfig;
import com.questrail.relay.core.AdminCapability;
import com.questrail.relay.ledger.AssetLedger;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.observability.Slf4jRelayObservabilitySink;
import com.questrail.relay.time.SystemWallClock;
import com.questrail.relay.time.WallClock;
import com.questrail.relay.transport.FeeSchedule;
import com.questrail.relay.transport.TransportPool;
import com.questrail.relay.transport.datagram.DatagramEndpoint;
import com.questrail.relay.transport.datagram.DatagramRelayTransport;
import com.questrail.relay.transport.datagram.netty.NettyUdpDatagramEndpoint;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * DatagramRelayRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a relay reachable over UDP.
 *
 * <p>Wires a {@link RelayNode} to a {@link DatagramRelayTransport} backed by a
 * {@link NettyUdpDatagramEndpoint} (or a supplied endpoint, for tests) and
 * connects the node as the transport's delivery handler. No relay semantics
 * live here.</p>
 */
public final class DatagramRelayRuntime
{
    private final RelayNode node;
    private final DatagramRelayTransport transport;

    private DatagramRelayRuntime(RelayNode node, DatagramRelayTransport transport) {
        this.node = node;
        this.transport = transport;
    }

    public void start() {
        transport.start();
    }

    public void stop() {
        transport.stop();
    }

    public RelayNode node() {
        return node;
    }

    public DatagramRelayTransport transport() {
        return transport;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RelayConfig config;
        private AssetLedger ledger;
        private AdminCapability administrator;
        private DatagramPeerConfig peers;
        private FeeSchedule fees = FeeSchedule.defaults();
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private Supplier<DatagramEndpoint> endpointFactory;
        private Address poolAddress;
        private RelayObservabilitySink observabilitySink = new Slf4jRelayObservabilitySink();
        private WallClock clock = SystemWallClock.INSTANCE;

        public Builder withConfig(RelayConfig config) {
            this.config = config;
            return this;
        }

        public Builder withLedger(AssetLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder withAdministrator(AdminCapability administrator) {
            this.administrator = administrator;
            return this;
        }

        public Builder withPeers(DatagramPeerConfig peers) {
            this.peers = peers;
            return this;
        }

        public Builder withFeeSchedule(FeeSchedule fees) {
            this.fees = fees;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress address) {
            this.bindAddress = address;
            return this;
        }

        /**
         * Replaces the Netty endpoint, e.g. with an in-memory endpoint in tests.
         */
        public Builder withEndpoint(Supplier<DatagramEndpoint> endpointFactory) {
            this.endpointFactory = endpointFactory;
            return this;
        }

        /**
         * The transport's account on the local ledger. Defaults to
         * {@code datagram-pool-<network>}.
         */
        public Builder withPoolAddress(Address poolAddress) {
            this.poolAddress = poolAddress;
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

        public DatagramRelayRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(ledger, "ledger");
            Objects.requireNonNull(administrator, "administrator");
            Objects.requireNonNull(peers, "peers");
            Objects.requireNonNull(fees, "fees");

            Address pool = poolAddress != null
                    ? poolAddress
                    : Address.of("datagram-pool-" + config.localNetwork());
            DatagramEndpoint endpoint = endpointFactory != null
                    ? endpointFactory.get()
                    : new NettyUdpDatagramEndpoint(Objects.requireNonNull(bindAddress, "bindAddress"));

            DatagramRelayTransport transport = new DatagramRelayTransport(
                    config.localNetwork(),
                    new TransportPool(ledger, pool),
                    endpoint,
                    peers,
                    fees,
                    new DefaultEnvelopeEncoder(),
                    new DefaultEnvelopeDecoder(),
                    observabilitySink,
                    clock);

            RelayNode node = RelayNode.builder()
                    .withConfig(config)
                    .withLedger(ledger)
                    .withTransport(transport)
                    .withAdministrator(administrator)
                    .withObservabilitySink(observabilitySink)
                    .withClock(clock)
                    .build();

            transport.connect(node.address(), node);
            return new DatagramRelayRuntime(node, transport);
        }
    }
}
