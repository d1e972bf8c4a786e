package com.questrail.relay.transport.loopback;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.ledger.AssetLedger;
import com.questrail.relay.model.DeliveredMessage;
import com.questrail.relay.model.OutboundMessage;
import com.questrail.relay.transport.DeliveryHandler;
import com.questrail.relay.transport.FeeAuthorization;
import com.questrail.relay.transport.FeeSchedule;
import com.questrail.relay.transport.MessageIds;
import com.questrail.relay.transport.RelayTransport;
import com.questrail.relay.transport.TransportException;
import com.questrail.relay.transport.TransportPool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * LoopbackTransportNetwork
 * =============================================================================
 * In-process trusted transport joining relays that live on distinct networks.
 *
 * <h2>Architectural Role</h2>
 * Each network is {@linkplain #attach attached} with its own asset ledger and
 * receives an {@link Endpoint}, the {@link RelayTransport} its relay
 * dispatches through. A dispatch locks the fee and carried assets in the
 * source network's {@link TransportPool} and queues the message. Nothing is
 * delivered until {@link #deliverPending()} runs, which keeps send and
 * delivery independent as they are between real networks.
 *
 * <h2>Delivery</h2>
 * For each queued message the destination pool releases the carried assets
 * to the receiving relay, then the relay's {@link DeliveryHandler} is invoked.
 * If the handler fails, the release is reversed and the message is recorded
 * in {@link #failedDeliveries()}; it can be attempted again with
 * {@link #redeliver(MessageId)}, which is also how duplicate delivery is
 * exercised.
 *
 * <h2>Threading</h2>
 * Internal state is guarded by a private lock. Delivery handlers are invoked
 * without that lock held, so a handler may dispatch new messages.
 */
public final class LoopbackTransportNetwork
{
    private static final Logger log = LoggerFactory.getLogger(LoopbackTransportNetwork.class);

    /**
     * A message that could not be applied, with the reason.
     */
    public record FailedDelivery(DeliveredMessage message, RuntimeException cause) {}

    private final Object lock = new Object();
    private final FeeSchedule fees;

    private final Map<NetworkId, Endpoint> endpoints = new HashMap<>();
    private final Deque<DeliveredMessage> pending = new ArrayDeque<>();
    private final Map<MessageId, DeliveredMessage> dispatched = new LinkedHashMap<>();
    private final List<FailedDelivery> failed = new ArrayList<>();
    private final byte[] idNonce = MessageIds.newNonce();
    private long sequence;

    public LoopbackTransportNetwork(FeeSchedule fees) {
        this.fees = Objects.requireNonNull(fees, "fees");
    }

    /**
     * Joins {@code network}, whose assets are kept on {@code ledger}.
     *
     * @throws IllegalStateException if the network is already attached
     */
    public Endpoint attach(NetworkId network, AssetLedger ledger) {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(ledger, "ledger");
        synchronized (lock) {
            if (endpoints.containsKey(network)) {
                throw new IllegalStateException("Network " + network + " is already attached");
            }
            Address poolAddress = Address.of("loopback-pool-" + network);
            Endpoint endpoint = new Endpoint(network, new TransportPool(ledger, poolAddress));
            endpoints.put(network, endpoint);
            log.debug("Attached network {} (pool {})", network, poolAddress);
            return endpoint;
        }
    }

    public FeeSchedule fees() {
        return fees;
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    /**
     * Every message accepted so far, in dispatch order.
     */
    public List<DeliveredMessage> dispatchedMessages() {
        synchronized (lock) {
            return List.copyOf(dispatched.values());
        }
    }

    public List<FailedDelivery> failedDeliveries() {
        synchronized (lock) {
            return List.copyOf(failed);
        }
    }

    /**
     * Delivers every queued message, including messages queued by handlers
     * while this call runs.
     *
     * @return the number of messages applied successfully
     */
    public int deliverPending() {
        int delivered = 0;
        while (true) {
            DeliveredMessage next;
            synchronized (lock) {
                next = pending.poll();
            }
            if (next == null) {
                return delivered;
            }
            if (deliver(next)) {
                delivered++;
            }
        }
    }

    /**
     * Delivers an already dispatched message again.
     *
     * @return {@code true} if the receiving relay applied it
     * @throws IllegalArgumentException if no message with this id was dispatched
     */
    public boolean redeliver(MessageId id) {
        DeliveredMessage message;
        synchronized (lock) {
            message = dispatched.get(id);
        }
        if (message == null) {
            throw new IllegalArgumentException("Unknown message " + id);
        }
        return deliver(message);
    }

    private boolean deliver(DeliveredMessage message) {
        Endpoint destination;
        synchronized (lock) {
            destination = endpoints.get(message.destinationNetwork());
        }
        if (destination == null || destination.handler == null) {
            recordFailure(message, new TransportException(
                    "No relay connected on network " + message.destinationNetwork()));
            return false;
        }

        Runnable undoRelease;
        try {
            undoRelease = destination.pool.release(destination.relay, message.assetTransfers());
        } catch (TransportException e) {
            recordFailure(message, e);
            return false;
        }

        try {
            destination.handler.deliver(message);
            return true;
        } catch (RuntimeException e) {
            undoRelease.run();
            recordFailure(message, e);
            return false;
        }
    }

    private void recordFailure(DeliveredMessage message, RuntimeException cause) {
        log.warn("Delivery of {} to network {} failed: {}",
                message.id(), message.destinationNetwork(), cause.getMessage());
        synchronized (lock) {
            failed.add(new FailedDelivery(message, cause));
        }
    }

    private MessageId accept(Endpoint source, NetworkId destination, OutboundMessage message, FeeAuthorization fee) {
        synchronized (lock) {
            if (!endpoints.containsKey(destination)) {
                throw new TransportException("Network " + destination + " is not reachable");
            }
            if (!message.destinationNetwork().equals(destination)) {
                throw new TransportException("Message addressed to " + message.destinationNetwork()
                        + " dispatched towards " + destination);
            }
            source.pool.lock(message.sender(), message, fee, fees.feeFor(message));

            MessageId id = MessageIds.derive(message, idNonce, ++sequence);
            DeliveredMessage delivered = message.deliveredAs(id);
            dispatched.put(id, delivered);
            pending.add(delivered);
            log.debug("Accepted {} from network {} to network {}", id, source.network, destination);
            return id;
        }
    }

    /**
     * One network's attachment point.
     */
    public final class Endpoint implements RelayTransport
    {
        private final NetworkId network;
        private final TransportPool pool;
        private volatile Address relay;
        private volatile DeliveryHandler handler;

        private Endpoint(NetworkId network, TransportPool pool) {
            this.network = network;
            this.pool = pool;
        }

        /**
         * Routes deliveries for this network to {@code handler}; released
         * assets are paid to {@code relay}.
         */
        public void connect(Address relay, DeliveryHandler handler) {
            this.relay = Objects.requireNonNull(relay, "relay");
            this.handler = Objects.requireNonNull(handler, "handler");
        }

        public NetworkId network() {
            return network;
        }

        public TransportPool pool() {
            return pool;
        }

        @Override
        public Address address() {
            return pool.address();
        }

        @Override
        public long quote(NetworkId destination, OutboundMessage message) {
            return fees.feeFor(message);
        }

        @Override
        public MessageId dispatch(NetworkId destination, OutboundMessage message, FeeAuthorization fee) {
            Objects.requireNonNull(destination, "destination");
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(fee, "fee");
            if (!message.sourceNetwork().equals(network)) {
                throw new TransportException("Message from network " + message.sourceNetwork()
                        + " dispatched through the endpoint of " + network);
            }
            return accept(this, destination, message, fee);
        }
    }
}
