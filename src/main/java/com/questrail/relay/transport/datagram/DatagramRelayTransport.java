package com.questrail.relay.transport.datagram;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.codec.EnvelopeDecodeException;
import com.questrail.relay.codec.EnvelopeDecoder;
import com.questrail.relay.codec.EnvelopeEncoder;
import com.questrail.relay.config.DatagramPeerConfig;
import com.questrail.relay.model.DeliveredMessage;
import com.questrail.relay.model.OutboundMessage;
import com.questrail.relay.observability.RelayErrorEvent;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.time.WallClock;
import com.questrail.relay.transport.DeliveryHandler;
import com.questrail.relay.transport.FeeAuthorization;
import com.questrail.relay.transport.FeeSchedule;
import com.questrail.relay.transport.MessageIds;
import com.questrail.relay.transport.RelayTransport;
import com.questrail.relay.transport.TransportException;
import com.questrail.relay.transport.TransportPool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * DatagramRelayTransport
 * =============================================================================
 * {@link RelayTransport} that carries each message as one CRC-protected
 * envelope datagram to the transport peer serving the destination network.
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   OutboundMessage
 *        → EnvelopeEncoder             (oversized envelopes refused)
 *            → TransportPool.lock      (fee and carried assets collected)
 *                → DatagramEndpoint.send(peer, ...)
 * </pre>
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint
 *        → EnvelopeDecoder             (invalid datagrams dropped and reported)
 *            → TransportPool.release   (carried assets paid to the local relay)
 *                → DeliveryHandler
 * </pre>
 *
 * <p>Datagrams are accepted only from a configured peer whose network matches
 * the envelope's source network, and only when addressed to the local
 * network. If the relay rejects a message, the release is reversed.</p>
 *
 * <h2>Explicit non-responsibilities</h2>
 * No acknowledgements, retries or ordering. A lost datagram is a lost
 * message; the sending relay has already committed its send.
 */
public final class DatagramRelayTransport implements RelayTransport, DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(DatagramRelayTransport.class);

    /**
     * Largest UDP payload an IPv4 datagram can carry.
     */
    public static final int MAX_DATAGRAM_BYTES = 65_507;

    private final NetworkId localNetwork;
    private final TransportPool pool;
    private final DatagramEndpoint endpoint;
    private final DatagramPeerConfig peers;
    private final FeeSchedule fees;
    private final EnvelopeEncoder encoder;
    private final EnvelopeDecoder decoder;
    private final RelayObservabilitySink sink;
    private final WallClock clock;

    private final Object lock = new Object();
    private final byte[] idNonce = MessageIds.newNonce();
    private long sequence;

    private volatile boolean up;
    private volatile Address relay;
    private volatile DeliveryHandler handler;

    public DatagramRelayTransport(NetworkId localNetwork,
                                  TransportPool pool,
                                  DatagramEndpoint endpoint,
                                  DatagramPeerConfig peers,
                                  FeeSchedule fees,
                                  EnvelopeEncoder encoder,
                                  EnvelopeDecoder decoder,
                                  RelayObservabilitySink sink,
                                  WallClock clock) {
        this.localNetwork = Objects.requireNonNull(localNetwork, "localNetwork");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.peers = Objects.requireNonNull(peers, "peers");
        this.fees = Objects.requireNonNull(fees, "fees");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.endpoint.setListener(this);
    }

    /**
     * Routes inbound messages to {@code handler}; released assets are paid to
     * {@code relay}.
     */
    public void connect(Address relay, DeliveryHandler handler) {
        this.relay = Objects.requireNonNull(relay, "relay");
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public boolean isUp() {
        return up;
    }

    public TransportPool pool() {
        return pool;
    }

    // -------------------------------------------------------------------------
    // RelayTransport
    // -------------------------------------------------------------------------

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

        if (!up) {
            throw new TransportException("Datagram endpoint is down");
        }
        SocketAddress peer = peers.resolve(destination).orElseThrow(() ->
                new TransportException("No peer configured for network " + destination));
        if (!message.sourceNetwork().equals(localNetwork)) {
            throw new TransportException("Message from network " + message.sourceNetwork()
                    + " dispatched through the transport of " + localNetwork);
        }

        synchronized (lock) {
            MessageId id = MessageIds.derive(message, idNonce, ++sequence);
            byte[] datagram = encoder.encode(message.deliveredAs(id));
            if (datagram.length > MAX_DATAGRAM_BYTES) {
                throw new TransportException("Envelope of " + datagram.length
                        + " bytes exceeds the datagram limit of " + MAX_DATAGRAM_BYTES);
            }

            Runnable undoLock = pool.lock(message.sender(), message, fee, fees.feeFor(message));
            try {
                endpoint.send(peer, datagram);
            } catch (RuntimeException e) {
                undoLock.run();
                throw new TransportException("Could not send " + id + " to " + peer, e);
            }
            log.debug("Sent {} ({} bytes) to network {} at {}", id, datagram.length, destination, peer);
            return id;
        }
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        up = true;
        log.info("Datagram transport for network {} is up", localNetwork);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        up = false;
        if (cause == null) {
            log.info("Datagram transport for network {} stopped", localNetwork);
        } else {
            log.warn("Datagram transport for network {} went down", localNetwork, cause);
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        final DeliveredMessage message;
        try {
            message = decoder.decode(payload);
        } catch (EnvelopeDecodeException e) {
            drop("Invalid envelope from " + remote + ": " + e.getMessage(), e);
            return;
        }

        if (!message.destinationNetwork().equals(localNetwork)) {
            drop("Envelope " + message.id() + " is addressed to network "
                    + message.destinationNetwork(), null);
            return;
        }
        Optional<SocketAddress> expectedPeer = peers.resolve(message.sourceNetwork());
        if (expectedPeer.isEmpty() || !expectedPeer.get().equals(remote)) {
            drop("Envelope " + message.id() + " from " + remote
                    + " does not come from the peer of network " + message.sourceNetwork(), null);
            return;
        }

        DeliveryHandler h = handler;
        Address r = relay;
        if (h == null || r == null) {
            drop("No relay connected; dropping " + message.id(), null);
            return;
        }

        Runnable undoRelease;
        try {
            undoRelease = pool.release(r, message.assetTransfers());
        } catch (TransportException e) {
            drop("Cannot fund delivery of " + message.id() + ": " + e.getMessage(), e);
            return;
        }

        try {
            h.deliver(message);
        } catch (RuntimeException e) {
            // the relay has already reported its own failure
            undoRelease.run();
            log.debug("Relay rejected {}: {}", message.id(), e.getMessage());
        }
    }

    private void drop(String reason, Throwable cause) {
        log.warn(reason);
        sink.onError(new RelayErrorEvent(clock.now(), "receive", null, reason, cause));
    }
}
