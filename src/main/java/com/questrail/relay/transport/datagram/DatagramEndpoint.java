package com.questrail.relay.transport.datagram;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based link (UDP-style) between relay transports.
 *
 * <p>Higher layers are responsible for turning inbound datagrams into
 * envelopes and for deciding what to send. Implementations may be backed by
 * Netty, java.nio, or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation the endpoint notifies its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all resources.
     *
     * <p>The listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} at most once
     * per transition.</p>
     */
    void stop();

    /**
     * Send one datagram to {@code remote}.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener for inbound datagrams and lifecycle events. Must
     * be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
