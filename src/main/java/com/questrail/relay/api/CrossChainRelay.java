package com.questrail.relay.api;

import java.util.Optional;

/**
 * CrossChainRelay
 * -----------------------------------------------------------------------------
 * {@code CrossChainRelay} is the caller-facing façade of a relay deployed on
 * one network.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Dispatching an asset plus an opaque payload to a recipient on another
 *       network, through an external trusted transport</li>
 *   <li>Exposing read-only observability state: the allowlists, replay status
 *       and the last applied inbound message</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Awaiting, cancelling or timing out remote delivery</li>
 *   <li>Retrying a failed dispatch</li>
 *   <li>Verifying cross-network proofs (delegated to the transport)</li>
 * </ul>
 *
 * <h2>One-way messaging</h2>
 * A send returns as soon as the transport has accepted the message and
 * assigned it a {@link MessageId}. Delivery happens later, independently, when
 * the transport invokes the destination relay's inbound entry point. There is
 * no handle to wait on; correlating a send with its delivery is done by id,
 * through {@link #hasProcessed(MessageId)} on the destination relay or through
 * the emitted audit events.
 *
 * <h2>Failures</h2>
 * Every operation is atomic: it either applies all of its state changes or
 * none of them, and every failure surfaces as a {@link RelayException}.
 */
public interface CrossChainRelay
{
    /**
     * Dispatches {@code request} on behalf of {@code caller}.
     *
     * @return the transport-assigned message id
     * @throws RelayException on any validation, custody, fee or transport failure
     */
    MessageId send(Address caller, SendRequest request);

    /**
     * Returns the fee the transport would currently charge for
     * {@code request}, without changing any state.
     * <p>
     * The value is only an estimate: the fee is re-quoted when the send is
     * actually made.
     */
    long quoteSend(SendRequest request);

    /**
     * Returns the most recently applied inbound message, if any.
     */
    Optional<ReceivedMessageSnapshot> lastReceived();

    /**
     * Returns {@code true} once an inbound message with this id has been
     * consumed. Never reverts to {@code false}.
     */
    boolean hasProcessed(MessageId id);

    boolean isDestinationAllowed(NetworkId network);

    boolean isSourceAllowed(NetworkId network);

    boolean isAssetAllowed(AssetType asset);

    boolean isSenderAllowed(Address sender);

    /**
     * Returns the relay's custody balance of {@code asset}.
     */
    long custodyBalance(AssetType asset);

    /**
     * Returns the asset used for prefunded-reserve fee settlement, if one is
     * configured.
     */
    Optional<AssetType> feeAsset();
}
