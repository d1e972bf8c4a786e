package com.questrail.relay.api;

import java.util.Objects;

/**
 * Parameters of one outbound send.
 *
 * <p>Only the fields whose absence the relay reports as a typed failure are
 * left unchecked here: a {@code null} receiver surfaces as
 * {@link RelayErrorKind#INVALID_RECEIVER} and a non-positive amount as
 * {@link RelayErrorKind#INVALID_AMOUNT}, both during validation of the send.</p>
 *
 * @param destination     network to deliver to
 * @param receiver        recipient of the asset on the destination network (may be {@code null}; rejected at send)
 * @param payload         opaque bytes carried to the recipient (empty when none)
 * @param asset           asset to move
 * @param amount          amount in the asset's smallest unit
 * @param settlement      how the transport fee is covered
 * @param attachedPayment native value attached to the call; only meaningful for
 *                        {@link FeeSettlement#CALLER_ATTACHED_PAYMENT}
 */
public record SendRequest(
        NetworkId destination,
        Address receiver,
        byte[] payload,
        AssetType asset,
        long amount,
        FeeSettlement settlement,
        long attachedPayment
) {
    public SendRequest {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(settlement, "settlement");
        payload = payload == null ? new byte[0] : payload.clone();
        if (attachedPayment < 0) {
            throw new IllegalArgumentException("attachedPayment must be non-negative");
        }
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * A send whose fee is drawn from the relay's prefunded reserve.
     */
    public static SendRequest prefunded(NetworkId destination,
                                        Address receiver,
                                        byte[] payload,
                                        AssetType asset,
                                        long amount) {
        return new SendRequest(destination, receiver, payload, asset, amount,
                FeeSettlement.PREFUNDED_RESERVE, 0L);
    }

    /**
     * A send whose fee is paid from {@code attachedPayment}, excess refunded.
     */
    public static SendRequest withAttachedPayment(NetworkId destination,
                                                  Address receiver,
                                                  byte[] payload,
                                                  AssetType asset,
                                                  long amount,
                                                  long attachedPayment) {
        return new SendRequest(destination, receiver, payload, asset, amount,
                FeeSettlement.CALLER_ATTACHED_PAYMENT, attachedPayment);
    }
}
