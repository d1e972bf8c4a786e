package com.questrail.relay.transport;

import com.questrail.relay.model.OutboundMessage;

/**
 * Pricing of the transports shipped with the relay.
 *
 * <p>The fee for a message is {@code baseFee + perDataByte * data.length +
 * perAssetTransfer * assetTransfers.size()}, in whichever asset the message
 * names as its fee asset.</p>
 */
public record FeeSchedule(long baseFee, long perDataByte, long perAssetTransfer)
{
    public FeeSchedule {
        if (baseFee < 0 || perDataByte < 0 || perAssetTransfer < 0) {
            throw new IllegalArgumentException("Fee parameters must be non-negative");
        }
    }

    public static FeeSchedule defaults() {
        return builder().build();
    }

    /**
     * A schedule that charges nothing.
     */
    public static FeeSchedule free() {
        return new FeeSchedule(0, 0, 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public long feeFor(OutboundMessage message) {
        long dataFee = Math.multiplyExact(perDataByte, (long) message.data().length);
        long transferFee = Math.multiplyExact(perAssetTransfer, (long) message.assetTransfers().size());
        return Math.addExact(baseFee, Math.addExact(dataFee, transferFee));
    }

    public static final class Builder {
        private long baseFee = 1_000;
        private long perDataByte = 2;
        private long perAssetTransfer = 250;

        public Builder withBaseFee(long baseFee) {
            this.baseFee = baseFee;
            return this;
        }

        public Builder withPerDataByte(long perDataByte) {
            this.perDataByte = perDataByte;
            return this;
        }

        public Builder withPerAssetTransfer(long perAssetTransfer) {
            this.perAssetTransfer = perAssetTransfer;
            return this;
        }

        public FeeSchedule build() {
            return new FeeSchedule(baseFee, perDataByte, perAssetTransfer);
        }
    }
}
