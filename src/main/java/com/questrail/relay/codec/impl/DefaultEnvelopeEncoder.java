package com.questrail.relay.codec.impl;

import com.questrail.relay.codec.EnvelopeEncoder;
import com.questrail.relay.model.AssetTransfer;
import com.questrail.relay.model.DeliveredMessage;

import java.util.List;
import java.util.Objects;

/**
 * DefaultEnvelopeEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EnvelopeEncoder}; the mechanical inverse
 * of {@link DefaultEnvelopeDecoder}.
 */
public final class DefaultEnvelopeEncoder implements EnvelopeEncoder
{
    static final int MAGIC_0 = 0x52; // 'R'
    static final int MAGIC_1 = 0x4C; // 'L'
    static final int VERSION = 1;

    @Override
    public byte[] encode(DeliveredMessage message) {
        Objects.requireNonNull(message, "message");

        List<AssetTransfer> transfers = message.assetTransfers();
        WireWriter out = new WireWriter()
                .u8(MAGIC_0)
                .u8(MAGIC_1)
                .u8(VERSION)
                .string(message.id().value())
                .i64(message.sourceNetwork().selector())
                .i64(message.destinationNetwork().selector())
                .string(message.sender().value())
                .string(message.receiver().value())
                .block(message.data())
                .u16(transfers.size());
        for (AssetTransfer transfer : transfers) {
            out.string(transfer.asset().id()).i64(transfer.amount());
        }
        return EnvelopeCrc.append(out.toByteArray());
    }
}
