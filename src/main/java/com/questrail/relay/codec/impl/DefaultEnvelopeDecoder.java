package com.questrail.relay.codec.impl;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.codec.EnvelopeDecodeException;
import com.questrail.relay.codec.EnvelopeDecoder;
import com.questrail.relay.model.AssetTransfer;
import com.questrail.relay.model.DeliveredMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * DefaultEnvelopeDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EnvelopeDecoder}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>CRC validation over the whole datagram</li>
 *   <li>Magic and version check</li>
 *   <li>Structural parse of every field, rejecting trailing bytes</li>
 *   <li>Construction of the {@link DeliveredMessage}, whose value types reject
 *       impossible values (network selector 0, blank addresses, non-positive
 *       amounts)</li>
 * </ol>
 */
public final class DefaultEnvelopeDecoder implements EnvelopeDecoder
{
    // magic(2) + version(1) + crc(2)
    private static final int MIN_LENGTH = 5;

    @Override
    public DeliveredMessage decode(byte[] datagram) {
        if (datagram == null || datagram.length < MIN_LENGTH) {
            throw new EnvelopeDecodeException("Envelope too short");
        }

        EnvelopeCrc.validate(datagram);

        try {
            WireReader in = new WireReader(datagram, 0, datagram.length - EnvelopeCrc.LENGTH);
            if (in.u8() != DefaultEnvelopeEncoder.MAGIC_0 || in.u8() != DefaultEnvelopeEncoder.MAGIC_1) {
                throw new EnvelopeDecodeException("Not a relay envelope (bad magic)");
            }
            int version = in.u8();
            if (version != DefaultEnvelopeEncoder.VERSION) {
                throw new EnvelopeDecodeException("Unsupported envelope version " + version);
            }

            MessageId id = MessageId.of(in.string("id"));
            NetworkId source = NetworkId.of(in.i64());
            NetworkId destination = NetworkId.of(in.i64());
            Address sender = Address.of(in.string("sender"));
            Address receiver = Address.of(in.string("receiver"));
            byte[] data = in.block("data");

            int count = in.u16();
            List<AssetTransfer> transfers = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                AssetType asset = AssetType.of(in.string("asset"));
                transfers.add(new AssetTransfer(asset, in.i64()));
            }
            in.requireFullyConsumed();

            return new DeliveredMessage(id, source, destination, sender, receiver, data, transfers);
        }
        catch (MalformedFieldException | IllegalArgumentException e) {
            throw new EnvelopeDecodeException("Malformed envelope: " + e.getMessage(), e);
        }
    }
}
