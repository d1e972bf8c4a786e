package com.questrail.relay.codec.impl;

import com.questrail.relay.codec.EnvelopeDecodeException;

import java.util.Arrays;

/**
 * EnvelopeCrc
 * -----------------------------------------------------------------------------
 * CRC-16/ARC trailer for relay envelopes.
 */
final class EnvelopeCrc
{
    /*
     * CRC-16/ARC (reflected algorithm)
     *   • Polynomial (normal): 0x8005, reflected: 0xA001
     *   • INIT: 0x0000, XOROUT: 0x0000
     *   • Input and output reflected
     * Check value for "123456789" is 0xBB3D.
     */
    private static final int REFLECTED_POLY = 0xA001;
    private static final int INIT = 0x0000;

    static final int LENGTH = 2;

    private EnvelopeCrc() {}

    /**
     * Validates the two-byte big-endian CRC at the end of {@code datagram}.
     *
     * @throws EnvelopeDecodeException if the datagram is too short to carry a
     *         CRC or the CRC does not match
     */
    static void validate(byte[] datagram) {
        if (datagram.length < LENGTH) {
            throw new EnvelopeDecodeException("CRC expected but datagram too short");
        }
        final int len = datagram.length;
        final int transmitted = ((datagram[len - 2] & 0xFF) << 8) | (datagram[len - 1] & 0xFF);
        final int computed = compute(datagram, 0, len - LENGTH);
        if (transmitted != computed) {
            throw new EnvelopeDecodeException(String.format(
                    "CRC mismatch: transmitted=0x%04X computed=0x%04X", transmitted, computed));
        }
    }

    /**
     * Returns {@code body} followed by its CRC, big-endian.
     */
    static byte[] append(byte[] body) {
        final int crc = compute(body, 0, body.length);
        final byte[] out = Arrays.copyOf(body, body.length + LENGTH);
        out[out.length - 2] = (byte) ((crc >>> 8) & 0xFF);
        out[out.length - 1] = (byte) (crc & 0xFF);
        return out;
    }

    static int compute(byte[] data, int off, int len) {
        int crc = INIT & 0xFFFF;
        for (int i = off; i < off + len; i++) {
            crc ^= (data[i] & 0xFF);
            for (int b = 0; b < 8; b++) {
                if ((crc & 0x0001) != 0) {
                    crc = (crc >>> 1) ^ REFLECTED_POLY;
                } else {
                    crc = (crc >>> 1);
                }
            }
            crc &= 0xFFFF;
        }
        return crc & 0xFFFF;
    }
}
