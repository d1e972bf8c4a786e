package com.questrail.relay.codec.impl;

import com.questrail.relay.codec.EnvelopeDecodeException;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EnvelopeCrcTest
 * -----------------------------------------------------------------------------
 * CRC-16/ARC: polynomial 0x8005 (reflected 0xA001), init 0x0000, reflected
 * input and output, no final XOR. Appended big-endian.
 */
final class EnvelopeCrcTest
{
    @Test
    void standardCheckValue()
    {
        byte[] check = "123456789".getBytes(StandardCharsets.US_ASCII);
        assertEquals(0xBB3D, EnvelopeCrc.compute(check, 0, check.length));
    }

    @Test
    void emptyInputYieldsInitialValue()
    {
        assertEquals(0x0000, EnvelopeCrc.compute(new byte[0], 0, 0));
    }

    @Test
    void appendWritesBigEndianTrailer()
    {
        byte[] check = "123456789".getBytes(StandardCharsets.US_ASCII);
        byte[] withCrc = EnvelopeCrc.append(check);

        assertEquals(check.length + 2, withCrc.length);
        assertEquals((byte) 0xBB, withCrc[withCrc.length - 2]);
        assertEquals((byte) 0x3D, withCrc[withCrc.length - 1]);
        assertDoesNotThrow(() -> EnvelopeCrc.validate(withCrc));
    }

    @Test
    void validateRejectsMismatch()
    {
        byte[] payload = new byte[] { 0x52, 0x4C, 0x01, 0x00, 0x00 };
        assertThrows(EnvelopeDecodeException.class, () -> EnvelopeCrc.validate(payload));
    }

    @Test
    void validateRejectsTooShort()
    {
        assertThrows(EnvelopeDecodeException.class, () -> EnvelopeCrc.validate(new byte[] { 0x01 }));
    }

    @Test
    void computeHonoursOffsetAndLength()
    {
        byte[] framed = "xx123456789yy".getBytes(StandardCharsets.US_ASCII);
        assertEquals(0xBB3D, EnvelopeCrc.compute(framed, 2, 9));
    }
}
