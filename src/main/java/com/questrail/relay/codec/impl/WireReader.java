package com.questrail.relay.codec.impl;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Reads big-endian fields from a fixed byte range, failing on any overrun.
 */
final class WireReader
{
    private final byte[] data;
    private final int end;
    private int pos;

    WireReader(byte[] data, int offset, int length) {
        this.data = data;
        this.pos = offset;
        this.end = offset + length;
    }

    int u8() {
        require(1, "u8");
        return data[pos++] & 0xFF;
    }

    int u16() {
        require(2, "u16");
        int value = ((data[pos] & 0xFF) << 8) | (data[pos + 1] & 0xFF);
        pos += 2;
        return value;
    }

    long i64() {
        require(8, "i64");
        long value = 0;
        for (int i = 0; i < 8; i++) {
            value = (value << 8) | (data[pos + i] & 0xFF);
        }
        pos += 8;
        return value;
    }

    String string(String field) {
        int length = u16();
        require(length, field);
        try {
            String value = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data, pos, length))
                    .toString();
            pos += length;
            return value;
        } catch (CharacterCodingException e) {
            throw new MalformedFieldException(field + " is not valid UTF-8");
        }
    }

    byte[] block(String field) {
        require(4, field + " length");
        long length = ((long) (data[pos] & 0xFF) << 24)
                | ((data[pos + 1] & 0xFF) << 16)
                | ((data[pos + 2] & 0xFF) << 8)
                | (data[pos + 3] & 0xFF);
        pos += 4;
        if (length > remaining()) {
            throw new MalformedFieldException(field + " length " + length + " exceeds remaining " + remaining());
        }
        byte[] value = Arrays.copyOfRange(data, pos, pos + (int) length);
        pos += (int) length;
        return value;
    }

    int remaining() {
        return end - pos;
    }

    void requireFullyConsumed() {
        if (remaining() != 0) {
            throw new MalformedFieldException(remaining() + " trailing bytes");
        }
    }

    private void require(int count, String field) {
        if (count > remaining()) {
            throw new MalformedFieldException("truncated " + field + ": need " + count
                    + " bytes, have " + remaining());
        }
    }
}
