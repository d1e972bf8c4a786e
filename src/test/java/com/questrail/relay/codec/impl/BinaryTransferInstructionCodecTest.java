package com.questrail.relay.codec.impl;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.codec.InstructionDecodeException;
import com.questrail.relay.model.TransferInstruction;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

final class BinaryTransferInstructionCodecTest
{
    private static final Address RECIPIENT = Address.of("0xr2");
    private static final AssetType ASSET = AssetType.of("0xa1");

    private final BinaryTransferInstructionCodec codec = new BinaryTransferInstructionCodec();

    @Test
    void instructionWithoutMemoIsVersionOne()
    {
        TransferInstruction instruction = TransferInstruction.withoutMemo(RECIPIENT, ASSET, 50);

        byte[] encoded = codec.encode(instruction);

        assertEquals(BinaryTransferInstructionCodec.VERSION_WITHOUT_MEMO, encoded[0]);
        TransferInstruction decoded = codec.decode(encoded);
        assertEquals(instruction, decoded);
        assertTrue(decoded.memo().isEmpty());
    }

    @Test
    void emptyMemoIsPreservedAsPresent()
    {
        TransferInstruction instruction = TransferInstruction.withMemo(RECIPIENT, ASSET, 50, new byte[0]);

        byte[] encoded = codec.encode(instruction);

        assertEquals(BinaryTransferInstructionCodec.VERSION_WITH_MEMO, encoded[0]);
        TransferInstruction decoded = codec.decode(encoded);
        assertTrue(decoded.memo().isPresent());
        assertEquals(0, decoded.memo().get().length);
    }

    @Test
    void memoBytesSurviveUnchanged()
    {
        byte[] memo = "ship to dock 4".getBytes(StandardCharsets.UTF_8);

        TransferInstruction decoded = codec.decode(
            codec.encode(TransferInstruction.withMemo(RECIPIENT, ASSET, Long.MAX_VALUE, memo)));

        assertArrayEquals(memo, decoded.memo().orElseThrow());
        assertEquals(Long.MAX_VALUE, decoded.amount());
    }

    @Test
    void emptyInputIsRejected()
    {
        assertThrows(InstructionDecodeException.class, () -> codec.decode(new byte[0]));
        assertThrows(InstructionDecodeException.class, () -> codec.decode(null));
    }

    @Test
    void unknownVersionIsRejected()
    {
        byte[] encoded = codec.encode(TransferInstruction.withoutMemo(RECIPIENT, ASSET, 1));
        encoded[0] = 3;

        assertThrows(InstructionDecodeException.class, () -> codec.decode(encoded));
    }

    @Test
    void truncatedInstructionIsRejected()
    {
        byte[] encoded = codec.encode(TransferInstruction.withoutMemo(RECIPIENT, ASSET, 1));

        assertThrows(InstructionDecodeException.class,
            () -> codec.decode(Arrays.copyOf(encoded, encoded.length - 1)));
    }

    @Test
    void trailingBytesAreRejected()
    {
        byte[] encoded = codec.encode(TransferInstruction.withoutMemo(RECIPIENT, ASSET, 1));

        assertThrows(InstructionDecodeException.class,
            () -> codec.decode(Arrays.copyOf(encoded, encoded.length + 1)));
    }

    @Test
    void nonPositiveAmountIsRejected()
    {
        byte[] encoded = new WireWriter()
            .u8(BinaryTransferInstructionCodec.VERSION_WITHOUT_MEMO)
            .string(RECIPIENT.value())
            .string(ASSET.id())
            .i64(0)
            .toByteArray();

        assertThrows(InstructionDecodeException.class, () -> codec.decode(encoded));
    }

    @Test
    void invalidUtf8RecipientIsRejected()
    {
        byte[] encoded = new byte[] { 1, 0, 1, (byte) 0xFF, 0, 1, 'a', 0, 0, 0, 0, 0, 0, 0, 1 };

        assertThrows(InstructionDecodeException.class, () -> codec.decode(encoded));
    }
}
