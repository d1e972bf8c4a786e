package com.questrail.relay.codec.impl;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.codec.InstructionDecodeException;
import com.questrail.relay.codec.TransferInstructionCodec;
import com.questrail.relay.model.TransferInstruction;

import java.util.Objects;
import java.util.Optional;

/**
 * BinaryTransferInstructionCodec
 * -----------------------------------------------------------------------------
 * Length-prefixed binary encoding of {@link TransferInstruction}.
 *
 * <p>Instructions without a memo are written as version 1, which is what
 * token-only relays produce and expect. Instructions with a memo (including an
 * empty one) are written as version 2.</p>
 */
public final class BinaryTransferInstructionCodec implements TransferInstructionCodec
{
    static final int VERSION_WITHOUT_MEMO = 1;
    static final int VERSION_WITH_MEMO = 2;

    @Override
    public byte[] encode(TransferInstruction instruction) {
        Objects.requireNonNull(instruction, "instruction");

        Optional<byte[]> memo = instruction.memo();
        WireWriter out = new WireWriter()
                .u8(memo.isPresent() ? VERSION_WITH_MEMO : VERSION_WITHOUT_MEMO)
                .string(instruction.recipient().value())
                .string(instruction.asset().id())
                .i64(instruction.amount());
        memo.ifPresent(out::block);
        return out.toByteArray();
    }

    @Override
    public TransferInstruction decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new InstructionDecodeException("Empty transfer instruction");
        }
        try {
            WireReader in = new WireReader(data, 0, data.length);
            int version = in.u8();
            if (version != VERSION_WITHOUT_MEMO && version != VERSION_WITH_MEMO) {
                throw new InstructionDecodeException("Unknown instruction version " + version);
            }
            String recipient = in.string("recipient");
            String asset = in.string("asset");
            long amount = in.i64();
            byte[] memo = version == VERSION_WITH_MEMO ? in.block("memo") : null;
            in.requireFullyConsumed();

            return memo == null
                    ? TransferInstruction.withoutMemo(Address.of(recipient), AssetType.of(asset), amount)
                    : TransferInstruction.withMemo(Address.of(recipient), AssetType.of(asset), amount, memo);
        }
        catch (MalformedFieldException | IllegalArgumentException e) {
            throw new InstructionDecodeException("Malformed transfer instruction: " + e.getMessage(), e);
        }
    }
}
