package com.questrail.relay.codec;

import com.questrail.relay.model.TransferInstruction;

/**
 * TransferInstructionCodec
 * -----------------------------------------------------------------------------
 * Converts a {@link TransferInstruction} to and from the data bytes of a
 * relay message.
 *
 * <p>Sending and receiving relays must agree on this encoding; it is the only
 * part of a message the transport treats as opaque.</p>
 */
public interface TransferInstructionCodec
{
    byte[] encode(TransferInstruction instruction);

    /**
     * Decodes one complete instruction.
     *
     * @throws InstructionDecodeException if {@code data} is not exactly one
     *         well-formed instruction
     */
    TransferInstruction decode(byte[] data);
}
