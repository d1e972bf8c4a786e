package com.questrail.relay.codec;

/**
 * Indicates that message data could not be decoded into a transfer
 * instruction.
 *
 * This typically reflects:
 * <ul>
 *   <li>Truncated data or trailing bytes</li>
 *   <li>An unknown instruction version</li>
 *   <li>Field values that no valid instruction can hold (blank recipient,
 *       non-positive amount)</li>
 * </ul>
 */
public final class InstructionDecodeException extends RuntimeException
{
    public InstructionDecodeException(String message) {
        super(message);
    }

    public InstructionDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
