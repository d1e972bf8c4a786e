package com.questrail.relay.api;

/**
 * RelayErrorKind
 * -----------------------------------------------------------------------------
 * Taxonomy of terminal relay failures.
 *
 * <p>Every kind is terminal for the operation that raised it; the relay never
 * retries internally. The relay also makes no distinction between failures
 * that can never succeed (a disallowed asset) and failures that might succeed
 * later (an empty fee reserve that an administrator could top up). Callers
 * inspect the kind to decide whether resubmitting makes sense.</p>
 */
public enum RelayErrorKind
{
    /** Destination or source network is not in its allowlist. */
    CHAIN_NOT_ALLOWED,

    /** Asset type is not in the asset allowlist. */
    TOKEN_NOT_ALLOWED,

    /** Inbound sender is not in the sender allowlist. */
    SENDER_NOT_ALLOWED,

    /** Receiver identifier is missing. */
    INVALID_RECEIVER,

    /** Transfer amount is zero or negative. */
    INVALID_AMOUNT,

    /** Quoted fee exceeds the available reserve, escrow credit or attached payment. */
    INSUFFICIENT_FEE_BALANCE,

    /** Message id has already been applied. */
    REPLAYED_MESSAGE,

    /** An asset transfer did not report success. */
    TRANSFER_FAILED,

    /** A recovery call found a zero balance. */
    NOTHING_TO_WITHDRAW,

    /** The presented administrator capability is not the current one. */
    UNAUTHORIZED,

    /** A transfer instruction is malformed, or carries data the relay profile does not transmit. */
    INVALID_PAYLOAD,

    /** The requested fee settlement mode is disabled by the relay profile. */
    UNSUPPORTED_FEE_SETTLEMENT,

    /** The transport rejected the dispatch. */
    DISPATCH_FAILED
}
