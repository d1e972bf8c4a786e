package com.questrail.relay.api;

/**
 * The two supported ways of covering the transport's dispatch fee.
 */
public enum FeeSettlement
{
    /**
     * The fee is paid out of the relay's standing balance of the configured
     * fee asset. The reserve is shared by every caller.
     */
    PREFUNDED_RESERVE,

    /**
     * The caller attaches native value to the send; the quote is kept for the
     * transport and any excess is refunded within the same operation.
     */
    CALLER_ATTACHED_PAYMENT
}
