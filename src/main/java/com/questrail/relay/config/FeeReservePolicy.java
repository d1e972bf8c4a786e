package com.questrail.relay.config;

/**
 * How the prefunded fee reserve is attributed to callers.
 */
public enum FeeReservePolicy
{
    /**
     * One pool for every caller. Any caller's dispatch may consume fee-asset
     * funds another party contributed. This is the default.
     */
    SHARED,

    /**
     * Each caller must hold escrowed fee credit covering the quote, deposited
     * beforehand; the quote is debited from that caller's credit only.
     */
    PER_CALLER_ESCROW
}
