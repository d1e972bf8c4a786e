package com.questrail.relay.core;

/**
 * The four independent allowlists a relay maintains.
 */
public enum AllowlistKind
{
    /** Networks this relay may send to. */
    DESTINATION_NETWORK,

    /** Networks this relay accepts deliveries from. */
    SOURCE_NETWORK,

    /** Assets this relay may move, in either direction. */
    ASSET,

    /** Remote relays whose messages this relay accepts. */
    SENDER
}
