package com.questrail.relay.core;

import com.questrail.relay.api.Address;

import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * Proof of administrative authority over one relay.
 *
 * <p>A capability is an unguessable token bound to the holder it was issued
 * for. The relay accepts exactly one capability at a time; issuing a new one
 * through {@link AdminControl#transferAdministration} revokes the previous
 * one.</p>
 */
public final class AdminCapability
{
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int TOKEN_BYTES = 32;

    private final Address holder;
    private final byte[] token;

    private AdminCapability(Address holder, byte[] token) {
        this.holder = holder;
        this.token = token;
    }

    /**
     * Issues a fresh capability for {@code holder}.
     */
    public static AdminCapability issue(Address holder) {
        Objects.requireNonNull(holder, "holder");
        byte[] token = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(token);
        return new AdminCapability(holder, token);
    }

    public Address holder() {
        return holder;
    }

    boolean sameAuthorityAs(AdminCapability other) {
        return other != null
                && holder.equals(other.holder)
                && MessageDigest.isEqual(token, other.token);
    }

    @Override
    public String toString() {
        return "AdminCapability[holder=" + holder + "]";
    }
}
