package com.questrail.relay.config;

import com.questrail.relay.api.FeeSettlement;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * RelayProfile
 * -----------------------------------------------------------------------------
 * Selects which protocol features a relay deployment carries.
 *
 * <p>Earlier deployments of the relay existed as separate near-duplicate
 * variants: one with replay protection and payload data, one without replay
 * protection, and one that moved tokens only. A single implementation now
 * covers all of them, switched by this profile.</p>
 *
 * <ul>
 *   <li><b>replayProtection</b>: consult and update the processed-message
 *       ledger on delivery. When enabled, a replay is always rejected with
 *       {@code REPLAYED_MESSAGE}.</li>
 *   <li><b>payloadData</b>: carry the caller's opaque payload to the
 *       recipient. When disabled, sends with a non-empty payload are
 *       rejected.</li>
 *   <li><b>senderAllowlist</b>: require inbound senders to be allowlisted.</li>
 *   <li><b>feeSettlements</b>: the fee settlement modes callers may use.</li>
 * </ul>
 */
public record RelayProfile(
        boolean replayProtection,
        boolean payloadData,
        boolean senderAllowlist,
        Set<FeeSettlement> feeSettlements
) {
    public RelayProfile {
        Objects.requireNonNull(feeSettlements, "feeSettlements");
        if (feeSettlements.isEmpty()) {
            throw new IllegalArgumentException("At least one fee settlement mode required");
        }
        feeSettlements = Set.copyOf(feeSettlements);
    }

    /**
     * Every feature enabled. This is the profile new deployments use.
     */
    public static RelayProfile standard() {
        return new RelayProfile(true, true, true, EnumSet.allOf(FeeSettlement.class));
    }

    /**
     * Tokens only: replay-protected and sender-checked, but no payload data.
     */
    public static RelayProfile tokenOnly() {
        return new RelayProfile(true, false, true, EnumSet.allOf(FeeSettlement.class));
    }

    /**
     * The first-generation router: payload data but neither replay protection
     * nor a sender allowlist. Kept for interoperating with relays that were
     * deployed with it; not recommended for new deployments.
     */
    public static RelayProfile legacy() {
        return new RelayProfile(false, true, false, EnumSet.allOf(FeeSettlement.class));
    }

    public boolean supports(FeeSettlement settlement) {
        return feeSettlements.contains(settlement);
    }
}
