package com.questrail.relay.core;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.RelayErrorKind;
import com.questrail.relay.api.RelayException;
import com.questrail.relay.ledger.AssetLedger;

import java.util.Objects;

/**
 * Custody
 * -----------------------------------------------------------------------------
 * The relay's holdings on its local {@link AssetLedger}.
 *
 * <p>Every movement checks the ledger's explicit result and turns a rejected
 * transfer into {@link RelayErrorKind#TRANSFER_FAILED}. Every successful
 * movement or approval registers its reverse on the enclosing
 * {@link RelayTransaction}.</p>
 */
public final class Custody
{
    private final AssetLedger ledger;
    private final Address relay;

    public Custody(AssetLedger ledger, Address relay) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.relay = Objects.requireNonNull(relay, "relay");
    }

    public Address holder() {
        return relay;
    }

    public long balance(AssetType asset) {
        return ledger.balanceOf(asset, relay);
    }

    /**
     * Pulls {@code amount} from {@code owner} using the allowance the owner
     * granted the relay.
     */
    public void transferIn(RelayTransaction tx, AssetType asset, Address owner, long amount) {
        if (!ledger.transferFrom(asset, relay, owner, relay, amount)) {
            throw new RelayException(RelayErrorKind.TRANSFER_FAILED,
                    "Could not take " + amount + " " + asset + " from " + owner
                            + " (balance or allowance too low)");
        }
        tx.onRollback(() -> {
            reverse(asset, relay, owner, amount);
            // the pull consumed allowance; give it back
            ledger.approve(asset, owner, relay,
                    Math.addExact(ledger.allowance(asset, owner, relay), amount));
        });
    }

    /**
     * Takes native value attached to a call into custody. The caller authorizes
     * this by making the call, so no allowance is involved.
     */
    public void acceptAttachedValue(RelayTransaction tx, Address caller, long amount) {
        if (!ledger.transfer(AssetType.NATIVE, caller, relay, amount)) {
            throw new RelayException(RelayErrorKind.TRANSFER_FAILED,
                    "Caller " + caller + " cannot cover attached value " + amount);
        }
        tx.onRollback(() -> reverse(AssetType.NATIVE, relay, caller, amount));
    }

    public void transferOut(RelayTransaction tx, AssetType asset, Address recipient, long amount) {
        if (!ledger.transfer(asset, relay, recipient, amount)) {
            throw new RelayException(RelayErrorKind.TRANSFER_FAILED,
                    "Could not release " + amount + " " + asset + " to " + recipient);
        }
        tx.onRollback(() -> reverse(asset, recipient, relay, amount));
    }

    /**
     * Sets the amount of {@code asset} that {@code spender} may pull from the relay.
     */
    public void approve(RelayTransaction tx, AssetType asset, Address spender, long amount) {
        long previous = ledger.allowance(asset, relay, spender);
        ledger.approve(asset, relay, spender, amount);
        tx.onRollback(() -> ledger.approve(asset, relay, spender, previous));
    }

    private void reverse(AssetType asset, Address from, Address to, long amount) {
        if (!ledger.transfer(asset, from, to, amount)) {
            throw new IllegalStateException("Ledger refused to reverse " + amount + " " + asset
                    + " from " + from + " to " + to);
        }
    }
}
