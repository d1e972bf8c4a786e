package com.questrail.relay.core;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.RelayErrorKind;
import com.questrail.relay.api.RelayException;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-caller fee credit for the {@code PER_CALLER_ESCROW} reserve policy.
 *
 * <p>The credited amounts are held in the relay's shared fee-asset balance;
 * this class only tracks who may draw on how much of it.</p>
 */
public final class FeeEscrow
{
    private final Map<Address, Long> credits = new HashMap<>();

    public long creditOf(Address caller) {
        return credits.getOrDefault(Objects.requireNonNull(caller, "caller"), 0L);
    }

    void credit(RelayTransaction tx, Address caller, long amount) {
        long previous = creditOf(caller);
        credits.put(caller, Math.addExact(previous, amount));
        tx.onRollback(() -> restore(caller, previous));
    }

    void debit(RelayTransaction tx, Address caller, long amount) {
        long previous = creditOf(caller);
        if (previous < amount) {
            throw new RelayException(RelayErrorKind.INSUFFICIENT_FEE_BALANCE,
                    "Fee escrow of " + caller + " holds " + previous + ", fee is " + amount);
        }
        restore(caller, previous - amount);
        tx.onRollback(() -> restore(caller, previous));
    }

    private void restore(Address caller, long value) {
        if (value == 0) {
            credits.remove(caller);
        } else {
            credits.put(caller, value);
        }
    }
}
