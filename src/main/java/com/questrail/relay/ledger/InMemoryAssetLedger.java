package com.questrail.relay.ledger;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * InMemoryAssetLedger
 * -----------------------------------------------------------------------------
 * Heap-backed {@link AssetLedger} used by the loopback and datagram runtimes
 * and by tests.
 *
 * <h2>Threading model</h2>
 * A single private lock protects all balances and allowances, so every
 * operation is individually atomic.
 *
 * <h2>Zero and negative amounts</h2>
 * Transfers of zero succeed without effect. Negative amounts are rejected
 * (the transfer returns {@code false}); {@link #mint} throws for them.
 */
public final class InMemoryAssetLedger implements AssetLedger
{
    private record Holding(AssetType asset, Address holder) {}

    private record Allowance(AssetType asset, Address owner, Address spender) {}

    private final Object lock = new Object();

    private final Map<Holding, Long> balances = new HashMap<>();
    private final Map<Allowance, Long> allowances = new HashMap<>();

    /**
     * Credits {@code amount} of {@code asset} to {@code holder} out of thin air.
     * Intended for funding accounts in simulations and tests.
     */
    public void mint(AssetType asset, Address holder, long amount) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(holder, "holder");
        if (amount < 0) {
            throw new IllegalArgumentException("mint amount must be non-negative");
        }
        synchronized (lock) {
            balances.merge(new Holding(asset, holder), amount, Math::addExact);
        }
    }

    @Override
    public long balanceOf(AssetType asset, Address holder) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(holder, "holder");
        synchronized (lock) {
            return balances.getOrDefault(new Holding(asset, holder), 0L);
        }
    }

    @Override
    public long allowance(AssetType asset, Address owner, Address spender) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(spender, "spender");
        synchronized (lock) {
            return allowances.getOrDefault(new Allowance(asset, owner, spender), 0L);
        }
    }

    @Override
    public void approve(AssetType asset, Address owner, Address spender, long amount) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(spender, "spender");
        if (amount < 0) {
            throw new IllegalArgumentException("allowance must be non-negative");
        }
        synchronized (lock) {
            Allowance key = new Allowance(asset, owner, spender);
            if (amount == 0) {
                allowances.remove(key);
            } else {
                allowances.put(key, amount);
            }
        }
    }

    @Override
    public boolean transfer(AssetType asset, Address from, Address to, long amount) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        synchronized (lock) {
            return moveLocked(asset, from, to, amount);
        }
    }

    @Override
    public boolean transferFrom(AssetType asset, Address spender, Address from, Address to, long amount) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(spender, "spender");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        synchronized (lock) {
            Allowance key = new Allowance(asset, from, spender);
            long allowed = allowances.getOrDefault(key, 0L);
            if (amount < 0 || allowed < amount) {
                return false;
            }
            if (!moveLocked(asset, from, to, amount)) {
                return false;
            }
            long remaining = allowed - amount;
            if (remaining == 0) {
                allowances.remove(key);
            } else {
                allowances.put(key, remaining);
            }
            return true;
        }
    }

    private boolean moveLocked(AssetType asset, Address from, Address to, long amount) {
        if (amount < 0) {
            return false;
        }
        if (amount == 0) {
            return true;
        }
        Holding source = new Holding(asset, from);
        long available = balances.getOrDefault(source, 0L);
        if (available < amount) {
            return false;
        }
        if (from.equals(to)) {
            return true;
        }
        Holding target = new Holding(asset, to);
        long credited;
        try {
            credited = Math.addExact(balances.getOrDefault(target, 0L), amount);
        } catch (ArithmeticException e) {
            return false;
        }
        balances.put(source, available - amount);
        balances.put(target, credited);
        return true;
    }
}
