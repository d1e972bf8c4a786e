package com.questrail.relay.model;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * The decoded content of a message's data: who receives how much of what, and
 * optionally an opaque memo supplied by the original caller.
 *
 * <p>A memo that is present but empty is distinct from an absent memo: relays
 * whose profile transmits payload data always include one, token-only relays
 * never do.</p>
 */
public final class TransferInstruction
{
    private final Address recipient;
    private final AssetType asset;
    private final long amount;
    private final byte[] memo; // null when absent

    private TransferInstruction(Address recipient, AssetType asset, long amount, byte[] memo) {
        this.recipient = Objects.requireNonNull(recipient, "recipient");
        this.asset = Objects.requireNonNull(asset, "asset");
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive (was " + amount + ")");
        }
        this.amount = amount;
        this.memo = memo == null ? null : memo.clone();
    }

    public static TransferInstruction withMemo(Address recipient, AssetType asset, long amount, byte[] memo) {
        return new TransferInstruction(recipient, asset, amount, memo == null ? new byte[0] : memo);
    }

    public static TransferInstruction withoutMemo(Address recipient, AssetType asset, long amount) {
        return new TransferInstruction(recipient, asset, amount, null);
    }

    public Address recipient() {
        return recipient;
    }

    public AssetType asset() {
        return asset;
    }

    public long amount() {
        return amount;
    }

    public Optional<byte[]> memo() {
        return memo == null ? Optional.empty() : Optional.of(memo.clone());
    }

    /**
     * Memo bytes, or an empty array when no memo is carried.
     */
    public byte[] memoOrEmpty() {
        return memo == null ? new byte[0] : memo.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransferInstruction that)) return false;
        return amount == that.amount
                && recipient.equals(that.recipient)
                && asset.equals(that.asset)
                && Arrays.equals(memo, that.memo);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(recipient, asset, amount) + Arrays.hashCode(memo);
    }

    @Override
    public String toString() {
        return "TransferInstruction[" +
                "recipient=" + recipient +
                ", asset=" + asset +
                ", amount=" + amount +
                ", memoLength=" + (memo == null ? "absent" : String.valueOf(memo.length)) +
                ']';
    }
}
