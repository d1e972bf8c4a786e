package com.questrail.relay.ledger;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;

/**
 * AssetLedger
 * -----------------------------------------------------------------------------
 * Port to the book of per-holder asset balances on one network.
 *
 * <p>The relay holds custody on this ledger and releases from it. It is an
 * external collaborator: the relay does not define how balances are stored or
 * replicated, only the operations it needs.</p>
 *
 * <h2>Explicit transfer results</h2>
 * <p>{@link #transfer} and {@link #transferFrom} report success as a
 * {@code boolean}. Implementations must return {@code false} (not throw and
 * not silently succeed) when the source balance or allowance is insufficient.
 * Callers are required to check the result; the relay turns a {@code false}
 * into a terminal failure of the enclosing operation.</p>
 *
 * <h2>Allowances</h2>
 * <p>{@link #approve} sets (not increments) the amount {@code spender} may
 * pull from {@code owner} through {@link #transferFrom}. A successful
 * {@code transferFrom} consumes allowance.</p>
 */
public interface AssetLedger
{
    long balanceOf(AssetType asset, Address holder);

    long allowance(AssetType asset, Address owner, Address spender);

    void approve(AssetType asset, Address owner, Address spender, long amount);

    /**
     * Moves {@code amount} from {@code from} to {@code to}.
     *
     * @return {@code true} if the transfer was applied; {@code false} if it
     *         was rejected and no balance changed
     */
    boolean transfer(AssetType asset, Address from, Address to, long amount);

    /**
     * Moves {@code amount} from {@code from} to {@code to} on behalf of
     * {@code spender}, consuming allowance.
     *
     * @return {@code true} if the transfer was applied; {@code false} if it
     *         was rejected and neither balances nor allowance changed
     */
    boolean transferFrom(AssetType asset, Address spender, Address from, Address to, long amount);
}
