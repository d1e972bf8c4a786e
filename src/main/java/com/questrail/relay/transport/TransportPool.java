package com.questrail.relay.transport;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.ledger.AssetLedger;
import com.questrail.relay.model.AssetTransfer;
import com.questrail.relay.model.OutboundMessage;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * TransportPool
 * -----------------------------------------------------------------------------
 * A transport's own account on one network's asset ledger.
 *
 * <p>Transports shipped with the relay move assets by lock-and-release: on
 * dispatch the pool on the source network pulls the fee and the carried
 * assets from the sending relay; on delivery the pool on the destination
 * network releases the carried amounts to the receiving relay. A pool must be
 * funded with enough liquidity to cover what it releases.</p>
 *
 * <p>{@link #lock} and {@link #release} are all-or-nothing: when one movement
 * fails, the movements already made by the same call are reversed before the
 * failure is reported.</p>
 */
public final class TransportPool
{
    private final AssetLedger ledger;
    private final Address address;

    public TransportPool(AssetLedger ledger, Address address) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.address = Objects.requireNonNull(address, "address");
    }

    public Address address() {
        return address;
    }

    public long balance(AssetType asset) {
        return ledger.balanceOf(asset, address);
    }

    /**
     * Collects the fee and the carried assets of {@code message} from
     * {@code sender}.
     *
     * @param requiredFee fee the transport charges for the message
     * @return an action that returns everything collected to {@code sender}
     * @throws TransportException if the fee authorization is too small or in
     *         the wrong asset, or if any pull is refused
     */
    public Runnable lock(Address sender, OutboundMessage message, FeeAuthorization fee, long requiredFee) {
        if (!fee.asset().equals(message.feeAsset())) {
            throw new TransportException("Fee authorized in " + fee.asset()
                    + " but the message pays in " + message.feeAsset());
        }
        if (fee.amount() < requiredFee) {
            throw new TransportException("Fee authorization " + fee.amount()
                    + " is below the required fee " + requiredFee);
        }

        Deque<Runnable> undo = new ArrayDeque<>();
        try {
            if (fee instanceof FeeAuthorization.Allowance && requiredFee > 0) {
                pull(undo, sender, fee.asset(), requiredFee);
            }
            for (AssetTransfer transfer : message.assetTransfers()) {
                pull(undo, sender, transfer.asset(), transfer.amount());
            }
        } catch (TransportException e) {
            undo.forEach(Runnable::run);
            throw e;
        }
        return () -> undo.forEach(Runnable::run);
    }

    /**
     * Pays {@code transfers} out of the pool to {@code recipient}.
     *
     * @return an action that moves the released amounts back into the pool
     * @throws TransportException if the pool lacks liquidity for any transfer
     */
    public Runnable release(Address recipient, List<AssetTransfer> transfers) {
        Deque<Runnable> undo = new ArrayDeque<>();
        for (AssetTransfer transfer : transfers) {
            if (!ledger.transfer(transfer.asset(), address, recipient, transfer.amount())) {
                undo.forEach(Runnable::run);
                throw new TransportException("Pool " + address + " cannot release "
                        + transfer.amount() + " " + transfer.asset());
            }
            undo.push(() -> move(transfer.asset(), recipient, address, transfer.amount()));
        }
        return () -> undo.forEach(Runnable::run);
    }

    private void pull(Deque<Runnable> undo, Address sender, AssetType asset, long amount) {
        if (!ledger.transferFrom(asset, address, sender, address, amount)) {
            throw new TransportException("Could not collect " + amount + " " + asset + " from " + sender);
        }
        undo.push(() -> move(asset, address, sender, amount));
    }

    private void move(AssetType asset, Address from, Address to, long amount) {
        if (!ledger.transfer(asset, from, to, amount)) {
            throw new IllegalStateException("Ledger refused to return " + amount + " " + asset
                    + " from " + from + " to " + to);
        }
    }
}
