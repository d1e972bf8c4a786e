package com.questrail.relay.core;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.FeeSettlement;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.api.RelayErrorKind;
import com.questrail.relay.api.RelayException;
import com.questrail.relay.config.FeeReservePolicy;
import com.questrail.relay.model.OutboundMessage;
import com.questrail.relay.transport.TransportException;

import java.util.Objects;

/**
 * FeeQuoter
 * -----------------------------------------------------------------------------
 * Obtains the transport fee for a send and makes sure it is covered.
 *
 * <p>The fee is re-queried from the current transport for every send. Nothing
 * is cached: the transport may reprice at any time and the administrator may
 * replace the transport between sends.</p>
 *
 * <h2>Coverage</h2>
 * <ul>
 *   <li>{@link FeeSettlement#PREFUNDED_RESERVE}: the relay's balance of the fee
 *       asset must cover the quote. Under {@link FeeReservePolicy#PER_CALLER_ESCROW}
 *       the caller's escrow credit must cover it too, and is debited.</li>
 *   <li>{@link FeeSettlement#CALLER_ATTACHED_PAYMENT}: the attached value must
 *       cover the quote. It is taken into custody and everything above the
 *       quote is refunded to the caller at once.</li>
 * </ul>
 */
public final class FeeQuoter
{
    private final RelaySettings settings;
    private final Custody custody;
    private final FeeEscrow escrow;
    private final FeeReservePolicy reservePolicy;

    public FeeQuoter(RelaySettings settings, Custody custody, FeeEscrow escrow, FeeReservePolicy reservePolicy) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.custody = Objects.requireNonNull(custody, "custody");
        this.escrow = Objects.requireNonNull(escrow, "escrow");
        this.reservePolicy = Objects.requireNonNull(reservePolicy, "reservePolicy");
    }

    public FeeQuote quote(NetworkId destination, OutboundMessage message) {
        long fee = settings.transport().quote(destination, message);
        if (fee < 0) {
            throw new TransportException("Transport quoted a negative fee: " + fee);
        }
        return new FeeQuote(message.feeAsset(), fee, destination);
    }

    /**
     * Verifies the quoted fee is covered and settles the caller's side of it.
     *
     * @param inFlight amount of the fee asset taken into custody earlier in the
     *                 same send; it belongs to the transfer and is not
     *                 available to pay the fee
     * @throws RelayException {@link RelayErrorKind#INSUFFICIENT_FEE_BALANCE} if
     *         the fee is not covered
     */
    public void ensureFeeCoverage(RelayTransaction tx,
                                  FeeQuote quote,
                                  FeeSettlement settlement,
                                  Address caller,
                                  long attachedPayment,
                                  long inFlight) {
        switch (settlement) {
            case PREFUNDED_RESERVE -> coverFromReserve(tx, quote, caller, inFlight);
            case CALLER_ATTACHED_PAYMENT -> coverFromAttachedPayment(tx, quote, caller, attachedPayment);
        }
    }

    /**
     * Credits {@code amount} of the fee asset, pulled from {@code caller}, to
     * the caller's fee escrow.
     *
     * @throws RelayException {@link RelayErrorKind#UNSUPPORTED_FEE_SETTLEMENT}
     *         unless the relay runs the per-caller escrow policy with a fee
     *         asset configured
     */
    public void depositEscrow(RelayTransaction tx, Address caller, long amount) {
        Objects.requireNonNull(caller, "caller");
        if (reservePolicy != FeeReservePolicy.PER_CALLER_ESCROW) {
            throw new RelayException(RelayErrorKind.UNSUPPORTED_FEE_SETTLEMENT,
                    "This relay pays fees from a shared reserve; escrow deposits are not accepted");
        }
        if (amount <= 0) {
            throw new RelayException(RelayErrorKind.INVALID_AMOUNT,
                    "Deposit must be positive (was " + amount + ")");
        }
        AssetType feeAsset = settings.feeAsset().orElseThrow(() -> new RelayException(
                RelayErrorKind.UNSUPPORTED_FEE_SETTLEMENT, "No fee asset configured"));
        custody.transferIn(tx, feeAsset, caller, amount);
        escrow.credit(tx, caller, amount);
    }

    public long escrowBalance(Address caller) {
        return escrow.creditOf(caller);
    }

    private void coverFromReserve(RelayTransaction tx, FeeQuote quote, Address caller, long inFlight) {
        long available = Math.subtractExact(custody.balance(quote.feeAsset()), inFlight);
        if (available < quote.amount()) {
            throw new RelayException(RelayErrorKind.INSUFFICIENT_FEE_BALANCE,
                    "Fee reserve holds " + available + " " + quote.feeAsset()
                            + ", fee is " + quote.amount());
        }
        if (reservePolicy == FeeReservePolicy.PER_CALLER_ESCROW) {
            escrow.debit(tx, caller, quote.amount());
        }
    }

    private void coverFromAttachedPayment(RelayTransaction tx, FeeQuote quote, Address caller, long attached) {
        if (attached < quote.amount()) {
            throw new RelayException(RelayErrorKind.INSUFFICIENT_FEE_BALANCE,
                    "Attached payment " + attached + " is below the fee " + quote.amount());
        }
        if (attached == 0) {
            return;
        }
        custody.acceptAttachedValue(tx, caller, attached);
        long excess = attached - quote.amount();
        if (excess > 0) {
            custody.transferOut(tx, quote.feeAsset(), caller, excess);
        }
    }
}
