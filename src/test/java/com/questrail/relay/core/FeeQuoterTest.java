package com.questrail.relay.core;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.FeeSettlement;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.api.RelayErrorKind;
import com.questrail.relay.api.RelayException;
import com.questrail.relay.config.FeeReservePolicy;
import com.questrail.relay.ledger.InMemoryAssetLedger;
import com.questrail.relay.model.OutboundMessage;
import com.questrail.relay.transport.ScriptedTransport;
import com.questrail.relay.transport.TransportException;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class FeeQuoterTest
{
    private static final AssetType FEE = AssetType.of("0xfee");
    private static final Address RELAY = Address.of("0xrelay");
    private static final Address CALLER = Address.of("0xcaller");
    private static final NetworkId DEST = NetworkId.of(7);

    private final InMemoryAssetLedger ledger = new InMemoryAssetLedger();
    private final ScriptedTransport transport = new ScriptedTransport(25);
    private final Custody custody = new Custody(ledger, RELAY);

    private FeeQuoter quoter(FeeReservePolicy policy) {
        return new FeeQuoter(new RelaySettings(Optional.of(FEE), transport), custody, new FeeEscrow(), policy);
    }

    private static OutboundMessage message(AssetType feeAsset, FeeSettlement settlement) {
        return new OutboundMessage(NetworkId.of(1), DEST, RELAY, Address.of("0xpeer"),
            new byte[0], List.of(), feeAsset, settlement);
    }

    private static FeeQuote quote(AssetType asset, long amount) {
        return new FeeQuote(asset, amount, DEST);
    }

    @Test
    void quoteComesFromTheCurrentTransport()
    {
        FeeQuote quote = quoter(FeeReservePolicy.SHARED).quote(DEST, message(FEE, FeeSettlement.PREFUNDED_RESERVE));

        assertEquals(new FeeQuote(FEE, 25, DEST), quote);
        transport.setFee(40);
        assertEquals(40, quoter(FeeReservePolicy.SHARED)
            .quote(DEST, message(FEE, FeeSettlement.PREFUNDED_RESERVE)).amount());
    }

    @Test
    void negativeQuoteIsATransportFault()
    {
        transport.setFee(-1);

        assertThrows(TransportException.class,
            () -> quoter(FeeReservePolicy.SHARED).quote(DEST, message(FEE, FeeSettlement.PREFUNDED_RESERVE)));
    }

    @Test
    void reserveMustCoverTheQuoteAfterExcludingFundsInFlight()
    {
        ledger.mint(FEE, RELAY, 100);
        FeeQuoter quoter = quoter(FeeReservePolicy.SHARED);

        quoter.ensureFeeCoverage(new RelayTransaction(), quote(FEE, 100), FeeSettlement.PREFUNDED_RESERVE, CALLER, 0, 0);

        RelayException e = assertThrows(RelayException.class, () -> quoter.ensureFeeCoverage(
            new RelayTransaction(), quote(FEE, 100), FeeSettlement.PREFUNDED_RESERVE, CALLER, 0, 1));
        assertEquals(RelayErrorKind.INSUFFICIENT_FEE_BALANCE, e.kind());
    }

    @Test
    void attachedPaymentBelowTheQuoteIsRefused()
    {
        ledger.mint(AssetType.NATIVE, CALLER, 100);

        RelayException e = assertThrows(RelayException.class, () -> quoter(FeeReservePolicy.SHARED)
            .ensureFeeCoverage(new RelayTransaction(), quote(AssetType.NATIVE, 30),
                FeeSettlement.CALLER_ATTACHED_PAYMENT, CALLER, 29, 0));

        assertEquals(RelayErrorKind.INSUFFICIENT_FEE_BALANCE, e.kind());
        assertEquals(100, ledger.balanceOf(AssetType.NATIVE, CALLER));
    }

    @Test
    void attachedPaymentKeepsExactlyTheQuote()
    {
        ledger.mint(AssetType.NATIVE, CALLER, 100);

        quoter(FeeReservePolicy.SHARED).ensureFeeCoverage(new RelayTransaction(), quote(AssetType.NATIVE, 30),
            FeeSettlement.CALLER_ATTACHED_PAYMENT, CALLER, 45, 0);

        assertEquals(70, ledger.balanceOf(AssetType.NATIVE, CALLER));
        assertEquals(30, custody.balance(AssetType.NATIVE));
    }

    @Test
    void escrowDepositAndDebit()
    {
        ledger.mint(FEE, CALLER, 50);
        ledger.approve(FEE, CALLER, RELAY, 50);
        FeeQuoter quoter = quoter(FeeReservePolicy.PER_CALLER_ESCROW);

        RelayTransaction deposit = new RelayTransaction();
        quoter.depositEscrow(deposit, CALLER, 50);
        deposit.commit();
        assertEquals(50, quoter.escrowBalance(CALLER));

        RelayTransaction send = new RelayTransaction();
        quoter.ensureFeeCoverage(send, quote(FEE, 20), FeeSettlement.PREFUNDED_RESERVE, CALLER, 0, 0);
        assertEquals(30, quoter.escrowBalance(CALLER));
        send.rollback(new RuntimeException("abort"));

        assertEquals(50, quoter.escrowBalance(CALLER));
    }

    @Test
    void escrowDepositRequiresAFeeAsset()
    {
        FeeQuoter quoter = new FeeQuoter(new RelaySettings(Optional.empty(), transport), custody,
            new FeeEscrow(), FeeReservePolicy.PER_CALLER_ESCROW);

        RelayException e = assertThrows(RelayException.class,
            () -> quoter.depositEscrow(new RelayTransaction(), CALLER, 10));

        assertEquals(RelayErrorKind.UNSUPPORTED_FEE_SETTLEMENT, e.kind());
    }
}
