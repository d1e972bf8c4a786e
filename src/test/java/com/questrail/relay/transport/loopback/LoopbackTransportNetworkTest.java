package com.questrail.relay.transport.loopback;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.api.RelayErrorKind;
import com.questrail.relay.api.RelayException;
import com.questrail.relay.api.SendRequest;
import com.questrail.relay.config.RelayConfig;
import com.questrail.relay.core.AdminCapability;
import com.questrail.relay.ledger.InMemoryAssetLedger;
import com.questrail.relay.model.AssetTransfer;
import com.questrail.relay.model.OutboundMessage;
import com.questrail.relay.observability.MessageDeliveredEvent;
import com.questrail.relay.observability.RecordingObservabilitySink;
import com.questrail.relay.runtime.RelayNode;
import com.questrail.relay.transport.FeeAuthorization;
import com.questrail.relay.transport.FeeSchedule;
import com.questrail.relay.transport.TransportException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LoopbackTransportNetworkTest
 * -----------------------------------------------------------------------------
 * Two relays on two networks, each with its own ledger, joined by one
 * loopback network. Exercises the full path: send, lock in the source pool,
 * release from the destination pool and delivery to the end recipient.
 */
final class LoopbackTransportNetworkTest
{
    private static final NetworkId NET_A = NetworkId.parse("16015286601757825753");
    private static final NetworkId NET_B = NetworkId.parse("14767482510784806043");
    private static final AssetType TOKEN = AssetType.of("0xa1");
    private static final AssetType FEE = AssetType.of("0xfee");
    private static final Address RELAY_A = Address.of("0xrelay-a");
    private static final Address RELAY_B = Address.of("0xrelay-b");
    private static final Address ALICE = Address.of("0xalice");
    private static final Address BOB = Address.of("0xbob");
    private static final Address OWNER = Address.of("0xowner");

    private final InMemoryAssetLedger ledgerA = new InMemoryAssetLedger();
    private final InMemoryAssetLedger ledgerB = new InMemoryAssetLedger();
    private final RecordingObservabilitySink sinkB = new RecordingObservabilitySink();
    private final AdminCapability adminA = AdminCapability.issue(OWNER);
    private final AdminCapability adminB = AdminCapability.issue(OWNER);

    private LoopbackTransportNetwork network;
    private LoopbackTransportNetwork.Endpoint endpointA;
    private LoopbackTransportNetwork.Endpoint endpointB;
    private RelayNode relayA;
    private RelayNode relayB;

    @BeforeEach
    void setUp()
    {
        network = new LoopbackTransportNetwork(FeeSchedule.builder()
            .withBaseFee(10)
            .withPerDataByte(0)
            .withPerAssetTransfer(0)
            .build());
        endpointA = network.attach(NET_A, ledgerA);
        endpointB = network.attach(NET_B, ledgerB);

        relayA = node(NET_A, RELAY_A, ledgerA, endpointA, adminA, new RecordingObservabilitySink());
        relayB = node(NET_B, RELAY_B, ledgerB, endpointB, adminB, sinkB);
        endpointA.connect(RELAY_A, relayA);
        endpointB.connect(RELAY_B, relayB);

        relayA.setDestinationAllowed(adminA, NET_B, true);
        relayA.setAssetAllowed(adminA, TOKEN, true);
        relayB.setSourceAllowed(adminB, NET_A, true);
        relayB.setAssetAllowed(adminB, TOKEN, true);
        relayB.setSenderAllowed(adminB, RELAY_A, true);

        ledgerA.mint(TOKEN, ALICE, 500);
        ledgerA.approve(TOKEN, ALICE, RELAY_A, 500);
        ledgerA.mint(FEE, RELAY_A, 100);
        ledgerB.mint(TOKEN, endpointB.pool().address(), 1_000);
    }

    private static RelayNode node(NetworkId network, Address address, InMemoryAssetLedger ledger,
                                  LoopbackTransportNetwork.Endpoint endpoint, AdminCapability admin,
                                  RecordingObservabilitySink sink)
    {
        return RelayNode.builder()
            .withConfig(RelayConfig.builder()
                .withLocalNetwork(network)
                .withRelayAddress(address)
                .withFeeAsset(FEE)
                .build())
            .withLedger(ledger)
            .withTransport(endpoint)
            .withAdministrator(admin)
            .withObservabilitySink(sink)
            .build();
    }

    @Test
    void sendIsDeliveredToTheRecipientOnTheOtherNetwork()
    {
        byte[] memo = "hello".getBytes(StandardCharsets.UTF_8);

        MessageId id = relayA.send(ALICE, SendRequest.prefunded(NET_B, BOB, memo, TOKEN, 120));

        assertEquals(1, network.pendingCount());
        assertEquals(0, ledgerB.balanceOf(TOKEN, BOB));
        assertEquals(120, endpointA.pool().balance(TOKEN));
        assertEquals(10, endpointA.pool().balance(FEE));
        assertEquals(90, ledgerA.balanceOf(FEE, RELAY_A));
        assertEquals(0, ledgerA.balanceOf(TOKEN, RELAY_A));

        assertEquals(1, network.deliverPending());

        assertEquals(120, ledgerB.balanceOf(TOKEN, BOB));
        assertEquals(880, endpointB.pool().balance(TOKEN));
        assertEquals(0, ledgerB.balanceOf(TOKEN, RELAY_B));
        assertTrue(relayB.hasProcessed(id));
        assertArrayEquals(memo, relayB.lastReceived().orElseThrow().payload());
        assertEquals(1, sinkB.eventsOfType(MessageDeliveredEvent.class).size());
    }

    @Test
    void redeliveryIsRejectedAsReplayAndReleasesNothing()
    {
        MessageId id = relayA.send(ALICE, SendRequest.prefunded(NET_B, BOB, new byte[0], TOKEN, 50));
        network.deliverPending();

        assertFalse(network.redeliver(id));

        assertEquals(50, ledgerB.balanceOf(TOKEN, BOB));
        assertEquals(950, endpointB.pool().balance(TOKEN));
        LoopbackTransportNetwork.FailedDelivery failure = network.failedDeliveries().get(0);
        assertEquals(id, failure.message().id());
        RelayException cause = assertInstanceOf(RelayException.class, failure.cause());
        assertEquals(RelayErrorKind.REPLAYED_MESSAGE, cause.kind());
    }

    @Test
    void rejectedDeliveryReturnsLiquidityToThePool()
    {
        relayB.setSenderAllowed(adminB, RELAY_A, false);
        relayA.send(ALICE, SendRequest.prefunded(NET_B, BOB, new byte[0], TOKEN, 50));

        assertEquals(0, network.deliverPending());

        assertEquals(1_000, endpointB.pool().balance(TOKEN));
        assertEquals(0, ledgerB.balanceOf(TOKEN, RELAY_B));
        assertEquals(1, network.failedDeliveries().size());
    }

    @Test
    void poolWithoutLiquidityFailsDeliveryBeforeTheRelayIsCalled()
    {
        relayA.send(ALICE, SendRequest.prefunded(NET_B, BOB, new byte[0], TOKEN, 50));
        ledgerB.transfer(TOKEN, endpointB.pool().address(), OWNER, 1_000);

        assertEquals(0, network.deliverPending());

        assertInstanceOf(TransportException.class, network.failedDeliveries().get(0).cause());
        assertEquals(0, relayB.processedCount());
    }

    @Test
    void redeliveryAfterAFailureSucceedsOnceTheCauseIsFixed()
    {
        relayB.setAssetAllowed(adminB, TOKEN, false);
        MessageId id = relayA.send(ALICE, SendRequest.prefunded(NET_B, BOB, new byte[0], TOKEN, 50));
        network.deliverPending();
        assertTrue(relayB.hasProcessed(id));

        relayB.setAssetAllowed(adminB, TOKEN, true);

        assertFalse(network.redeliver(id));
        assertEquals(0, ledgerB.balanceOf(TOKEN, BOB));
    }

    @Test
    void quoteFollowsTheSchedule()
    {
        LoopbackTransportNetwork priced = new LoopbackTransportNetwork(FeeSchedule.defaults());
        LoopbackTransportNetwork.Endpoint endpoint = priced.attach(NET_A, ledgerA);
        OutboundMessage message = outbound(new byte[10], FEE);

        FeeSchedule defaults = FeeSchedule.defaults();
        assertEquals(defaults.baseFee() + 10 * defaults.perDataByte() + defaults.perAssetTransfer(),
            endpoint.quote(NET_B, message));
    }

    @Test
    void dispatchRefusesUnknownDestination()
    {
        OutboundMessage message = new OutboundMessage(NET_A, NetworkId.of(99), RELAY_A, BOB, new byte[0],
            List.of(new AssetTransfer(TOKEN, 1)), FEE, com.questrail.relay.api.FeeSettlement.PREFUNDED_RESERVE);

        assertThrows(TransportException.class,
            () -> endpointA.dispatch(NetworkId.of(99), message, new FeeAuthorization.Allowance(FEE, 10)));
        assertEquals(0, network.pendingCount());
    }

    @Test
    void dispatchRefusesAnInsufficientFeeAuthorizationAndLocksNothing()
    {
        ledgerA.mint(TOKEN, RELAY_A, 5);
        ledgerA.approve(TOKEN, RELAY_A, endpointA.address(), 5);
        ledgerA.approve(FEE, RELAY_A, endpointA.address(), 9);

        assertThrows(TransportException.class,
            () -> endpointA.dispatch(NET_B, outbound(new byte[0], FEE), new FeeAuthorization.Allowance(FEE, 9)));

        assertEquals(5, ledgerA.balanceOf(TOKEN, RELAY_A));
        assertEquals(0, network.dispatchedMessages().size());
    }

    @Test
    void attachingTwiceIsRefused()
    {
        assertThrows(IllegalStateException.class, () -> network.attach(NET_A, ledgerA));
    }

    @Test
    void redeliverOfUnknownIdIsRefused()
    {
        assertThrows(IllegalArgumentException.class, () -> network.redeliver(MessageId.of("ff")));
    }

    private static OutboundMessage outbound(byte[] data, AssetType feeAsset)
    {
        return new OutboundMessage(NET_A, NET_B, RELAY_A, BOB, data,
            List.of(new AssetTransfer(TOKEN, 5)), feeAsset, com.questrail.relay.api.FeeSettlement.PREFUNDED_RESERVE);
    }
}
