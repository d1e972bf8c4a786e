package com.questrail.relay.runtime;

import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.ReceivedMessageSnapshot;
import com.questrail.relay.api.RelayErrorKind;
import com.questrail.relay.api.RelayException;
import com.questrail.relay.config.FeeReservePolicy;
import com.questrail.relay.config.RelayProfile;
import com.questrail.relay.model.DeliveredMessage;
import com.questrail.relay.model.TransferInstruction;
import com.questrail.relay.observability.MessageDeliveredEvent;
import com.questrail.relay.observability.RelayErrorEvent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.questrail.relay.runtime.RelayFixture.A1;
import static com.questrail.relay.runtime.RelayFixture.R2;
import static com.questrail.relay.runtime.RelayFixture.RELAY;
import static com.questrail.relay.runtime.RelayFixture.REMOTE;
import static com.questrail.relay.runtime.RelayFixture.REMOTE_RELAY;
import static com.questrail.relay.runtime.RelayFixture.id;
import static com.questrail.relay.runtime.RelayFixture.inbound;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Inbound deliveries through {@link RelayNode}: validation, idempotency,
 * release of custody and the processed-message ledger.
 */
final class RelayNodeDeliverTest
{
    private static final byte[] MEMO = "invoice 7".getBytes(StandardCharsets.UTF_8);

    private RelayFixture f;

    @BeforeEach
    void setUp()
    {
        f = new RelayFixture(0).allowStandardRoute();
        f.ledger.mint(A1, RELAY, 1_000);
    }

    private DeliveredMessage message(int n, long amount)
    {
        return inbound(id(n), REMOTE_RELAY, TransferInstruction.withMemo(R2, A1, amount, MEMO));
    }

    @Test
    void deliveryReleasesCustodyToTheRecipient()
    {
        f.node.deliver(message(1, 50));

        assertEquals(50, f.balance(A1, R2));
        assertEquals(950, f.balance(A1, RELAY));
        assertTrue(f.node.hasProcessed(id(1)));
    }

    @Test
    void deliveryRecordsSnapshotAndEvent()
    {
        f.node.deliver(message(1, 50));

        ReceivedMessageSnapshot snapshot = f.node.lastReceived().orElseThrow();
        assertEquals(id(1), snapshot.id());
        assertEquals(REMOTE, snapshot.sourceNetwork());
        assertEquals(REMOTE_RELAY, snapshot.sender());
        assertEquals(R2, snapshot.recipient());
        assertEquals(A1, snapshot.asset());
        assertEquals(50, snapshot.amount());
        assertArrayEquals(MEMO, snapshot.payload());

        List<MessageDeliveredEvent> events = f.sink.eventsOfType(MessageDeliveredEvent.class);
        assertEquals(1, events.size());
        MessageDeliveredEvent event = events.get(0);
        assertEquals(snapshot.id(), event.id());
        assertEquals(snapshot.recipient(), event.recipient());
        assertEquals(snapshot.amount(), event.amount());
        assertArrayEquals(MEMO, event.payload());
    }

    @Test
    void replayedMessageIsRejectedAndChangesNothing()
    {
        f.node.deliver(message(1, 50));

        RelayException e = assertThrows(RelayException.class, () -> f.node.deliver(message(1, 50)));

        assertEquals(RelayErrorKind.REPLAYED_MESSAGE, e.kind());
        assertEquals(50, f.balance(A1, R2));
        assertEquals(1, f.sink.eventsOfType(MessageDeliveredEvent.class).size());
        assertEquals(1, f.node.processedCount());
    }

    @Test
    void unknownSourceIsRejectedBeforeTheIdIsConsumed()
    {
        f.node.setSourceAllowed(f.admin, REMOTE, false);

        RelayException e = assertThrows(RelayException.class, () -> f.node.deliver(message(1, 50)));

        assertEquals(RelayErrorKind.CHAIN_NOT_ALLOWED, e.kind());
        assertFalse(f.node.hasProcessed(id(1)));
        assertEquals(0, f.balance(A1, R2));
    }

    @Test
    void unknownSenderIsRejected()
    {
        DeliveredMessage forged = inbound(id(1), com.questrail.relay.api.Address.of("0xmallory"),
            TransferInstruction.withMemo(R2, A1, 50, MEMO));

        RelayException e = assertThrows(RelayException.class, () -> f.node.deliver(forged));

        assertEquals(RelayErrorKind.SENDER_NOT_ALLOWED, e.kind());
        assertFalse(f.node.hasProcessed(id(1)));
    }

    @Test
    void malformedInstructionConsumesTheId()
    {
        DeliveredMessage garbage = inbound(id(1), REMOTE_RELAY, new byte[] { 9, 9, 9 }, A1, 50);

        RelayException e = assertThrows(RelayException.class, () -> f.node.deliver(garbage));

        assertEquals(RelayErrorKind.INVALID_PAYLOAD, e.kind());
        assertTrue(f.node.hasProcessed(id(1)));
        assertEquals(1_000, f.balance(A1, RELAY));
        assertTrue(f.node.lastReceived().isEmpty());
    }

    @Test
    void disallowedInstructionAssetIsRejected()
    {
        AssetType other = AssetType.of("0xother");
        f.ledger.mint(other, RELAY, 100);

        RelayException e = assertThrows(RelayException.class, () -> f.node.deliver(
            inbound(id(1), REMOTE_RELAY, TransferInstruction.withoutMemo(R2, other, 10))));

        assertEquals(RelayErrorKind.TOKEN_NOT_ALLOWED, e.kind());
        assertEquals(0, f.balance(other, R2));
        assertTrue(f.node.hasProcessed(id(1)));
    }

    @Test
    void failedReleaseLeavesTheIdConsumed()
    {
        RelayException e = assertThrows(RelayException.class, () -> f.node.deliver(message(1, 5_000)));
        assertEquals(RelayErrorKind.TRANSFER_FAILED, e.kind());
        assertTrue(f.node.hasProcessed(id(1)));

        f.ledger.mint(A1, RELAY, 5_000);
        RelayException again = assertThrows(RelayException.class, () -> f.node.deliver(message(1, 5_000)));
        assertEquals(RelayErrorKind.REPLAYED_MESSAGE, again.kind());
        assertEquals(0, f.balance(A1, R2));
    }

    @Test
    void failedDeliveryKeepsThePreviousSnapshot()
    {
        f.node.deliver(message(1, 50));
        assertThrows(RelayException.class, () -> f.node.deliver(message(2, 5_000)));

        assertEquals(id(1), f.node.lastReceived().orElseThrow().id());
    }

    @Test
    void deliveryFailuresAreReportedUnderTheDeliverOperation()
    {
        f.node.deliver(message(1, 50));
        assertThrows(RelayException.class, () -> f.node.deliver(message(1, 50)));

        List<RelayErrorEvent> errors = f.sink.eventsOfType(RelayErrorEvent.class);
        assertEquals(1, errors.size());
        assertEquals("deliver", errors.get(0).operation());
        assertEquals(RelayErrorKind.REPLAYED_MESSAGE, errors.get(0).kind());
    }

    @Test
    void processedLedgerOnlyGrows()
    {
        MessageId first = id(1);
        f.node.deliver(message(1, 10));
        assertThrows(RelayException.class, () -> f.node.deliver(message(2, 99_999)));
        f.node.deliver(message(3, 10));

        assertTrue(f.node.hasProcessed(first));
        assertTrue(f.node.hasProcessed(id(2)));
        assertTrue(f.node.hasProcessed(id(3)));
        assertEquals(3, f.node.processedCount());
    }

    @Test
    void legacyProfileSkipsReplayAndSenderChecks()
    {
        RelayFixture legacy = new RelayFixture(0, RelayProfile.legacy(), FeeReservePolicy.SHARED);
        legacy.node.setSourceAllowed(legacy.admin, REMOTE, true);
        legacy.node.setAssetAllowed(legacy.admin, A1, true);
        legacy.ledger.mint(A1, RELAY, 1_000);

        DeliveredMessage anySender = inbound(id(1), com.questrail.relay.api.Address.of("0xunlisted"),
            TransferInstruction.withMemo(R2, A1, 50, MEMO));
        legacy.node.deliver(anySender);
        legacy.node.deliver(anySender);

        assertEquals(100, legacy.balance(A1, R2));
        assertFalse(legacy.node.hasProcessed(id(1)));
    }

    @Test
    void tokenOnlyInstructionHasEmptyPayload()
    {
        f.node.deliver(inbound(id(1), REMOTE_RELAY, TransferInstruction.withoutMemo(R2, A1, 20)));

        assertArrayEquals(new byte[0], f.node.lastReceived().orElseThrow().payload());
    }
}
