package com.questrail.relay.core;

import com.questrail.relay.api.ReceivedMessageSnapshot;
import com.questrail.relay.api.RelayErrorKind;
import com.questrail.relay.api.RelayException;
import com.questrail.relay.codec.InstructionDecodeException;
import com.questrail.relay.codec.TransferInstructionCodec;
import com.questrail.relay.config.RelayProfile;
import com.questrail.relay.model.DeliveredMessage;
import com.questrail.relay.model.TransferInstruction;
import com.questrail.relay.observability.MessageDeliveredEvent;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.time.WallClock;

import java.util.Objects;
import java.util.Optional;

/**
 * InboundReceiver
 * -----------------------------------------------------------------------------
 * Applies a message delivered by the transport: validates its origin, records
 * it as processed, decodes its transfer instruction and releases custody to
 * the recipient named there.
 *
 * <h2>Order of operations</h2>
 * <ol>
 *   <li>Source network allowed, else {@code CHAIN_NOT_ALLOWED}</li>
 *   <li>Sender allowed, else {@code SENDER_NOT_ALLOWED}</li>
 *   <li>Id not yet processed, else {@code REPLAYED_MESSAGE}</li>
 *   <li>Id marked processed</li>
 *   <li>Instruction decoded, else {@code INVALID_PAYLOAD}</li>
 *   <li>Instruction asset allowed, else {@code TOKEN_NOT_ALLOWED}</li>
 *   <li>Custody released to the recipient</li>
 *   <li>Last-received snapshot replaced</li>
 *   <li>{@link MessageDeliveredEvent} published on commit</li>
 * </ol>
 *
 * <p>The mark in step 4 is never undone. A delivery that fails after it has
 * consumed its id for good, while its custody changes are rolled back.</p>
 *
 * <p>Steps 2 to 4 are skipped when the relay profile disables the sender
 * allowlist or replay protection respectively.</p>
 */
public final class InboundReceiver
{
    private final RelayProfile profile;
    private final AllowlistRegistry registry;
    private final ProcessedMessageLedger ledger;
    private final Custody custody;
    private final TransferInstructionCodec codec;
    private final RelayObservabilitySink sink;
    private final WallClock clock;

    private ReceivedMessageSnapshot lastReceived;

    public InboundReceiver(RelayProfile profile,
                           AllowlistRegistry registry,
                           ProcessedMessageLedger ledger,
                           Custody custody,
                           TransferInstructionCodec codec,
                           RelayObservabilitySink sink,
                           WallClock clock) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.custody = Objects.requireNonNull(custody, "custody");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<ReceivedMessageSnapshot> lastReceived() {
        return Optional.ofNullable(lastReceived);
    }

    public void deliver(RelayTransaction tx, DeliveredMessage message) {
        Objects.requireNonNull(message, "message");

        if (!registry.isSourceAllowed(message.sourceNetwork())) {
            throw new RelayException(RelayErrorKind.CHAIN_NOT_ALLOWED,
                    "Source network " + message.sourceNetwork() + " is not allowed");
        }
        if (profile.senderAllowlist() && !registry.isSenderAllowed(message.sender())) {
            throw new RelayException(RelayErrorKind.SENDER_NOT_ALLOWED,
                    "Sender " + message.sender() + " is not allowed");
        }
        if (profile.replayProtection()) {
            if (!ledger.markProcessed(message.id())) {
                throw new RelayException(RelayErrorKind.REPLAYED_MESSAGE,
                        "Message " + message.id() + " was already processed");
            }
        }

        TransferInstruction instruction;
        try {
            instruction = codec.decode(message.data());
        } catch (InstructionDecodeException e) {
            throw new RelayException(RelayErrorKind.INVALID_PAYLOAD,
                    "Message " + message.id() + " carries no valid transfer instruction", e);
        }

        if (!registry.isAssetAllowed(instruction.asset())) {
            throw new RelayException(RelayErrorKind.TOKEN_NOT_ALLOWED,
                    "Asset " + instruction.asset() + " is not allowed");
        }

        custody.transferOut(tx, instruction.asset(), instruction.recipient(), instruction.amount());

        ReceivedMessageSnapshot snapshot = new ReceivedMessageSnapshot(
                message.id(),
                message.sourceNetwork(),
                message.sender(),
                instruction.recipient(),
                instruction.asset(),
                instruction.amount(),
                instruction.memoOrEmpty());
        ReceivedMessageSnapshot previous = lastReceived;
        lastReceived = snapshot;
        tx.onRollback(() -> lastReceived = previous);

        tx.afterCommit(() -> sink.onMessageDelivered(new MessageDeliveredEvent(
                clock.now(),
                snapshot.id(),
                snapshot.sourceNetwork(),
                snapshot.sender(),
                snapshot.recipient(),
                snapshot.asset(),
                snapshot.amount(),
                snapshot.payload())));
    }
}
