package com.questrail.relay.core;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.FeeSettlement;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.RelayErrorKind;
import com.questrail.relay.api.RelayException;
import com.questrail.relay.api.SendRequest;
import com.questrail.relay.codec.TransferInstructionCodec;
import com.questrail.relay.config.RelayConfig;
import com.questrail.relay.config.RelayProfile;
import com.questrail.relay.model.AssetTransfer;
import com.questrail.relay.model.OutboundMessage;
import com.questrail.relay.model.TransferInstruction;
import com.questrail.relay.observability.MessageDispatchedEvent;
import com.questrail.relay.observability.RelayObservabilitySink;
import com.questrail.relay.time.WallClock;
import com.questrail.relay.transport.FeeAuthorization;
import com.questrail.relay.transport.RelayTransport;

import java.util.List;
import java.util.Objects;

/**
 * OutboundDispatcher
 * -----------------------------------------------------------------------------
 * Validates a send, takes the caller's asset into custody, settles the
 * transport fee and hands the message to the transport.
 *
 * <h2>Order of operations</h2>
 * <ol>
 *   <li>Destination network allowed, else {@code CHAIN_NOT_ALLOWED}</li>
 *   <li>Asset allowed, else {@code TOKEN_NOT_ALLOWED}</li>
 *   <li>Receiver present, else {@code INVALID_RECEIVER}</li>
 *   <li>Amount positive, else {@code INVALID_AMOUNT}; settlement mode and
 *       payload permitted by the relay profile</li>
 *   <li>Asset pulled from the caller into custody</li>
 *   <li>Outbound message built</li>
 *   <li>Fee quoted and its coverage settled</li>
 *   <li>Transport approved for the asset (and, for the reserve, the fee)</li>
 *   <li>Message dispatched</li>
 *   <li>{@link MessageDispatchedEvent} published on commit</li>
 * </ol>
 *
 * <p>Any failure aborts the enclosing {@link RelayTransaction}, which undoes
 * every step already taken. Nothing is retried.</p>
 */
public final class OutboundDispatcher
{
    private final RelayConfig config;
    private final AllowlistRegistry registry;
    private final RelaySettings settings;
    private final Custody custody;
    private final FeeQuoter feeQuoter;
    private final TransferInstructionCodec codec;
    private final RelayObservabilitySink sink;
    private final WallClock clock;

    public OutboundDispatcher(RelayConfig config,
                              AllowlistRegistry registry,
                              RelaySettings settings,
                              Custody custody,
                              FeeQuoter feeQuoter,
                              TransferInstructionCodec codec,
                              RelayObservabilitySink sink,
                              WallClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.custody = Objects.requireNonNull(custody, "custody");
        this.feeQuoter = Objects.requireNonNull(feeQuoter, "feeQuoter");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public MessageId send(RelayTransaction tx, Address caller, SendRequest request) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(request, "request");

        AssetType feeAsset = validate(request);

        custody.transferIn(tx, request.asset(), caller, request.amount());

        OutboundMessage message = buildMessage(request, feeAsset);

        FeeQuote quote = feeQuoter.quote(request.destination(), message);
        long inFlight = feeAsset.equals(request.asset()) ? request.amount() : 0L;
        feeQuoter.ensureFeeCoverage(tx, quote, request.settlement(), caller,
                request.attachedPayment(), inFlight);

        RelayTransport transport = settings.transport();
        FeeAuthorization authorization = authorizeTransport(tx, transport, request, quote);

        MessageId id = transport.dispatch(request.destination(), message, authorization);

        tx.afterCommit(() -> sink.onMessageDispatched(new MessageDispatchedEvent(
                clock.now(), id, request.destination(), request.receiver(),
                request.asset(), request.amount(), quote.feeAsset(), quote.amount())));
        return id;
    }

    /**
     * Validates {@code request} and prices it, without taking custody or
     * changing any state.
     */
    public FeeQuote quote(SendRequest request) {
        Objects.requireNonNull(request, "request");
        AssetType feeAsset = validate(request);
        return feeQuoter.quote(request.destination(), buildMessage(request, feeAsset));
    }

    /**
     * Runs the validation steps and resolves the asset the fee is paid in.
     */
    private AssetType validate(SendRequest request) {
        if (!registry.isDestinationAllowed(request.destination())) {
            throw new RelayException(RelayErrorKind.CHAIN_NOT_ALLOWED,
                    "Destination network " + request.destination() + " is not allowed");
        }
        if (!registry.isAssetAllowed(request.asset())) {
            throw new RelayException(RelayErrorKind.TOKEN_NOT_ALLOWED,
                    "Asset " + request.asset() + " is not allowed");
        }
        if (request.receiver() == null) {
            throw new RelayException(RelayErrorKind.INVALID_RECEIVER, "Receiver is missing");
        }
        if (request.amount() <= 0) {
            throw new RelayException(RelayErrorKind.INVALID_AMOUNT,
                    "Amount must be positive (was " + request.amount() + ")");
        }

        RelayProfile profile = config.profile();
        if (!profile.supports(request.settlement())) {
            throw new RelayException(RelayErrorKind.UNSUPPORTED_FEE_SETTLEMENT,
                    request.settlement() + " is not enabled on this relay");
        }
        if (!profile.payloadData() && request.payload().length > 0) {
            throw new RelayException(RelayErrorKind.INVALID_PAYLOAD,
                    "This relay carries tokens only; payload must be empty");
        }

        if (request.settlement() == FeeSettlement.CALLER_ATTACHED_PAYMENT) {
            return AssetType.NATIVE;
        }
        return settings.feeAsset().orElseThrow(() -> new RelayException(
                RelayErrorKind.UNSUPPORTED_FEE_SETTLEMENT,
                "No fee asset configured for the prefunded reserve"));
    }

    private OutboundMessage buildMessage(SendRequest request, AssetType feeAsset) {
        TransferInstruction instruction = config.profile().payloadData()
                ? TransferInstruction.withMemo(request.receiver(), request.asset(), request.amount(), request.payload())
                : TransferInstruction.withoutMemo(request.receiver(), request.asset(), request.amount());

        return new OutboundMessage(
                config.localNetwork(),
                request.destination(),
                config.relayAddress(),
                request.receiver(),
                codec.encode(instruction),
                List.of(new AssetTransfer(request.asset(), request.amount())),
                feeAsset,
                request.settlement());
    }

    private FeeAuthorization authorizeTransport(RelayTransaction tx,
                                                RelayTransport transport,
                                                SendRequest request,
                                                FeeQuote quote) {
        Address spender = transport.address();

        if (request.settlement() == FeeSettlement.PREFUNDED_RESERVE) {
            // one allowance per asset: approve sets, it does not add
            if (quote.feeAsset().equals(request.asset())) {
                custody.approve(tx, request.asset(), spender,
                        Math.addExact(request.amount(), quote.amount()));
            } else {
                custody.approve(tx, request.asset(), spender, request.amount());
                custody.approve(tx, quote.feeAsset(), spender, quote.amount());
            }
            return new FeeAuthorization.Allowance(quote.feeAsset(), quote.amount());
        }

        custody.approve(tx, request.asset(), spender, request.amount());
        if (quote.amount() > 0) {
            custody.transferOut(tx, AssetType.NATIVE, spender, quote.amount());
        }
        return new FeeAuthorization.AttachedValue(quote.amount());
    }
}
