package com.questrail.relay.transport;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.model.OutboundMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ScriptedTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link RelayTransport} with a scripted fee and an optional
 * scripted failure.
 *
 * <p>It records every dispatch and assigns sequential ids. It never moves
 * assets, so tests can observe exactly what the relay approved or pushed.</p>
 */
public final class ScriptedTransport implements RelayTransport {

    public record Dispatch(NetworkId destination, OutboundMessage message, FeeAuthorization fee) {}

    private final Address address;
    private final List<Dispatch> dispatches = new ArrayList<>();
    private long fee;
    private TransportException failure;
    private int quoteCalls;
    private long nextId = 1;

    public ScriptedTransport(Address address, long fee) {
        this.address = address;
        this.fee = fee;
    }

    public ScriptedTransport(long fee) {
        this(Address.of("transport"), fee);
    }

    public void setFee(long fee) {
        this.fee = fee;
    }

    public void failNextDispatch(String reason) {
        this.failure = new TransportException(reason);
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public long quote(NetworkId destination, OutboundMessage message) {
        quoteCalls++;
        return fee;
    }

    @Override
    public MessageId dispatch(NetworkId destination, OutboundMessage message, FeeAuthorization fee) {
        if (failure != null) {
            TransportException e = failure;
            failure = null;
            throw e;
        }
        dispatches.add(new Dispatch(destination, message, fee));
        return MessageId.of(String.format("%064x", nextId++));
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public List<Dispatch> dispatches() {
        return Collections.unmodifiableList(dispatches);
    }

    public Dispatch lastDispatch() {
        return dispatches.get(dispatches.size() - 1);
    }

    public int quoteCalls() {
        return quoteCalls;
    }
}
