package com.questrail.relay.transport;

import com.questrail.relay.api.Address;
import com.questrail.relay.api.AssetType;
import com.questrail.relay.api.FeeSettlement;
import com.questrail.relay.api.MessageId;
import com.questrail.relay.api.NetworkId;
import com.questrail.relay.model.AssetTransfer;
import com.questrail.relay.model.OutboundMessage;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MessageIdsTest
{
    private static final byte[] NONCE = new byte[MessageIds.NONCE_LENGTH];

    private static OutboundMessage message(long amount)
    {
        return new OutboundMessage(NetworkId.of(1), NetworkId.of(2), Address.of("s"), Address.of("r"),
            new byte[] { 7 }, List.of(new AssetTransfer(AssetType.of("t"), amount)),
            AssetType.of("fee"), FeeSettlement.PREFUNDED_RESERVE);
    }

    @Test
    void idIsA256BitHexDigest()
    {
        MessageId id = MessageIds.derive(message(5), NONCE, 1);

        assertEquals(64, id.value().length());
    }

    @Test
    void sameInputsGiveTheSameId()
    {
        assertEquals(MessageIds.derive(message(5), NONCE, 1), MessageIds.derive(message(5), NONCE, 1));
    }

    @Test
    void sequenceAndContentChangeTheId()
    {
        MessageId base = MessageIds.derive(message(5), NONCE, 1);

        assertNotEquals(base, MessageIds.derive(message(5), NONCE, 2));
        assertNotEquals(base, MessageIds.derive(message(6), NONCE, 1));
    }

    @Test
    void nonceSeparatesTransportsThatReuseASequence()
    {
        byte[] first = MessageIds.newNonce();
        byte[] second = MessageIds.newNonce();

        assertEquals(MessageIds.NONCE_LENGTH, first.length);
        assertFalse(Arrays.equals(first, second));
        assertNotEquals(MessageIds.derive(message(5), first, 1), MessageIds.derive(message(5), second, 1));
    }

    @Test
    void nonceMustHaveTheFullLength()
    {
        assertThrows(IllegalArgumentException.class, () -> MessageIds.derive(message(5), new byte[4], 1));
    }
}
