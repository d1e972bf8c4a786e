package com.questrail.relay.transport;

import com.questrail.relay.api.MessageId;
import com.questrail.relay.model.AssetTransfer;
import com.questrail.relay.model.OutboundMessage;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Derives message ids as the SHA-256 of a message's routing fields, its
 * content, the dispatching transport's nonce and its sequence number.
 *
 * <p>Each transport instance draws a fresh random nonce when it is built, so
 * its sequence may restart at zero without repeating an id issued by an
 * earlier instance.</p>
 */
public final class MessageIds
{
    public static final int NONCE_LENGTH = 16;

    private static final SecureRandom RANDOM = new SecureRandom();

    private MessageIds() {}

    /**
     * Returns a new random 128-bit nonce for one transport instance.
     */
    public static byte[] newNonce() {
        byte[] nonce = new byte[NONCE_LENGTH];
        RANDOM.nextBytes(nonce);
        return nonce;
    }

    public static MessageId derive(OutboundMessage message, byte[] nonce, long sequence) {
        Objects.requireNonNull(nonce, "nonce");
        if (nonce.length != NONCE_LENGTH) {
            throw new IllegalArgumentException("nonce must be " + NONCE_LENGTH + " bytes");
        }
        MessageDigest digest = sha256();
        digest.update(nonce);
        digest.update(ByteBuffer.allocate(24)
                .putLong(message.sourceNetwork().selector())
                .putLong(message.destinationNetwork().selector())
                .putLong(sequence)
                .array());
        update(digest, message.sender().value());
        update(digest, message.receiver().value());
        digest.update(message.data());
        for (AssetTransfer transfer : message.assetTransfers()) {
            update(digest, transfer.asset().id());
            digest.update(ByteBuffer.allocate(8).putLong(transfer.amount()).array());
        }
        return MessageId.of(HexFormat.of().formatHex(digest.digest()));
    }

    private static void update(MessageDigest digest, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(4).putInt(bytes.length).array());
        digest.update(bytes);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is required by every Java platform", e);
        }
    }
}
