package com.questrail.relay.core;

import com.questrail.relay.api.MessageId;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Append-only set of message ids that have been applied.
 *
 * <p>An id goes from absent to present at most once and is never removed,
 * not even when the delivery that marked it later fails. There is no expiry.</p>
 */
public final class ProcessedMessageLedger
{
    private final Set<MessageId> processed = new HashSet<>();

    public boolean hasProcessed(MessageId id) {
        return processed.contains(Objects.requireNonNull(id, "id"));
    }

    /**
     * @return {@code true} if the id was newly recorded, {@code false} if it
     *         was already present
     */
    public boolean markProcessed(MessageId id) {
        return processed.add(Objects.requireNonNull(id, "id"));
    }

    public int size() {
        return processed.size();
    }
}
