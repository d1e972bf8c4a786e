package com.questrail.relay.observability;

import com.questrail.relay.api.RelayErrorKind;

import java.time.Instant;

/**
 * Record representing a failed relay operation or a dropped inbound artifact.
 *
 * @param operation name of the failed operation (e.g. {@code "send"})
 * @param kind      failure kind, or {@code null} when the failure is not a
 *                  {@code RelayException} (decode defects at the transport edge)
 */
public record RelayErrorEvent(
    Instant timestamp,
    String operation,
    RelayErrorKind kind,
    String message,
    Throwable cause
) {
}
