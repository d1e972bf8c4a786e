package com.questrail.relay.observability;

/**
 * Main interface for receiving relay audit events.
 * Implementations can provide logging, metrics, or external audit trails.
 *
 * <p>Callbacks are invoked synchronously from inside the relay's serialized
 * operations, after the operation's state changes are final. Implementations
 * must not call back into the relay and should return quickly.</p>
 */
public interface RelayObservabilitySink {
    /**
     * Called for every allowlist mutation.
     */
    void onAllowlistChanged(AllowlistChangedEvent event);

    /**
     * Called when an outbound message has been accepted by the transport.
     */
    void onMessageDispatched(MessageDispatchedEvent event);

    /**
     * Called when an inbound message has been applied.
     */
    void onMessageDelivered(MessageDeliveredEvent event);

    /**
     * Called when an administrator withdraws funds.
     */
    void onFundsRecovered(FundsRecoveredEvent event);

    /**
     * Called when administrative configuration changes.
     */
    void onConfigurationChanged(ConfigurationChangedEvent event);

    /**
     * Called when an operation fails or an inbound artifact is dropped.
     */
    void onError(RelayErrorEvent event);
}
