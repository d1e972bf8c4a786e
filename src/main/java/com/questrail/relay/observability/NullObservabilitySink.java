package com.questrail.relay.observability;

/**
 * No-op implementation of RelayObservabilitySink.
 */
public final class NullObservabilitySink implements RelayObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onAllowlistChanged(AllowlistChangedEvent event) {}

    @Override
    public void onMessageDispatched(MessageDispatchedEvent event) {}

    @Override
    public void onMessageDelivered(MessageDeliveredEvent event) {}

    @Override
    public void onFundsRecovered(FundsRecoveredEvent event) {}

    @Override
    public void onConfigurationChanged(ConfigurationChangedEvent event) {}

    @Override
    public void onError(RelayErrorEvent event) {}
}
