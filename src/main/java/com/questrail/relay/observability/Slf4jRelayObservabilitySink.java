package com.questrail.relay.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RelayObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRelayObservabilitySink implements RelayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRelayObservabilitySink.class);

    @Override
    public void onAllowlistChanged(AllowlistChangedEvent event) {
        log.info("Allowlist {}: {} -> {}",
            event.kind(),
            event.identifier(),
            event.allowed() ? "allowed" : "denied");
    }

    @Override
    public void onMessageDispatched(MessageDispatchedEvent event) {
        log.info("Dispatched {} to network {}: {} x {} for {} (fee {} {})",
            event.id(),
            event.destination(),
            event.amount(),
            event.asset(),
            event.receiver(),
            event.fee(),
            event.feeAsset());
    }

    @Override
    public void onMessageDelivered(MessageDeliveredEvent event) {
        log.info("Delivered {} from network {} (sender {}): {} x {} to {}",
            event.id(),
            event.source(),
            event.sender(),
            event.amount(),
            event.asset(),
            event.recipient());
    }

    @Override
    public void onFundsRecovered(FundsRecoveredEvent event) {
        log.warn("Recovered {} x {} to {}", event.amount(), event.asset(), event.beneficiary());
    }

    @Override
    public void onConfigurationChanged(ConfigurationChangedEvent event) {
        log.info("Configuration {}: {} -> {}", event.setting(), event.previous(), event.current());
    }

    @Override
    public void onError(RelayErrorEvent event) {
        if (event.kind() != null) {
            log.warn("Relay {} failed [{}]: {}", event.operation(), event.kind(), event.message());
            log.debug("Failure detail", event.cause());
        } else {
            log.error("Relay {} error: {}", event.operation(), event.message(), event.cause());
        }
    }
}
