package com.stablepeg.service.market;

import com.stablepeg.config.StablePegProperties;
import com.stablepeg.model.enums.CircuitState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Slf4j
@Component
public class ProviderCircuitBreaker {

    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;

    public ProviderCircuitBreaker(StablePegProperties properties, Clock clock) {
        this.failureThreshold = properties.getProvider().getCircuitFailureThreshold();
        this.recoveryTimeout = properties.getProvider().getCircuitRecoveryTimeout();
        this.clock = clock;
    }

    public synchronized boolean allowRequest() {
        if (state != CircuitState.OPEN) {
            return true;
        }
        if (!clock.instant().isBefore(openedAt.plus(recoveryTimeout))) {
            state = CircuitState.HALF_OPEN;
            log.info("Provider circuit half-open, allowing a trial call");
            return true;
        }
        return false;
    }

    public synchronized void recordSuccess() {
        if (state != CircuitState.CLOSED) {
            log.info("Provider circuit closed after successful call");
        }
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        if (state == CircuitState.HALF_OPEN || consecutiveFailures >= failureThreshold) {
            if (state != CircuitState.OPEN) {
                log.warn("Provider circuit opened after {} consecutive failures, pausing calls for {}s",
                        consecutiveFailures, recoveryTimeout.toSeconds());
            }
            state = CircuitState.OPEN;
            openedAt = clock.instant();
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
