package com.stablepeg.service.cooldown;

import com.stablepeg.exception.CooldownStoreException;
import com.stablepeg.model.domain.DeliveryResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Last-alert timestamps per {@link CooldownKey}. All methods throw {@link CooldownStoreException}
 * when the backing storage cannot be read or written.
 */
public interface CooldownStore {

    /**
     * True if no alert was recorded for the key or the last one is at least {@code window} old.
     */
    boolean isEligible(CooldownKey key, Instant now, Duration window);

    /**
     * Unconditionally overwrites the last-alert timestamp.
     */
    void recordAlert(CooldownKey key, Instant at);

    /**
     * Checks eligibility, runs {@code delivery} and records the alert on success, all while holding the
     * key's lock. Returns empty when the key is still cooling down and the delivery was not attempted.
     * <p>
     * A read failure before delivery is thrown. A write failure after a confirmed delivery is returned in
     * {@link GuardedDelivery#recordFailure()} so the caller still sees the alert as sent.
     */
    Optional<GuardedDelivery> dispatchIfEligible(CooldownKey key, Instant now, Duration window,
                                                 Supplier<DeliveryResult> delivery);

    Optional<Instant> lastAlert(CooldownKey key);

    /**
     * Drops records older than {@code maxWindow}; they can no longer suppress anything.
     */
    int purgeExpired(Instant now, Duration maxWindow);

    int size();
}
