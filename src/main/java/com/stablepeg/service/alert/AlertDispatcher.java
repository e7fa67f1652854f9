package com.stablepeg.service.alert;

import com.stablepeg.config.StablePegProperties;
import com.stablepeg.event.AlertDispatchedEvent;
import com.stablepeg.exception.CooldownStoreException;
import com.stablepeg.model.config.TierConfig;
import com.stablepeg.model.domain.AlertPayload;
import com.stablepeg.model.domain.Asset;
import com.stablepeg.model.domain.DeliveryResult;
import com.stablepeg.model.domain.DispatchDecision;
import com.stablepeg.model.domain.Notification;
import com.stablepeg.model.domain.PegClassification;
import com.stablepeg.model.domain.RiskAssessment;
import com.stablepeg.model.enums.DispatchOutcome;
import com.stablepeg.model.enums.SubscriptionTier;
import com.stablepeg.service.cooldown.CooldownKey;
import com.stablepeg.service.cooldown.CooldownStore;
import com.stablepeg.service.cooldown.GuardedDelivery;
import com.stablepeg.service.notification.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides per (tier, asset) whether a classification becomes a notification. Alerts go out only for
 * WARNING and DEPEGGED, only when the cooldown allows it, and the cooldown is recorded only after the
 * channel confirms delivery.
 * <p>
 * A return to STABLE is silent unless {@code stablepeg.alerts.recovery-notices-enabled} is set; recovery
 * notices bypass the cooldown and do not record one.
 */
@Slf4j
@Service
public class AlertDispatcher {

    private final CooldownStore cooldownStore;
    private final List<NotificationChannel> channels;
    private final AlertMessageFormatter formatter;
    private final StablePegProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // keys alerted since their last STABLE reading
    private final Set<CooldownKey> outstanding = ConcurrentHashMap.newKeySet();

    public AlertDispatcher(CooldownStore cooldownStore,
                           List<NotificationChannel> channels,
                           AlertMessageFormatter formatter,
                           StablePegProperties properties,
                           ApplicationEventPublisher eventPublisher,
                           Clock clock) {
        this.cooldownStore = cooldownStore;
        this.channels = List.copyOf(channels);
        this.formatter = formatter;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * @param risk optional assessment, attached only when the tier has risk scoring enabled
     * @throws CooldownStoreException if cooldown state cannot be read before delivery
     */
    public DispatchDecision evaluate(SubscriptionTier tier, Asset asset, PegClassification classification,
                                     RiskAssessment risk) {
        CooldownKey key = new CooldownKey(tier, asset.symbol());
        TierConfig tierConfig = properties.tier(tier);

        if (!classification.status().isAlertable()) {
            if (outstanding.contains(key) && properties.getAlerts().isRecoveryNoticesEnabled()) {
                return sendRecovery(tier, asset, classification, key);
            }
            outstanding.remove(key);
            return DispatchDecision.of(tier, asset.symbol(), DispatchOutcome.NOT_ALERTABLE);
        }

        Optional<NotificationChannel> channel = channelFor(tier);
        if (channel.isEmpty()) {
            log.warn("No notification channel for {} tier, {} {} not sent",
                    tier, asset.symbol(), classification.status());
            return DispatchDecision.of(tier, asset.symbol(), DispatchOutcome.NO_CHANNEL);
        }

        Instant now = clock.instant();
        AlertPayload payload = buildPayload(tier, asset, classification,
                tierConfig.isRiskScoring() ? risk : null, false, now);
        Notification notification = new Notification(tier, formatter.format(payload), payload);

        Optional<GuardedDelivery> attempt = cooldownStore.dispatchIfEligible(
                key, now, tierConfig.getCooldown(), () -> channel.get().deliver(notification));

        if (attempt.isEmpty()) {
            log.debug("[{}] {} {} suppressed by cooldown", tier, asset.symbol(), classification.status());
            return new DispatchDecision(tier, asset.symbol(), DispatchOutcome.SUPPRESSED_BY_COOLDOWN, payload, null);
        }
        DeliveryResult result = attempt.get().result();
        if (!result.success()) {
            log.warn("[{}] Delivery of {} {} alert via {} failed: {}", tier, asset.symbol(),
                    classification.status(), channel.get().getName(), result.detail());
            return new DispatchDecision(tier, asset.symbol(), DispatchOutcome.DELIVERY_FAILED, payload,
                    result.detail());
        }

        outstanding.add(key);
        log.info("[{}] Alert sent: {} {} @ {} ({}%)", tier, asset.symbol(), classification.status(),
                classification.price(), payload.deviationPercent());
        eventPublisher.publishEvent(new AlertDispatchedEvent(this, payload, channel.get().getName()));

        CooldownStoreException recordFailure = attempt.get().recordFailure();
        if (recordFailure != null) {
            log.error("[{}] {} alert delivered but its cooldown was not persisted", tier, asset.symbol(),
                    recordFailure);
            return new DispatchDecision(tier, asset.symbol(), DispatchOutcome.DISPATCHED, payload,
                    recordFailure.getMessage(), true);
        }
        return new DispatchDecision(tier, asset.symbol(), DispatchOutcome.DISPATCHED, payload, null);
    }

    private DispatchDecision sendRecovery(SubscriptionTier tier, Asset asset, PegClassification classification,
                                          CooldownKey key) {
        Optional<NotificationChannel> channel = channelFor(tier);
        if (channel.isEmpty()) {
            outstanding.remove(key);
            return DispatchDecision.of(tier, asset.symbol(), DispatchOutcome.NO_CHANNEL);
        }
        AlertPayload payload = buildPayload(tier, asset, classification, null, true, clock.instant());
        DeliveryResult result = channel.get().deliver(new Notification(tier, formatter.format(payload), payload));
        if (!result.success()) {
            log.warn("[{}] Recovery notice for {} failed: {}", tier, asset.symbol(), result.detail());
            return new DispatchDecision(tier, asset.symbol(), DispatchOutcome.DELIVERY_FAILED, payload, result.detail());
        }
        outstanding.remove(key);
        log.info("[{}] Recovery notice sent: {} back at {}", tier, asset.symbol(), classification.price());
        eventPublisher.publishEvent(new AlertDispatchedEvent(this, payload, channel.get().getName()));
        return new DispatchDecision(tier, asset.symbol(), DispatchOutcome.RECOVERY_SENT, payload, null);
    }

    private Optional<NotificationChannel> channelFor(SubscriptionTier tier) {
        return channels.stream().filter(c -> c.supports(tier)).findFirst();
    }

    private AlertPayload buildPayload(SubscriptionTier tier, Asset asset, PegClassification classification,
                                      RiskAssessment risk, boolean recovery, Instant now) {
        return AlertPayload.builder()
                .tier(tier)
                .symbol(asset.symbol())
                .name(asset.name())
                .price(classification.price())
                .deviationPercent(classification.deviationPercent())
                .status(classification.status())
                .riskScore(risk != null ? risk.score() : null)
                .riskLevel(risk != null ? risk.level() : null)
                .riskConfidence(risk != null ? risk.confidence() : null)
                .recovery(recovery)
                .timestamp(now)
                .build();
    }
}
