package com.stablepeg.model.domain;

import com.stablepeg.model.enums.DispatchOutcome;
import com.stablepeg.model.enums.SubscriptionTier;

/**
 * @param cooldownLost the alert went out but its cooldown could not be persisted
 */
public record DispatchDecision(
        SubscriptionTier tier,
        String symbol,
        DispatchOutcome outcome,
        AlertPayload payload,
        String detail,
        boolean cooldownLost
) {
    public DispatchDecision(SubscriptionTier tier, String symbol, DispatchOutcome outcome,
                            AlertPayload payload, String detail) {
        this(tier, symbol, outcome, payload, detail, false);
    }

    public static DispatchDecision of(SubscriptionTier tier, String symbol, DispatchOutcome outcome) {
        return new DispatchDecision(tier, symbol, outcome, null, null);
    }

    public boolean delivered() {
        return outcome == DispatchOutcome.DISPATCHED || outcome == DispatchOutcome.RECOVERY_SENT;
    }
}
