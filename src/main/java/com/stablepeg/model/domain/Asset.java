package com.stablepeg.model.domain;

import com.stablepeg.model.enums.SubscriptionTier;

import java.math.BigDecimal;
import java.util.Set;

public record Asset(
        String symbol,
        String name,
        String providerId,
        String type,
        Set<SubscriptionTier> tiers
) {
    public static final BigDecimal REFERENCE_VALUE = BigDecimal.ONE;

    public Asset {
        tiers = Set.copyOf(tiers);
    }

    public boolean isWatchedBy(SubscriptionTier tier) {
        // enterprise targets see every registered asset
        return tier == SubscriptionTier.ENTERPRISE || tiers.contains(tier);
    }
}
