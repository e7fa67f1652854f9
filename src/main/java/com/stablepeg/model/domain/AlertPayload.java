package com.stablepeg.model.domain;

import com.stablepeg.model.enums.PegStatus;
import com.stablepeg.model.enums.RiskLevel;
import com.stablepeg.model.enums.SubscriptionTier;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder
public record AlertPayload(
        SubscriptionTier tier,
        String symbol,
        String name,
        BigDecimal price,
        BigDecimal deviationPercent,
        PegStatus status,
        Double riskScore,
        RiskLevel riskLevel,
        Double riskConfidence,
        boolean recovery,
        Instant timestamp
) {
}
