package com.stablepeg.model.dto;

import com.stablepeg.model.enums.PegStatus;
import com.stablepeg.model.enums.RiskLevel;
import com.stablepeg.model.enums.SubscriptionTier;

import java.math.BigDecimal;

public record PegStatusResponse(
        String symbol,
        String name,
        SubscriptionTier tier,
        PegStatus status,
        BigDecimal price,
        BigDecimal deviationPercent,
        BigDecimal thresholdPercent,
        Double riskScore,
        RiskLevel riskLevel,
        Double riskConfidence
) {
}
