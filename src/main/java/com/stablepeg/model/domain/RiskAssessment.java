package com.stablepeg.model.domain;

import com.stablepeg.model.enums.RiskHorizon;
import com.stablepeg.model.enums.RiskLevel;

import java.time.Instant;
import java.util.List;

public record RiskAssessment(
        String symbol,
        double score,
        RiskLevel level,
        double confidence,
        List<SignalContribution> contributions,
        int sampleCount,
        boolean sentimentIncluded,
        RiskHorizon horizon,
        Instant timestamp
) {
    public RiskAssessment {
        contributions = List.copyOf(contributions);
    }
}
