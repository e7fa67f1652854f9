package com.stablepeg.model.config;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
public class RiskConfig {
    /** 1h, 6h or 24h. */
    private String horizon = "24h";
    private int minSamples = 10;
    private double lowHistoryConfidenceCap = 30;
    private double partialSignalConfidenceCap = 70;
    private boolean redistributeMissingWeight = true;

    /** Deviation that maps to a full 100 on the deviation signal. */
    private double deviationScale = 0.02;
    /** Standard deviation of deviations that maps to 100 on the volatility signal. */
    private double volatilityScale = 0.005;
    /** Projected deviation growth over the horizon that maps to 100 on the trend signal. */
    private double trendScale = 0.01;

    private Weights weights = new Weights();

    /** Operator-supplied sentiment per symbol, -100 (panic) to +100 (confident). */
    private Map<String, Double> sentiment = new HashMap<>();

    @Data
    public static class Weights {
        private double deviation = 0.35;
        private double volatility = 0.30;
        private double trend = 0.20;
        private double sentiment = 0.15;
    }
}
