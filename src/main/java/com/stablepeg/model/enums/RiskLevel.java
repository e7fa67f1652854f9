package com.stablepeg.model.enums;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromScore(double score) {
        if (score <= 25) {
            return LOW;
        } else if (score <= 50) {
            return MEDIUM;
        } else if (score <= 75) {
            return HIGH;
        }
        return CRITICAL;
    }
}
