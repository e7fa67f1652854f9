package com.stablepeg.model.domain;

import com.stablepeg.model.enums.PegStatus;

import java.math.BigDecimal;

/**
 * @param deviation signed relative distance from the peg, {@code (price - ref) / ref}
 * @param magnitude absolute value of {@code deviation}
 * @param threshold tier threshold the status was derived from
 */
public record PegClassification(
        PegStatus status,
        BigDecimal price,
        BigDecimal deviation,
        BigDecimal magnitude,
        BigDecimal threshold
) {
    public BigDecimal deviationPercent() {
        return deviation.movePointRight(2);
    }
}
