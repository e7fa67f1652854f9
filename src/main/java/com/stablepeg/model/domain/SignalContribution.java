package com.stablepeg.model.domain;

/**
 * @param value        normalized signal risk, 0-100
 * @param weight       effective weight after redistribution
 * @param contribution {@code value * weight}, the points this signal adds to the score
 */
public record SignalContribution(String name, double value, double weight, double contribution) {
}
