package com.stablepeg.service.classifier;

import com.stablepeg.config.StablePegProperties;
import com.stablepeg.model.domain.Asset;
import com.stablepeg.model.domain.PegClassification;
import com.stablepeg.model.domain.PriceSample;
import com.stablepeg.model.enums.PegStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Maps a price to a peg status against a caller-supplied threshold:
 * STABLE below the threshold, WARNING up to {@code threshold * multiplier}, DEPEGGED from there on.
 */
@Service
public class PegClassifier {

    private static final int DEVIATION_SCALE = 8;

    private final BigDecimal depegMultiplier;

    @Autowired
    public PegClassifier(StablePegProperties properties) {
        this(properties.getClassifier().getDepegMultiplier());
    }

    public PegClassifier(BigDecimal depegMultiplier) {
        if (depegMultiplier == null || depegMultiplier.compareTo(BigDecimal.ONE) < 0) {
            throw new IllegalArgumentException("Depeg multiplier must be >= 1, got " + depegMultiplier);
        }
        this.depegMultiplier = depegMultiplier;
    }

    public PegClassification classify(PriceSample sample, BigDecimal threshold) {
        return classify(sample.price(), threshold);
    }

    public PegClassification classify(BigDecimal price, BigDecimal threshold) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive, got " + price);
        }
        if (threshold == null || threshold.signum() <= 0) {
            throw new IllegalArgumentException("Threshold must be positive, got " + threshold);
        }

        BigDecimal deviation = deviation(price);
        BigDecimal magnitude = deviation.abs();

        PegStatus status;
        if (magnitude.compareTo(threshold) < 0) {
            status = PegStatus.STABLE;
        } else if (magnitude.compareTo(threshold.multiply(depegMultiplier)) < 0) {
            status = PegStatus.WARNING;
        } else {
            status = PegStatus.DEPEGGED;
        }

        return new PegClassification(status, price, deviation, magnitude, threshold);
    }

    public static BigDecimal deviation(BigDecimal price) {
        return price.subtract(Asset.REFERENCE_VALUE)
                .divide(Asset.REFERENCE_VALUE, DEVIATION_SCALE, RoundingMode.HALF_UP);
    }
}
