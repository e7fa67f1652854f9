package com.stablepeg.support;

import com.stablepeg.config.StablePegProperties;
import com.stablepeg.model.config.TierConfig;
import com.stablepeg.model.domain.Asset;
import com.stablepeg.model.domain.PriceSample;
import com.stablepeg.model.enums.SubscriptionTier;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Properties matching the shipped defaults: free at 0.5%/30m, premium at 0.2%/5m with risk scoring.
 */
public final class TestProperties {

    private TestProperties() {
    }

    public static StablePegProperties defaults() {
        StablePegProperties properties = new StablePegProperties();
        properties.getTiers().put(SubscriptionTier.FREE, TierConfig.builder()
                .threshold(new BigDecimal("0.005"))
                .cooldown(Duration.ofMinutes(30))
                .riskScoring(false)
                .build());
        properties.getTiers().put(SubscriptionTier.PREMIUM, TierConfig.builder()
                .threshold(new BigDecimal("0.002"))
                .cooldown(Duration.ofMinutes(5))
                .riskScoring(true)
                .build());
        properties.getProvider().setInitialBackoff(Duration.ZERO);
        properties.getProvider().setMaxBackoff(Duration.ZERO);
        properties.getProvider().setMinCallInterval(Duration.ZERO);
        return properties;
    }

    public static Asset asset(String symbol, String providerId, SubscriptionTier... tiers) {
        return new Asset(symbol, symbol + " Stablecoin", providerId, "fiat-backed", Set.of(tiers));
    }

    public static PriceSample sample(String providerId, String price, Instant at) {
        return new PriceSample(providerId, new BigDecimal(price), new BigDecimal("1000000"),
                new BigDecimal("50000000"), at, "test#1");
    }
}
