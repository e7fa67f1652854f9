package com.stablepeg.model.domain;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceSample(
        String providerId,
        BigDecimal price,
        BigDecimal volume24h,
        BigDecimal marketCap,
        Instant timestamp,
        String provenance
) {
}
