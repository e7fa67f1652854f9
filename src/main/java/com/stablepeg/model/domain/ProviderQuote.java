package com.stablepeg.model.domain;

import java.math.BigDecimal;
import java.time.Instant;

public record ProviderQuote(BigDecimal price, BigDecimal volume24h, BigDecimal marketCap, Instant lastUpdated) {
}
