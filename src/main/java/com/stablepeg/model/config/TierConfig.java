package com.stablepeg.model.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TierConfig {
    @Builder.Default
    private boolean enabled = true;

    /** Deviation threshold as a fraction of the peg (0.005 = 0.5%). */
    private BigDecimal threshold;

    @Builder.Default
    private Duration cooldown = Duration.ofMinutes(30);

    /** Attach a risk assessment to this tier's alerts. */
    private boolean riskScoring;
}
