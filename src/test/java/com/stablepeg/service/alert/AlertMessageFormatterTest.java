package com.stablepeg.service.alert;

import com.stablepeg.model.domain.AlertPayload;
import com.stablepeg.model.enums.PegStatus;
import com.stablepeg.model.enums.RiskLevel;
import com.stablepeg.model.enums.SubscriptionTier;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AlertMessageFormatterTest {

    private final AlertMessageFormatter formatter = new AlertMessageFormatter();

    private static AlertPayload.AlertPayloadBuilder usdt() {
        return AlertPayload.builder()
                .tier(SubscriptionTier.FREE)
                .symbol("USDT")
                .name("Tether")
                .price(new BigDecimal("0.994"))
                .deviationPercent(new BigDecimal("-0.600"))
                .status(PegStatus.WARNING)
                .timestamp(Instant.parse("2024-05-01T12:00:00Z"));
    }

    @Test
    void shouldRenderWarningForFreeTier() {
        String text = formatter.format(usdt().build());

        assertEquals("⚠️ PEG WARNING\n\n"
                + "⚠️ USDT (Tether): $0.9940 (-0.60%)\n"
                + "📊 Status: Warning\n"
                + "\n🕐 2024-05-01 12:00 UTC", text);
    }

    @Test
    void shouldRenderDepegWithRiskAndPremiumFooter() {
        String text = formatter.format(usdt()
                .tier(SubscriptionTier.PREMIUM)
                .price(new BigDecimal("1.0312"))
                .deviationPercent(new BigDecimal("3.12"))
                .status(PegStatus.DEPEGGED)
                .riskScore(81.4)
                .riskLevel(RiskLevel.CRITICAL)
                .riskConfidence(70.0)
                .build());

        assertTrue(text.startsWith("🚨 DEPEG ALERT"));
        assertTrue(text.contains("🔴 USDT (Tether): $1.0312 (+3.12%)"));
        assertTrue(text.contains("🎯 Risk: 81/100 CRITICAL (confidence 70%)"));
        assertTrue(text.endsWith("💎 Premium Alert - Early Warning"));
    }

    @Test
    void shouldRenderRecoveryWithoutPremiumFooter() {
        String text = formatter.format(usdt()
                .tier(SubscriptionTier.PREMIUM)
                .price(new BigDecimal("1.0001"))
                .deviationPercent(new BigDecimal("0.01"))
                .status(PegStatus.STABLE)
                .recovery(true)
                .build());

        assertTrue(text.startsWith("✅ PEG RESTORED"));
        assertTrue(text.contains("📊 Status: Stable"));
        assertFalse(text.contains("Premium Alert"));
    }

    @Test
    void shouldOmitNameWhenBlank() {
        String text = formatter.format(usdt().name("").build());

        assertTrue(text.contains("⚠️ USDT: $0.9940"));
    }
}
