package com.stablepeg.service.alert;

import com.stablepeg.model.domain.AlertPayload;
import com.stablepeg.model.enums.PegStatus;
import com.stablepeg.model.enums.SubscriptionTier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

@Component
public class AlertMessageFormatter {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneId.of("UTC"));

    public String format(AlertPayload payload) {
        StringBuilder sb = new StringBuilder();

        if (payload.recovery()) {
            sb.append("✅ PEG RESTORED\n\n");
        } else {
            sb.append(payload.status() == PegStatus.DEPEGGED ? "🚨 DEPEG ALERT\n\n" : "⚠️ PEG WARNING\n\n");
        }

        sb.append(statusEmoji(payload.status())).append(' ')
                .append(payload.symbol());
        if (payload.name() != null && !payload.name().isBlank()) {
            sb.append(" (").append(payload.name()).append(')');
        }
        sb.append(": $").append(formatPrice(payload.price()))
                .append(" (").append(formatDeviation(payload.deviationPercent())).append(")\n");
        sb.append("📊 Status: ").append(payload.status().getDisplayName()).append('\n');

        if (payload.riskScore() != null) {
            sb.append("🎯 Risk: ").append(String.format(Locale.ROOT, "%.0f/100", payload.riskScore()));
            if (payload.riskLevel() != null) {
                sb.append(' ').append(payload.riskLevel());
            }
            if (payload.riskConfidence() != null) {
                sb.append(String.format(Locale.ROOT, " (confidence %.0f%%)", payload.riskConfidence()));
            }
            sb.append('\n');
        }

        sb.append("\n🕐 ").append(TIME_FORMATTER.format(payload.timestamp())).append(" UTC");

        if (payload.tier() == SubscriptionTier.PREMIUM && !payload.recovery()) {
            sb.append("\n\n💎 Premium Alert - Early Warning");
        }
        return sb.toString();
    }

    private String statusEmoji(PegStatus status) {
        return switch (status) {
            case STABLE -> "✅";
            case WARNING -> "⚠️";
            case DEPEGGED -> "🔴";
        };
    }

    private String formatPrice(BigDecimal price) {
        return price.setScale(4, RoundingMode.HALF_UP).toPlainString();
    }

    private String formatDeviation(BigDecimal deviationPercent) {
        String sign = deviationPercent.signum() >= 0 ? "+" : "";
        return sign + deviationPercent.setScale(2, RoundingMode.HALF_UP).toPlainString() + "%";
    }
}
