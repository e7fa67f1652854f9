package com.stablepeg.config;

import com.stablepeg.model.config.AssetConfig;
import com.stablepeg.model.config.HistoryConfig;
import com.stablepeg.model.config.MonitorConfig;
import com.stablepeg.model.config.ProviderConfig;
import com.stablepeg.model.config.RiskConfig;
import com.stablepeg.model.config.TierConfig;
import com.stablepeg.model.enums.SubscriptionTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "stablepeg")
public class StablePegProperties {

    private MonitorConfig monitor = new MonitorConfig();
    private ClassifierConfig classifier = new ClassifierConfig();
    private Map<SubscriptionTier, TierConfig> tiers = new EnumMap<>(SubscriptionTier.class);
    private ProviderConfig provider = new ProviderConfig();
    private CooldownConfig cooldown = new CooldownConfig();
    private HistoryConfig history = new HistoryConfig();
    private RiskConfig risk = new RiskConfig();
    private AlertsConfig alerts = new AlertsConfig();
    private TelegramConfig telegram = new TelegramConfig();
    private WebhookConfig webhook = new WebhookConfig();
    private AlertStreamConfig alertStream = new AlertStreamConfig();
    private List<AssetConfig> assets = new ArrayList<>();

    public TierConfig tier(SubscriptionTier tier) {
        TierConfig config = tiers.get(tier);
        if (config == null) {
            throw new IllegalStateException("No configuration for tier " + tier);
        }
        return config;
    }

    @Data
    public static class ClassifierConfig {
        /** Deviation at or above threshold * multiplier is DEPEGGED. */
        private BigDecimal depegMultiplier = new BigDecimal("2.0");
    }

    @Data
    public static class CooldownConfig {
        /** JSON file backing cooldown records. Blank keeps them in memory only. */
        private String file;
    }

    @Data
    public static class AlertsConfig {
        private boolean recoveryNoticesEnabled = false;
        private int historySize = 200;
    }

    @Data
    public static class TelegramConfig {
        private String botToken;
        private Map<SubscriptionTier, String> chatIds = new EnumMap<>(SubscriptionTier.class);
        private boolean enabled = true;
    }

    @Data
    public static class WebhookConfig {
        private Map<SubscriptionTier, String> urls = new EnumMap<>(SubscriptionTier.class);
    }

    @Data
    public static class AlertStreamConfig {
        /** Origins allowed to open {@code /ws/alerts}. */
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    }
}
