package com.stablepeg.model.config;

import com.stablepeg.model.enums.SubscriptionTier;
import lombok.Data;

import java.util.EnumSet;
import java.util.Set;

@Data
public class AssetConfig {
    private String symbol;
    private String name;
    private String providerId;
    private String type;
    private Set<SubscriptionTier> tiers = EnumSet.noneOf(SubscriptionTier.class);
}
