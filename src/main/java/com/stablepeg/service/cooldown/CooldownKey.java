package com.stablepeg.service.cooldown;

import com.stablepeg.model.enums.SubscriptionTier;

import java.util.Locale;

public record CooldownKey(SubscriptionTier tier, String symbol) {

    private static final String SEPARATOR = ":";

    public CooldownKey {
        symbol = symbol.toUpperCase(Locale.ROOT);
    }

    public String asString() {
        return tier.name() + SEPARATOR + symbol;
    }

    public static CooldownKey parse(String value) {
        int idx = value.indexOf(SEPARATOR);
        if (idx <= 0 || idx == value.length() - 1) {
            throw new IllegalArgumentException("Malformed cooldown key: " + value);
        }
        return new CooldownKey(SubscriptionTier.valueOf(value.substring(0, idx)), value.substring(idx + 1));
    }

    @Override
    public String toString() {
        return asString();
    }
}
