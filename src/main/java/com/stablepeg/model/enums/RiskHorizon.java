package com.stablepeg.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RiskHorizon {
    ONE_HOUR("1h", 1),
    SIX_HOURS("6h", 6),
    ONE_DAY("24h", 24);

    private final String tag;
    private final int hours;

    RiskHorizon(String tag, int hours) {
        this.tag = tag;
        this.hours = hours;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public int getHours() {
        return hours;
    }

    public static RiskHorizon fromTag(String tag) {
        return Arrays.stream(values())
                .filter(h -> h.tag.equalsIgnoreCase(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown risk horizon: " + tag));
    }
}
