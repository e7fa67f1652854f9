package com.stablepeg.model.enums;

public enum SubscriptionTier {
    FREE("Free"),
    PREMIUM("Premium"),
    ENTERPRISE("Enterprise");

    private final String displayName;

    SubscriptionTier(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
