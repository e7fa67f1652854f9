package com.stablepeg.model.enums;

// declared in severity order
public enum PegStatus {
    STABLE("Stable"),
    WARNING("Warning"),
    DEPEGGED("Depegged");

    private final String displayName;

    PegStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isAlertable() {
        return this != STABLE;
    }
}
