package com.stablepeg.model.enums;

public enum DispatchOutcome {
    NOT_ALERTABLE,
    SUPPRESSED_BY_COOLDOWN,
    DISPATCHED,
    DELIVERY_FAILED,
    NO_CHANNEL,
    RECOVERY_SENT,
    STORE_UNAVAILABLE
}
