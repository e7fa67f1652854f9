package com.stablepeg.model.enums;

public enum FailureKind {
    /** Timeout, 5xx, rate limiting. Retried within the tick, eligible again next tick. */
    TRANSIENT,
    /** Unknown identifier, auth failure. Flagged until an operator clears it. */
    PERSISTENT
}
