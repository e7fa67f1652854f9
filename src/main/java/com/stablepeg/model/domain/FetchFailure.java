package com.stablepeg.model.domain;

import com.stablepeg.model.enums.FailureKind;

public record FetchFailure(FailureKind kind, String reason) {

    public static FetchFailure transientFailure(String reason) {
        return new FetchFailure(FailureKind.TRANSIENT, reason);
    }

    public static FetchFailure persistent(String reason) {
        return new FetchFailure(FailureKind.PERSISTENT, reason);
    }
}
