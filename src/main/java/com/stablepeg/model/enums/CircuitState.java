package com.stablepeg.model.enums;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
