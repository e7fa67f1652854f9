package com.stablepeg.model.enums;

public enum MonitorState {
    IDLE,
    FETCHING,
    CLASSIFYING,
    SCORING,
    DISPATCHING,
    FAILED,
    STOPPED
}
