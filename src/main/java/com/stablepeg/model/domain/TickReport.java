package com.stablepeg.model.domain;

import com.stablepeg.model.enums.MonitorState;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record TickReport(
        long tickId,
        Instant startedAt,
        Instant finishedAt,
        MonitorState finalState,
        int requestedAssets,
        int fetchedAssets,
        Map<String, String> failedAssets,
        int classifications,
        List<DispatchDecision> decisions,
        String error
) {
    public TickReport {
        failedAssets = Map.copyOf(failedAssets);
        decisions = List.copyOf(decisions);
    }

    public long dispatchedCount() {
        return decisions.stream().filter(DispatchDecision::delivered).count();
    }
}
