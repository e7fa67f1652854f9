package com.stablepeg.controller;

import com.stablepeg.service.cooldown.CooldownStore;
import com.stablepeg.service.history.PriceHistory;
import com.stablepeg.service.market.CallRateLimiter;
import com.stablepeg.service.market.FlaggedAssetRegistry;
import com.stablepeg.service.market.ProviderCircuitBreaker;
import com.stablepeg.service.monitor.MonitorScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/status")
@RequiredArgsConstructor
public class StatusController {

    private final MonitorScheduler monitorScheduler;
    private final ProviderCircuitBreaker circuitBreaker;
    private final CallRateLimiter rateLimiter;
    private final FlaggedAssetRegistry flaggedAssets;
    private final CooldownStore cooldownStore;
    private final PriceHistory priceHistory;

    @GetMapping
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("state", monitorScheduler.getState());
        status.put("tickInProgress", monitorScheduler.isTickInProgress());
        status.put("ticks", monitorScheduler.getTickCount());
        status.put("skippedTicks", monitorScheduler.getSkippedTicks());
        status.put("failedTicks", monitorScheduler.getFailedTicks());
        status.put("providerCircuit", circuitBreaker.getState());
        status.put("providerCallsLastMinute", rateLimiter.callsInLastMinute());
        status.put("flaggedAssets", flaggedAssets.getAll().size());
        status.put("cooldownRecords", cooldownStore.size());
        status.put("trackedHistories", priceHistory.getTrackedAssetsCount());
        monitorScheduler.getLastReport().ifPresent(report -> {
            status.put("lastTickId", report.tickId());
            status.put("lastTickAt", report.finishedAt());
            status.put("lastTickState", report.finalState());
            status.put("lastTickFetched", report.fetchedAssets() + "/" + report.requestedAssets());
            status.put("lastTickAlerts", report.dispatchedCount());
        });
        return status;
    }
}
