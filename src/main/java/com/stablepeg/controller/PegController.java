package com.stablepeg.controller;

import com.stablepeg.model.domain.Asset;
import com.stablepeg.model.domain.PegClassification;
import com.stablepeg.model.domain.RiskAssessment;
import com.stablepeg.model.dto.PegStatusResponse;
import com.stablepeg.model.enums.SubscriptionTier;
import com.stablepeg.service.catalog.AssetCatalog;
import com.stablepeg.service.monitor.MonitorScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/pegs")
@RequiredArgsConstructor
public class PegController {

    private final MonitorScheduler monitorScheduler;
    private final AssetCatalog assetCatalog;

    @GetMapping
    public List<PegStatusResponse> getPegs(@RequestParam(defaultValue = "FREE") SubscriptionTier tier) {
        List<PegStatusResponse> result = new ArrayList<>();
        monitorScheduler.getLatestClassifications(tier).forEach((symbol, classification) ->
                assetCatalog.findBySymbol(symbol).ifPresent(asset ->
                        result.add(toResponse(asset, tier, classification))));
        result.sort(Comparator.comparing((PegStatusResponse r) -> r.deviationPercent().abs()).reversed());
        return result;
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<List<PegStatusResponse>> getPeg(@PathVariable String symbol) {
        return assetCatalog.findBySymbol(symbol)
                .map(asset -> {
                    Map<SubscriptionTier, PegClassification> byTier =
                            monitorScheduler.getLatestClassifications(asset.symbol());
                    List<PegStatusResponse> result = new ArrayList<>();
                    byTier.forEach((tier, classification) -> result.add(toResponse(asset, tier, classification)));
                    return ResponseEntity.ok(result);
                })
                .orElse(ResponseEntity.notFound().build());
    }

    private PegStatusResponse toResponse(Asset asset, SubscriptionTier tier, PegClassification classification) {
        RiskAssessment risk = monitorScheduler.getLatestRisk(asset.symbol()).orElse(null);
        return new PegStatusResponse(
                asset.symbol(),
                asset.name(),
                tier,
                classification.status(),
                classification.price(),
                classification.deviationPercent(),
                classification.threshold().movePointRight(2),
                risk != null ? risk.score() : null,
                risk != null ? risk.level() : null,
                risk != null ? risk.confidence() : null
        );
    }
}
