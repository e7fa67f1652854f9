package com.stablepeg.controller;

import com.stablepeg.model.domain.Asset;
import com.stablepeg.model.enums.SubscriptionTier;
import com.stablepeg.service.catalog.AssetCatalog;
import com.stablepeg.service.market.FlaggedAssetRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/assets")
@RequiredArgsConstructor
public class AssetController {

    private final AssetCatalog assetCatalog;
    private final FlaggedAssetRegistry flaggedAssets;

    @GetMapping
    public Collection<Asset> getAssets(@RequestParam(required = false) SubscriptionTier tier) {
        return tier != null ? assetCatalog.assetsFor(tier) : new ArrayList<>(assetCatalog.getAll());
    }

    @GetMapping("/flagged")
    public Map<String, FlaggedAssetRegistry.Flag> getFlagged() {
        return flaggedAssets.getAll();
    }

    /**
     * Operator override: lets the gateway request a flagged provider id again from the next tick.
     */
    @DeleteMapping("/flagged/{providerId}")
    public ResponseEntity<Void> clearFlag(@PathVariable String providerId) {
        return flaggedAssets.clear(providerId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
