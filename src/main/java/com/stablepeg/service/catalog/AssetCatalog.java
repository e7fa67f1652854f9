package com.stablepeg.service.catalog;

import com.stablepeg.config.StablePegProperties;
import com.stablepeg.model.config.AssetConfig;
import com.stablepeg.model.domain.Asset;
import com.stablepeg.model.enums.SubscriptionTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
public class AssetCatalog {

    private final Map<String, Asset> assetsBySymbol;

    @Autowired
    public AssetCatalog(StablePegProperties properties) {
        this(properties.getAssets());
    }

    AssetCatalog(List<AssetConfig> configs) {
        Map<String, Asset> assets = new LinkedHashMap<>();
        for (AssetConfig config : configs) {
            Asset asset = toAsset(config);
            String key = normalize(asset.symbol());
            if (assets.putIfAbsent(key, asset) != null) {
                throw new IllegalStateException("Duplicate asset symbol in catalog: " + asset.symbol());
            }
        }
        this.assetsBySymbol = Collections.unmodifiableMap(assets);
        log.info("Asset catalog loaded: {} assets, {} distinct provider ids",
                assets.size(), providerIds(assets.values()).size());
    }

    public static AssetCatalog of(Collection<Asset> assets) {
        return new AssetCatalog(assets.stream().map(AssetCatalog::toConfig).toList());
    }

    public Collection<Asset> getAll() {
        return assetsBySymbol.values();
    }

    public Optional<Asset> findBySymbol(String symbol) {
        return Optional.ofNullable(assetsBySymbol.get(normalize(symbol)));
    }

    public List<Asset> assetsFor(SubscriptionTier tier) {
        return assetsBySymbol.values().stream()
                .filter(asset -> asset.isWatchedBy(tier))
                .toList();
    }

    /**
     * Union of the assets watched by any of the given tiers, in catalog order.
     */
    public List<Asset> assetsFor(Collection<SubscriptionTier> tiers) {
        return assetsBySymbol.values().stream()
                .filter(asset -> tiers.stream().anyMatch(asset::isWatchedBy))
                .toList();
    }

    public static Set<String> providerIds(Collection<Asset> assets) {
        return assets.stream()
                .map(Asset::providerId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int size() {
        return assetsBySymbol.size();
    }

    private static Asset toAsset(AssetConfig config) {
        if (config.getSymbol() == null || config.getSymbol().isBlank()) {
            throw new IllegalStateException("Asset without symbol in catalog");
        }
        if (config.getProviderId() == null || config.getProviderId().isBlank()) {
            throw new IllegalStateException("Asset " + config.getSymbol() + " has no provider id");
        }
        if (config.getTiers() == null || config.getTiers().isEmpty()) {
            throw new IllegalStateException("Asset " + config.getSymbol() + " belongs to no tier");
        }
        String name = config.getName() != null ? config.getName() : config.getSymbol();
        return new Asset(config.getSymbol(), name, config.getProviderId(), config.getType(), config.getTiers());
    }

    private static AssetConfig toConfig(Asset asset) {
        AssetConfig config = new AssetConfig();
        config.setSymbol(asset.symbol());
        config.setName(asset.name());
        config.setProviderId(asset.providerId());
        config.setType(asset.type());
        config.setTiers(asset.tiers());
        return config;
    }

    private static String normalize(String symbol) {
        return symbol.toUpperCase(Locale.ROOT);
    }
}
