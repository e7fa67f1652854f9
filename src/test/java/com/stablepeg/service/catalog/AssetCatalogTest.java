package com.stablepeg.service.catalog;

import com.stablepeg.model.config.AssetConfig;
import com.stablepeg.model.domain.Asset;
import com.stablepeg.model.enums.SubscriptionTier;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AssetCatalogTest {

    private static AssetConfig config(String symbol, String providerId, SubscriptionTier... tiers) {
        AssetConfig config = new AssetConfig();
        config.setSymbol(symbol);
        config.setName(symbol);
        config.setProviderId(providerId);
        config.setType("fiat-backed");
        config.setTiers(tiers.length == 0 ? EnumSet.noneOf(SubscriptionTier.class) : EnumSet.of(tiers[0], tiers));
        return config;
    }

    private final AssetCatalog catalog = new AssetCatalog(List.of(
            config("USDT", "tether", SubscriptionTier.FREE, SubscriptionTier.PREMIUM),
            config("FRAX", "frax", SubscriptionTier.PREMIUM),
            config("USDT.e", "tether", SubscriptionTier.PREMIUM)
    ));

    @Test
    void shouldResolveAssetsPerTier() {
        assertEquals(List.of("USDT"), catalog.assetsFor(SubscriptionTier.FREE).stream().map(Asset::symbol).toList());
        assertEquals(3, catalog.assetsFor(SubscriptionTier.PREMIUM).size());
        // enterprise watches the whole catalog
        assertEquals(3, catalog.assetsFor(SubscriptionTier.ENTERPRISE).size());
    }

    @Test
    void shouldDeduplicateProviderIdsInUnion() {
        List<Asset> union = catalog.assetsFor(EnumSet.of(SubscriptionTier.FREE, SubscriptionTier.PREMIUM));

        assertEquals(3, union.size());
        assertEquals(Set.of("tether", "frax"), AssetCatalog.providerIds(union));
    }

    @Test
    void shouldFindBySymbolIgnoringCase() {
        assertTrue(catalog.findBySymbol("usdt.E").isPresent());
        assertTrue(catalog.findBySymbol("DAI").isEmpty());
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThrows(IllegalStateException.class, () -> new AssetCatalog(List.of(
                config("USDC", "usd-coin", SubscriptionTier.FREE),
                config("usdc", "usd-coin", SubscriptionTier.PREMIUM))));
        assertThrows(IllegalStateException.class, () -> new AssetCatalog(List.of(
                config("USDC", " ", SubscriptionTier.FREE))));
        assertThrows(IllegalStateException.class, () -> new AssetCatalog(List.of(
                config("USDC", "usd-coin"))));
    }
}
