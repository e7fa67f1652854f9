package com.stablepeg.controller;

import com.stablepeg.model.enums.SubscriptionTier;
import com.stablepeg.service.catalog.AssetCatalog;
import com.stablepeg.service.market.FlaggedAssetRegistry;
import com.stablepeg.support.MutableClock;
import com.stablepeg.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AssetControllerTest {

    private FlaggedAssetRegistry flaggedAssets;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AssetCatalog catalog = AssetCatalog.of(List.of(
                TestProperties.asset("USDT", "tether", SubscriptionTier.FREE),
                TestProperties.asset("PYUSD", "paypal-usd", SubscriptionTier.PREMIUM)));
        flaggedAssets = new FlaggedAssetRegistry(new MutableClock(Instant.parse("2024-05-01T12:00:00Z")));
        mockMvc = MockMvcBuilders.standaloneSetup(new AssetController(catalog, flaggedAssets)).build();
    }

    @Test
    void shouldFilterAssetsByTier() throws Exception {
        mockMvc.perform(get("/api/v1/assets").param("tier", "PREMIUM"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].symbol").value("PYUSD"));

        // enterprise watches the whole catalog
        mockMvc.perform(get("/api/v1/assets").param("tier", "ENTERPRISE"))
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void shouldListAndClearFlaggedIds() throws Exception {
        // Given
        flaggedAssets.flag("paypal-usd", "unknown identifier");

        // When & Then
        mockMvc.perform(get("/api/v1/assets/flagged"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['paypal-usd'].reason").value("unknown identifier"));

        mockMvc.perform(delete("/api/v1/assets/flagged/paypal-usd"))
                .andExpect(status().isNoContent());
        assertFalse(flaggedAssets.isFlagged("paypal-usd"));

        mockMvc.perform(delete("/api/v1/assets/flagged/paypal-usd"))
                .andExpect(status().isNotFound());
    }
}
