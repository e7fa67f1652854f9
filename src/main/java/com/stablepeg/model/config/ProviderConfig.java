package com.stablepeg.model.config;

import lombok.Data;

import java.time.Duration;

@Data
public class ProviderConfig {
    private String baseUrl = "https://api.coingecko.com/api/v3";
    private String apiKey;
    private int maxBatchSize = 50;
    private int maxCallsPerMinute = 30;
    private Duration minCallInterval = Duration.ofSeconds(2);
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(1);
    private Duration maxBackoff = Duration.ofSeconds(10);

    /** Longest a single fetch may wait for rate-limit permits before giving up on the rest. */
    private Duration fetchTimeout = Duration.ofSeconds(60);

    private int circuitFailureThreshold = 5;
    private Duration circuitRecoveryTimeout = Duration.ofSeconds(60);
}
