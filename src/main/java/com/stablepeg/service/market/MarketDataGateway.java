package com.stablepeg.service.market;

import com.stablepeg.config.StablePegProperties;
import com.stablepeg.exception.MarketDataException;
import com.stablepeg.model.config.ProviderConfig;
import com.stablepeg.model.domain.FetchFailure;
import com.stablepeg.model.domain.FetchResult;
import com.stablepeg.model.domain.PriceSample;
import com.stablepeg.model.domain.ProviderQuote;
import com.stablepeg.model.domain.ProviderResponse;
import com.stablepeg.model.enums.FailureKind;
import com.stablepeg.provider.MarketDataProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Batched, rate-limited access to the market data provider. Never throws for provider problems:
 * every requested id ends up either as a sample or as a failure in the returned {@link FetchResult}.
 */
@Slf4j
@Service
public class MarketDataGateway {

    private final MarketDataProvider provider;
    private final CallRateLimiter rateLimiter;
    private final ProviderCircuitBreaker circuitBreaker;
    private final FlaggedAssetRegistry flaggedAssets;
    private final ProviderConfig config;
    private final Clock clock;

    public MarketDataGateway(MarketDataProvider provider,
                             CallRateLimiter rateLimiter,
                             ProviderCircuitBreaker circuitBreaker,
                             FlaggedAssetRegistry flaggedAssets,
                             StablePegProperties properties,
                             Clock clock) {
        this.provider = provider;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.flaggedAssets = flaggedAssets;
        this.config = properties.getProvider();
        this.clock = clock;
    }

    public FetchResult fetch(Collection<String> providerIds) {
        Map<String, PriceSample> samples = new LinkedHashMap<>();
        Map<String, FetchFailure> failures = new LinkedHashMap<>();

        List<String> requested = new ArrayList<>();
        for (String id : new LinkedHashSet<>(providerIds)) {
            var flag = flaggedAssets.get(id);
            if (flag.isPresent()) {
                failures.put(id, FetchFailure.persistent("flagged: " + flag.get().reason()));
            } else {
                requested.add(id);
            }
        }

        Instant deadline = clock.instant().plus(config.getFetchTimeout());
        int batchSize = Math.max(1, config.getMaxBatchSize());
        for (int i = 0; i < requested.size(); i += batchSize) {
            List<String> batch = requested.subList(i, Math.min(i + batchSize, requested.size()));
            fetchBatch(batch, deadline, samples, failures);
        }

        if (!failures.isEmpty()) {
            log.warn("Fetch degraded: {}/{} ids fetched, failed: {}",
                    samples.size(), samples.size() + failures.size(), failures);
        } else {
            log.debug("Fetched {} ids from {}", samples.size(), provider.getName());
        }
        return new FetchResult(samples, failures);
    }

    private void fetchBatch(List<String> batch, Instant deadline,
                            Map<String, PriceSample> samples, Map<String, FetchFailure> failures) {
        Set<String> pending = new LinkedHashSet<>(batch);
        String lastReason = "not attempted";

        for (int attempt = 1; attempt <= config.getMaxAttempts() && !pending.isEmpty(); attempt++) {
            if (!circuitBreaker.allowRequest()) {
                lastReason = "circuit open";
                break;
            }
            if (!rateLimiter.acquire(deadline)) {
                lastReason = Thread.currentThread().isInterrupted()
                        ? "interrupted" : "rate limit budget exhausted";
                break;
            }

            try {
                ProviderResponse response = provider.fetchQuotes(List.copyOf(pending));
                circuitBreaker.recordSuccess();
                lastReason = applyResponse(response, pending, samples, failures);
            } catch (MarketDataException e) {
                circuitBreaker.recordFailure();
                if (!e.isTransientFailure()) {
                    for (String id : pending) {
                        flaggedAssets.flag(id, e.getMessage());
                        failures.put(id, FetchFailure.persistent(e.getMessage()));
                    }
                    pending.clear();
                    break;
                }
                lastReason = e.getMessage();
                log.warn("Provider batch of {} failed (attempt {}/{}): {}",
                        pending.size(), attempt, config.getMaxAttempts(), e.getMessage());
            } catch (RuntimeException e) {
                circuitBreaker.recordFailure();
                lastReason = "unexpected provider error: " + e.getMessage();
                log.error("Unexpected error from provider {} (attempt {}/{})",
                        provider.getName(), attempt, config.getMaxAttempts(), e);
            }

            if (!pending.isEmpty() && attempt < config.getMaxAttempts()) {
                if (!sleep(backoff(attempt))) {
                    lastReason = "interrupted";
                    break;
                }
            }
        }

        for (String id : pending) {
            failures.put(id, FetchFailure.transientFailure(lastReason));
        }
    }

    /**
     * Moves resolved ids out of {@code pending}. Returns the reason to report for ids still pending.
     */
    private String applyResponse(ProviderResponse response, Set<String> pending,
                                 Map<String, PriceSample> samples, Map<String, FetchFailure> failures) {
        response.quotes().forEach((id, quote) -> {
            if (pending.remove(id)) {
                samples.put(id, toSample(id, quote, response.callId()));
            }
        });

        String reason = "missing from provider response";
        for (Map.Entry<String, FetchFailure> entry : response.errors().entrySet()) {
            String id = entry.getKey();
            FetchFailure failure = entry.getValue();
            if (!pending.contains(id)) {
                continue;
            }
            if (failure.kind() == FailureKind.PERSISTENT) {
                pending.remove(id);
                flaggedAssets.flag(id, failure.reason());
                failures.put(id, failure);
            } else {
                reason = failure.reason();
            }
        }
        return reason;
    }

    private PriceSample toSample(String id, ProviderQuote quote, String callId) {
        Instant timestamp = quote.lastUpdated() != null ? quote.lastUpdated() : clock.instant();
        return new PriceSample(id, quote.price(), quote.volume24h(), quote.marketCap(), timestamp, callId);
    }

    Duration backoff(int attempt) {
        long initial = config.getInitialBackoff().toMillis();
        long delay = initial * (1L << Math.min(attempt - 1, 20));
        return Duration.ofMillis(Math.min(delay, config.getMaxBackoff().toMillis()));
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
