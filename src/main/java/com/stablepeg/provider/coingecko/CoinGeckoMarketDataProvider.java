package com.stablepeg.provider.coingecko;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablepeg.config.StablePegProperties;
import com.stablepeg.exception.MarketDataException;
import com.stablepeg.model.config.ProviderConfig;
import com.stablepeg.model.domain.FetchFailure;
import com.stablepeg.model.domain.ProviderQuote;
import com.stablepeg.model.domain.ProviderResponse;
import com.stablepeg.provider.MarketDataProvider;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CoinGecko {@code /simple/price} adapter. Ids missing from a successful response are reported as
 * unknown identifiers; HTTP and IO failures surface as {@link MarketDataException}.
 */
@Slf4j
@Component
public class CoinGeckoMarketDataProvider implements MarketDataProvider {

    private static final String NAME = "coingecko";
    private static final String API_KEY_HEADER = "x-cg-demo-api-key";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProviderConfig config;
    private final Clock clock;

    private final AtomicLong callCounter = new AtomicLong();

    public CoinGeckoMarketDataProvider(OkHttpClient httpClient,
                                       ObjectMapper objectMapper,
                                       StablePegProperties properties,
                                       Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = properties.getProvider();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ProviderResponse fetchQuotes(Collection<String> providerIds) {
        String callId = NAME + "#" + callCounter.incrementAndGet();
        Request request = buildRequest(providerIds);

        log.debug("[{}] Fetching {} ids", callId, providerIds.size());

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("[{}] HTTP {} from CoinGecko", callId, response.code());
                throw MarketDataException.forStatus(response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new MarketDataException("Empty response body", true, response.code());
            }
            JsonNode root = objectMapper.readTree(body.string());
            return parse(callId, root, providerIds);
        } catch (IOException e) {
            throw new MarketDataException("CoinGecko request failed: " + e.getMessage(), e);
        }
    }

    private Request buildRequest(Collection<String> providerIds) {
        HttpUrl base = HttpUrl.parse(config.getBaseUrl() + "/simple/price");
        if (base == null) {
            throw new IllegalStateException("Invalid provider base url: " + config.getBaseUrl());
        }
        HttpUrl url = base.newBuilder()
                .addQueryParameter("ids", String.join(",", providerIds))
                .addQueryParameter("vs_currencies", "usd")
                .addQueryParameter("include_24hr_vol", "true")
                .addQueryParameter("include_market_cap", "true")
                .addQueryParameter("include_last_updated_at", "true")
                .addQueryParameter("precision", "full")
                .build();

        Request.Builder builder = new Request.Builder().url(url).get();
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            builder.header(API_KEY_HEADER, config.getApiKey());
        }
        return builder.build();
    }

    private ProviderResponse parse(String callId, JsonNode root, Collection<String> providerIds) {
        Map<String, ProviderQuote> quotes = new LinkedHashMap<>();
        Map<String, FetchFailure> errors = new LinkedHashMap<>();

        for (String id : providerIds) {
            JsonNode node = root.get(id);
            if (node == null || !node.hasNonNull("usd")) {
                errors.put(id, FetchFailure.persistent("unknown identifier"));
                continue;
            }
            quotes.put(id, new ProviderQuote(
                    decimal(node.get("usd")),
                    decimal(node.get("usd_24h_vol")),
                    decimal(node.get("usd_market_cap")),
                    node.hasNonNull("last_updated_at")
                            ? Instant.ofEpochSecond(node.get("last_updated_at").asLong())
                            : clock.instant()
            ));
        }

        if (!errors.isEmpty()) {
            log.warn("[{}] CoinGecko returned no price for {}", callId, errors.keySet());
        }
        return new ProviderResponse(callId, quotes, errors);
    }

    private BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        // keep the literal digits
        return new BigDecimal(node.asText());
    }
}
