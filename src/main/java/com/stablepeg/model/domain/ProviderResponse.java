package com.stablepeg.model.domain;

import java.util.Map;

public record ProviderResponse(String callId, Map<String, ProviderQuote> quotes, Map<String, FetchFailure> errors) {

    public ProviderResponse {
        quotes = Map.copyOf(quotes);
        errors = Map.copyOf(errors);
    }
}
