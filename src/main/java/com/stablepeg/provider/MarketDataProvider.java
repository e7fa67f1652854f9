package com.stablepeg.provider;

import com.stablepeg.exception.MarketDataException;
import com.stablepeg.model.domain.ProviderResponse;

import java.util.Collection;

public interface MarketDataProvider {

    String getName();

    /**
     * One batch call for the given provider ids.
     *
     * @return quotes for the ids the provider resolved and per-id errors for the ones it did not
     * @throws MarketDataException when the whole call failed
     */
    ProviderResponse fetchQuotes(Collection<String> providerIds);
}
