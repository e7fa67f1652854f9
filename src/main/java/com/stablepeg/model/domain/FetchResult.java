package com.stablepeg.model.domain;

import java.util.Map;

// each requested id appears in exactly one map
public record FetchResult(Map<String, PriceSample> samples, Map<String, FetchFailure> failures) {

    public FetchResult {
        samples = Map.copyOf(samples);
        failures = Map.copyOf(failures);
    }
}
