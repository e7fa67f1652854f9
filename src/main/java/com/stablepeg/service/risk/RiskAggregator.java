package com.stablepeg.service.risk;

import com.stablepeg.model.domain.PriceSample;
import com.stablepeg.model.domain.RiskAssessment;

import java.util.List;
import java.util.OptionalDouble;

public interface RiskAggregator {

    /**
     * @param samples   recent samples for the asset, oldest first; may be empty
     * @param sentiment sentiment score from -100 (panic) to +100 (confident), if one is known
     */
    RiskAssessment assess(String symbol, List<PriceSample> samples, OptionalDouble sentiment);
}
