package com.stablepeg.service.risk;

import java.util.OptionalDouble;

public interface SentimentSource {

    OptionalDouble sentimentFor(String symbol);
}
