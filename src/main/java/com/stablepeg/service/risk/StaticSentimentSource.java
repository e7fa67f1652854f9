package com.stablepeg.service.risk;

import com.stablepeg.config.StablePegProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.OptionalDouble;

@Component
@RequiredArgsConstructor
public class StaticSentimentSource implements SentimentSource {

    private final StablePegProperties properties;

    @Override
    public OptionalDouble sentimentFor(String symbol) {
        Map<String, Double> scores = properties.getRisk().getSentiment();
        Double score = scores.get(symbol);
        if (score == null) {
            score = scores.entrySet().stream()
                    .filter(e -> e.getKey().equalsIgnoreCase(symbol))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(null);
        }
        return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
    }
}
