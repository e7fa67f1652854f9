package com.stablepeg.service.risk;

import com.stablepeg.config.StablePegProperties;
import com.stablepeg.model.config.RiskConfig;
import com.stablepeg.model.domain.Asset;
import com.stablepeg.model.domain.PriceSample;
import com.stablepeg.model.domain.RiskAssessment;
import com.stablepeg.model.domain.SignalContribution;
import com.stablepeg.model.enums.RiskHorizon;
import com.stablepeg.model.enums.RiskLevel;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Transparent weighted heuristic over four signals, each normalized to 0-100:
 * <ul>
 *     <li>deviation: how far the latest sample sits from the peg</li>
 *     <li>volatility: standard deviation of deviations across the window</li>
 *     <li>trend: least-squares slope of the absolute deviation, projected over the horizon</li>
 *     <li>sentiment: inverted operator sentiment, only when one is supplied</li>
 * </ul>
 * Confidence starts from how closely the signals agree and is then capped for missing sentiment and
 * for short history.
 */
@Slf4j
@Service
public class WeightedRiskAggregator implements RiskAggregator {

    static final String DEVIATION = "deviation";
    static final String VOLATILITY = "volatility";
    static final String TREND = "trend";
    static final String SENTIMENT = "sentiment";

    private static final double MIN_CONFIDENCE = 10;
    private static final double MAX_SCORE = 100;
    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    private final RiskConfig config;
    private final RiskHorizon horizon;
    private final Clock clock;

    @Autowired
    public WeightedRiskAggregator(StablePegProperties properties, Clock clock) {
        this(properties.getRisk(), clock);
    }

    public WeightedRiskAggregator(RiskConfig config, Clock clock) {
        this.config = config;
        this.horizon = RiskHorizon.fromTag(config.getHorizon());
        this.clock = clock;
    }

    @Override
    public RiskAssessment assess(String symbol, List<PriceSample> samples, OptionalDouble sentiment) {
        double[] deviations = samples.stream()
                .mapToDouble(s -> s.price().subtract(Asset.REFERENCE_VALUE).doubleValue())
                .toArray();

        Map<String, Double> signals = new LinkedHashMap<>();
        signals.put(DEVIATION, deviationSignal(deviations));
        signals.put(VOLATILITY, volatilitySignal(deviations));
        signals.put(TREND, trendSignal(samples, deviations));
        if (sentiment.isPresent()) {
            signals.put(SENTIMENT, sentimentSignal(sentiment.getAsDouble()));
        }

        Map<String, Double> weights = effectiveWeights(sentiment.isPresent());
        List<SignalContribution> contributions = new ArrayList<>();
        double score = 0;
        for (Map.Entry<String, Double> signal : signals.entrySet()) {
            double weight = weights.get(signal.getKey());
            double contribution = signal.getValue() * weight;
            contributions.add(new SignalContribution(signal.getKey(), round(signal.getValue()), weight, round(contribution)));
            score += contribution;
        }
        score = round(clamp(score, 0, MAX_SCORE));

        double confidence = round(confidence(signals.values(), sentiment.isPresent(), samples.size()));

        log.debug("Risk for {}: score={} confidence={} samples={} signals={}",
                symbol, score, confidence, samples.size(), signals);

        return new RiskAssessment(symbol, score, RiskLevel.fromScore(score), confidence, contributions,
                samples.size(), sentiment.isPresent(), horizon, clock.instant());
    }

    private double deviationSignal(double[] deviations) {
        if (deviations.length == 0) {
            return 0;
        }
        return normalize(Math.abs(deviations[deviations.length - 1]), config.getDeviationScale());
    }

    private double volatilitySignal(double[] deviations) {
        if (deviations.length < 2) {
            return 0;
        }
        DescriptiveStatistics stats = new DescriptiveStatistics(deviations);
        return normalize(stats.getStandardDeviation(), config.getVolatilityScale());
    }

    /**
     * Only a widening deviation counts as risk; a peg moving back toward 1.00 contributes nothing.
     */
    private double trendSignal(List<PriceSample> samples, double[] deviations) {
        if (samples.size() < 2) {
            return 0;
        }
        Instant origin = samples.get(0).timestamp();
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < samples.size(); i++) {
            double hours = Duration.between(origin, samples.get(i).timestamp()).toMillis() / MILLIS_PER_HOUR;
            regression.addData(hours, Math.abs(deviations[i]));
        }
        double slopePerHour = regression.getSlope();
        if (Double.isNaN(slopePerHour) || slopePerHour <= 0) {
            return 0;
        }
        return normalize(slopePerHour * horizon.getHours(), config.getTrendScale());
    }

    private double sentimentSignal(double sentiment) {
        return (MAX_SCORE - clamp(sentiment, -MAX_SCORE, MAX_SCORE)) / 2;
    }

    private Map<String, Double> effectiveWeights(boolean withSentiment) {
        RiskConfig.Weights w = config.getWeights();
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(DEVIATION, w.getDeviation());
        weights.put(VOLATILITY, w.getVolatility());
        weights.put(TREND, w.getTrend());
        if (withSentiment) {
            weights.put(SENTIMENT, w.getSentiment());
        }

        if (!withSentiment && !config.isRedistributeMissingWeight()) {
            return weights;
        }
        double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0) {
            throw new IllegalStateException("Risk weights must sum to a positive value");
        }
        weights.replaceAll((name, weight) -> weight / total);
        return weights;
    }

    private double confidence(Iterable<Double> signals, boolean withSentiment, int sampleCount) {
        DescriptiveStatistics spread = new DescriptiveStatistics();
        signals.forEach(spread::addValue);
        double confidence = clamp(MAX_SCORE - 2 * spread.getStandardDeviation(), MIN_CONFIDENCE, MAX_SCORE);

        if (!withSentiment) {
            confidence = Math.min(confidence, config.getPartialSignalConfidenceCap());
        }
        int minSamples = Math.max(1, config.getMinSamples());
        if (sampleCount < minSamples) {
            confidence = Math.min(confidence, config.getLowHistoryConfidenceCap() * sampleCount / minSamples);
        }
        return confidence;
    }

    private static double normalize(double value, double scale) {
        return clamp(value / scale * MAX_SCORE, 0, MAX_SCORE);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
