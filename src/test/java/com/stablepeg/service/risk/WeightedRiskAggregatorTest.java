package com.stablepeg.service.risk;

import com.stablepeg.model.config.RiskConfig;
import com.stablepeg.model.domain.PriceSample;
import com.stablepeg.model.domain.RiskAssessment;
import com.stablepeg.model.domain.SignalContribution;
import com.stablepeg.model.enums.RiskHorizon;
import com.stablepeg.model.enums.RiskLevel;
import com.stablepeg.support.MutableClock;
import com.stablepeg.support.TestProperties;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class WeightedRiskAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final double EPSILON = 1e-6;

    private final RiskConfig config = new RiskConfig();
    private final MutableClock clock = new MutableClock(NOW);

    private WeightedRiskAggregator aggregator() {
        return new WeightedRiskAggregator(config, clock);
    }

    private static List<PriceSample> hourly(int count, double startPrice, double step) {
        List<PriceSample> samples = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            BigDecimal price = BigDecimal.valueOf(startPrice + step * i);
            samples.add(TestProperties.sample("tether", price.toPlainString(),
                    NOW.minus(Duration.ofHours(count - 1 - i))));
        }
        return samples;
    }

    private static SignalContribution signal(RiskAssessment assessment, String name) {
        return assessment.contributions().stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void shouldScoreWithoutSentimentAndCapConfidence() {
        RiskAssessment assessment = aggregator().assess("USDT", hourly(20, 0.999, 0.0001), OptionalDouble.empty());

        assertFalse(assessment.sentimentIncluded());
        assertEquals(3, assessment.contributions().size());
        assertTrue(assessment.confidence() <= config.getPartialSignalConfidenceCap());
        double weights = assessment.contributions().stream().mapToDouble(SignalContribution::weight).sum();
        assertEquals(1.0, weights, EPSILON);
        assertEquals(RiskHorizon.ONE_DAY, assessment.horizon());
        assertEquals(NOW, assessment.timestamp());
    }

    @Test
    void shouldAllowFullConfidenceWhenAllSignalsAgree() {
        List<PriceSample> flat = hourly(20, 1.0, 0);

        RiskAssessment withSentiment = aggregator().assess("USDC", flat, OptionalDouble.of(100));
        RiskAssessment withoutSentiment = aggregator().assess("USDC", flat, OptionalDouble.empty());

        assertEquals(100.0, withSentiment.confidence(), EPSILON);
        assertEquals(0.0, withSentiment.score(), EPSILON);
        assertEquals(RiskLevel.LOW, withSentiment.level());
        assertEquals(4, withSentiment.contributions().size());
        assertEquals(70.0, withoutSentiment.confidence(), EPSILON);
    }

    @Test
    void shouldLowerConfidenceAsHistoryShrinks() {
        double previous = Double.MAX_VALUE;
        for (int count : new int[]{15, 10, 9, 6, 3, 1, 0}) {
            RiskAssessment assessment = aggregator().assess("DAI", hourly(count, 1.0, 0), OptionalDouble.of(100));

            assertTrue(assessment.confidence() <= previous, "confidence rose at " + count + " samples");
            if (count < config.getMinSamples()) {
                assertTrue(assessment.confidence() <= config.getLowHistoryConfidenceCap());
            }
            assertEquals(count, assessment.sampleCount());
            previous = assessment.confidence();
        }
    }

    @Test
    void shouldRateWideningDepegAsCritical() {
        RiskAssessment assessment = aggregator().assess("FRAX", hourly(11, 1.0, -0.003), OptionalDouble.empty());

        assertEquals(100.0, signal(assessment, WeightedRiskAggregator.DEVIATION).value(), EPSILON);
        assertEquals(100.0, signal(assessment, WeightedRiskAggregator.VOLATILITY).value(), EPSILON);
        assertEquals(100.0, signal(assessment, WeightedRiskAggregator.TREND).value(), EPSILON);
        assertEquals(100.0, assessment.score(), EPSILON);
        assertEquals(RiskLevel.CRITICAL, assessment.level());
    }

    @Test
    void shouldIgnoreTrendTowardPeg() {
        RiskAssessment assessment = aggregator().assess("FRAX", hourly(11, 0.97, 0.003), OptionalDouble.empty());

        assertEquals(0.0, signal(assessment, WeightedRiskAggregator.TREND).value(), EPSILON);
        assertEquals(0.0, signal(assessment, WeightedRiskAggregator.DEVIATION).value(), 0.01);
    }

    @Test
    void shouldTreatPanicSentimentAsRisk() {
        RiskAssessment assessment = aggregator().assess("USDe", hourly(20, 1.0, 0), OptionalDouble.of(-100));

        SignalContribution sentiment = signal(assessment, WeightedRiskAggregator.SENTIMENT);
        assertEquals(100.0, sentiment.value(), EPSILON);
        assertEquals(15.0, assessment.score(), EPSILON);
    }

    @Test
    void shouldNotRedistributeWhenDisabled() {
        config.setRedistributeMissingWeight(false);

        RiskAssessment assessment = aggregator().assess("USDT", hourly(20, 1.0, 0), OptionalDouble.empty());

        double weights = assessment.contributions().stream().mapToDouble(SignalContribution::weight).sum();
        assertEquals(0.85, weights, EPSILON);
    }

    @Test
    void shouldProduceAssessmentWithoutHistory() {
        RiskAssessment assessment = aggregator().assess("PYUSD", List.of(), OptionalDouble.empty());

        assertEquals(0.0, assessment.score(), EPSILON);
        assertEquals(0.0, assessment.confidence(), EPSILON);
        assertEquals(0, assessment.sampleCount());
    }

    @Test
    void shouldRejectUnknownHorizon() {
        config.setHorizon("3d");

        assertThrows(IllegalArgumentException.class, this::aggregator);
    }
}
