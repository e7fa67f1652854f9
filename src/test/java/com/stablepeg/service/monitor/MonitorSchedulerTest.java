package com.stablepeg.service.monitor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablepeg.config.StablePegProperties;
import com.stablepeg.exception.CooldownStoreException;
import com.stablepeg.model.config.HistoryConfig;
import com.stablepeg.model.domain.Asset;
import com.stablepeg.model.domain.DispatchDecision;
import com.stablepeg.model.domain.FetchFailure;
import com.stablepeg.model.domain.FetchResult;
import com.stablepeg.model.domain.PriceSample;
import com.stablepeg.model.domain.RiskAssessment;
import com.stablepeg.model.domain.TickReport;
import com.stablepeg.model.enums.DispatchOutcome;
import com.stablepeg.model.enums.MonitorState;
import com.stablepeg.model.enums.PegStatus;
import com.stablepeg.model.enums.RiskHorizon;
import com.stablepeg.model.enums.RiskLevel;
import com.stablepeg.model.enums.SubscriptionTier;
import com.stablepeg.service.alert.AlertDispatcher;
import com.stablepeg.service.catalog.AssetCatalog;
import com.stablepeg.service.classifier.PegClassifier;
import com.stablepeg.service.history.PriceHistory;
import com.stablepeg.service.market.MarketDataGateway;
import com.stablepeg.service.risk.RiskAggregator;
import com.stablepeg.service.risk.SentimentSource;
import com.stablepeg.support.MutableClock;
import com.stablepeg.support.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonitorSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private MarketDataGateway gateway;

    @Mock
    private RiskAggregator riskAggregator;

    @Mock
    private SentimentSource sentimentSource;

    @Mock
    private AlertDispatcher dispatcher;

    private StablePegProperties properties;
    private PriceHistory priceHistory;
    private MonitorScheduler scheduler;

    private final Asset usdt = TestProperties.asset("USDT", "tether", SubscriptionTier.FREE);
    private final Asset usdc = TestProperties.asset("USDC", "usd-coin", SubscriptionTier.FREE);
    private final Asset dai = TestProperties.asset("DAI", "dai", SubscriptionTier.FREE);
    private final Asset frax = TestProperties.asset("FRAX", "frax", SubscriptionTier.FREE);

    @BeforeEach
    void setUp() {
        properties = TestProperties.defaults();
        properties.getMonitor().setEnabled(false);
        properties.getMonitor().setWorkerThreads(2);
        properties.getMonitor().setTickTimeout(Duration.ofSeconds(5));
        priceHistory = new PriceHistory(new ObjectMapper(), new HistoryConfig());

        lenient().when(dispatcher.evaluate(any(), any(), any(), any())).thenAnswer(inv -> DispatchDecision.of(
                inv.getArgument(0), ((Asset) inv.getArgument(1)).symbol(), DispatchOutcome.NOT_ALERTABLE));
        lenient().when(sentimentSource.sentimentFor(any())).thenReturn(OptionalDouble.empty());
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    private MonitorScheduler scheduler(Asset... assets) {
        scheduler = new MonitorScheduler(AssetCatalog.of(List.of(assets)), gateway,
                new PegClassifier(new BigDecimal("2")), riskAggregator, sentimentSource, priceHistory, dispatcher,
                properties, new MutableClock(NOW));
        return scheduler;
    }

    private static PriceSample sample(String providerId, String price) {
        return TestProperties.sample(providerId, price, NOW);
    }

    private static void awaitIdle(MonitorScheduler scheduler) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (scheduler.isTickInProgress() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(scheduler.isTickInProgress(), "tick did not finish in time");
    }

    @Test
    void shouldClassifyFetchedAssetsAndReportFailedOnes() {
        // Given
        MonitorScheduler scheduler = scheduler(usdt, usdc, dai, frax);
        when(gateway.fetch(anyCollection())).thenReturn(new FetchResult(
                Map.of("tether", sample("tether", "1.0001"),
                        "usd-coin", sample("usd-coin", "0.9998"),
                        "dai", sample("dai", "0.9940")),
                Map.of("frax", FetchFailure.transientFailure("timeout"))));

        // When
        TickReport report = scheduler.runTick();

        // Then
        assertEquals(MonitorState.IDLE, report.finalState());
        assertEquals(4, report.requestedAssets());
        assertEquals(3, report.fetchedAssets());
        assertEquals(Map.of("FRAX", "timeout"), report.failedAssets());
        assertEquals(3, report.classifications());
        assertEquals(3, report.decisions().size());
        assertNull(report.error());

        assertEquals(PegStatus.WARNING, scheduler.getLatestClassifications(SubscriptionTier.FREE).get("DAI").status());
        assertFalse(scheduler.getLatestClassifications(SubscriptionTier.FREE).containsKey("FRAX"));
        assertEquals(1, priceHistory.samples("DAI").size());
        // free tier has no risk scoring, so the scoring phase is skipped
        verify(riskAggregator, never()).assess(any(), anyList(), any());
        verify(dispatcher, never()).evaluate(any(), eq(frax), any(), any());
        assertEquals(report, scheduler.getLastReport().orElseThrow());
    }

    @Test
    void shouldScoreAssetsWatchedByRiskScoringTier() {
        // Given
        Asset premiumUsdc = TestProperties.asset("USDC", "usd-coin", SubscriptionTier.FREE, SubscriptionTier.PREMIUM);
        MonitorScheduler scheduler = scheduler(usdt, premiumUsdc);
        when(gateway.fetch(anyCollection())).thenReturn(new FetchResult(
                Map.of("tether", sample("tether", "1.0"), "usd-coin", sample("usd-coin", "0.9970")), Map.of()));
        RiskAssessment risk = new RiskAssessment("USDC", 40, RiskLevel.MEDIUM, 27, List.of(), 1, false,
                RiskHorizon.ONE_DAY, NOW);
        when(riskAggregator.assess(eq("USDC"), anyList(), any())).thenReturn(risk);

        // When
        TickReport report = scheduler.runTick();

        // Then
        assertEquals(3, report.classifications());
        verify(riskAggregator, times(1)).assess(eq("USDC"), anyList(), any());
        verify(riskAggregator, never()).assess(eq("USDT"), anyList(), any());
        verify(dispatcher).evaluate(eq(SubscriptionTier.PREMIUM), eq(premiumUsdc), any(), eq(risk));
        assertEquals(risk, scheduler.getLatestRisk("USDC").orElseThrow());
        assertEquals(PegStatus.WARNING, scheduler.getLatestClassifications("USDC").get(SubscriptionTier.PREMIUM).status());
        assertEquals(PegStatus.STABLE, scheduler.getLatestClassifications("USDC").get(SubscriptionTier.FREE).status());
    }

    @Test
    void shouldMarkDecisionsStoreUnavailableWhenCooldownStoreFails() {
        // Given
        MonitorScheduler scheduler = scheduler(usdt, dai);
        when(gateway.fetch(anyCollection())).thenReturn(new FetchResult(
                Map.of("tether", sample("tether", "0.98"), "dai", sample("dai", "0.97")), Map.of()));
        when(dispatcher.evaluate(any(), any(), any(), any()))
                .thenThrow(new CooldownStoreException("cooldown file unreadable"));

        // When
        TickReport report = scheduler.runTick();

        // Then
        assertEquals(MonitorState.IDLE, report.finalState());
        assertEquals(2, report.decisions().size());
        assertTrue(report.decisions().stream().allMatch(d -> d.outcome() == DispatchOutcome.STORE_UNAVAILABLE));
        assertEquals(0, report.dispatchedCount());
    }

    @Test
    void shouldReportFailedTickOnUnexpectedError() {
        MonitorScheduler scheduler = scheduler(usdt);
        when(gateway.fetch(anyCollection())).thenThrow(new IllegalStateException("boom"));

        TickReport report = scheduler.runTick();

        assertEquals(MonitorState.FAILED, report.finalState());
        assertEquals("IllegalStateException: boom", report.error());
        assertEquals(1, scheduler.getFailedTicks());
        assertEquals(MonitorState.IDLE, scheduler.getState());
    }

    @Test
    void shouldSkipTriggerWhileTickIsRunning() throws InterruptedException {
        // Given
        MonitorScheduler scheduler = scheduler(usdt);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(gateway.fetch(anyCollection())).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new FetchResult(Map.of("tether", sample("tether", "1.0")), Map.of());
        });

        // When
        assertTrue(scheduler.trigger());
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        boolean overlapping = scheduler.trigger();
        release.countDown();
        awaitIdle(scheduler);

        // Then
        assertFalse(overlapping);
        assertEquals(1, scheduler.getSkippedTicks());
        verify(gateway, times(1)).fetch(anyCollection());
        assertEquals(MonitorState.IDLE, scheduler.getLastReport().orElseThrow().finalState());
    }

    @Test
    void shouldAbortTickThatExceedsTimeout() throws InterruptedException {
        // Given
        properties.getMonitor().setTickTimeout(Duration.ofMillis(200));
        MonitorScheduler scheduler = scheduler(usdt);
        when(gateway.fetch(anyCollection())).thenAnswer(inv -> {
            Thread.sleep(10_000);
            return new FetchResult(Map.of(), Map.of());
        });

        // When
        assertTrue(scheduler.trigger());
        awaitIdle(scheduler);

        // Then
        TickReport report = scheduler.getLastReport().orElseThrow();
        assertEquals(MonitorState.FAILED, report.finalState());
        assertTrue(report.error().contains("FETCHING"));
        assertEquals(1, scheduler.getFailedTicks());
        verify(dispatcher, never()).evaluate(any(), any(), any(), any());
    }

    @Test
    void shouldHoldOverlapGuardUntilAbortedDispatchReturns() throws InterruptedException {
        // Given
        properties.getMonitor().setTickTimeout(Duration.ofMillis(300));
        MonitorScheduler scheduler = scheduler(usdt);
        when(gateway.fetch(anyCollection())).thenReturn(new FetchResult(
                Map.of("tether", sample("tether", "0.98")), Map.of()));
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AtomicInteger evaluations = new AtomicInteger();
        when(dispatcher.evaluate(any(), eq(usdt), any(), any())).thenAnswer(inv -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            evaluations.incrementAndGet();
            try {
                // a channel call that does not react to interrupts
                sleepIgnoringInterrupts(1500);
            } finally {
                active.decrementAndGet();
            }
            return DispatchDecision.of(SubscriptionTier.FREE, "USDT", DispatchOutcome.DISPATCHED);
        });

        // When
        assertTrue(scheduler.trigger());
        Thread.sleep(600);
        boolean secondTrigger = scheduler.trigger();
        awaitIdle(scheduler);

        // Then
        assertFalse(secondTrigger);
        assertEquals(1, maxActive.get());
        assertEquals(1, evaluations.get());
        TickReport report = scheduler.getLastReport().orElseThrow();
        assertEquals(MonitorState.FAILED, report.finalState());
        assertTrue(report.error().contains("DISPATCHING"));
    }

    @Test
    void shouldLetInFlightTickFinishOnShutdown() throws InterruptedException {
        // Given
        MonitorScheduler scheduler = scheduler(usdt);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(gateway.fetch(anyCollection())).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new FetchResult(Map.of("tether", sample("tether", "1.0")), Map.of());
        });
        assertTrue(scheduler.trigger());
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        Thread releaser = new Thread(() -> {
            sleepIgnoringInterrupts(200);
            release.countDown();
        });

        // When
        releaser.start();
        scheduler.shutdown();
        releaser.join();

        // Then
        TickReport report = scheduler.getLastReport().orElseThrow();
        assertEquals(MonitorState.IDLE, report.finalState());
        assertNull(report.error());
        assertEquals(MonitorState.STOPPED, scheduler.getState());
        assertFalse(scheduler.trigger());
        verify(dispatcher, times(1)).evaluate(any(), eq(usdt), any(), any());
    }

    @Test
    void shouldStopDispatchWhenDeliveredAlertLosesItsCooldown() {
        // Given
        properties.getMonitor().setWorkerThreads(1);
        MonitorScheduler scheduler = scheduler(usdt, dai);
        when(gateway.fetch(anyCollection())).thenReturn(new FetchResult(
                Map.of("tether", sample("tether", "0.98"), "dai", sample("dai", "0.97")), Map.of()));
        when(dispatcher.evaluate(any(), eq(usdt), any(), any())).thenReturn(new DispatchDecision(
                SubscriptionTier.FREE, "USDT", DispatchOutcome.DISPATCHED, null, "Failed to save cooldown records", true));

        // When
        TickReport report = scheduler.runTick();

        // Then
        assertEquals(MonitorState.IDLE, report.finalState());
        assertEquals(2, report.decisions().size());
        assertEquals(DispatchOutcome.DISPATCHED, report.decisions().get(0).outcome());
        assertEquals(DispatchOutcome.STORE_UNAVAILABLE, report.decisions().get(1).outcome());
        assertEquals(1, report.dispatchedCount());
        verify(dispatcher, never()).evaluate(any(), eq(dai), any(), any());
    }

    private static void sleepIgnoringInterrupts(long millis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        boolean interrupted = false;
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(remaining);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
