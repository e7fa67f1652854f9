package com.stablepeg.service.monitor;

import com.stablepeg.config.StablePegProperties;
import com.stablepeg.exception.CooldownStoreException;
import com.stablepeg.model.config.MonitorConfig;
import com.stablepeg.model.config.TierConfig;
import com.stablepeg.model.domain.Asset;
import com.stablepeg.model.domain.DispatchDecision;
import com.stablepeg.model.domain.FetchFailure;
import com.stablepeg.model.domain.FetchResult;
import com.stablepeg.model.domain.PegClassification;
import com.stablepeg.model.domain.PriceSample;
import com.stablepeg.model.domain.RiskAssessment;
import com.stablepeg.model.domain.TickReport;
import com.stablepeg.model.enums.DispatchOutcome;
import com.stablepeg.model.enums.MonitorState;
import com.stablepeg.model.enums.SubscriptionTier;
import com.stablepeg.service.alert.AlertDispatcher;
import com.stablepeg.service.catalog.AssetCatalog;
import com.stablepeg.service.classifier.PegClassifier;
import com.stablepeg.service.history.PriceHistory;
import com.stablepeg.service.market.MarketDataGateway;
import com.stablepeg.service.risk.RiskAggregator;
import com.stablepeg.service.risk.SentimentSource;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Phaser;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the monitoring loop. Each tick walks
 * {@code IDLE -> FETCHING -> CLASSIFYING -> SCORING -> DISPATCHING -> IDLE}, with SCORING skipped when no
 * enabled tier uses risk scoring.
 * <p>
 * Ticks never overlap: a trigger that arrives while a tick is running is skipped and logged. A tick that
 * runs past {@code stablepeg.monitor.tick-timeout} is interrupted and reported as failed. Per-asset
 * scoring and dispatch run on a bounded worker pool; an aborted tick cancels its worker tasks and holds the
 * overlap guard until the ones already running have returned.
 */
@Slf4j
@Service
public class MonitorScheduler {

    private final AssetCatalog catalog;
    private final MarketDataGateway gateway;
    private final PegClassifier classifier;
    private final RiskAggregator riskAggregator;
    private final SentimentSource sentimentSource;
    private final PriceHistory priceHistory;
    private final AlertDispatcher dispatcher;
    private final StablePegProperties properties;
    private final MonitorConfig config;
    private final Clock clock;

    private final ScheduledExecutorService driver;
    private final ExecutorService tickExecutor;
    private final ExecutorService workers;

    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);
    private final AtomicLong tickCounter = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private final AtomicLong failedTicks = new AtomicLong();
    private volatile MonitorState state = MonitorState.IDLE;
    private volatile boolean stopped;
    private volatile TickReport lastReport;

    private final Map<SubscriptionTier, Map<String, PegClassification>> latestClassifications =
            new ConcurrentHashMap<>();
    private final Map<String, RiskAssessment> latestRisk = new ConcurrentHashMap<>();

    public MonitorScheduler(AssetCatalog catalog,
                            MarketDataGateway gateway,
                            PegClassifier classifier,
                            RiskAggregator riskAggregator,
                            SentimentSource sentimentSource,
                            PriceHistory priceHistory,
                            AlertDispatcher dispatcher,
                            StablePegProperties properties,
                            Clock clock) {
        this.catalog = catalog;
        this.gateway = gateway;
        this.classifier = classifier;
        this.riskAggregator = riskAggregator;
        this.sentimentSource = sentimentSource;
        this.priceHistory = priceHistory;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.config = properties.getMonitor();
        this.clock = clock;

        this.driver = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("monitor-driver-"));
        this.tickExecutor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("monitor-tick-"));
        this.workers = Executors.newFixedThreadPool(Math.max(1, config.getWorkerThreads()),
                new CustomizableThreadFactory("monitor-worker-"));
    }

    @PostConstruct
    public void start() {
        logStartupSummary();
        if (!config.isEnabled()) {
            log.warn("Peg monitoring disabled (stablepeg.monitor.enabled=false)");
            return;
        }
        driver.scheduleAtFixedRate(this::trigger,
                config.getInitialDelay().toMillis(),
                config.getPollInterval().toMillis(),
                TimeUnit.MILLISECONDS);
    }

    /**
     * Starts a tick in the background unless one is already running.
     *
     * @return false if the tick was skipped
     */
    public boolean trigger() {
        if (stopped) {
            return false;
        }
        if (!tickInProgress.compareAndSet(false, true)) {
            skippedTicks.incrementAndGet();
            log.warn("Tick skipped: previous tick still running in state {}", state);
            return false;
        }

        long tickId = tickCounter.incrementAndGet();
        Future<?> tick;
        try {
            tick = tickExecutor.submit(() -> {
                try {
                    runTick(tickId);
                } finally {
                    tickInProgress.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            tickInProgress.set(false);
            log.warn("Tick #{} rejected, scheduler is shutting down", tickId);
            return false;
        }

        try {
            driver.schedule(() -> {
                if (!tick.isDone()) {
                    log.error("Tick #{} exceeded timeout of {}, aborting", tickId, config.getTickTimeout());
                    tick.cancel(true);
                }
            }, config.getTickTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Watchdog for tick #{} not scheduled, driver stopped", tickId);
        }
        return true;
    }

    /**
     * Runs one complete tick on the calling thread, bypassing the overlap guard.
     */
    TickReport runTick() {
        return runTick(tickCounter.incrementAndGet());
    }

    private TickReport runTick(long tickId) {
        Instant startedAt = clock.instant();
        Map<String, String> failedAssets = new LinkedHashMap<>();
        List<DispatchDecision> decisions = new ArrayList<>();
        int requested = 0;
        int fetched = 0;
        int classified = 0;
        TickTasks tasks = new TickTasks();
        TickReport report;

        try {
            Set<SubscriptionTier> tiers = enabledTiers();
            List<Asset> assets = catalog.assetsFor(tiers);
            requested = assets.size();

            state = MonitorState.FETCHING;
            FetchResult result = gateway.fetch(AssetCatalog.providerIds(assets));
            Map<Asset, PriceSample> samples = new LinkedHashMap<>();
            for (Asset asset : assets) {
                PriceSample sample = result.samples().get(asset.providerId());
                if (sample != null) {
                    samples.put(asset, sample);
                    priceHistory.record(asset.symbol(), sample);
                } else {
                    FetchFailure failure = result.failures().get(asset.providerId());
                    failedAssets.put(asset.symbol(), failure != null ? failure.reason() : "no data returned");
                }
            }
            fetched = samples.size();
            if (!failedAssets.isEmpty()) {
                log.warn("Tick #{}: skipping {} assets without data: {}", tickId, failedAssets.size(), failedAssets);
            }
            checkInterrupted();

            state = MonitorState.CLASSIFYING;
            List<Evaluation> evaluations = classify(tiers, samples, failedAssets);
            classified = evaluations.size();
            checkInterrupted();

            Map<String, RiskAssessment> risks = Map.of();
            Set<Asset> scored = assetsNeedingRisk(evaluations);
            if (!scored.isEmpty()) {
                state = MonitorState.SCORING;
                risks = score(scored, tasks);
                latestRisk.putAll(risks);
            }
            checkInterrupted();

            state = MonitorState.DISPATCHING;
            decisions.addAll(dispatch(evaluations, risks, tasks));

            priceHistory.prune(clock.instant());
            priceHistory.save();

            report = new TickReport(tickId, startedAt, clock.instant(), MonitorState.IDLE, requested, fetched,
                    failedAssets, classified, decisions, null);
            log.info("Tick #{} done in {}ms: {}/{} fetched, {} classifications, {} alerts sent",
                    tickId, Duration.between(startedAt, report.finishedAt()).toMillis(),
                    fetched, requested, classified, report.dispatchedCount());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tasks.cancelAll();
            failedTicks.incrementAndGet();
            report = new TickReport(tickId, startedAt, clock.instant(), MonitorState.FAILED, requested, fetched,
                    failedAssets, classified, decisions, "tick interrupted or timed out in state " + state);
            log.error("Tick #{} aborted in state {}", tickId, state);
        } catch (RuntimeException e) {
            tasks.cancelAll();
            failedTicks.incrementAndGet();
            report = new TickReport(tickId, startedAt, clock.instant(), MonitorState.FAILED, requested, fetched,
                    failedAssets, classified, decisions, e.getClass().getSimpleName() + ": " + e.getMessage());
            log.error("Tick #{} failed in state {}", tickId, state, e);
        } finally {
            tasks.awaitAll();
            state = stopped ? MonitorState.STOPPED : MonitorState.IDLE;
        }

        lastReport = report;
        return report;
    }

    private List<Evaluation> classify(Set<SubscriptionTier> tiers, Map<Asset, PriceSample> samples,
                                      Map<String, String> failedAssets) {
        List<Evaluation> evaluations = new ArrayList<>();
        for (SubscriptionTier tier : tiers) {
            TierConfig tierConfig = properties.tier(tier);
            Map<String, PegClassification> latest =
                    latestClassifications.computeIfAbsent(tier, t -> new ConcurrentHashMap<>());
            samples.forEach((asset, sample) -> {
                if (!asset.isWatchedBy(tier)) {
                    return;
                }
                try {
                    PegClassification classification = classifier.classify(sample, tierConfig.getThreshold());
                    latest.put(asset.symbol(), classification);
                    evaluations.add(new Evaluation(tier, asset, classification));
                } catch (IllegalArgumentException e) {
                    log.warn("[{}] Cannot classify {}: {}", tier, asset.symbol(), e.getMessage());
                    failedAssets.putIfAbsent(asset.symbol(), e.getMessage());
                }
            });
        }
        return evaluations;
    }

    private Set<Asset> assetsNeedingRisk(List<Evaluation> evaluations) {
        Set<Asset> assets = new LinkedHashSet<>();
        for (Evaluation evaluation : evaluations) {
            if (properties.tier(evaluation.tier()).isRiskScoring()) {
                assets.add(evaluation.asset());
            }
        }
        return assets;
    }

    private Map<String, RiskAssessment> score(Set<Asset> assets, TickTasks tasks) throws InterruptedException {
        Map<String, Future<RiskAssessment>> futures = new LinkedHashMap<>();
        for (Asset asset : assets) {
            futures.put(asset.symbol(), tasks.submit(() -> riskAggregator.assess(
                    asset.symbol(),
                    priceHistory.samples(asset.symbol()),
                    sentimentSource.sentimentFor(asset.symbol()))));
        }

        Map<String, RiskAssessment> risks = new LinkedHashMap<>();
        for (Map.Entry<String, Future<RiskAssessment>> entry : futures.entrySet()) {
            try {
                risks.put(entry.getKey(), entry.getValue().get());
            } catch (ExecutionException e) {
                // alerts still go out without a score
                log.warn("Risk assessment for {} failed: {}", entry.getKey(), e.getCause().getMessage());
            }
        }
        return risks;
    }

    private List<DispatchDecision> dispatch(List<Evaluation> evaluations, Map<String, RiskAssessment> risks,
                                            TickTasks tasks) throws InterruptedException {
        AtomicBoolean storeUnavailable = new AtomicBoolean(false);
        List<Future<DispatchDecision>> futures = new ArrayList<>();
        for (Evaluation evaluation : evaluations) {
            futures.add(tasks.submit(
                    () -> dispatchOne(evaluation, risks.get(evaluation.asset().symbol()), storeUnavailable)));
        }

        List<DispatchDecision> decisions = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Evaluation evaluation = evaluations.get(i);
            try {
                decisions.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("[{}] Dispatch for {} failed", evaluation.tier(), evaluation.asset().symbol(), e.getCause());
                decisions.add(new DispatchDecision(evaluation.tier(), evaluation.asset().symbol(),
                        DispatchOutcome.DELIVERY_FAILED, null, String.valueOf(e.getCause().getMessage())));
            }
        }
        if (storeUnavailable.get()) {
            log.error("Cooldown store unavailable, dispatch phase aborted for this tick");
        }
        return decisions;
    }

    private DispatchDecision dispatchOne(Evaluation evaluation, RiskAssessment risk, AtomicBoolean storeUnavailable) {
        SubscriptionTier tier = evaluation.tier();
        String symbol = evaluation.asset().symbol();
        if (storeUnavailable.get()) {
            return DispatchDecision.of(tier, symbol, DispatchOutcome.STORE_UNAVAILABLE);
        }
        try {
            DispatchDecision decision = dispatcher.evaluate(tier, evaluation.asset(), evaluation.classification(), risk);
            if (decision.cooldownLost() && storeUnavailable.compareAndSet(false, true)) {
                log.error("[{}] Cooldown for {} not persisted after delivery: {}", tier, symbol, decision.detail());
            }
            return decision;
        } catch (CooldownStoreException e) {
            if (storeUnavailable.compareAndSet(false, true)) {
                log.error("[{}] Cooldown store failure while dispatching {}", tier, symbol, e);
            }
            return new DispatchDecision(tier, symbol, DispatchOutcome.STORE_UNAVAILABLE, null, e.getMessage());
        }
    }

    private Set<SubscriptionTier> enabledTiers() {
        Set<SubscriptionTier> tiers = EnumSet.noneOf(SubscriptionTier.class);
        properties.getTiers().forEach((tier, tierConfig) -> {
            if (tierConfig.isEnabled()) {
                tiers.add(tier);
            }
        });
        return tiers;
    }

    private static void checkInterrupted() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException();
        }
    }

    private void logStartupSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("\n=== StablePeg Monitor Startup Summary ===\n");
        sb.append(String.format("Polling every %ss, tick timeout %ss, %d workers, %d assets in catalog\n",
                config.getPollInterval().toSeconds(), config.getTickTimeout().toSeconds(),
                config.getWorkerThreads(), catalog.size()));

        for (SubscriptionTier tier : SubscriptionTier.values()) {
            TierConfig tierConfig = properties.getTiers().get(tier);
            if (tierConfig == null) {
                continue;
            }
            sb.append(String.format("  %s - %s, threshold=%s, cooldown=%dmin, risk=%s, %d assets\n",
                    tier, tierConfig.isEnabled() ? "ENABLED" : "DISABLED",
                    tierConfig.getThreshold() != null ? tierConfig.getThreshold().toPlainString() : "unset",
                    tierConfig.getCooldown().toMinutes(),
                    tierConfig.isRiskScoring() ? "on" : "off",
                    catalog.assetsFor(tier).size()));
        }

        sb.append("=========================================");
        log.info(sb.toString());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down MonitorScheduler");
        stopped = true;
        driver.shutdownNow();

        // let an in-flight tick finish its provider calls
        tickExecutor.shutdown();
        try {
            if (!tickExecutor.awaitTermination(config.getTickTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                tickExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            tickExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        state = MonitorState.STOPPED;
    }

    public MonitorState getState() {
        return state;
    }

    public boolean isTickInProgress() {
        return tickInProgress.get();
    }

    public Optional<TickReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    public Map<String, PegClassification> getLatestClassifications(SubscriptionTier tier) {
        Map<String, PegClassification> latest = latestClassifications.get(tier);
        return latest == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(latest));
    }

    public Map<SubscriptionTier, PegClassification> getLatestClassifications(String symbol) {
        Map<SubscriptionTier, PegClassification> result = new EnumMap<>(SubscriptionTier.class);
        latestClassifications.forEach((tier, latest) -> {
            PegClassification classification = latest.get(symbol);
            if (classification != null) {
                result.put(tier, classification);
            }
        });
        return result;
    }

    public Optional<RiskAssessment> getLatestRisk(String symbol) {
        return Optional.ofNullable(latestRisk.get(symbol));
    }

    public long getTickCount() {
        return tickCounter.get();
    }

    public long getSkippedTicks() {
        return skippedTicks.get();
    }

    public long getFailedTicks() {
        return failedTicks.get();
    }

    private record Evaluation(SubscriptionTier tier, Asset asset, PegClassification classification) {}

    /**
     * Worker tasks submitted by one tick. A task cancelled before it started never runs; one that already
     * started is interrupted and keeps its slot until it returns.
     */
    private final class TickTasks {

        private static final int PENDING = 0;
        private static final int RUNNING = 1;
        private static final int SKIPPED = 2;

        private final Phaser running = new Phaser(1);
        private final List<Future<?>> futures = new ArrayList<>();
        private final List<AtomicInteger> taskStates = new ArrayList<>();

        <T> Future<T> submit(Callable<T> task) {
            AtomicInteger taskState = new AtomicInteger(PENDING);
            running.register();
            Future<T> future;
            try {
                future = workers.submit(() -> {
                    if (!taskState.compareAndSet(PENDING, RUNNING)) {
                        return null;
                    }
                    try {
                        return task.call();
                    } finally {
                        running.arriveAndDeregister();
                    }
                });
            } catch (RejectedExecutionException e) {
                running.arriveAndDeregister();
                throw e;
            }
            futures.add(future);
            taskStates.add(taskState);
            return future;
        }

        void cancelAll() {
            for (int i = 0; i < futures.size(); i++) {
                futures.get(i).cancel(true);
                if (taskStates.get(i).compareAndSet(PENDING, SKIPPED)) {
                    running.arriveAndDeregister();
                }
            }
        }

        /**
         * Blocks until every started task has returned. An interrupt while waiting cancels again and keeps
         * waiting; the interrupt flag is restored on return.
         */
        void awaitAll() {
            boolean interrupted = Thread.interrupted();
            int phase = running.arrive();
            while (true) {
                try {
                    running.awaitAdvanceInterruptibly(phase, config.getTickTimeout().toMillis(), TimeUnit.MILLISECONDS);
                    break;
                } catch (TimeoutException e) {
                    log.warn("Still waiting for {} worker tasks to return", running.getUnarrivedParties());
                } catch (InterruptedException e) {
                    interrupted = true;
                    cancelAll();
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
