package com.stablepeg.service.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablepeg.config.StablePegProperties;
import com.stablepeg.model.config.HistoryConfig;
import com.stablepeg.model.domain.PriceSample;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class PriceHistory {

    private static final TypeReference<Map<String, List<PriceSample>>> STORED_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path storageFile;
    private final int maxSamples;
    private final Duration maxAge;

    private final Map<String, Deque<PriceSample>> windows = new ConcurrentHashMap<>();

    @Autowired
    public PriceHistory(ObjectMapper objectMapper, StablePegProperties properties) {
        this(objectMapper, properties.getHistory());
    }

    public PriceHistory(ObjectMapper objectMapper, HistoryConfig config) {
        this.objectMapper = objectMapper;
        this.storageFile = config.getFile() == null || config.getFile().isBlank() ? null : Path.of(config.getFile());
        this.maxSamples = Math.max(1, config.getMaxSamples());
        this.maxAge = config.getMaxAge();
    }

    @PostConstruct
    public void init() {
        if (storageFile == null || !Files.exists(storageFile)) {
            return;
        }
        try {
            Map<String, List<PriceSample>> stored = objectMapper.readValue(storageFile.toFile(), STORED_TYPE);
            stored.forEach((symbol, samples) -> samples.forEach(s -> record(symbol, s)));
            log.info("Loaded price history for {} assets from {}", windows.size(), storageFile);
        } catch (IOException e) {
            log.warn("Failed to load price history from {}: {}", storageFile, e.getMessage());
        }
    }

    public void record(String symbol, PriceSample sample) {
        Deque<PriceSample> window = windows.computeIfAbsent(key(symbol), k -> new ArrayDeque<>());
        synchronized (window) {
            PriceSample last = window.peekLast();
            if (last != null && !sample.timestamp().isAfter(last.timestamp())) {
                // provider has not refreshed the quote since the last tick
                return;
            }
            window.addLast(sample);
            while (window.size() > maxSamples) {
                window.pollFirst();
            }
            evictOlderThan(window, sample.timestamp().minus(maxAge));
        }
    }

    public List<PriceSample> samples(String symbol) {
        Deque<PriceSample> window = windows.get(key(symbol));
        if (window == null) {
            return List.of();
        }
        synchronized (window) {
            return List.copyOf(window);
        }
    }

    public int prune(Instant now) {
        Instant cutoff = now.minus(maxAge);
        int removed = 0;
        for (Deque<PriceSample> window : windows.values()) {
            synchronized (window) {
                removed += evictOlderThan(window, cutoff);
            }
        }
        windows.values().removeIf(Deque::isEmpty);
        return removed;
    }

    public void save() {
        if (storageFile == null) {
            return;
        }
        Map<String, List<PriceSample>> snapshot = new TreeMap<>();
        windows.forEach((symbol, window) -> {
            synchronized (window) {
                snapshot.put(symbol, new ArrayList<>(window));
            }
        });
        try {
            Path parent = storageFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(storageFile.toFile(), snapshot);
        } catch (IOException e) {
            log.error("Failed to save price history to {}", storageFile, e);
        }
    }

    public int getTrackedAssetsCount() {
        return windows.size();
    }

    private int evictOlderThan(Deque<PriceSample> window, Instant cutoff) {
        int removed = 0;
        while (!window.isEmpty() && window.peekFirst().timestamp().isBefore(cutoff)) {
            window.pollFirst();
            removed++;
        }
        return removed;
    }

    private String key(String symbol) {
        return symbol.toUpperCase(Locale.ROOT);
    }
}
