package com.stablepeg.service.cooldown;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablepeg.config.StablePegProperties;
import com.stablepeg.exception.CooldownStoreException;
import com.stablepeg.model.config.TierConfig;
import com.stablepeg.model.domain.DeliveryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Cooldown records kept in memory and written through to a JSON file after every change, so a restart
 * does not make cooling-down assets eligible early. With no file configured the store is memory-only.
 */
@Slf4j
@Service
public class FileCooldownStore implements CooldownStore {

    private static final TypeReference<Map<String, Instant>> RECORDS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path storageFile;
    private final Clock clock;
    private final Duration maxWindow;

    private final Map<String, Instant> records = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> keyLocks = new ConcurrentHashMap<>();
    private final Object fileLock = new Object();
    private volatile boolean loaded;

    @Autowired
    public FileCooldownStore(ObjectMapper objectMapper, StablePegProperties properties, Clock clock) {
        this(objectMapper, toPath(properties.getCooldown().getFile()), clock, longestCooldown(properties));
    }

    public FileCooldownStore(ObjectMapper objectMapper, Path storageFile, Clock clock, Duration maxWindow) {
        this.objectMapper = objectMapper;
        this.storageFile = storageFile;
        this.clock = clock;
        this.maxWindow = maxWindow;
        this.loaded = storageFile == null;
    }

    @Override
    public boolean isEligible(CooldownKey key, Instant now, Duration window) {
        ensureLoaded();
        Instant last = records.get(key.asString());
        return last == null || !now.isBefore(last.plus(window));
    }

    @Override
    public void recordAlert(CooldownKey key, Instant at) {
        ensureLoaded();
        records.put(key.asString(), at);
        persist();
    }

    @Override
    public Optional<GuardedDelivery> dispatchIfEligible(CooldownKey key, Instant now, Duration window,
                                                        Supplier<DeliveryResult> delivery) {
        ReentrantLock lock = keyLocks.computeIfAbsent(key.asString(), k -> new ReentrantLock());
        lock.lock();
        try {
            if (!isEligible(key, now, window)) {
                return Optional.empty();
            }
            DeliveryResult result = delivery.get();
            CooldownStoreException recordFailure = null;
            if (result.success()) {
                try {
                    recordAlert(key, now);
                } catch (CooldownStoreException e) {
                    recordFailure = e;
                }
            }
            return Optional.of(new GuardedDelivery(result, recordFailure));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Instant> lastAlert(CooldownKey key) {
        ensureLoaded();
        return Optional.ofNullable(records.get(key.asString()));
    }

    @Override
    public int purgeExpired(Instant now, Duration window) {
        ensureLoaded();
        Instant cutoff = now.minus(window);
        int before = records.size();
        records.entrySet().removeIf(e -> e.getValue().isBefore(cutoff));
        int removed = before - records.size();
        if (removed > 0) {
            persist();
        }
        return removed;
    }

    @Override
    public int size() {
        return records.size();
    }

    @Scheduled(fixedRateString = "${stablepeg.cooldown.cleanup-interval-ms:300000}")
    public void cleanupExpired() {
        try {
            int removed = purgeExpired(clock.instant(), maxWindow);
            log.debug("Cooldown cleanup: removed {} expired records, tracking {}", removed, records.size());
        } catch (CooldownStoreException e) {
            log.warn("Cooldown cleanup skipped: {}", e.getMessage());
        }
    }

    /**
     * Loads the file on first use. A failed load is retried on the next call; the store never falls back
     * to empty after a read error.
     */
    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (fileLock) {
            if (loaded) {
                return;
            }
            if (Files.exists(storageFile)) {
                try {
                    Map<String, Instant> stored = objectMapper.readValue(storageFile.toFile(), RECORDS_TYPE);
                    if (stored != null) {
                        records.putAll(stored);
                    }
                    log.info("Loaded {} cooldown records from {}", records.size(), storageFile);
                } catch (IOException e) {
                    throw new CooldownStoreException("Failed to load cooldown records from " + storageFile, e);
                }
            }
            loaded = true;
        }
    }

    private void persist() {
        if (storageFile == null) {
            return;
        }
        synchronized (fileLock) {
            try {
                Path parent = storageFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Path tmp = storageFile.resolveSibling(storageFile.getFileName() + ".tmp");
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), new TreeMap<>(records));
                Files.move(tmp, storageFile, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new CooldownStoreException("Failed to save cooldown records to " + storageFile, e);
            }
        }
    }

    private static Path toPath(String file) {
        return file == null || file.isBlank() ? null : Path.of(file);
    }

    private static Duration longestCooldown(StablePegProperties properties) {
        return properties.getTiers().values().stream()
                .map(TierConfig::getCooldown)
                .max(Duration::compareTo)
                .orElse(Duration.ofMinutes(30));
    }
}
