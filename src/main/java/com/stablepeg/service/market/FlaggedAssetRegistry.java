package com.stablepeg.service.market;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class FlaggedAssetRegistry {

    public record Flag(String providerId, String reason, Instant flaggedAt) {}

    private final Clock clock;
    private final Map<String, Flag> flags = new ConcurrentHashMap<>();

    public FlaggedAssetRegistry(Clock clock) {
        this.clock = clock;
    }

    public void flag(String providerId, String reason) {
        Flag flag = new Flag(providerId, reason, clock.instant());
        if (flags.putIfAbsent(providerId, flag) == null) {
            log.error("Provider id '{}' flagged after persistent failure: {}. "
                    + "It will not be fetched until the flag is cleared.", providerId, reason);
        }
    }

    public boolean isFlagged(String providerId) {
        return flags.containsKey(providerId);
    }

    public Optional<Flag> get(String providerId) {
        return Optional.ofNullable(flags.get(providerId));
    }

    public boolean clear(String providerId) {
        Flag removed = flags.remove(providerId);
        if (removed != null) {
            log.info("Flag cleared for provider id '{}' (was: {})", providerId, removed.reason());
            return true;
        }
        return false;
    }

    public Map<String, Flag> getAll() {
        return Collections.unmodifiableMap(new TreeMap<>(flags));
    }
}
