package com.stablepeg.service.market;

import com.stablepeg.config.StablePegProperties;
import com.stablepeg.model.config.ProviderConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding one-minute ledger of provider calls. Permits are handed out one at a time, spaced by at
 * least {@code minCallInterval} and never more than {@code maxCallsPerMinute} inside any minute.
 */
@Slf4j
@Component
public class CallRateLimiter {

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final int maxCallsPerMinute;
    private final Duration minCallInterval;
    private final Clock clock;

    private final Deque<Instant> ledger = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock(true);

    public CallRateLimiter(StablePegProperties properties, Clock clock) {
        ProviderConfig config = properties.getProvider();
        if (config.getMaxCallsPerMinute() <= 0) {
            throw new IllegalStateException("provider.max-calls-per-minute must be positive");
        }
        this.maxCallsPerMinute = config.getMaxCallsPerMinute();
        this.minCallInterval = config.getMinCallInterval();
        this.clock = clock;
    }

    /**
     * Blocks until a call may be issued, or returns {@code false} if that moment lies after
     * {@code deadline} or the thread is interrupted.
     */
    public boolean acquire(Instant deadline) {
        lock.lock();
        try {
            while (true) {
                Instant now = clock.instant();
                prune(now);
                Instant next = nextPermitAt(now);
                if (!next.isAfter(now)) {
                    ledger.addLast(now);
                    return true;
                }
                if (next.isAfter(deadline)) {
                    log.debug("Rate limiter: next permit at {} is past deadline {}", next, deadline);
                    return false;
                }
                try {
                    Thread.sleep(Duration.between(now, next).toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public int callsInLastMinute() {
        lock.lock();
        try {
            prune(clock.instant());
            return ledger.size();
        } finally {
            lock.unlock();
        }
    }

    private Instant nextPermitAt(Instant now) {
        Instant next = now;
        if (ledger.size() >= maxCallsPerMinute) {
            next = max(next, ledger.peekFirst().plus(WINDOW));
        }
        Instant last = ledger.peekLast();
        if (last != null) {
            next = max(next, last.plus(minCallInterval));
        }
        return next;
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!ledger.isEmpty() && !ledger.peekFirst().isAfter(cutoff)) {
            ledger.pollFirst();
        }
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
