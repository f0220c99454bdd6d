package com.stockalert.monitor.domain.ratelimit;

import com.stockalert.monitor.domain.exceptions.RateLimitInterruptedException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Sliding-window limiter: at most {@code maxRequests} admissions within any trailing window.
 *
 * <p>The lock is held while waiting, so concurrent callers queue up behind the one that
 * is sleeping and each of them re-reads the window after it gets the lock. An interrupted
 * wait records nothing and surfaces as {@link RateLimitInterruptedException}.
 */
@Slf4j
public class SlidingWindowRateLimiter implements RateLimiter {

    private final int maxRequests;
    private final Duration window;
    private final Duration safetyMargin;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Deque<Instant> admissions = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock(true);

    public SlidingWindowRateLimiter(
            int maxRequests, Duration window, Duration safetyMargin, Clock clock, Sleeper sleeper) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive: " + maxRequests);
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.safetyMargin = safetyMargin;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public void admit() {
        lock.lock();
        try {
            prune(clock.instant());

            if (admissions.size() >= maxRequests) {
                var oldest = admissions.peekFirst();
                var wait = Duration.between(clock.instant(), oldest.plus(window)).plus(safetyMargin);
                if (!wait.isNegative()) {
                    log.debug("Rate limit reached ({} per {}s), waiting {} ms",
                            maxRequests, window.toSeconds(), wait.toMillis());
                    awaitSlot(wait);
                }
                prune(clock.instant());
            }

            admissions.addLast(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public int occupancy() {
        lock.lock();
        try {
            prune(clock.instant());
            return admissions.size();
        } finally {
            lock.unlock();
        }
    }

    private void prune(Instant now) {
        while (!admissions.isEmpty() && !now.isBefore(admissions.peekFirst().plus(window))) {
            admissions.removeFirst();
        }
    }

    private void awaitSlot(Duration wait) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RateLimitInterruptedException.of(wait, e);
        }
    }
}
