package com.phillippitts.newwork.service.recovery;

import com.phillippitts.newwork.exception.RestartLimitExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Sliding-window limiter bounding automatic restarts.
 *
 * <p>An attempt is counted while its timestamp is newer than {@code now - window}. Old
 * entries are pruned lazily on every query, so the budget refills by itself once the
 * window has passed the oldest attempt; {@link #reset()} is only needed after a
 * user-initiated restart.
 *
 * <p>Thread-safe; all methods synchronize on the instance.
 */
public class RestartLimiter {

    private final int maxAttempts;
    private final Duration window;
    private final Clock clock;
    private final Deque<Instant> attempts = new ArrayDeque<>();

    public RestartLimiter(int maxAttempts, Duration window) {
        this(maxAttempts, window, Clock.systemUTC());
    }

    public RestartLimiter(int maxAttempts, Duration window, Clock clock) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got: " + maxAttempts);
        }
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
        this.maxAttempts = maxAttempts;
        this.window = window;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** True iff fewer than {@code maxAttempts} attempts fall inside the current window. */
    public synchronized boolean canAttempt() {
        pruneOld();
        return attempts.size() < maxAttempts;
    }

    public synchronized void recordAttempt() {
        pruneOld();
        attempts.addLast(clock.instant());
    }

    /**
     * Checks and records in one step.
     *
     * @throws RestartLimitExceededException if the window is full; nothing is recorded then
     */
    public synchronized void acquire() {
        if (!canAttempt()) {
            throw new RestartLimitExceededException(maxAttempts, waitTime());
        }
        recordAttempt();
    }

    /**
     * Time until the oldest in-window attempt leaves the window.
     *
     * @return remaining time, or {@link Duration#ZERO} when an attempt is allowed right now
     */
    public synchronized Duration waitTime() {
        pruneOld();
        if (attempts.size() < maxAttempts) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), attempts.peekFirst().plus(window));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public synchronized int remainingAttempts() {
        pruneOld();
        return Math.max(0, maxAttempts - attempts.size());
    }

    public synchronized int attemptsInWindow() {
        pruneOld();
        return attempts.size();
    }

    public synchronized void reset() {
        attempts.clear();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getWindow() {
        return window;
    }

    private void pruneOld() {
        Instant cutoff = clock.instant().minus(window);
        while (!attempts.isEmpty() && !attempts.peekFirst().isAfter(cutoff)) {
            attempts.removeFirst();
        }
    }
}
