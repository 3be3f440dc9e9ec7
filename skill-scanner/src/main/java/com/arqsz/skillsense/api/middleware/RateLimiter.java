package com.arqsz.skillsense.api.middleware;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fixed window rate limiter keyed by client identifier
 */
public class RateLimiter {

    private static final long IDLE_WINDOW_MILLIS = TimeUnit.HOURS.toMillis(1);

    private final Map<String, FixedWindow> windows = new ConcurrentHashMap<>();
    private final int maxRequests;
    private final long windowMillis;
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    /**
     * Creates a rate limiter
     * 
     * @param maxRequests   Maximum requests allowed per window
     * @param windowSeconds Window length in seconds
     */
    public RateLimiter(int maxRequests, long windowSeconds) {
        this(maxRequests, windowSeconds, Clock.systemUTC());
    }

    /**
     * Creates a rate limiter with an explicit clock
     * 
     * @param maxRequests   Maximum requests allowed per window
     * @param windowSeconds Window length in seconds
     * @param clock         Time source for window boundaries
     */
    public RateLimiter(int maxRequests, long windowSeconds, Clock clock) {
        this.maxRequests = maxRequests;
        this.windowMillis = TimeUnit.SECONDS.toMillis(windowSeconds);
        this.clock = clock;

        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rate-limiter-cleanup");
            thread.setDaemon(true);
            return thread;
        });
        this.cleanupExecutor.scheduleAtFixedRate(this::cleanup, 5, 5, TimeUnit.MINUTES);
    }

    /**
     * Checks if a request from the given identifier is allowed
     * 
     * @param identifier Unique identifier, usually the client IP
     * @return true if request is allowed, false if rate limit exceeded
     */
    public boolean allowRequest(String identifier) {
        FixedWindow window = windows.computeIfAbsent(identifier, k -> new FixedWindow(clock.millis()));
        return window.tryConsume(clock.millis());
    }

    /**
     * Gets remaining requests for an identifier
     * 
     * @param identifier The identifier to check
     * @return Number of remaining requests in current window
     */
    public int getRemainingRequests(String identifier) {
        FixedWindow window = windows.get(identifier);
        return window == null ? maxRequests : window.remaining(clock.millis());
    }

    /**
     * Gets seconds until the window of an identifier resets
     * 
     * @param identifier The identifier to check
     * @return Seconds until reset, or 0 if the identifier is unknown
     */
    public long getResetTime(String identifier) {
        FixedWindow window = windows.get(identifier);
        return window == null ? 0 : window.secondsUntilReset(clock.millis());
    }

    /**
     * Number of identifiers currently tracked
     */
    int trackedIdentifiers() {
        return windows.size();
    }

    /**
     * Removes windows that have been idle for over an hour
     */
    void cleanup() {
        long cutoff = clock.millis() - IDLE_WINDOW_MILLIS;
        windows.entrySet().removeIf(entry -> entry.getValue().lastAccess() < cutoff);
    }

    /**
     * Shuts down the cleanup executor
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
    }

    private class FixedWindow {
        private int used;
        private long windowStart;
        private long lastAccess;

        FixedWindow(long now) {
            this.windowStart = now;
            this.lastAccess = now;
        }

        synchronized boolean tryConsume(long now) {
            roll(now);
            lastAccess = now;
            if (used < maxRequests) {
                used++;
                return true;
            }
            return false;
        }

        synchronized int remaining(long now) {
            roll(now);
            return maxRequests - used;
        }

        synchronized long secondsUntilReset(long now) {
            return Math.max(0, (windowMillis - (now - windowStart)) / 1000);
        }

        synchronized long lastAccess() {
            return lastAccess;
        }

        private void roll(long now) {
            if (now - windowStart >= windowMillis) {
                used = 0;
                windowStart = now;
            }
        }
    }
}
