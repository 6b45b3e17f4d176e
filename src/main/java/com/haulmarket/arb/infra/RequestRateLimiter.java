package com.haulmarket.arb.infra;

import java.time.Duration;

/**
 * Simple token bucket pacing outgoing requests. A rate of zero or less disables it.
 */
public class RequestRateLimiter {

    private final double permitsPerSecond;
    private final Sleeper sleeper;
    private long lastSync = System.nanoTime();
    private double storedPermits = 0.0;

    public RequestRateLimiter(double permitsPerSecond, Sleeper sleeper) {
        this.permitsPerSecond = permitsPerSecond;
        this.sleeper = sleeper;
    }

    public synchronized void acquire() throws InterruptedException {
        if (permitsPerSecond <= 0) {
            return;
        }
        long now = System.nanoTime();
        double newPermits = (now - lastSync) / 1_000_000_000.0 * permitsPerSecond;
        storedPermits = Math.min(1.0, storedPermits + newPermits); // Max burst 1.0
        lastSync = now;

        if (storedPermits >= 1.0) {
            storedPermits -= 1.0;
            return;
        }

        double missing = 1.0 - storedPermits;
        long waitNanos = (long) (missing / permitsPerSecond * 1_000_000_000.0);
        sleeper.sleep(Duration.ofNanos(waitNanos));

        lastSync = System.nanoTime();
        storedPermits = 0;
    }
}
