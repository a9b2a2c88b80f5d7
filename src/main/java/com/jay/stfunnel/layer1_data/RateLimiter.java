package com.jay.stfunnel.layer1_data;

import com.jay.stfunnel.exception.MarketDataException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Caps concurrent provider calls and spaces call starts by a minimum interval.
 * One instance is shared by every caller of the same upstream within a process.
 */
@Slf4j
public class RateLimiter {

    private final Semaphore permits;
    private final long minSpacingNanos;
    private long nextStartNanos = 0;

    public RateLimiter(int maxConcurrent, long minSpacingMs) {
        if (maxConcurrent < 1) throw new IllegalArgumentException("maxConcurrent must be at least 1");
        this.permits = new Semaphore(maxConcurrent, true);
        this.minSpacingNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0, minSpacingMs));
    }

    /**
     * Runs the call once a permit and a start slot are available.
     * An interrupt while waiting surfaces as a provider failure for that ticker.
     */
    public <T> T execute(String ticker, Supplier<T> call) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketDataException(ticker, "Interrupted while waiting for rate limiter");
        }
        try {
            awaitSlot(ticker);
            return call.get();
        } finally {
            permits.release();
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    private void awaitSlot(String ticker) {
        long waitNanos;
        synchronized (this) {
            long now = System.nanoTime();
            long start = Math.max(now, nextStartNanos);
            nextStartNanos = start + minSpacingNanos;
            waitNanos = start - now;
        }
        if (waitNanos <= 0) return;
        try {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketDataException(ticker, "Interrupted while waiting for rate limiter");
        }
    }
}
