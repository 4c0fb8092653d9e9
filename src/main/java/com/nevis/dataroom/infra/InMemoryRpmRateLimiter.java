package com.nevis.dataroom.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute limiter, one greedy bucket per key. Callers block until a permit is free.
 */
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final int rpmLimit;

    public InMemoryRpmRateLimiter(int rpmLimit) {
        if (rpmLimit < 1) {
            throw new IllegalArgumentException("rpmLimit must be positive");
        }
        this.rpmLimit = rpmLimit;
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(rpmLimit, Refill.greedy(rpmLimit, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    public void acquire(String key, int permits) {
        Bucket bucket = buckets.computeIfAbsent(key, k -> createBucket());
        try {
            bucket.asBlocking().consume(Math.min(permits, rpmLimit));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limit on " + key, e);
        }
    }
}
