package com.docsage.api.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.SneakyThrows;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute limit per key. Callers over the limit block until a
 * token is refilled.
 */
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final int rpmLimit;

    public InMemoryRpmRateLimiter(int rpmLimit) {
        if (rpmLimit < 1) {
            throw new IllegalArgumentException("rpmLimit must be positive: " + rpmLimit);
        }
        this.rpmLimit = rpmLimit;
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(rpmLimit, Refill.greedy(rpmLimit, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    @SneakyThrows
    public void acquire(String key) {
        buckets.computeIfAbsent(key, k -> createBucket())
            .asBlocking()
            .consume(1);
    }
}
