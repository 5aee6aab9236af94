package com.agrotrace.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-caller Bucket4j buckets, one per budget class.
 */
@Configuration
public class RateLimitConfig {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final RateLimitProperties properties;

    public RateLimitConfig(RateLimitProperties properties) {
        this.properties = properties;
    }

    public Bucket resolveBucket(String callerId) {
        return buckets.computeIfAbsent(callerId, key -> createBucket(properties.getDefaultCapacity()));
    }

    /**
     * Budget for owner, verifier and moderator operations.
     */
    public Bucket resolveStrictBucket(String callerId) {
        return buckets.computeIfAbsent(callerId + ":strict", key -> createBucket(properties.getStrictCapacity()));
    }

    public Bucket resolveReadBucket(String callerId) {
        return buckets.computeIfAbsent(callerId + ":read", key -> createBucket(properties.getReadCapacity()));
    }

    private Bucket createBucket(long capacity) {
        Bandwidth limit = Bandwidth.classic(capacity, Refill.greedy(capacity, properties.getRefillPeriod()));
        return Bucket.builder().addLimit(limit).build();
    }
}
