package com.example.responsecache.middleware;

import java.util.function.Function;
import java.util.function.Predicate;

public record CacheOptions(
    Function<RequestDescriptor, String> keyGenerator,
    long ttlSeconds,
    Predicate<RequestDescriptor> condition,
    boolean storeResponses) {

    public static final long DEFAULT_TTL_SECONDS = 300;

    public CacheOptions {
        if (keyGenerator == null || condition == null) {
            throw new IllegalArgumentException("keyGenerator and condition are required");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive, got: " + ttlSeconds);
        }
    }

    public static CacheOptions defaults() {
        return new CacheOptions(
            request -> request.getMethod() + ":" + request.getPath(),
            DEFAULT_TTL_SECONDS,
            request -> true,
            true);
    }

    public CacheOptions withKeyGenerator(Function<RequestDescriptor, String> keyGenerator) {
        return new CacheOptions(keyGenerator, ttlSeconds, condition, storeResponses);
    }

    public CacheOptions withTtlSeconds(long ttlSeconds) {
        return new CacheOptions(keyGenerator, ttlSeconds, condition, storeResponses);
    }

    public CacheOptions withCondition(Predicate<RequestDescriptor> condition) {
        return new CacheOptions(keyGenerator, ttlSeconds, condition, storeResponses);
    }

    public CacheOptions withStoreResponses(boolean storeResponses) {
        return new CacheOptions(keyGenerator, ttlSeconds, condition, storeResponses);
    }
}
