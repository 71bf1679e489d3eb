package com.example.responsecache.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Response cache settings.
 *
 * <pre>{@code
 * response-cache:
 *   path: ./cache/response-cache.db   # or :memory:
 *   default-ttl-seconds: 3600
 *   cleanup-interval-millis: 60000
 *   middleware:
 *     ttl-seconds: 600
 *     store-responses: true
 *     url-patterns: [/api/users, /api/users/*, /api/posts, /api/expensive]
 * }</pre>
 *
 * @see CacheConfig
 */
@ConfigurationProperties(prefix = "response-cache")
public record CacheProperties(
    @DefaultValue("./cache/response-cache.db") String path,
    @DefaultValue("3600") long defaultTtlSeconds,
    @DefaultValue("60000") long cleanupIntervalMillis,
    @DefaultValue Middleware middleware) {

    public CacheProperties {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("response-cache.path must not be empty");
        }
        if (defaultTtlSeconds <= 0) {
            throw new IllegalArgumentException(
                "response-cache.default-ttl-seconds must be positive, got: " + defaultTtlSeconds);
        }
        if (cleanupIntervalMillis <= 0) {
            throw new IllegalArgumentException(
                "response-cache.cleanup-interval-millis must be positive, got: " + cleanupIntervalMillis);
        }
    }

    public record Middleware(
        @DefaultValue("600") long ttlSeconds,
        @DefaultValue("true") boolean storeResponses,
        @DefaultValue({"/api/users", "/api/users/*", "/api/posts", "/api/expensive"}) List<String> urlPatterns) {

        public Middleware {
            if (ttlSeconds <= 0) {
                throw new IllegalArgumentException(
                    "response-cache.middleware.ttl-seconds must be positive, got: " + ttlSeconds);
            }
        }
    }
}
