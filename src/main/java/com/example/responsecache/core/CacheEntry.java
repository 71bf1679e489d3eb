package com.example.responsecache.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public class CacheEntry {

    private final String key;
    private final Object value;
    private final Instant expiresAt;
    private final Instant createdAt;
    private final Instant accessedAt;
    private final long hitCount;

    public CacheEntry(String key, Object value, Instant expiresAt, Instant createdAt, Instant accessedAt, long hitCount) {
        this.key = key;
        this.value = value;
        this.expiresAt = expiresAt;
        this.createdAt = createdAt;
        this.accessedAt = accessedAt;
        this.hitCount = hitCount;
    }

    @JsonProperty("key")
    public String getKey() {
        return key;
    }

    @JsonProperty("value")
    public Object getValue() {
        return value;
    }

    @JsonProperty("expires_at")
    public Instant getExpiresAt() {
        return expiresAt;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("accessed_at")
    public Instant getAccessedAt() {
        return accessedAt;
    }

    @JsonProperty("hit_count")
    public long getHitCount() {
        return hitCount;
    }

    @Override
    public String toString() {
        return "CacheEntry{key='" + key + "', expiresAt=" + expiresAt + ", hitCount=" + hitCount + "}";
    }
}
