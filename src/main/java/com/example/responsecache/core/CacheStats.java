package com.example.responsecache.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

public class CacheStats {

    private final long total;
    private final long active;
    private final long expired;
    // mean serialized length, rounded
    private final long avgSize;
    private final long totalHits;
    // totalHits / total, two decimals
    private final BigDecimal hitRate;

    public CacheStats(long total, long active, long expired, long avgSize, long totalHits, BigDecimal hitRate) {
        this.total = total;
        this.active = active;
        this.expired = expired;
        this.avgSize = avgSize;
        this.totalHits = totalHits;
        this.hitRate = hitRate;
    }

    @JsonProperty("total")
    public long getTotal() {
        return total;
    }

    @JsonProperty("active")
    public long getActive() {
        return active;
    }

    @JsonProperty("expired")
    public long getExpired() {
        return expired;
    }

    @JsonProperty("avg_size")
    public long getAvgSize() {
        return avgSize;
    }

    @JsonProperty("total_hits")
    public long getTotalHits() {
        return totalHits;
    }

    @JsonProperty("hit_rate")
    public BigDecimal getHitRate() {
        return hitRate;
    }

    @Override
    public String toString() {
        return "CacheStats{total=" + total + ", active=" + active + ", expired=" + expired
            + ", avgSize=" + avgSize + ", totalHits=" + totalHits + ", hitRate=" + hitRate + "}";
    }
}
