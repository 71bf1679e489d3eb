package com.example.responsecache.middleware;

public enum CacheStatus {
    // unit of work not invoked
    HIT,
    MISS,
    // not a candidate, or the cache failed
    BYPASS
}
