package com.example.responsecache.api;

public class CacheWriteRequest {

    private Object value;
    // null or non-positive selects the cache default
    private Long ttl;

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public Long getTtl() {
        return ttl;
    }

    public void setTtl(Long ttl) {
        this.ttl = ttl;
    }
}
