package com.example.responsecache.core;

/**
 * Base type for failures raised by {@link CacheService}.
 * A missing or expired key is not a failure and never surfaces as one of these.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
