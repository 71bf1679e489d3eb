package com.example.responsecache.core;

public class CacheSerializationException extends CacheException {

    public CacheSerializationException(String message) {
        super(message);
    }

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
