package com.example.responsecache.core;

public class CacheDeserializationException extends CacheException {

    public CacheDeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
