package com.example.responsecache.core;

public class CacheInitializationException extends CacheException {

    public CacheInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
