package com.example.responsecache.core;

public class CacheStorageException extends CacheException {

    public CacheStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
