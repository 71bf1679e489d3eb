package com.example.responsecache.core;

public class CacheNotInitializedException extends CacheException {

    public CacheNotInitializedException() {
        super("Cache not initialized");
    }
}
