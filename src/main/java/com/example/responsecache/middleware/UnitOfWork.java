package com.example.responsecache.middleware;

// may complete later, from another thread
@FunctionalInterface
public interface UnitOfWork {

    void handle(RequestDescriptor request, ResponseWriter writer) throws Exception;
}
