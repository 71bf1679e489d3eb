package com.example.responsecache.middleware;

import java.io.IOException;

// send and json are terminal; a response completes through exactly one of them
public interface ResponseWriter {

    void header(String name, String value);

    void send(int status, String body) throws IOException;

    void json(int status, Object body) throws IOException;
}
