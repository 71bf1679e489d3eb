package com.example.responsecache.middleware;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import org.springframework.http.MediaType;

class ServletResponseWriter implements ResponseWriter {

    private final HttpServletResponse response;
    private final ObjectMapper objectMapper;

    ServletResponseWriter(HttpServletResponse response, ObjectMapper objectMapper) {
        this.response = response;
        this.objectMapper = objectMapper;
    }

    @Override
    public void header(String name, String value) {
        response.setHeader(name, value);
    }

    @Override
    public void send(int status, String body) throws IOException {
        if (!response.isCommitted()) {
            response.setStatus(status);
        }
        if (body != null && !body.isEmpty()) {
            response.getOutputStream().write(body.getBytes(charsetOf(response)));
        }
        response.flushBuffer();
    }

    @Override
    public void json(int status, Object body) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), body);
        response.flushBuffer();
    }

    // UTF-8 unless the content type declares a charset
    static Charset charsetOf(HttpServletResponse response) {
        String contentType = response.getContentType();
        if (contentType != null && contentType.toLowerCase().contains("charset=")) {
            return Charset.forName(response.getCharacterEncoding());
        }
        return StandardCharsets.UTF_8;
    }
}
