package com.example.responsecache.middleware;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class RequestDescriptor {

    private final String method;
    private final String path;
    private final Map<String, List<String>> queryParameters;
    private final Map<String, String> headers;

    public RequestDescriptor(String method, String path, Map<String, List<String>> queryParameters, Map<String, String> headers) {
        this.method = method;
        this.path = path;
        this.queryParameters = Collections.unmodifiableMap(new TreeMap<>(queryParameters));
        TreeMap<String, String> caseInsensitive = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        caseInsensitive.putAll(headers);
        this.headers = Collections.unmodifiableMap(caseInsensitive);
    }

    public static RequestDescriptor get(String path) {
        return new RequestDescriptor("GET", path, Map.of(), Map.of());
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public Map<String, List<String>> getQueryParameters() {
        return queryParameters;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    @Override
    public String toString() {
        return method + " " + path + (queryParameters.isEmpty() ? "" : " " + queryParameters);
    }
}
