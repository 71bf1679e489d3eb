package com.example.responsecache.config;

import com.example.responsecache.core.CacheService;
import com.example.responsecache.middleware.CacheInterceptor;
import com.example.responsecache.middleware.CacheOptions;
import com.example.responsecache.middleware.RequestDescriptor;
import com.example.responsecache.middleware.ResponseCacheFilter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheConfig {

    @Bean(initMethod = "init", destroyMethod = "close")
    public CacheService cacheService(CacheProperties properties) {
        // own mapper: stored values must not depend on web serialization settings
        return new CacheService(
            properties.path(),
            properties.defaultTtlSeconds(),
            properties.cleanupIntervalMillis(),
            new ObjectMapper(),
            Clock.systemUTC());
    }

    @Bean
    public CacheInterceptor apiCacheInterceptor(CacheService cacheService, CacheProperties properties, ObjectMapper objectMapper) {
        CacheOptions options = CacheOptions.defaults()
            .withKeyGenerator(request -> apiKey(request, objectMapper))
            .withTtlSeconds(properties.middleware().ttlSeconds())
            .withCondition(CacheConfig::allowsCaching)
            .withStoreResponses(properties.middleware().storeResponses());
        return new CacheInterceptor(cacheService, options, objectMapper);
    }

    @Bean
    public FilterRegistrationBean<ResponseCacheFilter> responseCacheFilter(
        CacheInterceptor apiCacheInterceptor, CacheProperties properties, ObjectMapper objectMapper) {
        FilterRegistrationBean<ResponseCacheFilter> registration =
            new FilterRegistrationBean<>(new ResponseCacheFilter(apiCacheInterceptor, objectMapper));
        registration.setUrlPatterns(properties.middleware().urlPatterns());
        registration.setName("responseCacheFilter");
        return registration;
    }

    // api:GET:/api/posts:{"limit":"5","userId":"1"}
    static String apiKey(RequestDescriptor request, ObjectMapper objectMapper) {
        Map<String, Object> query = new TreeMap<>();
        request.getQueryParameters().forEach((name, values) ->
            query.put(name, values.size() == 1 ? values.get(0) : values));
        try {
            return "api:" + request.getMethod() + ":" + request.getPath() + ":" + objectMapper.writeValueAsString(query);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static boolean allowsCaching(RequestDescriptor request) {
        String cacheControl = request.getHeader("Cache-Control");
        return cacheControl == null || !cacheControl.contains("no-cache");
    }
}
