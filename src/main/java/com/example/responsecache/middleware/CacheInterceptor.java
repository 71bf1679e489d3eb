package com.example.responsecache.middleware;

import com.example.responsecache.core.CacheService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves repeated read requests from a {@link CacheService} instead of re-running the unit of work.
 *
 * <p>On a hit the cached body is written straight to the caller. On a miss the unit of work receives a
 * writer that captures its first terminal write, stores successful (2xx) results and then forwards the
 * write unchanged. Cache failures are logged and never reach the caller.
 */
public class CacheInterceptor {

    public static final String HIT_HEADER = "X-Cache-Hit";
    public static final String KEY_HEADER = "X-Cache-Key";

    private static final Logger logger = LoggerFactory.getLogger(CacheInterceptor.class);

    private final CacheService cache;
    private final CacheOptions options;
    private final ObjectMapper objectMapper;

    public CacheInterceptor(CacheService cache, CacheOptions options, ObjectMapper objectMapper) {
        this.cache = cache;
        this.options = options;
        this.objectMapper = objectMapper;
    }

    public CacheInterceptor(CacheService cache, CacheOptions options) {
        this(cache, options, new ObjectMapper());
    }

    public CacheStatus intercept(RequestDescriptor request, ResponseWriter writer, UnitOfWork unitOfWork) throws Exception {
        if (!isCandidate(request)) {
            unitOfWork.handle(request, writer);
            return CacheStatus.BYPASS;
        }

        String key;
        Optional<Object> cached;
        try {
            key = options.keyGenerator().apply(request);
            cached = cache.get(key);
        } catch (RuntimeException e) {
            logger.warn("Cache lookup failed for {}, serving uncached: {}", request, e.getMessage());
            unitOfWork.handle(request, writer);
            return CacheStatus.BYPASS;
        }

        if (cached.isPresent()) {
            logger.debug("Cache hit: {} -> {}", request, key);
            writer.header(HIT_HEADER, "true");
            writer.header(KEY_HEADER, key);
            writer.json(200, cached.get());
            return CacheStatus.HIT;
        }

        logger.debug("Cache miss: {} -> {}", request, key);
        unitOfWork.handle(request, new CapturingWriter(writer, key));
        return CacheStatus.MISS;
    }

    private boolean isCandidate(RequestDescriptor request) {
        if (!"GET".equalsIgnoreCase(request.getMethod())) {
            return false;
        }
        try {
            return options.condition().test(request);
        } catch (RuntimeException e) {
            logger.warn("Cache condition failed for {}, bypassing cache: {}", request, e.getMessage());
            return false;
        }
    }

    private static boolean isSuccessful(int status) {
        return status >= 200 && status < 300;
    }

    private final class CapturingWriter implements ResponseWriter {

        private final ResponseWriter delegate;
        private final String key;
        private final AtomicBoolean armed = new AtomicBoolean(true);

        CapturingWriter(ResponseWriter delegate, String key) {
            this.delegate = delegate;
            this.key = key;
        }

        @Override
        public void header(String name, String value) {
            delegate.header(name, value);
        }

        @Override
        public void send(int status, String body) throws IOException {
            if (shouldStore(status)) {
                try {
                    store(objectMapper.readValue(body, Object.class));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    logger.warn("Failed to cache response for key {}: body is not JSON", key);
                }
            }
            delegate.send(status, body);
        }

        @Override
        public void json(int status, Object body) throws IOException {
            if (shouldStore(status)) {
                store(body);
            }
            delegate.json(status, body);
        }

        private boolean shouldStore(int status) {
            return armed.compareAndSet(true, false) && options.storeResponses() && isSuccessful(status);
        }

        private void store(Object value) {
            try {
                cache.set(key, value, options.ttlSeconds());
                delegate.header(HIT_HEADER, "false");
                delegate.header(KEY_HEADER, key);
            } catch (RuntimeException e) {
                logger.warn("Failed to cache response for key {}: {}", key, e.getMessage());
            }
        }
    }
}
