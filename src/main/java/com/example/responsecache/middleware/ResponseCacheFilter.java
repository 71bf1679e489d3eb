package com.example.responsecache.middleware;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

/**
 * Puts a {@link CacheInterceptor} in front of the servlet chain.
 *
 * <p>The handler writes into a {@link ContentCachingResponseWrapper}; once it is done, the buffered body
 * goes through the interceptor's raw write path exactly once. For handlers that complete asynchronously
 * this happens at the end of the async dispatch.
 */
public class ResponseCacheFilter extends OncePerRequestFilter {

    private static final String PENDING_ATTRIBUTE = ResponseCacheFilter.class.getName() + ".PENDING";

    private final CacheInterceptor interceptor;
    private final ObjectMapper objectMapper;

    public ResponseCacheFilter(CacheInterceptor interceptor, ObjectMapper objectMapper) {
        this.interceptor = interceptor;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (isAsyncDispatch(request)) {
            filterChain.doFilter(request, response);
            PendingResponse pending = (PendingResponse) request.getAttribute(PENDING_ATTRIBUTE);
            if (pending != null && !isAsyncStarted(request)) {
                request.removeAttribute(PENDING_ATTRIBUTE);
                pending.complete();
            }
            return;
        }

        ServletResponseWriter writer = new ServletResponseWriter(response, objectMapper);
        try {
            interceptor.intercept(describe(request), writer, (descriptor, out) -> {
                ContentCachingResponseWrapper buffered = new ContentCachingResponseWrapper(response);
                filterChain.doFilter(request, buffered);
                PendingResponse pending = new PendingResponse(response, buffered, out);
                if (isAsyncStarted(request)) {
                    request.setAttribute(PENDING_ATTRIBUTE, pending);
                } else {
                    pending.complete();
                }
            });
        } catch (ServletException | IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ServletException(e);
        }
    }

    static RequestDescriptor describe(HttpServletRequest request) {
        Map<String, List<String>> query = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) -> query.put(name, Arrays.asList(values)));

        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }
        return new RequestDescriptor(request.getMethod(), request.getRequestURI(), query, headers);
    }

    private static final class PendingResponse {

        private final HttpServletResponse response;
        private final ContentCachingResponseWrapper buffered;
        private final ResponseWriter out;

        PendingResponse(HttpServletResponse response, ContentCachingResponseWrapper buffered, ResponseWriter out) {
            this.response = response;
            this.buffered = buffered;
            this.out = out;
        }

        void complete() throws IOException {
            String body = new String(buffered.getContentAsByteArray(), ServletResponseWriter.charsetOf(buffered));
            if (buffered.getContentType() != null && !response.isCommitted()) {
                response.setContentType(buffered.getContentType());
            }
            out.send(buffered.getStatus(), body);
        }
    }
}
