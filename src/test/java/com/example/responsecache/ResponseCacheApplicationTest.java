package com.example.responsecache;

import com.example.responsecache.backend.MockBackend;
import com.example.responsecache.core.CacheService;
import com.example.responsecache.middleware.CacheInterceptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ResponseCacheApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CacheService cacheService;

    @Autowired
    private MockBackend backend;

    @BeforeEach
    void setUp() {
        cacheService.clear();
        backend.resetCount();
    }

    @Test
    void apiRoutesAreCachedThroughTheSharedEngine() throws Exception {
        mockMvc.perform(get("/api/users/1"))
            .andExpect(status().isOk())
            .andExpect(header().string(CacheInterceptor.HIT_HEADER, "false"))
            .andExpect(header().string(CacheInterceptor.KEY_HEADER, "api:GET:/api/users/1:{}"));

        mockMvc.perform(get("/api/users/1"))
            .andExpect(status().isOk())
            .andExpect(header().string(CacheInterceptor.HIT_HEADER, "true"))
            .andExpect(jsonPath("$.data.email").value("john@example.com"));

        assertThat(backend.getRequestCount()).isEqualTo(1);

        mockMvc.perform(get("/api/cache/stats"))
            .andExpect(jsonPath("$.data.total").value(1))
            .andExpect(jsonPath("$.data.total_hits").value(2));
    }

    @Test
    void managementRoutesAreNotCached() throws Exception {
        mockMvc.perform(get("/api/cache/stats"))
            .andExpect(status().isOk())
            .andExpect(header().doesNotExist(CacheInterceptor.HIT_HEADER));

        mockMvc.perform(get("/api/cache/entries"))
            .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void healthReportsCacheConnection() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.cache").value("connected"))
            .andExpect(jsonPath("$.cleanupFailures").value(0));
    }
}
