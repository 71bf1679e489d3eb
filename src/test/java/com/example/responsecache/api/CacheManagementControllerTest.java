package com.example.responsecache.api;

import com.example.responsecache.core.CacheService;
import com.example.responsecache.core.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CacheManagementControllerTest {

    private MutableClock clock;
    private CacheService cache;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cache = new CacheService(CacheService.IN_MEMORY, 3600, 60_000, new ObjectMapper(), clock);
        cache.init();
        mockMvc = MockMvcBuilders.standaloneSetup(new CacheManagementController(cache))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void setThenGetByKey() throws Exception {
        mockMvc.perform(post("/api/cache/greeting")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": {\"text\": \"hi\", \"count\": 2}, \"ttl\": 120}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.key").value("greeting"));

        mockMvc.perform(get("/api/cache/greeting"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.key").value("greeting"))
            .andExpect(jsonPath("$.data.value.text").value("hi"))
            .andExpect(jsonPath("$.data.value.count").value(2))
            .andExpect(jsonPath("$.data.exists").value(true));
    }

    @Test
    void unknownKeyIsNotFound() throws Exception {
        mockMvc.perform(get("/api/cache/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Cache key not found"));
    }

    @Test
    void setWithoutValueIsRejected() throws Exception {
        mockMvc.perform(post("/api/cache/k")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ttl\": 10}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Value is required"));

        assertThat(cache.has("k")).isFalse();
    }

    @Test
    void deleteReportsWhetherKeyExisted() throws Exception {
        cache.set("k", "v", 60);

        mockMvc.perform(delete("/api/cache/k"))
            .andExpect(jsonPath("$.deleted").value(true));
        mockMvc.perform(delete("/api/cache/k"))
            .andExpect(jsonPath("$.deleted").value(false))
            .andExpect(jsonPath("$.key").value("k"));
    }

    @Test
    void statsAndEntriesReflectStoredRows() throws Exception {
        cache.set("a", Map.of("n", 1), 60);
        cache.set("b", "two", 60);
        cache.get("a");

        mockMvc.perform(get("/api/cache/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.total").value(2))
            .andExpect(jsonPath("$.data.active").value(2))
            .andExpect(jsonPath("$.data.expired").value(0))
            .andExpect(jsonPath("$.data.total_hits").value(3))
            .andExpect(jsonPath("$.data.hit_rate").value(1.5));

        mockMvc.perform(get("/api/cache/entries").param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.data[0].key").exists())
            .andExpect(jsonPath("$.data[0].hit_count").exists())
            .andExpect(jsonPath("$.data[0].expires_at").exists());
    }

    @Test
    void cleanupReportsRemovedRows() throws Exception {
        cache.set("short", "v", 1);
        cache.set("long", "v", 600);
        clock.advance(Duration.ofSeconds(2));

        mockMvc.perform(post("/api/cache/cleanup"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Removed 1 expired entries"));
        mockMvc.perform(post("/api/cache/cleanup"))
            .andExpect(jsonPath("$.message").value("Removed 0 expired entries"));
    }

    @Test
    void clearRemovesEverything() throws Exception {
        cache.set("a", "v", 60);
        cache.set("b", "v", 60);

        mockMvc.perform(delete("/api/cache"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("All cache entries cleared"));

        assertThat(cache.stats().getTotal()).isZero();
    }

    @Test
    void cacheFailureBecomesServerError() throws Exception {
        cache.close();

        mockMvc.perform(get("/api/cache/stats"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Internal server error"))
            .andExpect(jsonPath("$.message").value("Cache not initialized"));
    }

    @Test
    void unexpectedFailureUsesTheSameErrorEnvelope() throws Exception {
        mockMvc = MockMvcBuilders.standaloneSetup(new FailingController())
            .setControllerAdvice(new ApiExceptionHandler())
            .build();

        mockMvc.perform(get("/failing"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Internal server error"))
            .andExpect(jsonPath("$.message").value("kaboom"));
    }

    @Test
    void frameworkErrorsKeepTheirStatus() throws Exception {
        mockMvc.perform(put("/api/cache/k"))
            .andExpect(status().isMethodNotAllowed())
            .andExpect(jsonPath("$.error").value("Method Not Allowed"));
    }

    @Test
    void maximalTtlIsStoredAsLongLived() throws Exception {
        mockMvc.perform(post("/api/cache/forever")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": \"v\", \"ttl\": 9223372036854775807}"))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/cache/forever"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.value").value("v"));
        assertThat(cache.stats().getActive()).isEqualTo(1);
    }

    @RestController
    static class FailingController {

        @GetMapping("/failing")
        String fail() {
            throw new IllegalStateException("kaboom");
        }
    }
}
