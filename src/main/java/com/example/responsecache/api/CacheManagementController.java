package com.example.responsecache.api;

import com.example.responsecache.core.CacheEntry;
import com.example.responsecache.core.CacheService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/cache")
public class CacheManagementController {

    private static final Logger logger = LoggerFactory.getLogger(CacheManagementController.class);

    private final CacheService cacheService;

    public CacheManagementController(CacheService cacheService) {
        this.cacheService = cacheService;
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        return Map.of("success", true, "data", cacheService.stats());
    }

    @GetMapping("/entries")
    public Map<String, Object> entries(@RequestParam(defaultValue = "50") int limit) {
        List<CacheEntry> entries = cacheService.listEntries(limit > 0 ? limit : 50);
        return Map.of("success", true, "data", entries, "count", entries.size());
    }

    @GetMapping("/{key}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String key) {
        Optional<Object> value = cacheService.get(key);
        if (value.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Cache key not found"));
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("key", key);
        data.put("value", value.get());
        data.put("exists", true);
        return ResponseEntity.ok(Map.of("success", true, "data", data));
    }

    @PostMapping("/{key}")
    public ResponseEntity<Map<String, Object>> set(@PathVariable String key, @RequestBody CacheWriteRequest request) {
        if (request.getValue() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Value is required"));
        }
        if (request.getTtl() == null) {
            cacheService.set(key, request.getValue());
        } else {
            cacheService.set(key, request.getValue(), request.getTtl());
        }
        return ResponseEntity.ok(Map.of(
            "success", true,
            "message", "Cache entry set successfully",
            "key", key));
    }

    @DeleteMapping("/{key}")
    public Map<String, Object> delete(@PathVariable String key) {
        boolean deleted = cacheService.delete(key);
        return Map.of("success", true, "deleted", deleted, "key", key);
    }

    @DeleteMapping
    public Map<String, Object> clear() {
        cacheService.clear();
        return Map.of("success", true, "message", "All cache entries cleared");
    }

    @PostMapping("/cleanup")
    public Map<String, Object> cleanup() {
        int removed = cacheService.cleanup();
        logger.info("Manual cache cleanup removed {} entries", removed);
        return Map.of("success", true, "message", "Removed " + removed + " expired entries");
    }
}
