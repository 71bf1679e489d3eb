package com.example.responsecache.api;

import com.example.responsecache.backend.MockBackend;
import com.example.responsecache.backend.Post;
import com.example.responsecache.backend.User;
import com.example.responsecache.core.CacheService;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ApiController {

    private final MockBackend backend;
    private final CacheService cacheService;

    public ApiController(MockBackend backend, CacheService cacheService) {
        this.backend = backend;
        this.cacheService = cacheService;
    }

    @GetMapping("/api/users")
    public Map<String, Object> getUsers() {
        List<User> users = backend.findUsers();
        return success(users);
    }

    @GetMapping("/api/users/{id}")
    public ResponseEntity<Map<String, Object>> getUser(@PathVariable int id) {
        Optional<User> user = backend.findUser(id);
        if (user.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "User not found"));
        }
        return ResponseEntity.ok(success(user.get()));
    }

    @GetMapping("/api/posts")
    public Map<String, Object> getPosts(
        @RequestParam(required = false) Integer userId,
        @RequestParam(defaultValue = "10") int limit
    ) {
        List<Post> posts = backend.findPosts(userId, limit);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", posts);
        body.put("count", posts.size());
        body.put("timestamp", Instant.now().toString());
        return body;
    }

    @GetMapping("/api/expensive")
    public Map<String, Object> getExpensive() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", backend.computeExpensive());
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", Instant.now().toString());
        body.put("cache", cacheService.isInitialized() ? "connected" : "disconnected");
        body.put("cleanupFailures", cacheService.getConsecutiveCleanupFailures());
        return body;
    }

    private static Map<String, Object> success(Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", data);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
