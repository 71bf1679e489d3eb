package com.example.responsecache.backend;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class MockBackend {

    private static final Logger logger = LoggerFactory.getLogger(MockBackend.class);

    private static final List<User> USERS = List.of(
        new User(1, "John Doe", "john@example.com", "admin"),
        new User(2, "Jane Smith", "jane@example.com", "user"),
        new User(3, "Bob Johnson", "bob@example.com", "user"));

    private static final List<Post> POSTS = List.of(
        new Post(1, "First Post", "This is the first post", 1),
        new Post(2, "Second Post", "This is the second post", 2),
        new Post(3, "Third Post", "This is the third post", 1));

    private final AtomicLong requestCount = new AtomicLong();
    private final long latencyMillis;

    public MockBackend(@Value("${demo.backend.latency-millis:500}") long latencyMillis) {
        this.latencyMillis = latencyMillis;
    }

    public List<User> findUsers() {
        logger.info("Fetching users from backend");
        simulateLatency(latencyMillis);
        return USERS;
    }

    public Optional<User> findUser(int id) {
        logger.info("Fetching user {} from backend", id);
        simulateLatency(latencyMillis * 3 / 5);
        return USERS.stream().filter(u -> u.getId() == id).findFirst();
    }

    public List<Post> findPosts(Integer userId, int limit) {
        logger.info("Fetching posts from backend");
        simulateLatency(latencyMillis * 4 / 5);
        return POSTS.stream()
            .filter(p -> userId == null || p.getUserId() == userId)
            .limit(Math.max(limit, 0))
            .collect(Collectors.toList());
    }

    public Map<String, Object> computeExpensive() {
        logger.info("Performing expensive computation");
        simulateLatency(latencyMillis * 4);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("computation", "fibonacci");
        result.put("input", 40);
        result.put("result", fibonacci(40));
        result.put("computed_at", Instant.now().toString());
        return result;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }

    private void simulateLatency(long millis) {
        requestCount.incrementAndGet();
        try {
            if (millis > 0) {
                Thread.sleep(millis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static long fibonacci(int n) {
        long a = 0;
        long b = 1;
        for (int i = 0; i < n; i++) {
            long next = a + b;
            a = b;
            b = next;
        }
        return a;
    }
}
