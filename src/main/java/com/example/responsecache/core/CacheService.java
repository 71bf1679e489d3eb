package com.example.responsecache.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.DigestUtils;

/**
 * Persistent TTL key-value store backed by SQLite.
 *
 * <p>Values are stored as JSON text together with an absolute expiry (epoch seconds), creation and
 * last-access timestamps and a hit counter. Rows whose {@code expires_at} is not in the future are
 * invisible to reads and are physically removed by {@link #cleanup()}, which also runs periodically
 * on a background thread owned by this instance.
 *
 * <p>A single JDBC connection is held per instance. It and its prepared statements are only touched
 * while holding {@link #lock}, so the instance can be shared by any number of request threads.
 */
public class CacheService implements AutoCloseable {

    public static final String IN_MEMORY = ":memory:";

    private static final Logger logger = LoggerFactory.getLogger(CacheService.class);

    private static final String CREATE_TABLE_SQL =
        "CREATE TABLE IF NOT EXISTS cache (" +
        "  key TEXT PRIMARY KEY, " +
        "  value TEXT NOT NULL, " +
        "  expires_at INTEGER NOT NULL, " +
        "  created_at INTEGER, " +
        "  accessed_at INTEGER, " +
        "  hit_count INTEGER DEFAULT 1" +
        ")";

    private static final String CREATE_EXPIRY_INDEX_SQL =
        "CREATE INDEX IF NOT EXISTS idx_expires_at ON cache(expires_at)";

    private static final String SET_SQL =
        "INSERT OR REPLACE INTO cache (key, value, expires_at, created_at, accessed_at, hit_count) " +
        "VALUES (?, ?, ?, ?, ?, 1)";
    private static final String GET_SQL =
        "SELECT value FROM cache WHERE key = ? AND expires_at > ?";
    private static final String UPDATE_ACCESS_SQL =
        "UPDATE cache SET accessed_at = ?, hit_count = hit_count + 1 WHERE key = ?";
    private static final String HAS_SQL =
        "SELECT 1 FROM cache WHERE key = ? AND expires_at > ?";
    private static final String DELETE_SQL = "DELETE FROM cache WHERE key = ?";
    private static final String CLEAR_SQL = "DELETE FROM cache";
    private static final String CLEANUP_SQL = "DELETE FROM cache WHERE expires_at <= ?";
    private static final String STATS_SQL =
        "SELECT " +
        "  COUNT(*), " +
        "  SUM(CASE WHEN expires_at > ? THEN 1 ELSE 0 END), " +
        "  SUM(CASE WHEN expires_at <= ? THEN 1 ELSE 0 END), " +
        "  AVG(LENGTH(value)), " +
        "  SUM(hit_count) " +
        "FROM cache";
    private static final String LIST_SQL =
        "SELECT key, value, expires_at, created_at, accessed_at, hit_count FROM cache " +
        "WHERE expires_at > ? ORDER BY accessed_at DESC, key LIMIT ?";

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();

    private final String storagePath;
    private final long defaultTtlSeconds;
    private final long cleanupIntervalMillis;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicInteger consecutiveCleanupFailures = new AtomicInteger();

    private volatile Connection connection;
    private Statements statements;
    private ScheduledExecutorService cleanupExecutor;

    public CacheService(String storagePath, long defaultTtlSeconds, long cleanupIntervalMillis) {
        this(storagePath, defaultTtlSeconds, cleanupIntervalMillis, new ObjectMapper(), Clock.systemUTC());
    }

    public CacheService(
        String storagePath,
        long defaultTtlSeconds,
        long cleanupIntervalMillis,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        if (storagePath == null || storagePath.isBlank()) {
            throw new IllegalArgumentException("storagePath must not be empty");
        }
        if (defaultTtlSeconds <= 0) {
            throw new IllegalArgumentException("defaultTtlSeconds must be positive, got: " + defaultTtlSeconds);
        }
        if (cleanupIntervalMillis <= 0) {
            throw new IllegalArgumentException("cleanupIntervalMillis must be positive, got: " + cleanupIntervalMillis);
        }
        this.storagePath = storagePath;
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.cleanupIntervalMillis = cleanupIntervalMillis;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Opens the storage, creates the schema, prepares statements and starts the reclamation cycle.
     * Calling it on an already initialized instance is a no-op.
     *
     * @throws CacheInitializationException if the storage cannot be opened or the schema created
     */
    public void init() {
        lock.lock();
        try {
            if (connection != null) {
                logger.debug("Cache at {} already initialized", storagePath);
                return;
            }

            Connection conn = null;
            try {
                if (!isInMemory()) {
                    createParentDirectory();
                }
                conn = openConnection();
                try (Statement stmt = conn.createStatement()) {
                    if (!isInMemory()) {
                        stmt.execute("PRAGMA journal_mode = WAL");
                    }
                    stmt.execute(CREATE_TABLE_SQL);
                    stmt.execute(CREATE_EXPIRY_INDEX_SQL);
                }
                this.statements = new Statements(conn);
                this.connection = conn;
            } catch (SQLException | IOException e) {
                if (conn != null) {
                    try {
                        conn.close();
                    } catch (SQLException closeError) {
                        e.addSuppressed(closeError);
                    }
                }
                logger.error("Failed to initialize cache at {}", storagePath, e);
                throw new CacheInitializationException("Failed to initialize cache: " + e.getMessage(), e);
            }

            startCleanup();
        } finally {
            lock.unlock();
        }
        logger.info("Cache initialized: path={}, defaultTtl={}s, cleanupInterval={}ms",
            storagePath, defaultTtlSeconds, cleanupIntervalMillis);
    }

    public boolean isInitialized() {
        return connection != null;
    }

    public boolean set(String key, Object value) {
        return set(key, value, 0);
    }

    /**
     * Stores {@code value} under {@code key}, replacing any existing row and resetting its hit count.
     *
     * @param ttlSeconds time to live; a non-positive value selects the default TTL
     */
    public boolean set(String key, Object value, long ttlSeconds) {
        requireInitialized();
        requireKey(key);
        if (value == null) {
            throw new CacheSerializationException("Cache value cannot be null");
        }

        String json = serialize(value);
        long now = nowSeconds();
        long expiresAt = expiryFor(now, ttlSeconds > 0 ? ttlSeconds : defaultTtlSeconds);

        lock.lock();
        try {
            PreparedStatement stmt = statements().set;
            stmt.setString(1, key);
            stmt.setString(2, json);
            stmt.setLong(3, expiresAt);
            stmt.setLong(4, now);
            stmt.setLong(5, now);
            stmt.executeUpdate();
            logger.debug("SET: key={}, expiresAt={}", key, expiresAt);
            return true;
        } catch (SQLException e) {
            throw storageFailure("set", e);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Object> get(String key) {
        return get(key, Object.class);
    }

    /**
     * Returns the value stored under {@code key} bound to {@code type}, counting the read as a hit.
     * Missing and expired keys yield an empty result.
     *
     * @throws CacheDeserializationException if the stored text cannot be read as {@code type}
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        requireInitialized();
        String json = readAndTouch(key);
        if (json == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(deserialize(key, json, type));
    }

    // does not count as a hit
    public boolean has(String key) {
        requireInitialized();
        lock.lock();
        try {
            PreparedStatement stmt = statements().has;
            stmt.setString(1, key);
            stmt.setLong(2, nowSeconds());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw storageFailure("check", e);
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(String key) {
        requireInitialized();
        lock.lock();
        try {
            PreparedStatement stmt = statements().delete;
            stmt.setString(1, key);
            boolean deleted = stmt.executeUpdate() > 0;
            logger.debug("DELETE: key={}, deleted={}", key, deleted);
            return deleted;
        } catch (SQLException e) {
            throw storageFailure("delete", e);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        requireInitialized();
        lock.lock();
        try {
            int removed = statements().clear.executeUpdate();
            logger.info("Cache cleared ({} entries)", removed);
        } catch (SQLException e) {
            throw storageFailure("clear", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Physically removes every row whose expiry is not in the future.
     *
     * @return number of rows removed
     */
    public int cleanup() {
        requireInitialized();
        lock.lock();
        try {
            PreparedStatement stmt = statements().cleanup;
            stmt.setLong(1, nowSeconds());
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw storageFailure("clean up", e);
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        requireInitialized();
        lock.lock();
        try {
            PreparedStatement stmt = statements().stats;
            long now = nowSeconds();
            stmt.setLong(1, now);
            stmt.setLong(2, now);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                long total = rs.getLong(1);
                long active = rs.getLong(2);
                long expired = rs.getLong(3);
                long avgSize = Math.round(rs.getDouble(4));
                long totalHits = rs.getLong(5);
                BigDecimal hitRate = total > 0
                    ? BigDecimal.valueOf(totalHits).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO.setScale(2);
                return new CacheStats(total, active, expired, avgSize, totalHits, hitRate);
            }
        } catch (SQLException e) {
            throw storageFailure("read stats of", e);
        } finally {
            lock.unlock();
        }
    }

    // active entries, most recently accessed first; not counted as hits
    public List<CacheEntry> listEntries(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        requireInitialized();
        lock.lock();
        try {
            PreparedStatement stmt = statements().list;
            stmt.setLong(1, nowSeconds());
            stmt.setInt(2, limit);
            List<CacheEntry> entries = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String key = rs.getString(1);
                    entries.add(new CacheEntry(
                        key,
                        deserialize(key, rs.getString(2), Object.class),
                        Instant.ofEpochSecond(rs.getLong(3)),
                        Instant.ofEpochSecond(rs.getLong(4)),
                        Instant.ofEpochSecond(rs.getLong(5)),
                        rs.getLong(6)));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw storageFailure("list entries of", e);
        } finally {
            lock.unlock();
        }
    }

    public int getConsecutiveCleanupFailures() {
        return consecutiveCleanupFailures.get();
    }

    /**
     * Stops the reclamation cycle and closes the storage. Safe to call repeatedly; afterwards every
     * operation fails with {@link CacheNotInitializedException} until {@link #init()} is called again.
     */
    @Override
    public void close() {
        ScheduledExecutorService executor;
        lock.lock();
        try {
            executor = cleanupExecutor;
            cleanupExecutor = null;
        } finally {
            lock.unlock();
        }
        // must not hold the lock here, a running cleanup needs it to finish
        if (executor != null) {
            stopCleanup(executor);
        }

        lock.lock();
        try {
            if (connection == null) {
                return;
            }
            try {
                statements.close();
            } finally {
                try {
                    connection.close();
                    logger.info("Cache at {} closed", storagePath);
                } catch (SQLException e) {
                    logger.warn("Error while closing cache storage at {}", storagePath, e);
                } finally {
                    statements = null;
                    connection = null;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Derives a fixed-length key: strings are hashed as-is, anything else is first written as JSON with
     * map keys and properties sorted, so equal structures produce equal keys regardless of ordering.
     *
     * @return 32 lowercase hex characters (MD5)
     */
    public static String generateKey(Object input) {
        String canonical;
        if (input instanceof String) {
            canonical = (String) input;
        } else {
            try {
                canonical = CANONICAL_MAPPER.writeValueAsString(input);
            } catch (JsonProcessingException e) {
                throw new CacheSerializationException("Cannot derive cache key: " + e.getOriginalMessage(), e);
            }
        }
        return DigestUtils.md5DigestAsHex(canonical.getBytes(StandardCharsets.UTF_8));
    }

    void runScheduledCleanup() {
        try {
            int removed = cleanup();
            consecutiveCleanupFailures.set(0);
            if (removed > 0) {
                logger.info("Cache cleanup: removed {} expired entries", removed);
            }
        } catch (RuntimeException e) {
            int failures = consecutiveCleanupFailures.incrementAndGet();
            logger.error("Cache cleanup failed ({} consecutive failures)", failures, e);
        }
    }

    private void startCleanup() {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cache-cleanup");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleAtFixedRate(
            this::runScheduledCleanup, cleanupIntervalMillis, cleanupIntervalMillis, TimeUnit.MILLISECONDS);
        this.cleanupExecutor = executor;
    }

    private void stopCleanup(ScheduledExecutorService executor) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Cache cleanup task did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private String readAndTouch(String key) {
        lock.lock();
        try {
            long now = nowSeconds();
            PreparedStatement select = statements().get;
            select.setString(1, key);
            select.setLong(2, now);
            String json;
            try (ResultSet rs = select.executeQuery()) {
                if (!rs.next()) {
                    logger.debug("GET: key={}, found=false", key);
                    return null;
                }
                json = rs.getString(1);
            }

            PreparedStatement touch = statements().updateAccess;
            touch.setLong(1, now);
            touch.setString(2, key);
            touch.executeUpdate();
            logger.debug("GET: key={}, found=true", key);
            return json;
        } catch (SQLException e) {
            throw storageFailure("get", e);
        } finally {
            lock.unlock();
        }
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("Failed to serialize cache value: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T deserialize(String key, String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new CacheDeserializationException(
                "Failed to deserialize cache value for key " + key + ": " + e.getOriginalMessage(), e);
        }
    }

    Connection openConnection() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + storagePath);
    }

    private Statements statements() {
        if (statements == null) {
            throw new CacheNotInitializedException();
        }
        return statements;
    }

    private void requireInitialized() {
        if (connection == null) {
            throw new CacheNotInitializedException();
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Cache key cannot be null or empty");
        }
    }

    // saturates at the largest Instant instead of wrapping into the past
    private static long expiryFor(long now, long ttlSeconds) {
        long max = Instant.MAX.getEpochSecond();
        return ttlSeconds > max - now ? max : now + ttlSeconds;
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }

    private boolean isInMemory() {
        return IN_MEMORY.equals(storagePath);
    }

    private void createParentDirectory() throws IOException {
        Path parent = Path.of(storagePath).toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
            logger.info("Created cache directory {}", parent);
        }
    }

    private static CacheStorageException storageFailure(String operation, SQLException e) {
        return new CacheStorageException("Failed to " + operation + " cache: " + e.getMessage(), e);
    }

    // rebuilt on every init()
    private static final class Statements {
        final PreparedStatement set;
        final PreparedStatement get;
        final PreparedStatement updateAccess;
        final PreparedStatement has;
        final PreparedStatement delete;
        final PreparedStatement clear;
        final PreparedStatement cleanup;
        final PreparedStatement stats;
        final PreparedStatement list;

        Statements(Connection conn) throws SQLException {
            this.set = conn.prepareStatement(SET_SQL);
            this.get = conn.prepareStatement(GET_SQL);
            this.updateAccess = conn.prepareStatement(UPDATE_ACCESS_SQL);
            this.has = conn.prepareStatement(HAS_SQL);
            this.delete = conn.prepareStatement(DELETE_SQL);
            this.clear = conn.prepareStatement(CLEAR_SQL);
            this.cleanup = conn.prepareStatement(CLEANUP_SQL);
            this.stats = conn.prepareStatement(STATS_SQL);
            this.list = conn.prepareStatement(LIST_SQL);
        }

        void close() {
            for (PreparedStatement stmt : List.of(set, get, updateAccess, has, delete, clear, cleanup, stats, list)) {
                try {
                    stmt.close();
                } catch (SQLException e) {
                    logger.warn("Failed to close cache statement", e);
                }
            }
        }
    }
}
