package com.example.responsecache.core;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheServiceFileStorageTest {

    @TempDir
    Path tempDir;

    @Test
    void createsMissingDirectoryAndEnablesWal() throws Exception {
        Path dbFile = tempDir.resolve("nested/dir/cache.db");
        CacheService cache = new CacheService(dbFile.toString(), 60, 60_000);
        try {
            cache.init();

            assertThat(Files.isDirectory(dbFile.getParent())).isTrue();
            assertThat(Files.exists(dbFile)).isTrue();
            try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile);
                 Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("PRAGMA journal_mode")) {
                assertThat(rs.next()).isTrue();
                assertThat(rs.getString(1)).isEqualToIgnoringCase("wal");
            }
        } finally {
            cache.close();
        }
    }

    @Test
    void entriesSurviveRestart() {
        String path = tempDir.resolve("cache.db").toString();

        CacheService first = new CacheService(path, 3600, 60_000);
        first.init();
        first.set("report", Map.of("rows", 12), 600);
        first.get("report");
        first.close();

        CacheService second = new CacheService(path, 3600, 60_000);
        second.init();
        try {
            assertThat(second.get("report")).contains(Map.of("rows", 12));
            assertThat(second.listEntries(1).get(0).getHitCount()).isEqualTo(3);
        } finally {
            second.close();
        }
    }

    @Test
    void generatedKeysAreStableAcrossInstances() {
        String path = tempDir.resolve("keys.db").toString();
        String key = CacheService.generateKey(Map.of("query", "users", "page", 2));

        CacheService first = new CacheService(path, 3600, 60_000);
        first.init();
        first.set(key, "cached", 600);
        first.close();

        CacheService second = new CacheService(path, 3600, 60_000);
        second.init();
        try {
            assertThat(second.get(CacheService.generateKey(Map.of("page", 2, "query", "users")))).contains("cached");
        } finally {
            second.close();
        }
    }

    @Test
    void unreachableStorageFailsInitialization() throws Exception {
        Path blocker = Files.createFile(tempDir.resolve("not-a-directory"));
        CacheService cache = new CacheService(blocker.resolve("cache.db").toString(), 60, 60_000);

        assertThatThrownBy(cache::init).isInstanceOf(CacheInitializationException.class);
        assertThat(cache.isInitialized()).isFalse();
        assertThatThrownBy(() -> cache.get("k")).isInstanceOf(CacheNotInitializedException.class);
    }
}
