package me.golemcore.tokens.adapter.outbound.cache;

import me.golemcore.tokens.domain.exception.CacheStoreException;
import me.golemcore.tokens.domain.model.UsageRecord;
import me.golemcore.tokens.port.outbound.CacheStorePort;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static me.golemcore.tokens.testsupport.UsageRecords.record;
import static org.junit.jupiter.api.Assertions.*;

class SqliteCacheStoreTest extends AbstractCacheStoreContractTest {

    @Override
    protected CacheStorePort open(Path directory) {
        return new SqliteCacheStore(directory);
    }

    private <T> T query(String sql, Class<T> type) {
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(
                "jdbc:sqlite:" + cacheDir.resolve(SqliteCacheStore.DATABASE_FILE), true);
        try {
            return new JdbcTemplate(dataSource).queryForObject(sql, type);
        } finally {
            dataSource.destroy();
        }
    }

    private void execute(String sql) {
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(
                "jdbc:sqlite:" + cacheDir.resolve(SqliteCacheStore.DATABASE_FILE), true);
        try {
            new JdbcTemplate(dataSource).execute(sql);
        } finally {
            dataSource.destroy();
        }
    }

    @Test
    void createsDatabaseWithCurrentSchemaVersion() {
        assertTrue(Files.exists(cacheDir.resolve(SqliteCacheStore.DATABASE_FILE)));
        assertEquals(SqliteCacheStore.SCHEMA_VERSION, query("PRAGMA user_version", Integer.class));
    }

    @Test
    void replacingEntryLeavesNoOrphanRecords() {
        store.insert("claude", "/a.jsonl", FP, List.of(record("claude", "a", "x", 1, 1),
                record("claude", "b", "x", 1, 1)));
        store.insert("claude", "/a.jsonl", FP, List.of(record("claude", "c", "x", 1, 1)));

        assertEquals(1, query("SELECT COUNT(*) FROM records", Integer.class));
        assertEquals(1, query("SELECT COUNT(*) FROM files", Integer.class));
    }

    @Test
    void pruneDeletesRecordsOfRemovedFiles() {
        store.insert("claude", "/a.jsonl", FP, List.of(record("claude", "a", "x", 1, 1)));
        store.insert("claude", "/b.jsonl", FP, List.of(record("claude", "b", "x", 1, 1)));

        store.prune("claude", List.of("/b.jsonl"));

        assertEquals(1, query("SELECT COUNT(*) FROM records", Integer.class));
    }

    @Test
    void olderSchemaIsDroppedAndRebuilt() {
        store.insert("claude", "/a.jsonl", FP, List.of(record("claude", "a", "x", 1, 1)));
        store.close();
        execute("PRAGMA user_version = 1");

        store = new SqliteCacheStore(cacheDir);

        assertFalse(store.isCached("claude", "/a.jsonl", FP));
        assertTrue(store.drainAll().isEmpty());
        assertEquals(SqliteCacheStore.SCHEMA_VERSION, query("PRAGMA user_version", Integer.class));
    }

    @Test
    void drainLeavesRowsForNextRun() {
        store.insert("claude", "/a.jsonl", FP, List.of(record("claude", "a", "x", 1, 1)));

        assertEquals(1, store.drainAll().size());
        assertEquals(1, store.drainAll().size());
    }

    @Test
    void undecodableRowIsSkippedOnDrain() {
        store.insert("claude", "/a.jsonl", FP, List.of(record("claude", "a", "x", 1, 1),
                record("claude", "b", "x", 1, 1)));
        store.close();
        execute("UPDATE records SET timestamp = 'garbage' WHERE message_id = 'a'");

        store = new SqliteCacheStore(cacheDir);
        List<UsageRecord> drained = store.drainAll();

        assertEquals(1, drained.size());
        assertEquals("b", drained.get(0).getMessageId());
    }

    @Test
    void unopenableDatabaseIsFatal() throws IOException {
        Path dir = cacheDir.resolve("broken");
        Files.createDirectories(dir.resolve(SqliteCacheStore.DATABASE_FILE));

        assertThrows(CacheStoreException.class, () -> new SqliteCacheStore(dir));
    }
}
