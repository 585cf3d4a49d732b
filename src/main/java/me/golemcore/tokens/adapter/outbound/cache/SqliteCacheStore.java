package me.golemcore.tokens.adapter.outbound.cache;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tokens.domain.exception.CacheStoreException;
import me.golemcore.tokens.domain.model.FileFingerprint;
import me.golemcore.tokens.domain.model.UsageRecord;
import me.golemcore.tokens.port.outbound.CacheStorePort;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cache store backed by an SQLite database, {@code <cache-dir>/records.db}.
 *
 * <p>
 * Every {@link #insert} and {@link #prune} runs in its own transaction, so the
 * database is consistent after each call and {@link #flush()} has nothing to
 * do. The schema version is kept in {@code PRAGMA user_version}; a database
 * with another version is wiped and rebuilt.
 *
 * @since 1.0
 */
@Slf4j
public class SqliteCacheStore implements CacheStorePort {

    static final int SCHEMA_VERSION = 2;
    static final String DATABASE_FILE = "records.db";
    private static final String LOG_PREFIX = "[Cache]";

    private static final List<String> CREATE_SCHEMA_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS files (
                file_id    INTEGER PRIMARY KEY AUTOINCREMENT,
                provider   TEXT NOT NULL,
                path       TEXT NOT NULL,
                mtime_secs INTEGER NOT NULL,
                size       INTEGER NOT NULL,
                UNIQUE (provider, path)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS records (
                file_id                     INTEGER NOT NULL REFERENCES files (file_id) ON DELETE CASCADE,
                session_id                  TEXT NOT NULL,
                timestamp                   TEXT NOT NULL,
                project                     TEXT NOT NULL,
                model                       TEXT NOT NULL,
                message_id                  TEXT NOT NULL,
                request_id                  TEXT NOT NULL,
                input_tokens                INTEGER NOT NULL,
                output_tokens               INTEGER NOT NULL,
                cache_creation_input_tokens INTEGER NOT NULL,
                cache_read_input_tokens     INTEGER NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_records_file_id ON records (file_id)");

    private static final String SELECT_FINGERPRINT_SQL = """
            SELECT mtime_secs, size
            FROM files
            WHERE provider = :provider AND path = :path
            """;

    private static final String UPSERT_FILE_SQL = """
            INSERT INTO files (provider, path, mtime_secs, size)
            VALUES (:provider, :path, :mtime_secs, :size)
            ON CONFLICT (provider, path)
            DO UPDATE SET mtime_secs = excluded.mtime_secs, size = excluded.size
            """;

    private static final String SELECT_FILE_ID_SQL = """
            SELECT file_id FROM files WHERE provider = :provider AND path = :path
            """;

    private static final String DELETE_RECORDS_SQL = "DELETE FROM records WHERE file_id = :file_id";

    private static final String DELETE_FILE_SQL = "DELETE FROM files WHERE file_id = :file_id";

    private static final String INSERT_RECORD_SQL = """
            INSERT INTO records (file_id, session_id, timestamp, project, model, message_id, request_id,
                                 input_tokens, output_tokens, cache_creation_input_tokens, cache_read_input_tokens)
            VALUES (:file_id, :session_id, :timestamp, :project, :model, :message_id, :request_id,
                    :input_tokens, :output_tokens, :cache_creation_input_tokens, :cache_read_input_tokens)
            """;

    private static final String SELECT_PROVIDER_FILES_SQL = """
            SELECT file_id, path FROM files WHERE provider = :provider
            """;

    private static final String SELECT_ALL_RECORDS_SQL = """
            SELECT f.provider, r.session_id, r.timestamp, r.project, r.model, r.message_id, r.request_id,
                   r.input_tokens, r.output_tokens, r.cache_creation_input_tokens, r.cache_read_input_tokens
            FROM records r
            JOIN files f ON f.file_id = r.file_id
            ORDER BY r.file_id, r.rowid
            """;

    private final SingleConnectionDataSource dataSource;
    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    /**
     * Opens or creates the database under {@code cacheDirectory}.
     *
     * @throws CacheStoreException
     *             when the database cannot be opened or initialized
     */
    public SqliteCacheStore(Path cacheDirectory) {
        Path databaseFile = cacheDirectory.resolve(DATABASE_FILE);
        try {
            Files.createDirectories(cacheDirectory);
        } catch (IOException e) {
            throw new CacheStoreException("Cannot create cache directory " + cacheDirectory, e);
        }
        this.dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + databaseFile, true);
        this.dataSource.setDriverClassName("org.sqlite.JDBC");
        this.jdbc = new NamedParameterJdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        try {
            initialize();
        } catch (DataAccessException e) {
            dataSource.destroy();
            throw new CacheStoreException("Cannot open cache database " + databaseFile, e);
        }
        log.debug("{} Opened {}", LOG_PREFIX, databaseFile);
    }

    private void initialize() {
        JdbcTemplate plain = jdbc.getJdbcTemplate();
        plain.queryForObject("PRAGMA journal_mode = WAL", String.class);
        plain.execute("PRAGMA synchronous = NORMAL");
        plain.execute("PRAGMA foreign_keys = ON");

        Integer version = plain.queryForObject("PRAGMA user_version", Integer.class);
        int current = version != null ? version : 0;
        if (current != 0 && current != SCHEMA_VERSION) {
            log.warn("{} Cache schema version {} differs from {}, rebuilding", LOG_PREFIX, current,
                    SCHEMA_VERSION);
            plain.execute("DROP TABLE IF EXISTS records");
            plain.execute("DROP TABLE IF EXISTS files");
        }
        for (String sql : CREATE_SCHEMA_SQL) {
            plain.execute(sql);
        }
        plain.execute("PRAGMA user_version = " + SCHEMA_VERSION);
    }

    @Override
    public String getBackendName() {
        return "sqlite";
    }

    @Override
    public boolean isCached(String provider, String path, FileFingerprint fingerprint) {
        List<FileFingerprint> stored = jdbc.query(SELECT_FINGERPRINT_SQL,
                new MapSqlParameterSource()
                        .addValue("provider", provider)
                        .addValue("path", path),
                (rs, rowNum) -> new FileFingerprint(rs.getLong("mtime_secs"), rs.getLong("size")));
        return !stored.isEmpty() && stored.get(0).equals(fingerprint);
    }

    @Override
    public void insert(String provider, String path, FileFingerprint fingerprint, List<UsageRecord> records) {
        transactionTemplate.executeWithoutResult(status -> {
            MapSqlParameterSource fileParams = new MapSqlParameterSource()
                    .addValue("provider", provider)
                    .addValue("path", path)
                    .addValue("mtime_secs", fingerprint.mtimeSeconds())
                    .addValue("size", fingerprint.sizeBytes());
            jdbc.update(UPSERT_FILE_SQL, fileParams);
            Long fileId = jdbc.queryForObject(SELECT_FILE_ID_SQL, fileParams, Long.class);

            jdbc.update(DELETE_RECORDS_SQL, new MapSqlParameterSource("file_id", fileId));
            if (!records.isEmpty()) {
                MapSqlParameterSource[] batch = records.stream()
                        .map(record -> recordParams(fileId, record))
                        .toArray(MapSqlParameterSource[]::new);
                jdbc.batchUpdate(INSERT_RECORD_SQL, batch);
            }
        });
    }

    @Override
    public void prune(String provider, Collection<String> knownPaths) {
        Set<String> known = new HashSet<>(knownPaths);
        transactionTemplate.executeWithoutResult(status -> {
            MapSqlParameterSource[] stale = jdbc.query(SELECT_PROVIDER_FILES_SQL,
                    new MapSqlParameterSource("provider", provider),
                    (rs, rowNum) -> new StoredFile(rs.getLong("file_id"), rs.getString("path")))
                    .stream()
                    .filter(file -> !known.contains(file.path()))
                    .map(file -> new MapSqlParameterSource("file_id", file.fileId()))
                    .toArray(MapSqlParameterSource[]::new);
            if (stale.length > 0) {
                jdbc.batchUpdate(DELETE_RECORDS_SQL, stale);
                jdbc.batchUpdate(DELETE_FILE_SQL, stale);
                log.debug("{} Pruned {} vanished {} files", LOG_PREFIX, stale.length, provider);
            }
        });
    }

    @Override
    public void flush() {
        // Each insert and prune already committed.
    }

    /**
     * Reads every stored record. Rows stay in the database for the next run.
     * Rows that cannot be decoded are skipped, and a failed query yields no
     * records.
     */
    @Override
    public List<UsageRecord> drainAll() {
        List<UsageRecord> records = new ArrayList<>();
        try {
            jdbc.query(SELECT_ALL_RECORDS_SQL, new MapSqlParameterSource(), (RowCallbackHandler) rs -> {
                try {
                    records.add(toRecord(rs));
                } catch (SQLException | DateTimeException e) {
                    log.warn("{} Skipping undecodable cached record: {}", LOG_PREFIX, e.getMessage());
                }
            });
        } catch (DataAccessException e) {
            log.warn("{} Failed to read cached records: {}", LOG_PREFIX, e.getMessage());
            return List.of();
        }
        return records;
    }

    private static UsageRecord toRecord(ResultSet rs) throws SQLException {
        return UsageRecord.builder()
                .provider(rs.getString("provider"))
                .sessionId(rs.getString("session_id"))
                .timestamp(Instant.parse(rs.getString("timestamp")))
                .project(rs.getString("project"))
                .model(rs.getString("model"))
                .messageId(rs.getString("message_id"))
                .requestId(rs.getString("request_id"))
                .inputTokens(rs.getLong("input_tokens"))
                .outputTokens(rs.getLong("output_tokens"))
                .cacheCreationInputTokens(rs.getLong("cache_creation_input_tokens"))
                .cacheReadInputTokens(rs.getLong("cache_read_input_tokens"))
                .build();
    }

    @Override
    public void close() {
        dataSource.destroy();
    }

    private static MapSqlParameterSource recordParams(Long fileId, UsageRecord record) {
        return new MapSqlParameterSource()
                .addValue("file_id", fileId)
                .addValue("session_id", record.getSessionId())
                .addValue("timestamp", record.getTimestamp().toString())
                .addValue("project", record.getProject())
                .addValue("model", record.getModel())
                .addValue("message_id", record.getMessageId())
                .addValue("request_id", record.getRequestId())
                .addValue("input_tokens", record.getInputTokens())
                .addValue("output_tokens", record.getOutputTokens())
                .addValue("cache_creation_input_tokens", record.getCacheCreationInputTokens())
                .addValue("cache_read_input_tokens", record.getCacheReadInputTokens());
    }

    private record StoredFile(long fileId, String path) {
    }
}
