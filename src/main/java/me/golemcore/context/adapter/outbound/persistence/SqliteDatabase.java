package me.golemcore.context.adapter.outbound.persistence;

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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.exception.StorageException;
import me.golemcore.context.infrastructure.config.EngineProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * SQLite database holding messages, checkpoints and compacted sessions.
 *
 * <p>
 * Connections are opened per operation in WAL mode. {@link #inTransaction}
 * commits on success and rolls back on any failure, so a failed batch leaves no
 * partial rows behind. SQL and serialization failures surface as
 * {@link StorageException}.
 */
@Component
@Slf4j
public class SqliteDatabase {

    private static final List<String> SCHEMA = List.of("""
            CREATE TABLE IF NOT EXISTS chat_messages (
                id TEXT PRIMARY KEY,
                conversation_id TEXT NOT NULL,
                role TEXT NOT NULL,
                content TEXT,
                timestamp INTEGER NOT NULL,
                token_count INTEGER,
                tool_call_id TEXT,
                tool_name TEXT,
                compression_state TEXT NOT NULL DEFAULT 'ACTIVE',
                replaced_by TEXT,
                is_summary INTEGER NOT NULL DEFAULT 0,
                condense_id TEXT,
                is_pruned INTEGER NOT NULL DEFAULT 0,
                checkpoint_id TEXT
            )
            """, """
            CREATE INDEX IF NOT EXISTS idx_chat_messages_conversation
            ON chat_messages(conversation_id, timestamp)
            """, """
            CREATE TABLE IF NOT EXISTS chat_checkpoints (
                id TEXT PRIMARY KEY,
                session_id TEXT NOT NULL,
                name TEXT NOT NULL,
                message_count INTEGER NOT NULL,
                token_count INTEGER NOT NULL,
                summary TEXT,
                messages_snapshot TEXT NOT NULL,
                created_at INTEGER NOT NULL
            )
            """, """
            CREATE INDEX IF NOT EXISTS idx_chat_checkpoints_session
            ON chat_checkpoints(session_id, created_at DESC)
            """, """
            CREATE TABLE IF NOT EXISTS compacted_sessions (
                id TEXT PRIMARY KEY,
                session_id TEXT NOT NULL,
                summary TEXT NOT NULL,
                key_topics TEXT NOT NULL DEFAULT '[]',
                decisions TEXT NOT NULL DEFAULT '[]',
                message_start TEXT,
                message_end TEXT,
                message_count INTEGER NOT NULL DEFAULT 0,
                created_at INTEGER NOT NULL,
                last_accessed_at INTEGER NOT NULL,
                access_count INTEGER NOT NULL DEFAULT 0,
                tier TEXT NOT NULL DEFAULT 'mid-term',
                tier_updated_at INTEGER,
                promotion_history TEXT NOT NULL DEFAULT '[]'
            )
            """, """
            CREATE INDEX IF NOT EXISTS idx_compacted_sessions_session
            ON compacted_sessions(session_id)
            """, """
            CREATE INDEX IF NOT EXISTS idx_compacted_sessions_promotion
            ON compacted_sessions(tier, access_count DESC, last_accessed_at ASC)
            """);

    private final EngineProperties properties;

    private String jdbcUrl;

    public SqliteDatabase(EngineProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        EngineProperties.StorageProperties storage = properties.getStorage();
        Path basePath = Paths.get(storage.getBasePath().replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        Path dbPath = basePath.resolve(storage.getDatabaseFile()).normalize();
        try {
            Files.createDirectories(dbPath.getParent());
        } catch (IOException e) {
            throw new StorageException("Failed to create database directory: " + dbPath.getParent(), e);
        }
        this.jdbcUrl = "jdbc:sqlite:" + dbPath;

        inTransaction("initialize schema", connection -> {
            try (Statement statement = connection.createStatement()) {
                for (String ddl : SCHEMA) {
                    statement.execute(ddl);
                }
            }
            return null;
        });
        log.info("[Store] SQLite database ready at: {}", dbPath);
    }

    public <T> T read(String operation, SqlWork<T> work) {
        try (Connection connection = openConnection()) {
            return work.apply(connection);
        } catch (SQLException | IOException e) {
            throw new StorageException("Failed to " + operation, e);
        }
    }

    public <T> T inTransaction(String operation, SqlWork<T> work) {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                T result = work.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException | IOException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException | IOException e) {
            throw new StorageException("Failed to " + operation, e);
        }
    }

    private Connection openConnection() throws SQLException {
        if (jdbcUrl == null) {
            throw new IllegalStateException("SQLite database is not initialized");
        }
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.warn("[Store] Rollback failed: {}", e.getMessage());
        }
    }

    /**
     * Unit of work against an open connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException, IOException;
    }
}
