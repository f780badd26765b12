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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.context.domain.model.Checkpoint;
import me.golemcore.context.domain.model.Message;
import me.golemcore.context.port.outbound.CheckpointStorePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link CheckpointStorePort} backed by the {@code chat_checkpoints} table. The
 * message snapshot is kept as a JSON array.
 */
@Component
@RequiredArgsConstructor
public class SqliteCheckpointStore implements CheckpointStorePort {

    private static final TypeReference<List<Message>> MESSAGE_LIST = new TypeReference<>() {
    };

    private static final String COLUMNS = "id, session_id, name, message_count, token_count, summary, "
            + "messages_snapshot, created_at";

    private static final String NEWEST_FIRST = " ORDER BY created_at DESC, rowid DESC";

    private final SqliteDatabase database;
    private final ObjectMapper objectMapper;

    @Override
    public void save(Checkpoint checkpoint) {
        database.inTransaction("save checkpoint " + checkpoint.id(), connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO chat_checkpoints (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
                statement.setString(1, checkpoint.id());
                statement.setString(2, checkpoint.sessionId());
                statement.setString(3, checkpoint.name());
                statement.setInt(4, checkpoint.messageCount());
                statement.setLong(5, checkpoint.tokenCount());
                statement.setString(6, checkpoint.summary());
                statement.setString(7, objectMapper.writeValueAsString(checkpoint.messagesSnapshot()));
                statement.setLong(8, checkpoint.createdAt().toEpochMilli());
                statement.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public Optional<Checkpoint> findById(String id) {
        return database.read("find checkpoint " + id, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM chat_checkpoints WHERE id = ?")) {
                statement.setString(1, id);
                return first(readAll(statement));
            }
        });
    }

    @Override
    public List<Checkpoint> listBySession(String sessionId) {
        return database.read("list checkpoints of " + sessionId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM chat_checkpoints WHERE session_id = ?" + NEWEST_FIRST)) {
                statement.setString(1, sessionId);
                return readAll(statement);
            }
        });
    }

    @Override
    public Optional<Checkpoint> findLatest(String sessionId) {
        return database.read("find latest checkpoint of " + sessionId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM chat_checkpoints WHERE session_id = ?" + NEWEST_FIRST
                            + " LIMIT 1")) {
                statement.setString(1, sessionId);
                return first(readAll(statement));
            }
        });
    }

    @Override
    public boolean delete(String id) {
        return database.inTransaction("delete checkpoint " + id, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "DELETE FROM chat_checkpoints WHERE id = ?")) {
                statement.setString(1, id);
                return statement.executeUpdate() > 0;
            }
        });
    }

    @Override
    public int deleteBySession(String sessionId) {
        return database.inTransaction("delete checkpoints of " + sessionId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "DELETE FROM chat_checkpoints WHERE session_id = ?")) {
                statement.setString(1, sessionId);
                return statement.executeUpdate();
            }
        });
    }

    private List<Checkpoint> readAll(PreparedStatement statement) throws SQLException, IOException {
        List<Checkpoint> checkpoints = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                checkpoints.add(Checkpoint.builder()
                        .id(rs.getString("id"))
                        .sessionId(rs.getString("session_id"))
                        .name(rs.getString("name"))
                        .messageCount(rs.getInt("message_count"))
                        .tokenCount(rs.getLong("token_count"))
                        .summary(rs.getString("summary"))
                        .messagesSnapshot(objectMapper.readValue(rs.getString("messages_snapshot"), MESSAGE_LIST))
                        .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                        .build());
            }
        }
        return checkpoints;
    }

    private static Optional<Checkpoint> first(List<Checkpoint> checkpoints) {
        return checkpoints.isEmpty() ? Optional.empty() : Optional.of(checkpoints.get(0));
    }
}
