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

import lombok.RequiredArgsConstructor;
import me.golemcore.context.domain.model.CompressionState;
import me.golemcore.context.domain.model.Message;
import me.golemcore.context.port.outbound.MessageStorePort;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link MessageStorePort} backed by the {@code chat_messages} table.
 * Timestamps are stored as epoch milliseconds. Content and token count are
 * written once on insert; updates only move the compression flags. A message
 * keeps the first checkpoint id it was given.
 */
@Component
@RequiredArgsConstructor
public class SqliteMessageStore implements MessageStorePort {

    private static final String COLUMNS = """
            id, conversation_id, role, content, timestamp, token_count, tool_call_id, tool_name,
            compression_state, replaced_by, is_summary, condense_id, is_pruned, checkpoint_id
            """;

    private static final String INSERT = "INSERT INTO chat_messages (" + COLUMNS
            + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE = """
            UPDATE chat_messages
            SET compression_state = ?, replaced_by = ?, is_pruned = ?, checkpoint_id = COALESCE(checkpoint_id, ?)
            WHERE id = ?
            """;

    private static final String ORDER = " ORDER BY timestamp ASC, rowid ASC";

    private final SqliteDatabase database;

    @Override
    public void append(Message message) {
        database.inTransaction("append message " + message.getId(), connection -> {
            insertAll(connection, List.of(message));
            return null;
        });
    }

    @Override
    public List<Message> listByConversation(String conversationId) {
        return database.read("list messages of " + conversationId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM chat_messages WHERE conversation_id = ?" + ORDER)) {
                statement.setString(1, conversationId);
                return readAll(statement);
            }
        });
    }

    @Override
    public List<Message> listActive(String conversationId) {
        return database.read("list active messages of " + conversationId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM chat_messages WHERE conversation_id = ? AND compression_state = ?"
                            + ORDER)) {
                statement.setString(1, conversationId);
                statement.setString(2, CompressionState.ACTIVE.name());
                return readAll(statement);
            }
        });
    }

    @Override
    public void updateAll(List<Message> updated, List<Message> inserted) {
        if (updated.isEmpty() && inserted.isEmpty()) {
            return;
        }
        database.inTransaction("update messages", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(UPDATE)) {
                for (Message message : updated) {
                    statement.setString(1, state(message).name());
                    statement.setString(2, message.getReplacedBy());
                    statement.setInt(3, message.isPruned() ? 1 : 0);
                    statement.setString(4, message.getCheckpointId());
                    statement.setString(5, message.getId());
                    statement.addBatch();
                }
                int[] counts = statement.executeBatch();
                for (int i = 0; i < counts.length; i++) {
                    if (counts[i] == 0) {
                        throw new SQLException("Message not found: " + updated.get(i).getId());
                    }
                }
            }
            insertAll(connection, inserted);
            return null;
        });
    }

    @Override
    public int countByConversation(String conversationId) {
        return database.read("count messages of " + conversationId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT COUNT(*) FROM chat_messages WHERE conversation_id = ?")) {
                statement.setString(1, conversationId);
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    @Override
    public Optional<Instant> findLatestTimestamp(String conversationId) {
        return database.read("find latest timestamp of " + conversationId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT MAX(timestamp) FROM chat_messages WHERE conversation_id = ?")) {
                statement.setString(1, conversationId);
                try (ResultSet rs = statement.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    long millis = rs.getLong(1);
                    return rs.wasNull() ? Optional.empty() : Optional.of(Instant.ofEpochMilli(millis));
                }
            }
        });
    }

    @Override
    public boolean existsAll(Collection<String> ids) {
        Set<String> distinct = new LinkedHashSet<>(ids);
        if (distinct.isEmpty()) {
            return true;
        }
        String placeholders = String.join(", ", Collections.nCopies(distinct.size(), "?"));
        return database.read("check message ids", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT COUNT(*) FROM chat_messages WHERE id IN (" + placeholders + ")")) {
                int index = 1;
                for (String id : distinct) {
                    statement.setString(index++, id);
                }
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next() && rs.getInt(1) == distinct.size();
                }
            }
        });
    }

    @Override
    public int deleteByConversation(String conversationId) {
        return database.inTransaction("delete messages of " + conversationId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "DELETE FROM chat_messages WHERE conversation_id = ?")) {
                statement.setString(1, conversationId);
                return statement.executeUpdate();
            }
        });
    }

    private void insertAll(Connection connection, List<Message> messages) throws SQLException {
        if (messages.isEmpty()) {
            return;
        }
        try (PreparedStatement statement = connection.prepareStatement(INSERT)) {
            for (Message message : messages) {
                statement.setString(1, message.getId());
                statement.setString(2, message.getConversationId());
                statement.setString(3, message.getRole());
                statement.setString(4, message.getContent());
                statement.setLong(5, message.getTimestamp().toEpochMilli());
                setNullableInt(statement, 6, message.getTokenCount());
                statement.setString(7, message.getToolCallId());
                statement.setString(8, message.getToolName());
                statement.setString(9, state(message).name());
                statement.setString(10, message.getReplacedBy());
                statement.setInt(11, message.isSummary() ? 1 : 0);
                statement.setString(12, message.getCondenseId());
                statement.setInt(13, message.isPruned() ? 1 : 0);
                statement.setString(14, message.getCheckpointId());
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private List<Message> readAll(PreparedStatement statement) throws SQLException {
        List<Message> messages = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                messages.add(map(rs));
            }
        }
        return messages;
    }

    private Message map(ResultSet rs) throws SQLException {
        int tokenCount = rs.getInt("token_count");
        Integer tokens = rs.wasNull() ? null : tokenCount;
        return Message.builder()
                .id(rs.getString("id"))
                .conversationId(rs.getString("conversation_id"))
                .role(rs.getString("role"))
                .content(rs.getString("content"))
                .timestamp(Instant.ofEpochMilli(rs.getLong("timestamp")))
                .tokenCount(tokens)
                .toolCallId(rs.getString("tool_call_id"))
                .toolName(rs.getString("tool_name"))
                .compressionState(CompressionState.valueOf(rs.getString("compression_state")))
                .replacedBy(rs.getString("replaced_by"))
                .summary(rs.getInt("is_summary") == 1)
                .condenseId(rs.getString("condense_id"))
                .pruned(rs.getInt("is_pruned") == 1)
                .checkpointId(rs.getString("checkpoint_id"))
                .build();
    }

    private CompressionState state(Message message) {
        return message.getCompressionState() != null ? message.getCompressionState() : CompressionState.ACTIVE;
    }

    private void setNullableInt(PreparedStatement statement, int index, Integer value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setInt(index, value);
        }
    }
}
