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
import me.golemcore.context.domain.model.CompactedSession;
import me.golemcore.context.domain.model.MemoryTier;
import me.golemcore.context.domain.model.TierTransition;
import me.golemcore.context.port.outbound.CompactedSessionStorePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link CompactedSessionStorePort} backed by the {@code compacted_sessions}
 * table. Topic, decision and history lists are stored as JSON arrays.
 */
@Component
@RequiredArgsConstructor
public class SqliteCompactedSessionStore implements CompactedSessionStorePort {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<TierTransition>> HISTORY = new TypeReference<>() {
    };

    private static final String COLUMNS = """
            id, session_id, summary, key_topics, decisions, message_start, message_end, message_count,
            created_at, last_accessed_at, access_count, tier, tier_updated_at, promotion_history
            """;

    private static final String UPSERT = "INSERT OR REPLACE INTO compacted_sessions (" + COLUMNS
            + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final SqliteDatabase database;
    private final ObjectMapper objectMapper;

    @Override
    public void save(CompactedSession session) {
        database.inTransaction("save memory " + session.getId(), connection -> {
            try (PreparedStatement statement = connection.prepareStatement(UPSERT)) {
                statement.setString(1, session.getId());
                statement.setString(2, session.getSessionId());
                statement.setString(3, session.getSummary());
                statement.setString(4, json(session.getKeyTopics()));
                statement.setString(5, json(session.getDecisions()));
                statement.setString(6, session.getMessageStart());
                statement.setString(7, session.getMessageEnd());
                statement.setInt(8, session.getMessageCount());
                statement.setLong(9, session.getCreatedAt().toEpochMilli());
                statement.setLong(10, session.getLastAccessedAt().toEpochMilli());
                statement.setInt(11, session.getAccessCount());
                statement.setString(12, tier(session).getValue());
                setNullableInstant(statement, 13, session.getTierUpdatedAt());
                statement.setString(14, json(session.getPromotionHistory()));
                statement.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public Optional<CompactedSession> findById(String id) {
        return database.read("find memory " + id, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM compacted_sessions WHERE id = ?")) {
                statement.setString(1, id);
                List<CompactedSession> found = readAll(statement);
                return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
            }
        });
    }

    @Override
    public List<CompactedSession> listBySession(String sessionId) {
        return database.read("list memories of " + sessionId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM compacted_sessions WHERE session_id = ?"
                            + " ORDER BY created_at ASC, rowid ASC")) {
                statement.setString(1, sessionId);
                return readAll(statement);
            }
        });
    }

    @Override
    public List<CompactedSession> listByTier(MemoryTier tier) {
        return database.read("list " + tier.getValue() + " memories", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM compacted_sessions WHERE tier = ?"
                            + " ORDER BY created_at ASC, rowid ASC")) {
                statement.setString(1, tier.getValue());
                return readAll(statement);
            }
        });
    }

    @Override
    public List<CompactedSession> listAll() {
        return database.read("list memories", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM compacted_sessions ORDER BY created_at ASC, rowid ASC")) {
                return readAll(statement);
            }
        });
    }

    @Override
    public List<CompactedSession> findForPromotion(int limit) {
        return database.read("find promotion candidates", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM compacted_sessions WHERE tier = ?"
                            + " ORDER BY access_count DESC, last_accessed_at ASC, rowid ASC LIMIT ?")) {
                statement.setString(1, MemoryTier.MID_TERM.getValue());
                statement.setInt(2, limit);
                return readAll(statement);
            }
        });
    }

    @Override
    public int recordAccess(String sessionId, Instant accessedAt) {
        return database.inTransaction("record access for " + sessionId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    UPDATE compacted_sessions
                    SET access_count = access_count + 1, last_accessed_at = ?
                    WHERE session_id = ?
                    """)) {
                statement.setLong(1, accessedAt.toEpochMilli());
                statement.setString(2, sessionId);
                return statement.executeUpdate();
            }
        });
    }

    @Override
    public boolean compareAndPromote(String id, Instant expectedLastAccessedAt, MemoryTier to, Instant at,
            List<TierTransition> promotionHistory) {
        return database.inTransaction("promote memory " + id, connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    UPDATE compacted_sessions
                    SET tier = ?, tier_updated_at = ?, promotion_history = ?
                    WHERE id = ? AND tier = ? AND last_accessed_at = ?
                    """)) {
                statement.setString(1, to.getValue());
                statement.setLong(2, at.toEpochMilli());
                statement.setString(3, json(promotionHistory));
                statement.setString(4, id);
                statement.setString(5, MemoryTier.MID_TERM.getValue());
                statement.setLong(6, expectedLastAccessedAt.toEpochMilli());
                return statement.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean deleteIfUnchanged(String id, Instant expectedLastAccessedAt) {
        return database.inTransaction("expire memory " + id, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "DELETE FROM compacted_sessions WHERE id = ? AND tier = ? AND last_accessed_at = ?")) {
                statement.setString(1, id);
                statement.setString(2, MemoryTier.MID_TERM.getValue());
                statement.setLong(3, expectedLastAccessedAt.toEpochMilli());
                return statement.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean delete(String id) {
        return database.inTransaction("delete memory " + id, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "DELETE FROM compacted_sessions WHERE id = ?")) {
                statement.setString(1, id);
                return statement.executeUpdate() > 0;
            }
        });
    }

    @Override
    public long count(MemoryTier tier) {
        return database.read("count " + tier.getValue() + " memories", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT COUNT(*) FROM compacted_sessions WHERE tier = ?")) {
                statement.setString(1, tier.getValue());
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            }
        });
    }

    private List<CompactedSession> readAll(PreparedStatement statement) throws SQLException, IOException {
        List<CompactedSession> sessions = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                long tierUpdated = rs.getLong("tier_updated_at");
                Instant tierUpdatedAt = rs.wasNull() ? null : Instant.ofEpochMilli(tierUpdated);
                sessions.add(CompactedSession.builder()
                        .id(rs.getString("id"))
                        .sessionId(rs.getString("session_id"))
                        .summary(rs.getString("summary"))
                        .keyTopics(new ArrayList<>(objectMapper.readValue(rs.getString("key_topics"), STRING_LIST)))
                        .decisions(new ArrayList<>(objectMapper.readValue(rs.getString("decisions"), STRING_LIST)))
                        .messageStart(rs.getString("message_start"))
                        .messageEnd(rs.getString("message_end"))
                        .messageCount(rs.getInt("message_count"))
                        .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                        .lastAccessedAt(Instant.ofEpochMilli(rs.getLong("last_accessed_at")))
                        .accessCount(rs.getInt("access_count"))
                        .tier(MemoryTier.fromValue(rs.getString("tier")))
                        .tierUpdatedAt(tierUpdatedAt)
                        .promotionHistory(new ArrayList<>(
                                objectMapper.readValue(rs.getString("promotion_history"), HISTORY)))
                        .build());
            }
        }
        return sessions;
    }

    private String json(List<?> values) throws IOException {
        return objectMapper.writeValueAsString(values != null ? values : List.of());
    }

    private static MemoryTier tier(CompactedSession session) {
        return session.getTier() != null ? session.getTier() : MemoryTier.MID_TERM;
    }

    private static void setNullableInstant(PreparedStatement statement, int index, Instant value)
            throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value.toEpochMilli());
        }
    }
}
