package com.phillippitts.voicegate.service.conversation;

import com.phillippitts.voicegate.domain.ConversationTurn;
import com.phillippitts.voicegate.domain.EngagementLevel;
import com.phillippitts.voicegate.domain.Speaker;
import com.phillippitts.voicegate.domain.TurnAnnotations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionOperations;

import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link TurnStore} over the {@code conversation_turns} table. Batches are written in one transaction.
 */
@Repository
public class JdbcTurnStore implements TurnStore {

    private static final String COLUMNS = "session_id, turn_number, speaker, text, captured_at, confidence, "
            + "response_time_ms, topic, requires_follow_up, contains_feedback, engagement_level";

    private static final RowMapper<ConversationTurn> ROW_MAPPER = (rs, rowNum) -> {
        String engagement = rs.getString("engagement_level");
        double confidence = rs.getDouble("confidence");
        Double conf = rs.wasNull() ? null : confidence;
        long responseTime = rs.getLong("response_time_ms");
        Long rt = rs.wasNull() ? null : responseTime;
        return new ConversationTurn(
                rs.getString("session_id"),
                Speaker.valueOf(rs.getString("speaker").toUpperCase(Locale.ROOT)),
                rs.getInt("turn_number"),
                rs.getString("text"),
                rs.getTimestamp("captured_at").toInstant(),
                conf,
                rt,
                new TurnAnnotations(
                        rs.getString("topic"),
                        rs.getBoolean("requires_follow_up"),
                        rs.getBoolean("contains_feedback"),
                        engagement == null ? null : EngagementLevel.valueOf(engagement.toUpperCase(Locale.ROOT))));
    };

    private final JdbcTemplate jdbc;
    private final TransactionOperations tx;

    public JdbcTurnStore(JdbcTemplate jdbc, TransactionOperations tx) {
        this.jdbc = Objects.requireNonNull(jdbc);
        this.tx = Objects.requireNonNull(tx);
    }

    @Override
    public void saveAll(List<ConversationTurn> turns) {
        if (turns.isEmpty()) {
            return;
        }
        tx.executeWithoutResult(status -> jdbc.batchUpdate(
                "INSERT INTO conversation_turns (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                turns, turns.size(), (ps, t) -> {
                    TurnAnnotations a = t.annotations();
                    ps.setString(1, t.sessionId());
                    ps.setInt(2, t.turnNumber());
                    ps.setString(3, t.speaker().dbValue());
                    ps.setString(4, t.text());
                    ps.setTimestamp(5, Timestamp.from(t.timestamp()));
                    if (t.confidence() == null) {
                        ps.setNull(6, Types.DOUBLE);
                    } else {
                        ps.setDouble(6, t.confidence());
                    }
                    if (t.responseTimeMs() == null) {
                        ps.setNull(7, Types.BIGINT);
                    } else {
                        ps.setLong(7, t.responseTimeMs());
                    }
                    ps.setString(8, a.topic());
                    ps.setBoolean(9, a.requiresFollowUp());
                    ps.setBoolean(10, a.containsFeedback());
                    ps.setString(11, a.engagementLevel() == null
                            ? null
                            : a.engagementLevel().name().toLowerCase(Locale.ROOT));
                }));
    }

    @Override
    public int countBySession(String sessionId) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM conversation_turns WHERE session_id = ?",
                Integer.class, sessionId);
        return count == null ? 0 : count;
    }

    @Override
    public int maxTurnNumber(String sessionId) {
        Integer max = jdbc.queryForObject(
                "SELECT COALESCE(MAX(turn_number), 0) FROM conversation_turns WHERE session_id = ?",
                Integer.class, sessionId);
        return max == null ? 0 : max;
    }

    @Override
    public List<ConversationTurn> findBySession(String sessionId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM conversation_turns WHERE session_id = ? ORDER BY turn_number",
                ROW_MAPPER, sessionId);
    }
}
