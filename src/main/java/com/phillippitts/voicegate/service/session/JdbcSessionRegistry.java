package com.phillippitts.voicegate.service.session;

import com.phillippitts.voicegate.domain.ModelTier;
import com.phillippitts.voicegate.domain.SessionStatus;
import com.phillippitts.voicegate.domain.VoiceProfile;
import com.phillippitts.voicegate.domain.VoiceSession;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SessionRegistry} over the {@code sessions} table.
 */
@Repository
public class JdbcSessionRegistry implements SessionRegistry {

    private static final String COLUMNS = "session_id, identity_key, model_tier, voice_profile, status, "
            + "started_at, last_activity_at, ended_at, end_reason, duration_seconds";

    private static final RowMapper<VoiceSession> ROW_MAPPER = (rs, rowNum) -> new VoiceSession(
            rs.getString("session_id"),
            rs.getString("identity_key"),
            ModelTier.fromWire(rs.getString("model_tier")),
            VoiceProfile.fromWire(rs.getString("voice_profile")),
            SessionStatus.fromDb(rs.getString("status")),
            rs.getTimestamp("started_at").toInstant(),
            toInstant(rs.getTimestamp("last_activity_at")),
            toInstant(rs.getTimestamp("ended_at")),
            rs.getString("end_reason"),
            rs.getLong("duration_seconds"));

    private final JdbcTemplate jdbc;

    public JdbcSessionRegistry(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc);
    }

    @Override
    public void register(VoiceSession s) {
        insert(s);
    }

    @Override
    public Optional<VoiceSession> find(String sessionId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM sessions WHERE session_id = ?", ROW_MAPPER, sessionId)
                .stream().findFirst();
    }

    @Override
    public boolean touch(String sessionId, Instant at) {
        return jdbc.update("UPDATE sessions SET last_activity_at = ? WHERE session_id = ? AND status = ?",
                Timestamp.from(at), sessionId, SessionStatus.ACTIVE.dbValue()) > 0;
    }

    @Override
    public boolean closeIfActive(String sessionId, Instant endedAt, String endReason, long durationSeconds) {
        return jdbc.update("UPDATE sessions SET status = ?, ended_at = ?, end_reason = ?, duration_seconds = ? "
                        + "WHERE session_id = ? AND status = ?",
                SessionStatus.ENDED.dbValue(), Timestamp.from(endedAt), endReason, durationSeconds,
                sessionId, SessionStatus.ACTIVE.dbValue()) == 1;
    }

    @Override
    public List<VoiceSession> findIdleActive(Instant cutoff, int limit) {
        return jdbc.query("SELECT " + COLUMNS + " FROM sessions WHERE status = ? AND last_activity_at < ? "
                        + "ORDER BY last_activity_at ASC LIMIT ?",
                ROW_MAPPER, SessionStatus.ACTIVE.dbValue(), Timestamp.from(cutoff), limit);
    }

    @Override
    public List<VoiceSession> findActive(int limit) {
        return jdbc.query("SELECT " + COLUMNS + " FROM sessions WHERE status = ? "
                        + "ORDER BY started_at DESC LIMIT ?",
                ROW_MAPPER, SessionStatus.ACTIVE.dbValue(), limit);
    }

    @Override
    public boolean hasNewerActiveSession(String identityKey, String excludingSessionId, Instant startedAfter) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM sessions WHERE identity_key = ? "
                        + "AND status = ? AND session_id <> ? AND started_at >= ?",
                Integer.class, identityKey, SessionStatus.ACTIVE.dbValue(), excludingSessionId,
                Timestamp.from(startedAfter));
        return count != null && count > 0;
    }

    @Override
    public void recordBlocked(VoiceSession attempt) {
        if (attempt.status() != SessionStatus.BLOCKED) {
            throw new IllegalArgumentException("Expected a blocked session, got " + attempt.status());
        }
        insert(attempt);
    }

    private void insert(VoiceSession s) {
        jdbc.update("INSERT INTO sessions (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                s.sessionId(), s.identityKey(), s.modelTier().wireName(), s.voiceProfile().wireName(),
                s.status().dbValue(), Timestamp.from(s.startedAt()), Timestamp.from(s.lastActivityAt()),
                s.endedAt() == null ? null : Timestamp.from(s.endedAt()), s.endReason(), s.durationSeconds());
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
