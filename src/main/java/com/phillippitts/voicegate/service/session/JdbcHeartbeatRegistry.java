package com.phillippitts.voicegate.service.session;

import com.phillippitts.voicegate.domain.HeartbeatRecord;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link HeartbeatRegistry} over the {@code session_heartbeats} table.
 *
 * <p>Upsert is written as update-then-insert so it runs unchanged on H2 and PostgreSQL.
 */
@Repository
public class JdbcHeartbeatRegistry implements HeartbeatRegistry {

    private static final String ONLINE = "online";
    private static final String OFFLINE = "offline";

    private static final RowMapper<HeartbeatRecord> ROW_MAPPER = (rs, rowNum) -> new HeartbeatRecord(
            rs.getString("session_id"),
            rs.getString("device_id"),
            rs.getTimestamp("last_heartbeat_at").toInstant(),
            ONLINE.equals(rs.getString("status")));

    private final JdbcTemplate jdbc;

    public JdbcHeartbeatRegistry(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc);
    }

    @Override
    public void upsert(String sessionId, String deviceId, Instant at) {
        if (refresh(sessionId, deviceId, at)) {
            return;
        }
        try {
            jdbc.update("INSERT INTO session_heartbeats (session_id, device_id, last_heartbeat_at, status) "
                    + "VALUES (?, ?, ?, ?)", sessionId, deviceId, Timestamp.from(at), ONLINE);
        } catch (DuplicateKeyException race) {
            refresh(sessionId, deviceId, at);
        }
    }

    private boolean refresh(String sessionId, String deviceId, Instant at) {
        return jdbc.update("UPDATE session_heartbeats SET device_id = ?, last_heartbeat_at = ?, status = ? "
                + "WHERE session_id = ?", deviceId, Timestamp.from(at), ONLINE, sessionId) > 0;
    }

    @Override
    public List<HeartbeatRecord> findStaleOnline(Instant cutoff, int limit) {
        return jdbc.query("SELECT session_id, device_id, last_heartbeat_at, status FROM session_heartbeats "
                        + "WHERE status = ? AND last_heartbeat_at < ? ORDER BY last_heartbeat_at ASC LIMIT ?",
                ROW_MAPPER, ONLINE, Timestamp.from(cutoff), limit);
    }

    @Override
    public boolean markOffline(String sessionId) {
        return jdbc.update("UPDATE session_heartbeats SET status = ? WHERE session_id = ? AND status = ?",
                OFFLINE, sessionId, ONLINE) > 0;
    }
}
