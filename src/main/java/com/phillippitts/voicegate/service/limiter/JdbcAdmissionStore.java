package com.phillippitts.voicegate.service.limiter;

import com.phillippitts.voicegate.domain.AdmissionRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link AdmissionStore} over the {@code admission_records} table.
 */
@Repository
public class JdbcAdmissionStore implements AdmissionStore {

    private static final String COLUMNS = "identity_key, session_count, daily_session_count, daily_reset_date, "
            + "daily_duration_seconds, lifetime_duration_seconds, first_session_at, last_session_at, "
            + "active_lock, blocked, blocked_reason";

    private static final RowMapper<AdmissionRecord> ROW_MAPPER = (rs, rowNum) -> new AdmissionRecord(
            rs.getString("identity_key"),
            rs.getInt("session_count"),
            rs.getInt("daily_session_count"),
            rs.getDate("daily_reset_date").toLocalDate(),
            rs.getLong("daily_duration_seconds"),
            rs.getLong("lifetime_duration_seconds"),
            rs.getTimestamp("first_session_at").toInstant(),
            rs.getTimestamp("last_session_at").toInstant(),
            rs.getBoolean("active_lock"),
            rs.getBoolean("blocked"),
            rs.getString("blocked_reason"));

    private final JdbcTemplate jdbc;

    public JdbcAdmissionStore(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc);
    }

    @Override
    public Optional<AdmissionRecord> find(String identityKey) {
        List<AdmissionRecord> rows = jdbc.query(
                "SELECT " + COLUMNS + " FROM admission_records WHERE identity_key = ?",
                ROW_MAPPER, identityKey);
        return rows.stream().findFirst();
    }

    @Override
    public Optional<AdmissionRecord> findForUpdate(String identityKey) {
        List<AdmissionRecord> rows = jdbc.query(
                "SELECT " + COLUMNS + " FROM admission_records WHERE identity_key = ? FOR UPDATE",
                ROW_MAPPER, identityKey);
        return rows.stream().findFirst();
    }

    @Override
    public void insert(AdmissionRecord r) {
        jdbc.update("INSERT INTO admission_records (" + COLUMNS + ", updated_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                r.identityKey(), r.sessionCount(), r.dailySessionCount(), Date.valueOf(r.dailyResetDate()),
                r.dailyDurationSeconds(), r.lifetimeDurationSeconds(),
                Timestamp.from(r.firstSessionAt()), Timestamp.from(r.lastSessionAt()),
                r.activeLock(), r.blocked(), r.blockedReason(), Timestamp.from(r.lastSessionAt()));
    }

    @Override
    public void update(AdmissionRecord r) {
        jdbc.update("UPDATE admission_records SET session_count = ?, daily_session_count = ?, "
                        + "daily_reset_date = ?, daily_duration_seconds = ?, lifetime_duration_seconds = ?, "
                        + "last_session_at = ?, active_lock = ?, blocked = ?, blocked_reason = ?, "
                        + "updated_at = CURRENT_TIMESTAMP WHERE identity_key = ?",
                r.sessionCount(), r.dailySessionCount(), Date.valueOf(r.dailyResetDate()),
                r.dailyDurationSeconds(), r.lifetimeDurationSeconds(), Timestamp.from(r.lastSessionAt()),
                r.activeLock(), r.blocked(), r.blockedReason(), r.identityKey());
    }

    @Override
    public boolean releaseLock(String identityKey) {
        return jdbc.update("UPDATE admission_records SET active_lock = FALSE, updated_at = CURRENT_TIMESTAMP "
                + "WHERE identity_key = ?", identityKey) > 0;
    }
}
