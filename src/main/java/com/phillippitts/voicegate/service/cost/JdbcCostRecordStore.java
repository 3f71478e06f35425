package com.phillippitts.voicegate.service.cost;

import com.phillippitts.voicegate.domain.ModelTier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link CostRecordStore} over the {@code session_costs} table. Idempotent on {@code session_id}.
 */
@Repository
public class JdbcCostRecordStore implements CostRecordStore {

    private static final String COLUMNS = "session_id, model_tier, duration_seconds, text_input_tokens, "
            + "text_output_tokens, audio_input_tokens, audio_output_tokens, text_input_cost, text_output_cost, "
            + "audio_input_cost, audio_output_cost, total_cost, error_occurred, end_reason, recorded_at";

    private static final RowMapper<CostRecord> ROW_MAPPER = (rs, rowNum) -> new CostRecord(
            rs.getString("session_id"),
            new CostBreakdown(
                    ModelTier.fromWire(rs.getString("model_tier")),
                    rs.getLong("duration_seconds"),
                    rs.getLong("text_input_tokens"),
                    rs.getLong("text_output_tokens"),
                    rs.getLong("audio_input_tokens"),
                    rs.getLong("audio_output_tokens"),
                    rs.getBigDecimal("text_input_cost"),
                    rs.getBigDecimal("text_output_cost"),
                    rs.getBigDecimal("audio_input_cost"),
                    rs.getBigDecimal("audio_output_cost"),
                    rs.getBigDecimal("total_cost")),
            rs.getBoolean("error_occurred"),
            rs.getString("end_reason"),
            rs.getTimestamp("recorded_at").toInstant());

    private final JdbcTemplate jdbc;

    public JdbcCostRecordStore(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc);
    }

    @Override
    public boolean insertIfAbsent(CostRecord r) {
        CostBreakdown b = r.breakdown();
        try {
            jdbc.update("INSERT INTO session_costs (" + COLUMNS + ") "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    r.sessionId(), b.modelTier().wireName(), b.durationSeconds(),
                    b.textInputTokens(), b.textOutputTokens(), b.audioInputTokens(), b.audioOutputTokens(),
                    b.textInputCost(), b.textOutputCost(), b.audioInputCost(), b.audioOutputCost(), b.totalCost(),
                    r.errorOccurred(), r.endReason(), Timestamp.from(r.recordedAt()));
            return true;
        } catch (DuplicateKeyException alreadyRecorded) {
            return false;
        }
    }

    @Override
    public Optional<CostRecord> find(String sessionId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM session_costs WHERE session_id = ?", ROW_MAPPER, sessionId)
                .stream().findFirst();
    }

    @Override
    public List<CostRecord> findRecordedBetween(Instant from, Instant to) {
        return jdbc.query("SELECT " + COLUMNS + " FROM session_costs WHERE recorded_at >= ? AND recorded_at < ? "
                        + "ORDER BY recorded_at",
                ROW_MAPPER, Timestamp.from(from), Timestamp.from(to));
    }
}
