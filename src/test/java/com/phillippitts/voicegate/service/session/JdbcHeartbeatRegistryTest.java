package com.phillippitts.voicegate.service.session;

import com.phillippitts.voicegate.domain.HeartbeatRecord;
import com.phillippitts.voicegate.testutil.H2Databases;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcHeartbeatRegistryTest {

    private static final Instant T0 = Instant.parse("2026-03-10T12:00:00Z");

    private JdbcTemplate jdbc;
    private JdbcHeartbeatRegistry registry;

    @BeforeEach
    void setUp() {
        jdbc = new JdbcTemplate(H2Databases.fresh());
        registry = new JdbcHeartbeatRegistry(jdbc);
    }

    @Test
    void upsertInsertsThenRefreshes() {
        registry.upsert("rt_1", "phone", T0);
        registry.upsert("rt_1", "tablet", T0.plusSeconds(30));

        Integer rows = jdbc.queryForObject("SELECT COUNT(*) FROM session_heartbeats", Integer.class);
        assertThat(rows).isEqualTo(1);
        assertThat(registry.findStaleOnline(T0.plusSeconds(60), 10))
                .containsExactly(new HeartbeatRecord("rt_1", "tablet", T0.plusSeconds(30), true));
    }

    @Test
    void staleQueryHonoursCutoffOrderAndLimit() {
        registry.upsert("rt_a", null, T0.minusSeconds(2000));
        registry.upsert("rt_b", null, T0.minusSeconds(3000));
        registry.upsert("rt_c", null, T0);

        assertThat(registry.findStaleOnline(T0.minusSeconds(900), 10))
                .extracting(HeartbeatRecord::sessionId)
                .containsExactly("rt_b", "rt_a");
        assertThat(registry.findStaleOnline(T0.minusSeconds(900), 1))
                .extracting(HeartbeatRecord::sessionId)
                .containsExactly("rt_b");
    }

    @Test
    void offlineRowsAreNotStaleAndMarkIsOneShot() {
        registry.upsert("rt_a", null, T0.minusSeconds(2000));

        assertThat(registry.markOffline("rt_a")).isTrue();
        assertThat(registry.markOffline("rt_a")).isFalse();
        assertThat(registry.markOffline("rt_unknown")).isFalse();
        assertThat(registry.findStaleOnline(T0, 10)).isEmpty();
    }

    @Test
    void heartbeatBringsOfflineRowBackOnline() {
        registry.upsert("rt_a", null, T0.minusSeconds(2000));
        registry.markOffline("rt_a");

        registry.upsert("rt_a", null, T0.minusSeconds(1000));

        assertThat(registry.findStaleOnline(T0, 10)).extracting(HeartbeatRecord::online).containsExactly(true);
    }
}
