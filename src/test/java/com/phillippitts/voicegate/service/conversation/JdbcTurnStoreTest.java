package com.phillippitts.voicegate.service.conversation;

import com.phillippitts.voicegate.domain.ConversationTurn;
import com.phillippitts.voicegate.domain.EngagementLevel;
import com.phillippitts.voicegate.domain.Speaker;
import com.phillippitts.voicegate.domain.TurnAnnotations;
import com.phillippitts.voicegate.testutil.H2Databases;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcTurnStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-10T12:00:00Z");

    private JdbcTurnStore store;

    @BeforeEach
    void setUp() {
        DataSource ds = H2Databases.fresh();
        store = new JdbcTurnStore(new JdbcTemplate(ds), new TransactionTemplate(new DataSourceTransactionManager(ds)));
    }

    private static ConversationTurn turn(String session, int n, Speaker speaker, String text) {
        return new ConversationTurn(session, speaker, n, text, T0.plusSeconds(n), null, null, null);
    }

    @Test
    void savesBatchAndReadsBackInOrder() {
        ConversationTurn annotated = new ConversationTurn("rt_1", Speaker.ASSISTANT, 2, "Great job today!",
                T0.plusSeconds(2), 0.92, 850L, new TurnAnnotations("fitness", false, true, EngagementLevel.MEDIUM));
        store.saveAll(List.of(turn("rt_1", 1, Speaker.USER, "I did my run"), annotated));

        List<ConversationTurn> read = store.findBySession("rt_1");
        assertThat(read).hasSize(2);
        assertThat(read.get(0).speaker()).isEqualTo(Speaker.USER);
        assertThat(read.get(0).confidence()).isNull();
        assertThat(read.get(0).responseTimeMs()).isNull();
        assertThat(read.get(0).annotations()).isEqualTo(TurnAnnotations.NONE);
        assertThat(read.get(1)).isEqualTo(annotated);
        assertThat(store.countBySession("rt_1")).isEqualTo(2);
        assertThat(store.countBySession("rt_2")).isZero();
    }

    @Test
    void reportsHighestTurnNumberPerSession() {
        store.saveAll(List.of(turn("rt_1", 1, Speaker.USER, "one"), turn("rt_1", 7, Speaker.ASSISTANT, "seven"),
                turn("rt_2", 3, Speaker.USER, "three")));

        assertThat(store.maxTurnNumber("rt_1")).isEqualTo(7);
        assertThat(store.maxTurnNumber("rt_2")).isEqualTo(3);
        assertThat(store.maxTurnNumber("rt_none")).isZero();
    }

    @Test
    void duplicateTurnNumberRollsBackWholeBatch() {
        store.saveAll(List.of(turn("rt_1", 1, Speaker.USER, "hello")));

        assertThatThrownBy(() -> store.saveAll(List.of(
                turn("rt_1", 2, Speaker.ASSISTANT, "hi"),
                turn("rt_1", 1, Speaker.USER, "again"))))
                .isInstanceOf(DataIntegrityViolationException.class);

        assertThat(store.countBySession("rt_1")).isEqualTo(1);
    }

    @Test
    void emptyBatchIsNoOp() {
        store.saveAll(List.of());

        assertThat(store.countBySession("rt_1")).isZero();
    }
}
