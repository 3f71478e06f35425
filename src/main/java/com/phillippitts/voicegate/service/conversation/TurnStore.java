package com.phillippitts.voicegate.service.conversation;

import com.phillippitts.voicegate.domain.ConversationTurn;

import java.util.List;

/**
 * Append-only persistence for conversation turns.
 *
 * <p>{@link #saveAll(List)} is all-or-nothing: on failure no turn of the batch is stored, so the
 * caller can requeue the whole batch without creating duplicates.
 */
public interface TurnStore {

    /**
     * @throws org.springframework.dao.DataAccessException when the batch could not be written
     */
    void saveAll(List<ConversationTurn> turns);

    int countBySession(String sessionId);

    /** Highest stored turn number of the session, 0 when it has none. */
    int maxTurnNumber(String sessionId);

    /** Turns of one session ordered by turn number. */
    List<ConversationTurn> findBySession(String sessionId);
}
