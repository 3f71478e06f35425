package com.phillippitts.voicegate.service.conversation;

/**
 * @param turnCount    turns accepted for the session (persisted or still queued)
 * @param pendingTurns turns still waiting in the in-memory queue
 */
public record SessionLogStats(String sessionId, int turnCount, int pendingTurns) {
}
