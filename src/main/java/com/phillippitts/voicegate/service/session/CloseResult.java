package com.phillippitts.voicegate.service.session;

import com.phillippitts.voicegate.service.cost.CostRecord;

/**
 * Outcome of a close request.
 *
 * @param closed          true only for the call that ended the session
 * @param durationSeconds duration charged to the identity (0 when not closed by this call)
 * @param endReason       reason recorded on the session row
 * @param cost            cost record, null when not closed by this call or when it could not be stored
 */
public record CloseResult(String sessionId, boolean closed, long durationSeconds, String endReason, CostRecord cost) {

    static CloseResult alreadyClosed(String sessionId, String endReason) {
        return new CloseResult(sessionId, false, 0, endReason, null);
    }
}
