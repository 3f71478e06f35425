package com.phillippitts.voicegate.service.session;

import com.phillippitts.voicegate.domain.AdmissionDecision;
import com.phillippitts.voicegate.service.broker.EphemeralSession;

/**
 * Outcome of a session open request: the admission decision and, when admitted, the credential.
 */
public record OpenResult(AdmissionDecision decision, EphemeralSession session) {

    public static OpenResult denied(AdmissionDecision decision) {
        return new OpenResult(decision, null);
    }

    public boolean admitted() {
        return session != null;
    }
}
