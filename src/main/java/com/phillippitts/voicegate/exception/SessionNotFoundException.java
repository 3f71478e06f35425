package com.phillippitts.voicegate.exception;

/**
 * Thrown when an operation references a voice session the registry does not know.
 */
public class SessionNotFoundException extends VoiceGateException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Voice session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
