package com.phillippitts.voicegate.exception;

/**
 * Thrown when a request carries no usable client identity (missing or "unknown" address,
 * illegal characters, oversized fingerprint).
 */
public class InvalidIdentityException extends VoiceGateException {

    private final String reason;

    public InvalidIdentityException(String reason) {
        super("Invalid client identity: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
