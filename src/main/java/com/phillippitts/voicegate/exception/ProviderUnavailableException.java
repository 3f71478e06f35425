package com.phillippitts.voicegate.exception;

/**
 * Thrown when the speech provider could not issue a credential after the bounded retry budget
 * was spent on transient failures (I/O errors, HTTP 429, HTTP 5xx).
 */
public class ProviderUnavailableException extends VoiceGateException {

    private final int attempts;

    public ProviderUnavailableException(String message, int attempts) {
        super(message + " (attempts: " + attempts + ")");
        this.attempts = attempts;
    }

    public ProviderUnavailableException(String message, int attempts, Throwable cause) {
        super(message + " (attempts: " + attempts + ")", cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
