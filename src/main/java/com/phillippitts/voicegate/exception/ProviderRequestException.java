package com.phillippitts.voicegate.exception;

/**
 * Thrown when the speech provider rejects a credential request for a reason retrying cannot fix
 * (authentication failure, malformed request, unreadable response body).
 */
public class ProviderRequestException extends VoiceGateException {

    private final int statusCode;

    public ProviderRequestException(String message, int statusCode) {
        super(message + " (status: " + statusCode + ")");
        this.statusCode = statusCode;
    }

    public ProviderRequestException(String message, int statusCode, Throwable cause) {
        super(message + " (status: " + statusCode + ")", cause);
        this.statusCode = statusCode;
    }

    /** HTTP status returned by the provider, or 0 when no response was parsed. */
    public int getStatusCode() {
        return statusCode;
    }
}
