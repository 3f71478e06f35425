package com.phillippitts.voicegate.exception;

/**
 * Thrown when the relational store rejects or fails a session-pipeline operation.
 * The message names the operation; storage detail stays in the cause and is never sent to clients.
 */
public class SessionStoreException extends VoiceGateException {

    private final String operation;

    public SessionStoreException(String operation, Throwable cause) {
        super("Session store operation failed: " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
