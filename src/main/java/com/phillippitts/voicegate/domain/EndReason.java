package com.phillippitts.voicegate.domain;

/**
 * Well-known reasons recorded when a session is closed. Operators may also supply free-text reasons.
 */
public enum EndReason {
    USER_ENDED("user_ended"),
    INACTIVITY_TIMEOUT("inactivity_timeout"),
    ORPHANED_CLEANUP("orphaned_cleanup"),
    ADMIN_FORCE_CLOSE("admin_force_close"),
    PROVIDER_FAILURE("provider_failure"),
    QUOTA_BLOCKED("quota_blocked");

    private final String code;

    EndReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
