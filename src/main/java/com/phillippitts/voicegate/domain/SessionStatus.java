package com.phillippitts.voicegate.domain;

import java.util.Locale;

public enum SessionStatus {
    ACTIVE, ENDED, BLOCKED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SessionStatus fromDb(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
