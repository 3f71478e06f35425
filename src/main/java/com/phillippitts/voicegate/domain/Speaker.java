package com.phillippitts.voicegate.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Speaker {
    USER, ASSISTANT;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Speaker> fromWire(String name) {
        return Arrays.stream(values()).filter(s -> s.dbValue().equals(name)).findFirst();
    }
}
