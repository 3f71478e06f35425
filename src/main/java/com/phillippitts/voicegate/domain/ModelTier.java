package com.phillippitts.voicegate.domain;

import java.util.Arrays;

/**
 * Realtime model tiers the gateway is allowed to request credentials for.
 */
public enum ModelTier {
    STANDARD("gpt-realtime"),
    MINI("gpt-realtime-mini");

    private final String wireName;

    ModelTier(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a provider model name.
     *
     * @throws IllegalArgumentException when the name is not a known tier
     */
    public static ModelTier fromWire(String name) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown model tier: " + name));
    }
}
