package com.phillippitts.voicegate.domain;

import java.util.Locale;

/**
 * Output voices offered by the speech provider.
 */
public enum VoiceProfile {
    ALLOY, ASH, BALLAD, CORAL, ECHO, SAGE, SHIMMER, VERSE, CEDAR, MARIN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException when the name is not a known voice
     */
    public static VoiceProfile fromWire(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Voice name must not be null");
        }
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
