package com.phillippitts.voicegate.service.capture;

import java.util.Arrays;
import java.util.Optional;

/**
 * Speech provider events the router understands.
 */
public enum CaptureEventType {
    SPEECH_START("speech_start"),
    SPEECH_END("speech_end"),
    TRANSCRIPT("transcript"),
    RESPONSE_START("response_start"),
    RESPONSE_END("response_end");

    private final String wireName;

    CaptureEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<CaptureEventType> fromWire(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}
