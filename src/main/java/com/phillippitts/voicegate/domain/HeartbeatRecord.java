package com.phillippitts.voicegate.domain;

import java.time.Instant;

/**
 * Liveness row maintained by long-lived (kiosk-style) clients.
 */
public record HeartbeatRecord(String sessionId, String deviceId, Instant lastHeartbeatAt, boolean online) {
}
