package com.phillippitts.voicegate.domain;

import java.util.Objects;

/**
 * Opaque client identity used as the admission key: client address plus optional device fingerprint.
 *
 * @param address     client IP address as reported by the edge (never null)
 * @param fingerprint device fingerprint, or null when the client did not send one
 */
public record ClientIdentity(String address, String fingerprint) {

    public ClientIdentity {
        Objects.requireNonNull(address, "address");
        if (fingerprint != null && fingerprint.isBlank()) {
            fingerprint = null;
        }
    }

    public static ClientIdentity of(String address) {
        return new ClientIdentity(address, null);
    }

    /** Storage key: {@code address} or {@code address|fingerprint}. */
    public String key() {
        return fingerprint == null ? address : address + '|' + fingerprint;
    }
}
