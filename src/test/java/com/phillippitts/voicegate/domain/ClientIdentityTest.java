package com.phillippitts.voicegate.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientIdentityTest {

    @Test
    void keyIsAddressWithoutFingerprint() {
        assertThat(ClientIdentity.of("203.0.113.7").key()).isEqualTo("203.0.113.7");
    }

    @Test
    void keyAppendsFingerprint() {
        assertThat(new ClientIdentity("203.0.113.7", "dev_1").key()).isEqualTo("203.0.113.7|dev_1");
    }

    @Test
    void blankFingerprintIsIgnored() {
        ClientIdentity identity = new ClientIdentity("::1", "  ");

        assertThat(identity.fingerprint()).isNull();
        assertThat(identity.key()).isEqualTo("::1");
    }

    @Test
    void addressIsRequired() {
        assertThatThrownBy(() -> new ClientIdentity(null, "x")).isInstanceOf(NullPointerException.class);
    }
}
