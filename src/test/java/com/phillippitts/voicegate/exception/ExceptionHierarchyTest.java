package com.phillippitts.voicegate.exception;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void voiceGateExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        VoiceGateException ex = new VoiceGateException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void sessionNotFoundShouldCarrySessionId() {
        SessionNotFoundException ex = new SessionNotFoundException("rt_42");

        assertThat(ex.getMessage()).contains("rt_42");
        assertThat(ex.getSessionId()).isEqualTo("rt_42");
        assertThat(ex).isInstanceOf(VoiceGateException.class);
    }

    @Test
    void sessionStoreExceptionShouldCarryOperationAndCause() {
        DataAccessResourceFailureException cause = new DataAccessResourceFailureException("down");
        SessionStoreException ex = new SessionStoreException("close-session", cause);

        assertThat(ex.getOperation()).isEqualTo("close-session");
        assertThat(ex.getMessage()).contains("close-session");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void invalidIdentityShouldCarryReason() {
        InvalidIdentityException ex = new InvalidIdentityException("malformed client address");

        assertThat(ex.getReason()).isEqualTo("malformed client address");
        assertThat(ex.getMessage()).contains("malformed client address");
    }

    @Test
    void providerExceptionsShouldCarryAttemptsAndStatus() {
        ProviderUnavailableException unavailable = new ProviderUnavailableException("down", 3);
        ProviderRequestException rejected = new ProviderRequestException("bad key", 401);

        assertThat(unavailable.getAttempts()).isEqualTo(3);
        assertThat(rejected.getStatusCode()).isEqualTo(401);
        assertThat(unavailable).isInstanceOf(VoiceGateException.class);
        assertThat(rejected).isInstanceOf(VoiceGateException.class);
    }
}
