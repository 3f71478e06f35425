package com.phillippitts.voicegate.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderExceptionBuilderTest {

    @Test
    void shouldBuildUnavailableWithContextInMessage() {
        IOException cause = new IOException("connection reset");

        ProviderUnavailableException ex = ProviderExceptionBuilder.create("Speech provider unavailable")
                .attempts(3)
                .durationMs(7012)
                .metadata("model", "gpt-realtime-mini")
                .metadata("lastStatus", 503)
                .cause(cause)
                .unavailable();

        assertThat(ex.getAttempts()).isEqualTo(3);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getMessage())
                .startsWith("Speech provider unavailable (")
                .contains("durationMs=7012")
                .contains("model=gpt-realtime-mini")
                .contains("lastStatus=503");
    }

    @Test
    void shouldBuildRejectedWithStatus() {
        ProviderRequestException ex = ProviderExceptionBuilder.create("rejected").status(401).rejected();

        assertThat(ex.getStatusCode()).isEqualTo(401);
        assertThat(ex.getMessage()).isEqualTo("rejected");
        assertThat(ex.getCause()).isNull();
    }

    @Test
    void shouldSkipNullMetadata() {
        ProviderRequestException ex = ProviderExceptionBuilder.create("rejected")
                .metadata("voice", null)
                .metadata(null, "x")
                .rejected();

        assertThat(ex.getMessage()).isEqualTo("rejected");
    }

    @Test
    void shouldRequireMessage() {
        assertThatThrownBy(() -> ProviderExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ProviderExceptionBuilder.create(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
