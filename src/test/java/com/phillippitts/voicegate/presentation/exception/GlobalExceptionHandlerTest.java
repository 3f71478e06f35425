package com.phillippitts.voicegate.presentation.exception;

import com.phillippitts.voicegate.exception.InvalidIdentityException;
import com.phillippitts.voicegate.exception.ProviderRequestException;
import com.phillippitts.voicegate.exception.ProviderUnavailableException;
import com.phillippitts.voicegate.exception.SessionNotFoundException;
import com.phillippitts.voicegate.exception.SessionStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesInvalidIdentityReturns400() {
        ResponseEntity<?> response = handler.handleInvalidIdentity(new InvalidIdentityException("malformed client address"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString())
                .contains("InvalidIdentityException")
                .contains("Unable to identify client");
    }

    @Test
    void verifiesBadRequestReturns400() {
        ResponseEntity<?> response = handler.handleBadRequest(new IllegalArgumentException("Unknown model tier: x"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("BadRequest").contains("Unknown model tier");
    }

    @Test
    void verifiesSessionNotFoundReturns404() {
        ResponseEntity<?> response = handler.handleSessionNotFound(new SessionNotFoundException("rt_9"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().toString()).contains("rt_9");
    }

    @Test
    void verifiesProviderUnavailableReturns503() {
        ResponseEntity<?> response = handler.handleProviderUnavailable(new ProviderUnavailableException("down", 3));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("Voice service temporarily unavailable");
    }

    @Test
    void verifiesProviderRejectionDoesNotLeakDetails() {
        ResponseEntity<?> response = handler.handleProviderRejected(
                new ProviderRequestException("Speech provider rejected credential request (model=x)", 401));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).doesNotContain("model=x");
    }

    @Test
    void verifiesStoreFailureReturns503WithoutCause() {
        ResponseEntity<?> response = handler.handleStore(
                new SessionStoreException("close-session", new DataAccessResourceFailureException("jdbc:secret")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).doesNotContain("jdbc:secret");
    }

    @Test
    void verifiesUnexpectedReturns500() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("InternalServerError").doesNotContain("boom");
    }
}
