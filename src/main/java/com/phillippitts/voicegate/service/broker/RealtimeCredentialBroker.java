package com.phillippitts.voicegate.service.broker;

import com.phillippitts.voicegate.config.properties.ProviderProperties;
import com.phillippitts.voicegate.domain.ModelTier;
import com.phillippitts.voicegate.domain.VoiceProfile;
import com.phillippitts.voicegate.exception.ProviderExceptionBuilder;
import com.phillippitts.voicegate.exception.ProviderRequestException;
import com.phillippitts.voicegate.exception.ProviderUnavailableException;
import com.phillippitts.voicegate.service.events.ProviderFailureEvent;
import com.phillippitts.voicegate.service.metrics.VoiceSessionMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * {@link CredentialBroker} calling the provider's realtime client secret endpoint.
 *
 * <p><b>Retry policy:</b> I/O errors, HTTP 429 and 5xx are retried through a Resilience4j
 * {@link Retry} up to {@code voice.provider.max-attempts} with exponential backoff
 * ({@code initial-backoff-ms * multiplier^(attempt-1)}, capped at {@code max-backoff-ms}).
 * Other 4xx answers and unreadable bodies fail at once with {@link ProviderRequestException}.
 *
 * <p>The API key is sent as a bearer token and never logged.
 */
@Service
public class RealtimeCredentialBroker implements CredentialBroker {
    private static final Logger LOG = LogManager.getLogger(RealtimeCredentialBroker.class);

    static final String CLIENT_SECRETS_PATH = "/v1/realtime/client_secrets";

    private final RestTemplate restTemplate;
    private final ProviderProperties props;
    private final VoiceSessionMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final Retry retry;

    @Autowired
    public RealtimeCredentialBroker(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                                    ProviderProperties props,
                                    VoiceSessionMetrics metrics,
                                    ApplicationEventPublisher publisher,
                                    Clock clock) {
        this(restTemplate, props, metrics, publisher, clock, backoff(props));
    }

    RealtimeCredentialBroker(RestTemplate restTemplate,
                             ProviderProperties props,
                             VoiceSessionMetrics metrics,
                             ApplicationEventPublisher publisher,
                             Clock clock,
                             IntervalFunction backoff) {
        this.restTemplate = Objects.requireNonNull(restTemplate);
        this.props = Objects.requireNonNull(props);
        this.metrics = Objects.requireNonNull(metrics);
        this.publisher = Objects.requireNonNull(publisher);
        this.clock = Objects.requireNonNull(clock);
        this.retry = Retry.of("provider-credentials", retryConfig(props.getMaxAttempts(), backoff));
        this.retry.getEventPublisher().onRetry(event -> LOG.warn(
                "Credential request attempt {} failed: {}; retrying in {} ms",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage(),
                event.getWaitInterval().toMillis()));
    }

    static IntervalFunction backoff(ProviderProperties props) {
        long initial = Math.max(1L, props.getInitialBackoffMs());
        return IntervalFunction.ofExponentialBackoff(initial, props.getBackoffMultiplier(),
                Math.max(initial, props.getMaxBackoffMs()));
    }

    static RetryConfig retryConfig(int maxAttempts, IntervalFunction backoff) {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(backoff)
                .retryOnException(RealtimeCredentialBroker::isTransient)
                .build();
    }

    @Override
    public EphemeralSession createSession(ModelTier modelTier, VoiceProfile voiceProfile) {
        Objects.requireNonNull(modelTier, "modelTier");
        Objects.requireNonNull(voiceProfile, "voiceProfile");

        HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody(modelTier, voiceProfile), headers());
        AtomicInteger attempts = new AtomicInteger();
        Supplier<EphemeralSession> call = Retry.decorateSupplier(retry, () -> {
            attempts.incrementAndGet();
            ResponseEntity<ClientSecretResponse> response =
                    restTemplate.postForEntity(CLIENT_SECRETS_PATH, request, ClientSecretResponse.class);
            return toSession(response.getBody(), modelTier, voiceProfile);
        });
        long t0 = System.nanoTime();

        try {
            EphemeralSession session = call.get();
            metrics.recordProviderCall("success", attempts.get(), System.nanoTime() - t0);
            LOG.info("Issued credential for session {} (model={}, voice={}, attempts={})",
                    session.sessionId(), modelTier.wireName(), voiceProfile.wireName(), attempts.get());
            return session;
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (isRetryable(status)) {
                throw unavailable(e, status, modelTier, attempts.get(), t0);
            }
            throw rejected(e, status, modelTier, attempts.get(), t0);
        } catch (ResourceAccessException e) {
            throw unavailable(e, -1, modelTier, attempts.get(), t0);
        } catch (RestClientException e) {
            // body could not be read
            throw rejected(e, -1, modelTier, attempts.get(), t0);
        }
    }

    static boolean isRetryable(int status) {
        return status == HttpStatus.TOO_MANY_REQUESTS.value() || status >= 500;
    }

    static boolean isTransient(Throwable e) {
        if (e instanceof ResourceAccessException) {
            return true;
        }
        return e instanceof HttpStatusCodeException
                && isRetryable(((HttpStatusCodeException) e).getStatusCode().value());
    }

    private ProviderUnavailableException unavailable(RestClientException e, int status, ModelTier tier,
                                                     int attempt, long t0) {
        long elapsedNanos = System.nanoTime() - t0;
        metrics.recordProviderCall("unavailable", attempt, elapsedNanos);
        publisher.publishEvent(new ProviderFailureEvent(clock.instant(), e.getMessage(), true, attempt, status));
        return ProviderExceptionBuilder.create("Speech provider unavailable")
                .attempts(attempt)
                .durationMs(elapsedNanos / 1_000_000L)
                .metadata("model", tier.wireName())
                .metadata("lastStatus", status)
                .cause(e)
                .unavailable();
    }

    private ProviderRequestException rejected(RestClientException e, int status, ModelTier tier,
                                              int attempt, long t0) {
        metrics.recordProviderCall("rejected", attempt, System.nanoTime() - t0);
        publisher.publishEvent(new ProviderFailureEvent(clock.instant(), e.getMessage(), false, attempt, status));
        return ProviderExceptionBuilder.create("Speech provider rejected credential request")
                .status(status)
                .attempts(attempt)
                .metadata("model", tier.wireName())
                .cause(e)
                .rejected();
    }

    private EphemeralSession toSession(ClientSecretResponse body, ModelTier tier, VoiceProfile voice) {
        if (body == null || body.value() == null || body.value().isBlank() || body.expiresAt() == null) {
            throw new RestClientException("Provider response lacks value or expires_at");
        }
        return new EphemeralSession(newSessionId(), body.value(), tier, voice,
                Instant.ofEpochSecond(body.expiresAt()));
    }

    private static String newSessionId() {
        return "rt_" + UUID.randomUUID().toString().replace("-", "");
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(props.getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private static Map<String, Object> requestBody(ModelTier tier, VoiceProfile voice) {
        return Map.of("session", Map.of(
                "type", "realtime",
                "model", tier.wireName(),
                "audio", Map.of("output", Map.of("voice", voice.wireName()))));
    }
}
