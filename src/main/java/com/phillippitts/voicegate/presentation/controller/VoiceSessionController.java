package com.phillippitts.voicegate.presentation.controller;

import com.phillippitts.voicegate.config.properties.ProviderProperties;
import com.phillippitts.voicegate.config.properties.UsageLimitProperties;
import com.phillippitts.voicegate.domain.ClientIdentity;
import com.phillippitts.voicegate.domain.ModelTier;
import com.phillippitts.voicegate.domain.VoiceProfile;
import com.phillippitts.voicegate.presentation.dto.AdmissionDeniedResponse;
import com.phillippitts.voicegate.presentation.dto.CloseSessionResponse;
import com.phillippitts.voicegate.presentation.dto.EndSessionRequest;
import com.phillippitts.voicegate.presentation.dto.HeartbeatRequest;
import com.phillippitts.voicegate.presentation.dto.OpenSessionRequest;
import com.phillippitts.voicegate.presentation.dto.SessionCreatedResponse;
import com.phillippitts.voicegate.domain.EndReason;
import com.phillippitts.voicegate.service.limiter.UsageLimiter;
import com.phillippitts.voicegate.service.limiter.UsageStatus;
import com.phillippitts.voicegate.service.session.CloseResult;
import com.phillippitts.voicegate.service.session.OpenResult;
import com.phillippitts.voicegate.service.session.SessionLifecycleService;
import com.phillippitts.voicegate.util.LogSanitizer;
import com.phillippitts.voicegate.util.TimeUtils;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public session endpoints used by the browser client.
 */
@RestController
@RequestMapping("/session")
class VoiceSessionController {

    private final SessionLifecycleService lifecycle;
    private final UsageLimiter limiter;
    private final ClientIdentityResolver identityResolver;
    private final ProviderProperties provider;
    private final UsageLimitProperties limits;

    VoiceSessionController(SessionLifecycleService lifecycle,
                           UsageLimiter limiter,
                           ClientIdentityResolver identityResolver,
                           ProviderProperties provider,
                           UsageLimitProperties limits) {
        this.lifecycle = lifecycle;
        this.limiter = limiter;
        this.identityResolver = identityResolver;
        this.provider = provider;
        this.limits = limits;
    }

    /**
     * Admits the caller and returns an ephemeral provider credential.
     * 429 with the denial reason when over quota or blocked.
     */
    @PostMapping
    ResponseEntity<?> open(@RequestBody(required = false) OpenSessionRequest body, HttpServletRequest request) {
        ClientIdentity identity = identityResolver.resolve(request);
        ModelTier tier = body == null || body.model() == null
                ? provider.getDefaultModelTier() : ModelTier.fromWire(body.model());
        VoiceProfile voice = body == null || body.voice() == null
                ? provider.getDefaultVoice() : VoiceProfile.fromWire(body.voice());

        OpenResult result = lifecycle.open(identity, tier, voice);
        if (!result.admitted()) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(AdmissionDeniedResponse.of(result.decision()));
        }
        return ResponseEntity.ok(SessionCreatedResponse.of(result.session(),
                result.decision().remainingCredits(), provider.getMaxSessionSeconds()));
    }

    @PostMapping("/end")
    ResponseEntity<CloseSessionResponse> end(@Valid @RequestBody EndSessionRequest body) {
        CloseResult result = lifecycle.close(body.sessionId(), EndReason.USER_ENDED.code(), body.toUsage());
        long credits = TimeUtils.ceilUnits(result.durationSeconds(), limits.getCreditUnitSeconds());
        return ResponseEntity.ok(CloseSessionResponse.of(result, credits));
    }

    @PostMapping("/heartbeat")
    ResponseEntity<Map<String, Object>> heartbeat(@Valid @RequestBody HeartbeatRequest body) {
        boolean active = lifecycle.heartbeat(body.sessionId(), body.deviceId());
        return ResponseEntity.ok(Map.of("sessionId", body.sessionId(), "active", active));
    }

    /**
     * Quota counters of the calling identity. Zeros for an identity never seen.
     */
    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status(HttpServletRequest request) {
        ClientIdentity identity = identityResolver.resolve(request);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("identity", LogSanitizer.maskIdentity(identity.key()));
        UsageStatus status = limiter.getStatus(identity.key()).orElse(null);
        if (status == null) {
            body.put("dailyCreditsUsed", 0);
            body.put("dailyCreditsRemaining", limits.getDailyCreditLimit());
            body.put("lifetimeCreditsUsed", 0);
            body.put("lifetimeCreditsRemaining", limits.getLifetimeCreditLimit());
            body.put("activeSession", false);
            body.put("blocked", false);
        } else {
            body.put("dailyCreditsUsed", status.dailyCreditsUsed());
            body.put("dailyCreditsRemaining", status.dailyCreditsRemaining());
            body.put("lifetimeCreditsUsed", status.lifetimeCreditsUsed());
            body.put("lifetimeCreditsRemaining", status.lifetimeCreditsRemaining());
            body.put("activeSession", status.activeSession());
            body.put("blocked", status.blocked());
            body.put("dailyResetAt", status.dailyResetAt());
        }
        return ResponseEntity.ok(body);
    }
}
