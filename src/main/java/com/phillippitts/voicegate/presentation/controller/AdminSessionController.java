package com.phillippitts.voicegate.presentation.controller;

import com.phillippitts.voicegate.presentation.dto.ActiveSessionView;
import com.phillippitts.voicegate.presentation.dto.CloseSessionResponse;
import com.phillippitts.voicegate.presentation.dto.ForceCloseRequest;
import com.phillippitts.voicegate.presentation.dto.UnblockRequest;
import com.phillippitts.voicegate.config.properties.UsageLimitProperties;
import com.phillippitts.voicegate.service.cost.CostAccountant;
import com.phillippitts.voicegate.service.cost.DailyCostSummary;
import com.phillippitts.voicegate.service.janitor.SessionJanitor;
import com.phillippitts.voicegate.service.limiter.UsageLimiter;
import com.phillippitts.voicegate.service.session.CloseResult;
import com.phillippitts.voicegate.service.session.SessionLifecycleService;
import com.phillippitts.voicegate.util.LogSanitizer;
import com.phillippitts.voicegate.util.TimeUtils;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints. Authentication is expected in front of the service.
 */
@RestController
@RequestMapping("/admin")
class AdminSessionController {

    private static final Logger LOG = LogManager.getLogger(AdminSessionController.class);

    private static final int MAX_LISTED_SESSIONS = 500;

    private final SessionLifecycleService lifecycle;
    private final SessionJanitor janitor;
    private final UsageLimiter limiter;
    private final CostAccountant costAccountant;
    private final UsageLimitProperties limits;
    private final Clock clock;

    AdminSessionController(SessionLifecycleService lifecycle,
                           SessionJanitor janitor,
                           UsageLimiter limiter,
                           CostAccountant costAccountant,
                           UsageLimitProperties limits,
                           Clock clock) {
        this.lifecycle = lifecycle;
        this.janitor = janitor;
        this.limiter = limiter;
        this.costAccountant = costAccountant;
        this.limits = limits;
        this.clock = clock;
    }

    /**
     * Force close. Works with the janitor sweeps disabled.
     */
    @PostMapping("/sessions/{sessionId}/close")
    ResponseEntity<CloseSessionResponse> close(@PathVariable String sessionId,
                                               @Valid @RequestBody(required = false) ForceCloseRequest body) {
        String reason = body == null ? null : body.reason();
        CloseResult result = janitor.forceCloseSession(sessionId, reason);
        long credits = TimeUtils.ceilUnits(result.durationSeconds(), limits.getCreditUnitSeconds());
        return ResponseEntity.ok(CloseSessionResponse.of(result, credits));
    }

    @GetMapping("/sessions/active")
    ResponseEntity<List<ActiveSessionView>> active() {
        return ResponseEntity.ok(lifecycle.activeSessions(MAX_LISTED_SESSIONS).stream()
                .map(ActiveSessionView::of)
                .toList());
    }

    @PostMapping("/identities/unblock")
    ResponseEntity<Map<String, Object>> unblock(@Valid @RequestBody UnblockRequest body) {
        boolean unblocked = limiter.unblock(body.identity());
        LOG.info("Unblock requested for {}: {}", LogSanitizer.maskIdentity(body.identity()), unblocked);
        if (!unblocked) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("unblocked", false));
        }
        return ResponseEntity.ok(Map.of("unblocked", true));
    }

    /**
     * Daily summary for {@code date}, today in the quota zone when omitted.
     */
    @GetMapping("/costs/daily")
    ResponseEntity<DailyCostSummary> dailyCosts(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate day = date != null ? date : TimeUtils.dayOf(clock.instant(), ZoneId.of(limits.getZone()));
        return ResponseEntity.ok(costAccountant.getDailyCostSummary(day));
    }
}
