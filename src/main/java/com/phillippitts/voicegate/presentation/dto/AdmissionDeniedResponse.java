package com.phillippitts.voicegate.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.voicegate.domain.AdmissionDecision;

import java.time.Instant;

/**
 * Body of a 429 answer.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdmissionDeniedResponse(String reason, int remainingCredits, Instant resetAt, boolean blocked) {

    public static AdmissionDeniedResponse of(AdmissionDecision decision) {
        return new AdmissionDeniedResponse(decision.reason(), decision.remainingCredits(), decision.resetAt(),
                decision.blocked());
    }
}
