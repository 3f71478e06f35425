package com.phillippitts.voicegate.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.voicegate.service.session.CloseResult;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CloseSessionResponse(
        String sessionId,
        boolean closed,
        long durationSeconds,
        long creditsUsed,
        String endReason,
        BigDecimal totalCost
) {
    public static CloseSessionResponse of(CloseResult result, long creditsUsed) {
        return new CloseSessionResponse(result.sessionId(), result.closed(), result.durationSeconds(), creditsUsed,
                result.endReason(), result.cost() == null ? null : result.cost().breakdown().totalCost());
    }
}
