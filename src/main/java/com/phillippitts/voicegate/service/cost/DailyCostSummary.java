package com.phillippitts.voicegate.service.cost;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Aggregate of the cost records of one day.
 *
 * @param successRate sessions without error divided by total sessions, 0 when there are none
 * @param peakHour    hour of day (0-23) with the most sessions, earliest hour on ties, 0 when empty
 */
public record DailyCostSummary(
        LocalDate date,
        int totalSessions,
        long totalDurationMinutes,
        long totalTextInputTokens,
        long totalTextOutputTokens,
        long totalAudioInputTokens,
        long totalAudioOutputTokens,
        BigDecimal totalCost,
        BigDecimal averageSessionCost,
        double successRate,
        int peakHour
) {
}
