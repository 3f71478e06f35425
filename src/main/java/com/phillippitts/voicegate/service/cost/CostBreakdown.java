package com.phillippitts.voicegate.service.cost;

import com.phillippitts.voicegate.domain.ModelTier;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Priced consumption of one session. Amounts are USD.
 *
 * <p>{@code totalCost} is always the exact sum of the four sub-costs.
 */
public record CostBreakdown(
        ModelTier modelTier,
        long durationSeconds,
        long textInputTokens,
        long textOutputTokens,
        long audioInputTokens,
        long audioOutputTokens,
        BigDecimal textInputCost,
        BigDecimal textOutputCost,
        BigDecimal audioInputCost,
        BigDecimal audioOutputCost,
        BigDecimal totalCost
) {
    public CostBreakdown {
        Objects.requireNonNull(modelTier, "modelTier");
        Objects.requireNonNull(textInputCost, "textInputCost");
        Objects.requireNonNull(textOutputCost, "textOutputCost");
        Objects.requireNonNull(audioInputCost, "audioInputCost");
        Objects.requireNonNull(audioOutputCost, "audioOutputCost");
        Objects.requireNonNull(totalCost, "totalCost");
        BigDecimal sum = textInputCost.add(textOutputCost).add(audioInputCost).add(audioOutputCost);
        if (sum.compareTo(totalCost) != 0) {
            throw new IllegalArgumentException("totalCost " + totalCost + " differs from sub-cost sum " + sum);
        }
    }
}
