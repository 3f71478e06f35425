package com.phillippitts.voicegate.presentation.dto;

import com.phillippitts.voicegate.domain.SessionUsage;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Usage reported by the client when it ends a session. Token and audio counters are optional.
 */
public record EndSessionRequest(
        @NotBlank @Size(max = 64) String sessionId,
        @NotNull @PositiveOrZero Long durationSeconds,
        @PositiveOrZero Long textInputTokens,
        @PositiveOrZero Long textOutputTokens,
        @PositiveOrZero Double audioInputSeconds,
        @PositiveOrZero Double audioOutputSeconds,
        Boolean errorOccurred
) {
    public SessionUsage toUsage() {
        return new SessionUsage(durationSeconds,
                textInputTokens == null ? 0 : textInputTokens,
                textOutputTokens == null ? 0 : textOutputTokens,
                audioInputSeconds == null ? 0 : audioInputSeconds,
                audioOutputSeconds == null ? 0 : audioOutputSeconds,
                Boolean.TRUE.equals(errorOccurred));
    }
}
