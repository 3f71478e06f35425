package com.phillippitts.voicegate.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record HeartbeatRequest(
        @NotBlank @Size(max = 64) String sessionId,
        @Size(max = 128) String deviceId
) {
}
