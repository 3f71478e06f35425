package com.phillippitts.voicegate.presentation.dto;

import jakarta.validation.constraints.Size;

public record ForceCloseRequest(@Size(max = 64) String reason) {
}
