package com.phillippitts.voicegate.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param identity identity key as stored: {@code address} or {@code address|fingerprint}
 */
public record UnblockRequest(@NotBlank @Size(max = 200) String identity) {
}
