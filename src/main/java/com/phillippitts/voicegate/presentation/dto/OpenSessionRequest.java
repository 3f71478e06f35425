package com.phillippitts.voicegate.presentation.dto;

/**
 * Optional overrides of the configured model and voice. An empty body uses the defaults.
 *
 * @param model provider model name ({@code gpt-realtime} or {@code gpt-realtime-mini})
 * @param voice output voice name
 */
public record OpenSessionRequest(String model, String voice) {
}
