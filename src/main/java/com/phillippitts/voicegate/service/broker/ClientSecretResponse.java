package com.phillippitts.voicegate.service.broker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provider answer to a client secret request. Only the fields the broker reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ClientSecretResponse(
        @JsonProperty("value") String value,
        @JsonProperty("expires_at") Long expiresAt
) {
}
