package com.phillippitts.voicegate.config.properties;

import com.phillippitts.voicegate.domain.ModelTier;
import com.phillippitts.voicegate.domain.VoiceProfile;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and retry settings for the speech provider's credential endpoint.
 */
@ConfigurationProperties(prefix = "voice.provider")
@Validated
public class ProviderProperties {

    @NotBlank
    private String baseUrl = "https://api.openai.com";

    /** Long-lived provider secret. Never returned to clients. */
    private String apiKey = "";

    /** Total attempts including the first call. */
    @Positive
    private int maxAttempts = 3;

    @PositiveOrZero
    private long initialBackoffMs = 1000;

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;

    @PositiveOrZero
    private long maxBackoffMs = 10_000;

    @Positive
    private long connectTimeoutMs = 3000;

    @Positive
    private long readTimeoutMs = 6000;

    @NotNull
    private ModelTier defaultModelTier = ModelTier.MINI;

    @NotNull
    private VoiceProfile defaultVoice = VoiceProfile.CEDAR;

    /** Advertised maximum conversation length returned with each credential. */
    @Positive
    private int maxSessionSeconds = 300;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
        this.initialBackoffMs = initialBackoffMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(long readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public ModelTier getDefaultModelTier() {
        return defaultModelTier;
    }

    public void setDefaultModelTier(ModelTier defaultModelTier) {
        this.defaultModelTier = defaultModelTier;
    }

    public VoiceProfile getDefaultVoice() {
        return defaultVoice;
    }

    public void setDefaultVoice(VoiceProfile defaultVoice) {
        this.defaultVoice = defaultVoice;
    }

    public int getMaxSessionSeconds() {
        return maxSessionSeconds;
    }

    public void setMaxSessionSeconds(int maxSessionSeconds) {
        this.maxSessionSeconds = maxSessionSeconds;
    }
}
