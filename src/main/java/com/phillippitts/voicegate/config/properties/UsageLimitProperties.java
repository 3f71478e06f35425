package com.phillippitts.voicegate.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Quota settings for the per-identity usage limiter.
 */
@ConfigurationProperties(prefix = "voice.limiter")
@Validated
public class UsageLimitProperties {

    /** Credits an identity may consume per calendar day. */
    @Positive(message = "Daily credit limit must be positive")
    private int dailyCreditLimit = 5;

    /** Credits an identity may consume in total before being blocked. */
    @Positive(message = "Lifetime credit limit must be positive")
    private int lifetimeCreditLimit = 15;

    /** Seconds of session time per credit. */
    @Positive(message = "Credit unit must be positive")
    private int creditUnitSeconds = 60;

    /** Admit when the store fails. Keep false outside local development. */
    private boolean allowOnError = false;

    /** Permanently block identities that reach the lifetime limit. */
    private boolean blockAfterLifetimeLimit = true;

    /** A held lock older than this is treated as orphaned by the admission check. */
    @PositiveOrZero
    private int staleLockGraceSeconds = 30;

    /** Deadline for one admission check, including store round trips. */
    @Positive
    private long admissionTimeoutMs = 2000;

    /** Zone whose midnight rolls the daily counter. */
    @NotBlank
    private String zone = "UTC";

    public int getDailyCreditLimit() {
        return dailyCreditLimit;
    }

    public void setDailyCreditLimit(int dailyCreditLimit) {
        this.dailyCreditLimit = dailyCreditLimit;
    }

    public int getLifetimeCreditLimit() {
        return lifetimeCreditLimit;
    }

    public void setLifetimeCreditLimit(int lifetimeCreditLimit) {
        this.lifetimeCreditLimit = lifetimeCreditLimit;
    }

    public int getCreditUnitSeconds() {
        return creditUnitSeconds;
    }

    public void setCreditUnitSeconds(int creditUnitSeconds) {
        this.creditUnitSeconds = creditUnitSeconds;
    }

    public boolean isAllowOnError() {
        return allowOnError;
    }

    public void setAllowOnError(boolean allowOnError) {
        this.allowOnError = allowOnError;
    }

    public boolean isBlockAfterLifetimeLimit() {
        return blockAfterLifetimeLimit;
    }

    public void setBlockAfterLifetimeLimit(boolean blockAfterLifetimeLimit) {
        this.blockAfterLifetimeLimit = blockAfterLifetimeLimit;
    }

    public int getStaleLockGraceSeconds() {
        return staleLockGraceSeconds;
    }

    public void setStaleLockGraceSeconds(int staleLockGraceSeconds) {
        this.staleLockGraceSeconds = staleLockGraceSeconds;
    }

    public long getAdmissionTimeoutMs() {
        return admissionTimeoutMs;
    }

    public void setAdmissionTimeoutMs(long admissionTimeoutMs) {
        this.admissionTimeoutMs = admissionTimeoutMs;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }
}
