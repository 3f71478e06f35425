package com.phillippitts.voicegate.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the session janitor sweeps.
 */
@ConfigurationProperties(prefix = "voice.janitor")
@Validated
public class JanitorProperties {

    /** Enable/disable both scheduled sweeps. Manual force-close stays available. */
    private boolean enabled = true;

    /** Period between sweeps, in milliseconds. */
    @Positive
    private long sweepIntervalMs = 60_000;

    /** Active sessions idle longer than this are closed with reason inactivity_timeout. */
    @Positive(message = "Inactivity timeout must be positive")
    private long inactivityTimeoutSeconds = 1800;

    /** Heartbeat-tracked sessions silent longer than this are closed with reason orphaned_cleanup. */
    @Positive(message = "Heartbeat timeout must be positive")
    private long heartbeatTimeoutSeconds = 900;

    /** Row limit of each snapshot query. */
    @Positive
    private int maxSessionsPerSweep = 200;

    /** Time budget of one sweep run; remaining rows wait for the next run. */
    @Positive
    private long maxSweepMillis = 20_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public long getInactivityTimeoutSeconds() {
        return inactivityTimeoutSeconds;
    }

    public void setInactivityTimeoutSeconds(long inactivityTimeoutSeconds) {
        this.inactivityTimeoutSeconds = inactivityTimeoutSeconds;
    }

    public long getHeartbeatTimeoutSeconds() {
        return heartbeatTimeoutSeconds;
    }

    public void setHeartbeatTimeoutSeconds(long heartbeatTimeoutSeconds) {
        this.heartbeatTimeoutSeconds = heartbeatTimeoutSeconds;
    }

    public int getMaxSessionsPerSweep() {
        return maxSessionsPerSweep;
    }

    public void setMaxSessionsPerSweep(int maxSessionsPerSweep) {
        this.maxSessionsPerSweep = maxSessionsPerSweep;
    }

    public long getMaxSweepMillis() {
        return maxSweepMillis;
    }

    public void setMaxSweepMillis(long maxSweepMillis) {
        this.maxSweepMillis = maxSweepMillis;
    }
}
