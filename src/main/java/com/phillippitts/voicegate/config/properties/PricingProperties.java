package com.phillippitts.voicegate.config.properties;

import com.phillippitts.voicegate.domain.ModelTier;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-tier token prices, in USD per million tokens.
 *
 * <p>Defaults follow the provider's published realtime pricing; override per tier with
 * {@code voice.pricing.tiers.mini.audio-input-per-million=...}.
 */
@ConfigurationProperties(prefix = "voice.pricing")
@Validated
public class PricingProperties {

    /** Audio seconds are priced as tokens at this rate. */
    @Positive
    private int audioTokensPerMinute = 1667;

    private Map<ModelTier, TierPrice> tiers = defaultTiers();

    public int getAudioTokensPerMinute() {
        return audioTokensPerMinute;
    }

    public void setAudioTokensPerMinute(int audioTokensPerMinute) {
        this.audioTokensPerMinute = audioTokensPerMinute;
    }

    public Map<ModelTier, TierPrice> getTiers() {
        return tiers;
    }

    public void setTiers(Map<ModelTier, TierPrice> tiers) {
        this.tiers = tiers;
    }

    private static Map<ModelTier, TierPrice> defaultTiers() {
        Map<ModelTier, TierPrice> defaults = new EnumMap<>(ModelTier.class);
        defaults.put(ModelTier.MINI, new TierPrice("0.60", "2.40", "25.00", "50.00"));
        defaults.put(ModelTier.STANDARD, new TierPrice("4.00", "16.00", "32.00", "64.00"));
        return defaults;
    }

    /**
     * Prices of one model tier.
     */
    public static class TierPrice {
        private BigDecimal textInputPerMillion;
        private BigDecimal textOutputPerMillion;
        private BigDecimal audioInputPerMillion;
        private BigDecimal audioOutputPerMillion;

        public TierPrice() {
            this("0", "0", "0", "0");
        }

        public TierPrice(String textIn, String textOut, String audioIn, String audioOut) {
            this.textInputPerMillion = new BigDecimal(textIn);
            this.textOutputPerMillion = new BigDecimal(textOut);
            this.audioInputPerMillion = new BigDecimal(audioIn);
            this.audioOutputPerMillion = new BigDecimal(audioOut);
        }

        public BigDecimal getTextInputPerMillion() {
            return textInputPerMillion;
        }

        public void setTextInputPerMillion(BigDecimal textInputPerMillion) {
            this.textInputPerMillion = textInputPerMillion;
        }

        public BigDecimal getTextOutputPerMillion() {
            return textOutputPerMillion;
        }

        public void setTextOutputPerMillion(BigDecimal textOutputPerMillion) {
            this.textOutputPerMillion = textOutputPerMillion;
        }

        public BigDecimal getAudioInputPerMillion() {
            return audioInputPerMillion;
        }

        public void setAudioInputPerMillion(BigDecimal audioInputPerMillion) {
            this.audioInputPerMillion = audioInputPerMillion;
        }

        public BigDecimal getAudioOutputPerMillion() {
            return audioOutputPerMillion;
        }

        public void setAudioOutputPerMillion(BigDecimal audioOutputPerMillion) {
            this.audioOutputPerMillion = audioOutputPerMillion;
        }
    }
}
