package com.phillippitts.voicegate.service.cost;

import com.phillippitts.voicegate.config.properties.PricingProperties;
import com.phillippitts.voicegate.config.properties.PricingProperties.TierPrice;
import com.phillippitts.voicegate.config.properties.ProviderProperties;
import com.phillippitts.voicegate.config.properties.UsageLimitProperties;
import com.phillippitts.voicegate.domain.ModelTier;
import com.phillippitts.voicegate.domain.SessionUsage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Prices session consumption and aggregates daily totals.
 *
 * <p>{@link #computeCost} and {@link #getDailyCostSummary(LocalDate, Collection)} are pure: they
 * read only their arguments and the pricing table. Every amount is recomputed from raw counters
 * with {@link BigDecimal}, so the same inputs always give the same output.
 *
 * <p>Audio is priced as tokens: {@code round(seconds * audioTokensPerMinute / 60)}, half up.
 */
@Service
public class CostAccountant {
    private static final Logger LOG = LogManager.getLogger(CostAccountant.class);

    /** Scale of stored amounts. Exact for prices with up to four decimals. */
    static final int MONEY_SCALE = 10;

    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000L);
    private static final BigDecimal SECONDS_PER_MINUTE = BigDecimal.valueOf(60);

    private final PricingProperties pricing;
    private final CostRecordStore store;
    private final ModelTier defaultTier;
    private final ZoneId zone;
    private final Clock clock;

    public CostAccountant(PricingProperties pricing,
                          CostRecordStore store,
                          ProviderProperties provider,
                          UsageLimitProperties limits,
                          Clock clock) {
        this.pricing = Objects.requireNonNull(pricing);
        this.store = Objects.requireNonNull(store);
        this.defaultTier = provider.getDefaultModelTier();
        this.zone = ZoneId.of(limits.getZone());
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Prices consumption at the default model tier.
     */
    public CostBreakdown computeCost(long durationSeconds, long textInputTokens, long textOutputTokens,
                                     double audioInputSeconds, double audioOutputSeconds) {
        return computeCost(defaultTier, durationSeconds, textInputTokens, textOutputTokens,
                audioInputSeconds, audioOutputSeconds);
    }

    /**
     * Prices consumption at the given tier.
     *
     * @throws IllegalArgumentException for negative counters or a tier without prices
     */
    public CostBreakdown computeCost(ModelTier tier, long durationSeconds, long textInputTokens,
                                     long textOutputTokens, double audioInputSeconds, double audioOutputSeconds) {
        Objects.requireNonNull(tier, "tier");
        if (durationSeconds < 0 || textInputTokens < 0 || textOutputTokens < 0
                || audioInputSeconds < 0 || audioOutputSeconds < 0) {
            throw new IllegalArgumentException("usage counters must not be negative");
        }
        TierPrice price = pricing.getTiers().get(tier);
        if (price == null) {
            throw new IllegalArgumentException("No pricing configured for tier " + tier.wireName());
        }

        long audioInputTokens = audioTokens(audioInputSeconds);
        long audioOutputTokens = audioTokens(audioOutputSeconds);

        BigDecimal textIn = price(textInputTokens, price.getTextInputPerMillion());
        BigDecimal textOut = price(textOutputTokens, price.getTextOutputPerMillion());
        BigDecimal audioIn = price(audioInputTokens, price.getAudioInputPerMillion());
        BigDecimal audioOut = price(audioOutputTokens, price.getAudioOutputPerMillion());
        BigDecimal total = textIn.add(textOut).add(audioIn).add(audioOut);

        return new CostBreakdown(tier, durationSeconds, textInputTokens, textOutputTokens,
                audioInputTokens, audioOutputTokens, textIn, textOut, audioIn, audioOut, total);
    }

    long audioTokens(double seconds) {
        return BigDecimal.valueOf(seconds)
                .multiply(BigDecimal.valueOf(pricing.getAudioTokensPerMinute()))
                .divide(SECONDS_PER_MINUTE, 0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    private static BigDecimal price(long tokens, BigDecimal perMillion) {
        return BigDecimal.valueOf(tokens)
                .multiply(perMillion)
                .divide(ONE_MILLION, MONEY_SCALE, RoundingMode.HALF_EVEN);
    }

    /**
     * Computes and stores the cost record of an ended session. A second call for the same session
     * returns the stored record unchanged.
     *
     * @throws org.springframework.dao.DataAccessException on store failures
     */
    public CostRecord recordSessionCost(String sessionId, ModelTier tier, SessionUsage usage, String endReason) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(usage, "usage");
        CostBreakdown breakdown = computeCost(tier == null ? defaultTier : tier, usage.durationSeconds(),
                usage.textInputTokens(), usage.textOutputTokens(),
                usage.audioInputSeconds(), usage.audioOutputSeconds());
        CostRecord record = new CostRecord(sessionId, breakdown, usage.errorOccurred(), endReason, clock.instant());

        if (store.insertIfAbsent(record)) {
            LOG.info("Session {} cost ${} ({}s, tier={})", sessionId,
                    breakdown.totalCost().setScale(4, RoundingMode.HALF_UP), breakdown.durationSeconds(),
                    breakdown.modelTier().wireName());
            return record;
        }
        LOG.debug("Cost for session {} already recorded", sessionId);
        return store.find(sessionId).orElse(record);
    }

    /**
     * Loads the records of {@code date} (in the quota zone) and aggregates them.
     *
     * @throws org.springframework.dao.DataAccessException on store failures
     */
    public DailyCostSummary getDailyCostSummary(LocalDate date) {
        Objects.requireNonNull(date, "date");
        Instant from = date.atStartOfDay(zone).toInstant();
        Instant to = date.plusDays(1).atStartOfDay(zone).toInstant();
        List<CostRecord> records = store.findRecordedBetween(from, to);
        return getDailyCostSummary(date, records);
    }

    /**
     * Pure reduction over the given records. Records are not filtered by date.
     */
    public DailyCostSummary getDailyCostSummary(LocalDate date, Collection<CostRecord> records) {
        Objects.requireNonNull(records, "records");
        int total = records.size();
        if (total == 0) {
            BigDecimal zero = BigDecimal.ZERO.setScale(MONEY_SCALE);
            return new DailyCostSummary(date, 0, 0, 0, 0, 0, 0, zero, zero, 0.0, 0);
        }

        long durationSeconds = 0;
        long textIn = 0;
        long textOut = 0;
        long audioIn = 0;
        long audioOut = 0;
        int successful = 0;
        BigDecimal totalCost = BigDecimal.ZERO.setScale(MONEY_SCALE);
        int[] perHour = new int[24];

        for (CostRecord r : records) {
            CostBreakdown b = r.breakdown();
            durationSeconds += b.durationSeconds();
            textIn += b.textInputTokens();
            textOut += b.textOutputTokens();
            audioIn += b.audioInputTokens();
            audioOut += b.audioOutputTokens();
            totalCost = totalCost.add(b.totalCost());
            if (!r.errorOccurred()) {
                successful++;
            }
            perHour[r.recordedAt().atZone(zone).getHour()]++;
        }

        long minutes = BigDecimal.valueOf(durationSeconds)
                .divide(SECONDS_PER_MINUTE, 0, RoundingMode.HALF_UP)
                .longValue();
        BigDecimal average = totalCost.divide(BigDecimal.valueOf(total), MONEY_SCALE, RoundingMode.HALF_EVEN);

        return new DailyCostSummary(date, total, minutes, textIn, textOut, audioIn, audioOut,
                totalCost, average, (double) successful / total, peakHour(perHour));
    }

    private static int peakHour(int[] perHour) {
        int peak = 0;
        for (int h = 1; h < perHour.length; h++) {
            if (perHour[h] > perHour[peak]) {
                peak = h;
            }
        }
        return peak;
    }
}
