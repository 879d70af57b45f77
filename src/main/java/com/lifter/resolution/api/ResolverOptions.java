package com.lifter.resolution.api;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Properties;

/**
 * Options for lifter resolution.
 * Configures date windows, performance tolerances, guard thresholds and source retries.
 *
 * <p>Defaults can be overridden in code through {@link #builder()} or from a properties file
 * via {@link #fromProperties(Properties)}; see {@code lifter-resolution.properties} for the keys.</p>
 */
public class ResolverOptions {

    public static final String DEFAULT_RESOURCE = "/lifter-resolution.properties";

    private static final int DEFAULT_DATE_WINDOW_DAYS = 5;
    private static final int DEFAULT_HISTORY_DATE_TOLERANCE_DAYS = 5;
    private static final double DEFAULT_BODYWEIGHT_TOLERANCE_KG = 2.0;
    private static final double DEFAULT_TOTAL_TOLERANCE_KG = 5.0;
    private static final double DEFAULT_EXTREME_DIFFERENCE_KG = 40.0;
    private static final double DEFAULT_EXTREME_ABSOLUTE_KG = 50.0;
    private static final LocalDate DEFAULT_DIVISION_CUTOVER = LocalDate.of(2025, 6, 1);
    private static final int DEFAULT_BISECTION_MAX_DEPTH = 3;
    private static final int DEFAULT_MIN_WINDOW_DAYS = 1;
    private static final int DEFAULT_HISTORY_MAX_PAGES = 50;
    private static final int DEFAULT_TIER_RETRIES = 2;
    private static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(500);
    private static final Duration DEFAULT_SOURCE_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_HISTORY_CACHE_MAX_SIZE = 10_000;
    private static final Duration DEFAULT_HISTORY_CACHE_TTL = Duration.ofHours(1);

    private final int dateWindowDays;
    private final int historyDateToleranceDays;
    private final double bodyweightToleranceKg;
    private final double totalToleranceKg;
    private final double extremeDifferenceKg;
    private final double extremeAbsoluteKg;
    private final LocalDate divisionCutover;
    private final int bisectionMaxDepth;
    private final int minWindowDays;
    private final int historyMaxPages;
    private final int tierRetries;
    private final Duration retryBackoff;
    private final Duration sourceTimeout;
    private final int historyCacheMaxSize;
    private final Duration historyCacheTtl;
    private final boolean sameDivisionSkipsTier1;
    private final boolean preserveHarvestedStableId;

    private ResolverOptions(Builder builder) {
        this.dateWindowDays = builder.dateWindowDays;
        this.historyDateToleranceDays = builder.historyDateToleranceDays;
        this.bodyweightToleranceKg = builder.bodyweightToleranceKg;
        this.totalToleranceKg = builder.totalToleranceKg;
        this.extremeDifferenceKg = builder.extremeDifferenceKg;
        this.extremeAbsoluteKg = builder.extremeAbsoluteKg;
        this.divisionCutover = builder.divisionCutover;
        this.bisectionMaxDepth = builder.bisectionMaxDepth;
        this.minWindowDays = builder.minWindowDays;
        this.historyMaxPages = builder.historyMaxPages;
        this.tierRetries = builder.tierRetries;
        this.retryBackoff = builder.retryBackoff;
        this.sourceTimeout = builder.sourceTimeout;
        this.historyCacheMaxSize = builder.historyCacheMaxSize;
        this.historyCacheTtl = builder.historyCacheTtl;
        this.sameDivisionSkipsTier1 = builder.sameDivisionSkipsTier1;
        this.preserveHarvestedStableId = builder.preserveHarvestedStableId;
    }

    /**
     * Days on each side of the meet date swept in the division rankings.
     */
    public int getDateWindowDays() {
        return dateWindowDays;
    }

    /**
     * Maximum distance in days between a history entry and the meet date.
     */
    public int getHistoryDateToleranceDays() {
        return historyDateToleranceDays;
    }

    public double getBodyweightToleranceKg() {
        return bodyweightToleranceKg;
    }

    public double getTotalToleranceKg() {
        return totalToleranceKg;
    }

    /**
     * Bodyweight gap that makes a same-name match suspicious when age brackets differ.
     */
    public double getExtremeDifferenceKg() {
        return extremeDifferenceKg;
    }

    /**
     * Bodyweight gap that forces a split regardless of age brackets.
     */
    public double getExtremeAbsoluteKg() {
        return extremeAbsoluteKg;
    }

    /**
     * Divisions of meets before this date are listed under their "(Inactive)" name.
     */
    public LocalDate getDivisionCutover() {
        return divisionCutover;
    }

    public int getBisectionMaxDepth() {
        return bisectionMaxDepth;
    }

    public int getMinWindowDays() {
        return minWindowDays;
    }

    public int getHistoryMaxPages() {
        return historyMaxPages;
    }

    public int getTierRetries() {
        return tierRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public Duration getSourceTimeout() {
        return sourceTimeout;
    }

    public int getHistoryCacheMaxSize() {
        return historyCacheMaxSize;
    }

    public Duration getHistoryCacheTtl() {
        return historyCacheTtl;
    }

    /**
     * When the name already has a result in the same meet and division, the division rankings
     * cannot tell the lifters apart and Tier 1 is skipped.
     */
    public boolean isSameDivisionSkipsTier1() {
        return sameDivisionSkipsTier1;
    }

    /**
     * Carry a stable id harvested by Tier 1 onto a lifter created after disambiguation failed.
     */
    public boolean isPreserveHarvestedStableId() {
        return preserveHarvestedStableId;
    }

    public static ResolverOptions defaults() {
        return builder().build();
    }

    /**
     * Loads options from the classpath resource {@value #DEFAULT_RESOURCE}, falling back to
     * defaults when it is absent.
     */
    public static ResolverOptions load() {
        try (InputStream in = ResolverOptions.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Builds options from properties. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static ResolverOptions fromProperties(Properties p) {
        Builder b = builder();
        String v;
        if ((v = p.getProperty("resolution.date-window-days")) != null) b.dateWindowDays(Integer.parseInt(v.trim()));
        if ((v = p.getProperty("resolution.history.date-tolerance-days")) != null) b.historyDateToleranceDays(Integer.parseInt(v.trim()));
        if ((v = p.getProperty("resolution.history.bodyweight-tolerance-kg")) != null) b.bodyweightToleranceKg(Double.parseDouble(v.trim()));
        if ((v = p.getProperty("resolution.history.total-tolerance-kg")) != null) b.totalToleranceKg(Double.parseDouble(v.trim()));
        if ((v = p.getProperty("resolution.history.max-pages")) != null) b.historyMaxPages(Integer.parseInt(v.trim()));
        if ((v = p.getProperty("resolution.guard.extreme-difference-kg")) != null) b.extremeDifferenceKg(Double.parseDouble(v.trim()));
        if ((v = p.getProperty("resolution.guard.extreme-absolute-kg")) != null) b.extremeAbsoluteKg(Double.parseDouble(v.trim()));
        if ((v = p.getProperty("resolution.division.cutover")) != null) b.divisionCutover(LocalDate.parse(v.trim()));
        if ((v = p.getProperty("resolution.division.bisection-max-depth")) != null) b.bisectionMaxDepth(Integer.parseInt(v.trim()));
        if ((v = p.getProperty("resolution.division.min-window-days")) != null) b.minWindowDays(Integer.parseInt(v.trim()));
        if ((v = p.getProperty("resolution.tier.retries")) != null) b.tierRetries(Integer.parseInt(v.trim()));
        if ((v = p.getProperty("resolution.tier.retry-backoff-ms")) != null) b.retryBackoff(Duration.ofMillis(Long.parseLong(v.trim())));
        if ((v = p.getProperty("resolution.source.timeout-ms")) != null) b.sourceTimeout(Duration.ofMillis(Long.parseLong(v.trim())));
        if ((v = p.getProperty("resolution.history.cache.max-size")) != null) b.historyCacheMaxSize(Integer.parseInt(v.trim()));
        if ((v = p.getProperty("resolution.history.cache.ttl-seconds")) != null) b.historyCacheTtl(Duration.ofSeconds(Long.parseLong(v.trim())));
        if ((v = p.getProperty("resolution.rule.same-division-skips-tier1")) != null) b.sameDivisionSkipsTier1(Boolean.parseBoolean(v.trim()));
        if ((v = p.getProperty("resolution.rule.preserve-harvested-stable-id")) != null) b.preserveHarvestedStableId(Boolean.parseBoolean(v.trim()));
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int dateWindowDays = DEFAULT_DATE_WINDOW_DAYS;
        private int historyDateToleranceDays = DEFAULT_HISTORY_DATE_TOLERANCE_DAYS;
        private double bodyweightToleranceKg = DEFAULT_BODYWEIGHT_TOLERANCE_KG;
        private double totalToleranceKg = DEFAULT_TOTAL_TOLERANCE_KG;
        private double extremeDifferenceKg = DEFAULT_EXTREME_DIFFERENCE_KG;
        private double extremeAbsoluteKg = DEFAULT_EXTREME_ABSOLUTE_KG;
        private LocalDate divisionCutover = DEFAULT_DIVISION_CUTOVER;
        private int bisectionMaxDepth = DEFAULT_BISECTION_MAX_DEPTH;
        private int minWindowDays = DEFAULT_MIN_WINDOW_DAYS;
        private int historyMaxPages = DEFAULT_HISTORY_MAX_PAGES;
        private int tierRetries = DEFAULT_TIER_RETRIES;
        private Duration retryBackoff = DEFAULT_RETRY_BACKOFF;
        private Duration sourceTimeout = DEFAULT_SOURCE_TIMEOUT;
        private int historyCacheMaxSize = DEFAULT_HISTORY_CACHE_MAX_SIZE;
        private Duration historyCacheTtl = DEFAULT_HISTORY_CACHE_TTL;
        private boolean sameDivisionSkipsTier1 = true;
        private boolean preserveHarvestedStableId = true;

        public Builder dateWindowDays(int dateWindowDays) {
            requireNonNegative(dateWindowDays, "dateWindowDays");
            this.dateWindowDays = dateWindowDays;
            return this;
        }

        public Builder historyDateToleranceDays(int historyDateToleranceDays) {
            requireNonNegative(historyDateToleranceDays, "historyDateToleranceDays");
            this.historyDateToleranceDays = historyDateToleranceDays;
            return this;
        }

        public Builder bodyweightToleranceKg(double bodyweightToleranceKg) {
            requireNonNegative(bodyweightToleranceKg, "bodyweightToleranceKg");
            this.bodyweightToleranceKg = bodyweightToleranceKg;
            return this;
        }

        public Builder totalToleranceKg(double totalToleranceKg) {
            requireNonNegative(totalToleranceKg, "totalToleranceKg");
            this.totalToleranceKg = totalToleranceKg;
            return this;
        }

        public Builder extremeDifferenceKg(double extremeDifferenceKg) {
            requireNonNegative(extremeDifferenceKg, "extremeDifferenceKg");
            this.extremeDifferenceKg = extremeDifferenceKg;
            return this;
        }

        public Builder extremeAbsoluteKg(double extremeAbsoluteKg) {
            requireNonNegative(extremeAbsoluteKg, "extremeAbsoluteKg");
            this.extremeAbsoluteKg = extremeAbsoluteKg;
            return this;
        }

        public Builder divisionCutover(LocalDate divisionCutover) {
            if (divisionCutover == null) {
                throw new IllegalArgumentException("divisionCutover is required");
            }
            this.divisionCutover = divisionCutover;
            return this;
        }

        public Builder bisectionMaxDepth(int bisectionMaxDepth) {
            requireNonNegative(bisectionMaxDepth, "bisectionMaxDepth");
            this.bisectionMaxDepth = bisectionMaxDepth;
            return this;
        }

        public Builder minWindowDays(int minWindowDays) {
            if (minWindowDays < 1) {
                throw new IllegalArgumentException("minWindowDays must be >= 1");
            }
            this.minWindowDays = minWindowDays;
            return this;
        }

        public Builder historyMaxPages(int historyMaxPages) {
            if (historyMaxPages < 1) {
                throw new IllegalArgumentException("historyMaxPages must be >= 1");
            }
            this.historyMaxPages = historyMaxPages;
            return this;
        }

        public Builder tierRetries(int tierRetries) {
            requireNonNegative(tierRetries, "tierRetries");
            this.tierRetries = tierRetries;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            if (retryBackoff == null || retryBackoff.isNegative()) {
                throw new IllegalArgumentException("retryBackoff must be >= 0");
            }
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder sourceTimeout(Duration sourceTimeout) {
            if (sourceTimeout == null || sourceTimeout.isNegative() || sourceTimeout.isZero()) {
                throw new IllegalArgumentException("sourceTimeout must be positive");
            }
            this.sourceTimeout = sourceTimeout;
            return this;
        }

        public Builder historyCacheMaxSize(int historyCacheMaxSize) {
            if (historyCacheMaxSize <= 0) {
                throw new IllegalArgumentException("historyCacheMaxSize must be > 0");
            }
            this.historyCacheMaxSize = historyCacheMaxSize;
            return this;
        }

        public Builder historyCacheTtl(Duration historyCacheTtl) {
            if (historyCacheTtl == null || historyCacheTtl.isNegative() || historyCacheTtl.isZero()) {
                throw new IllegalArgumentException("historyCacheTtl must be positive");
            }
            this.historyCacheTtl = historyCacheTtl;
            return this;
        }

        public Builder sameDivisionSkipsTier1(boolean sameDivisionSkipsTier1) {
            this.sameDivisionSkipsTier1 = sameDivisionSkipsTier1;
            return this;
        }

        public Builder preserveHarvestedStableId(boolean preserveHarvestedStableId) {
            this.preserveHarvestedStableId = preserveHarvestedStableId;
            return this;
        }

        public ResolverOptions build() {
            if (extremeAbsoluteKg < extremeDifferenceKg) {
                throw new IllegalArgumentException("extremeAbsoluteKg must be >= extremeDifferenceKg");
            }
            return new ResolverOptions(this);
        }

        private static void requireNonNegative(double value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be >= 0");
            }
        }
    }

    @Override
    public String toString() {
        return "ResolverOptions{" +
                "dateWindowDays=" + dateWindowDays +
                ", historyDateToleranceDays=" + historyDateToleranceDays +
                ", bodyweightToleranceKg=" + bodyweightToleranceKg +
                ", totalToleranceKg=" + totalToleranceKg +
                ", extremeDifferenceKg=" + extremeDifferenceKg +
                ", extremeAbsoluteKg=" + extremeAbsoluteKg +
                ", divisionCutover=" + divisionCutover +
                ", bisectionMaxDepth=" + bisectionMaxDepth +
                ", tierRetries=" + tierRetries +
                '}';
    }
}
