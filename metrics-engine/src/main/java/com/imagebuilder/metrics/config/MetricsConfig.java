package com.imagebuilder.metrics.config;

import com.imagebuilder.metrics.util.StringSemantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration for the usage report, sourced from environment variables.
 */
public final class MetricsConfig {
    private static final Logger LOG = LoggerFactory.getLogger(MetricsConfig.class);

    public final int repeatMinBuilds;
    public final Duration repeatPeriod;
    public final int activeMinDays;
    public final int activeRecentDays;

    public final List<String> filterPatterns;
    public final List<String> filterOrgIds;
    public final LocalDateTime sliceStart;
    public final LocalDateTime sliceEnd;

    public final Duration overTimePeriod;
    public final int topLimit;
    public final String reportPath;

    private MetricsConfig(
            int repeatMinBuilds,
            Duration repeatPeriod,
            int activeMinDays,
            int activeRecentDays,
            List<String> filterPatterns,
            List<String> filterOrgIds,
            LocalDateTime sliceStart,
            LocalDateTime sliceEnd,
            Duration overTimePeriod,
            int topLimit,
            String reportPath) {
        this.repeatMinBuilds = repeatMinBuilds;
        this.repeatPeriod = repeatPeriod;
        this.activeMinDays = activeMinDays;
        this.activeRecentDays = activeRecentDays;
        this.filterPatterns = Collections.unmodifiableList(filterPatterns);
        this.filterOrgIds = Collections.unmodifiableList(filterOrgIds);
        this.sliceStart = sliceStart;
        this.sliceEnd = sliceEnd;
        this.overTimePeriod = overTimePeriod;
        this.topLimit = topLimit;
        this.reportPath = reportPath;
    }

    public static MetricsConfig fromEnv() {
        return fromMap(System.getenv());
    }

    public static MetricsConfig defaults() {
        return fromMap(Collections.emptyMap());
    }

    public static MetricsConfig fromMap(Map<String, String> env) {
        int repeatMinBuilds = envInt(env, "IBMETRICS_REPEAT_MIN_BUILDS", 3);
        Duration repeatPeriod = Duration.ofDays(envInt(env, "IBMETRICS_REPEAT_PERIOD_DAYS", 7));
        int activeMinDays = envInt(env, "IBMETRICS_ACTIVE_MIN_DAYS", 3);
        int activeRecentDays = envInt(env, "IBMETRICS_ACTIVE_RECENT_DAYS", 30);

        List<String> filterPatterns = StringSemantics.splitCsv(env.get("IBMETRICS_FILTER_PATTERNS"));
        List<String> filterOrgIds = StringSemantics.splitCsv(env.get("IBMETRICS_FILTER_ORG_IDS"));
        LocalDateTime sliceStart = envDateTime(env, "IBMETRICS_START");
        LocalDateTime sliceEnd = envDateTime(env, "IBMETRICS_END");

        Duration overTimePeriod = Duration.ofDays(envInt(env, "IBMETRICS_PERIOD_DAYS", 7));
        int topLimit = envInt(env, "IBMETRICS_TOP_LIMIT", 20);
        String reportPath = StringSemantics.orDefault(env.get("IBMETRICS_REPORT_PATH"), "ibmetrics-report.json");

        return new MetricsConfig(
                repeatMinBuilds,
                repeatPeriod,
                activeMinDays,
                activeRecentDays,
                filterPatterns,
                filterOrgIds,
                sliceStart,
                sliceEnd,
                overTimePeriod,
                topLimit,
                reportPath);
    }

    private static int envInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            LOG.warn("Ignoring non-numeric {}={}; using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    // Accepts a date (midnight) or a full ISO local date-time.
    private static LocalDateTime envDateTime(Map<String, String> env, String key) {
        String value = StringSemantics.blankToNull(env.get(key));
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay();
            }
            return LocalDateTime.parse(trimmed);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, ex);
        }
    }

    @Override
    public String toString() {
        return "MetricsConfig{repeatMinBuilds=" + repeatMinBuilds
                + ", repeatPeriod=" + repeatPeriod
                + ", activeMinDays=" + activeMinDays
                + ", activeRecentDays=" + activeRecentDays
                + ", filterPatterns=" + filterPatterns.size()
                + ", filterOrgIds=" + filterOrgIds.size()
                + ", sliceStart=" + sliceStart
                + ", sliceEnd=" + sliceEnd
                + ", overTimePeriod=" + overTimePeriod
                + ", topLimit=" + topLimit
                + ", reportPath=" + reportPath + "}";
    }
}
