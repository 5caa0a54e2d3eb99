package com.imagebuilder.metrics.activity;

import com.imagebuilder.metrics.error.InvalidWindowSpecException;
import com.imagebuilder.metrics.model.BuildRecord;
import com.imagebuilder.metrics.model.Dataset;
import com.imagebuilder.metrics.model.OrgActivityState;
import com.imagebuilder.metrics.window.TimeBuckets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Per-organization repeat and active classification over ascending build timestamps.
 *
 * <p>Repeat contract: an organization is a repeat org when some run of {@code minBuilds}
 * consecutive builds spans strictly less than {@code period}, i.e. some {@code minBuilds - 1}
 * contiguous gaps sum to less than {@code period}. Organizations with fewer than
 * {@code minBuilds} builds never qualify. {@code minBuilds < 2} is rejected: a run of zero gaps
 * would make every organization a repeat org.
 *
 * <p>Active contract: at least {@code minDays} distinct build days and a most recent build day
 * (at midnight) strictly after {@code now - recentLimitDays}. {@code now} is always supplied by
 * the caller so results are reproducible.
 */
public final class ActivityClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(ActivityClassifier.class);

    public static final int MIN_REPEAT_BUILDS = 2;
    public static final int MIN_ACTIVE_DAYS = 1;

    private ActivityClassifier() {}

    public static Map<String, OrgActivityState> activityStates(Dataset dataset) {
        Map<String, List<LocalDateTime>> times = new LinkedHashMap<>();
        for (BuildRecord record : dataset.timestamped()) {
            if (record.orgId() != null) {
                times.computeIfAbsent(record.orgId(), k -> new ArrayList<>()).add(record.createdAt());
            }
        }
        Map<String, OrgActivityState> states = new LinkedHashMap<>();
        for (Map.Entry<String, List<LocalDateTime>> entry : times.entrySet()) {
            states.put(entry.getKey(), new OrgActivityState(entry.getKey(), entry.getValue()));
        }
        return states;
    }

    public static SortedSet<String> repeatOrgs(Dataset dataset, int minBuilds, Duration period) {
        if (minBuilds < MIN_REPEAT_BUILDS) {
            throw new InvalidWindowSpecException(
                    "minBuilds must be at least " + MIN_REPEAT_BUILDS + ", got " + minBuilds);
        }
        TimeBuckets.requirePositive(period, "period");

        SortedSet<String> repeat = new TreeSet<>();
        for (OrgActivityState state : activityStates(dataset).values()) {
            if (isRepeat(state, minBuilds, period)) {
                repeat.add(state.orgId());
            }
        }
        LOG.debug("Repeat orgs (minBuilds={}, period={}): {}", minBuilds, period, repeat.size());
        return repeat;
    }

    static boolean isRepeat(OrgActivityState state, int minBuilds, Duration period) {
        List<Duration> gaps = state.gaps();
        int run = minBuilds - 1;
        if (gaps.size() < run) {
            return false;
        }
        Duration sum = Duration.ZERO;
        for (int i = 0; i < run; i++) {
            sum = sum.plus(gaps.get(i));
        }
        if (sum.compareTo(period) < 0) {
            return true;
        }
        for (int i = run; i < gaps.size(); i++) {
            sum = sum.plus(gaps.get(i)).minus(gaps.get(i - run));
            if (sum.compareTo(period) < 0) {
                return true;
            }
        }
        return false;
    }

    public static SortedSet<String> activeOrgs(Dataset dataset, int minDays, int recentLimitDays, Clock clock) {
        return activeOrgs(dataset, minDays, recentLimitDays, LocalDateTime.now(clock));
    }

    public static SortedSet<String> activeOrgs(Dataset dataset, int minDays, int recentLimitDays, LocalDateTime now) {
        if (minDays < MIN_ACTIVE_DAYS) {
            throw new InvalidWindowSpecException("minDays must be at least " + MIN_ACTIVE_DAYS + ", got " + minDays);
        }
        if (recentLimitDays < 0) {
            throw new InvalidWindowSpecException("recentLimitDays must not be negative, got " + recentLimitDays);
        }
        LocalDateTime cutoff = now.minusDays(recentLimitDays);

        SortedSet<String> active = new TreeSet<>();
        for (Map.Entry<String, SortedSet<LocalDate>> entry : orgBuildDays(dataset).entrySet()) {
            SortedSet<LocalDate> days = entry.getValue();
            if (days.size() >= minDays && days.last().atStartOfDay().isAfter(cutoff)) {
                active.add(entry.getKey());
            }
        }
        LOG.debug("Active orgs (minDays={}, recentLimitDays={}, cutoff={}): {}",
                minDays, recentLimitDays, cutoff, active.size());
        return active;
    }

    /**
     * Distinct build days per organization.
     */
    public static Map<String, SortedSet<LocalDate>> orgBuildDays(Dataset dataset) {
        Map<String, SortedSet<LocalDate>> days = new TreeMap<>();
        for (OrgActivityState state : activityStates(dataset).values()) {
            days.put(state.orgId(), state.buildDays());
        }
        return days;
    }
}
