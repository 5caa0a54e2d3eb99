package com.imagebuilder.metrics.cohort;

import com.imagebuilder.metrics.error.EmptyDatasetException;
import com.imagebuilder.metrics.model.BuildRecord;
import com.imagebuilder.metrics.model.CountSeries;
import com.imagebuilder.metrics.model.Dataset;
import com.imagebuilder.metrics.model.Window;
import com.imagebuilder.metrics.window.Attributes;
import com.imagebuilder.metrics.window.TailPolicy;
import com.imagebuilder.metrics.window.TimeBuckets;
import com.imagebuilder.metrics.window.WindowAggregator;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * First-seen tracking per organization and the new-vs-returning breakdowns built on it.
 *
 * <p>Every organization with at least one timestamped build appears exactly once in
 * {@link #firstSeen(Dataset)}, mapped to the minimum of its timestamps. Returning organizations
 * for a bucket are all organizations minus new ones and are never negative.
 */
public final class CohortTracker {
    private CohortTracker() {}

    public static Map<String, LocalDateTime> firstSeen(Dataset dataset) {
        Map<String, LocalDateTime> first = new LinkedHashMap<>();
        for (BuildRecord record : dataset.timestamped()) {
            if (record.orgId() == null) {
                continue;
            }
            first.merge(record.orgId(), record.createdAt(), (a, b) -> b.isBefore(a) ? b : a);
        }
        return first;
    }

    /**
     * One reduced record per organization carrying only its first build timestamp.
     */
    public static Dataset firstSeenDataset(Dataset dataset) {
        List<BuildRecord> reduced = new ArrayList<>();
        for (Map.Entry<String, LocalDateTime> entry : firstSeen(dataset).entrySet()) {
            reduced.add(BuildRecord.orgAt(entry.getKey(), entry.getValue()));
        }
        return Dataset.of(reduced);
    }

    /**
     * Organizations whose first build falls in each calendar month. Buckets span the full
     * dataset range so the series lines up with {@link WindowAggregator#monthlyUsers(Dataset)}.
     */
    public static CountSeries monthlyNewOrgs(Dataset dataset) {
        List<Window> months = TimeBuckets.calendarMonths(dataset);
        return WindowAggregator.distinctPerWindow(firstSeenDataset(dataset), months, Attributes.ORG_ID);
    }

    public static List<PeriodCohort> monthlyCohorts(Dataset dataset) {
        CountSeries all = WindowAggregator.monthlyUsers(dataset);
        CountSeries fresh = monthlyNewOrgs(dataset);
        List<PeriodCohort> rows = new ArrayList<>(all.size());
        for (int i = 0; i < all.size(); i++) {
            rows.add(new PeriodCohort(all.label(i), all.count(i), fresh.count(i)));
        }
        return rows;
    }

    /**
     * New and returning organizations per fixed period anchored at the first build. The tail
     * period holding the last build is kept, including when that build sits exactly on a period
     * boundary.
     */
    public static List<PeriodCohort> periodCohorts(Dataset dataset, Duration period) {
        // Periods are half-open, so the range must end just past the last build.
        List<Window> periods = TimeBuckets.fixedPeriods(
                dataset.minCreatedAt(), dataset.maxCreatedAt().plusNanos(1), period, TailPolicy.INCLUDE_PARTIAL);
        Set<Object> seenSoFar = new HashSet<>();
        List<PeriodCohort> rows = new ArrayList<>(periods.size());
        for (Window window : periods) {
            Set<Object> orgs = WindowAggregator.distinctValues(dataset, Attributes.ORG_ID, window.start(), window.end());
            long newOrgs = 0L;
            for (Object org : orgs) {
                if (!seenSoFar.contains(org)) {
                    newOrgs++;
                }
            }
            rows.add(new PeriodCohort(window.start(), orgs.size(), newOrgs));
            seenSoFar.addAll(orgs);
        }
        return rows;
    }

    /**
     * Organizations active in {@code [start, start + period)} compared against every build before {@code start}.
     */
    public static PeriodCohort newOrgsInPeriod(Dataset dataset, LocalDateTime start, Duration period) {
        if (dataset.timestamped().isEmpty()) {
            throw new EmptyDatasetException("new orgs in period");
        }
        TimeBuckets.requirePositive(period, "period");
        Window window = new Window(start, start.plus(period));
        Set<Object> active = WindowAggregator.distinctValues(dataset, Attributes.ORG_ID, window.start(), window.end());
        Map<String, LocalDateTime> first = firstSeen(dataset);
        long newOrgs = 0L;
        for (Object org : active) {
            if (!first.get(org).isBefore(start)) {
                newOrgs++;
            }
        }
        return new PeriodCohort(start, active.size(), newOrgs);
    }
}
