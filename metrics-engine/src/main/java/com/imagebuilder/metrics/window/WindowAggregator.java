package com.imagebuilder.metrics.window;

import com.imagebuilder.metrics.error.EmptyDatasetException;
import com.imagebuilder.metrics.error.InvalidWindowSpecException;
import com.imagebuilder.metrics.model.BuildRecord;
import com.imagebuilder.metrics.model.CountSeries;
import com.imagebuilder.metrics.model.Dataset;
import com.imagebuilder.metrics.model.Window;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Distinct-value and record counts over calendar, fixed-period and sliding windows.
 *
 * <p>Semantics:
 * - Membership is half-open: a record at {@code t} belongs to {@code [start, end)} iff
 *   {@code start <= t < end}.
 * - Records without a timestamp never contribute, and a null attribute value is not a distinct value.
 * - An empty window yields a zero count; it is never omitted from the series.
 * - A dataset without timestamped records raises {@link EmptyDatasetException}.
 *
 * <p>Sliding windows of width {@code W} days start once a full window is available
 * ({@code t = min + W}) and step the window end by one day while {@code t < max}. Their labels
 * are window ends.
 */
public final class WindowAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(WindowAggregator.class);

    private static final Duration SLIDING_STEP = Duration.ofDays(1);

    private WindowAggregator() {}

    public static CountSeries monthlyUsers(Dataset dataset) {
        return distinctPerMonth(dataset, Attributes.ORG_ID);
    }

    public static CountSeries monthlyBuilds(Dataset dataset) {
        return distinctPerMonth(dataset, Attributes.JOB_ID);
    }

    public static CountSeries distinctPerMonth(Dataset dataset, Function<BuildRecord, ?> selector) {
        List<BuildRecord> sorted = requireChronological(dataset, "distinct per month");
        List<Window> buckets = TimeBuckets.calendarMonths(
                sorted.get(0).createdAt(), sorted.get(sorted.size() - 1).createdAt());
        return distinctPerWindow(sorted, buckets, selector);
    }

    public static CountSeries recordsPerMonth(Dataset dataset) {
        List<BuildRecord> sorted = requireChronological(dataset, "records per month");
        List<Window> buckets = TimeBuckets.calendarMonths(
                sorted.get(0).createdAt(), sorted.get(sorted.size() - 1).createdAt());
        return recordsPerWindow(sorted, buckets);
    }

    public static CountSeries distinctPerPeriod(
            Dataset dataset,
            Function<BuildRecord, ?> selector,
            LocalDateTime start,
            LocalDateTime end,
            Duration period,
            TailPolicy tailPolicy) {
        List<BuildRecord> sorted = requireChronological(dataset, "distinct per period");
        return distinctPerWindow(sorted, TimeBuckets.fixedPeriods(start, end, period, tailPolicy), selector);
    }

    public static CountSeries recordsPerPeriod(
            Dataset dataset,
            LocalDateTime start,
            LocalDateTime end,
            Duration period,
            TailPolicy tailPolicy) {
        List<BuildRecord> sorted = requireChronological(dataset, "records per period");
        return recordsPerWindow(sorted, TimeBuckets.fixedPeriods(start, end, period, tailPolicy));
    }

    /**
     * Distinct counts over caller-supplied buckets, labelled by bucket start.
     */
    public static CountSeries distinctPerWindow(
            Dataset dataset,
            List<Window> buckets,
            Function<BuildRecord, ?> selector) {
        return distinctPerWindow(requireChronological(dataset, "distinct per window"), buckets, selector);
    }

    public static CountSeries distinctSliding(Dataset dataset, Function<BuildRecord, ?> selector, int widthDays) {
        if (widthDays < 1) {
            throw new InvalidWindowSpecException("Sliding window width must be at least 1 day, got " + widthDays);
        }
        List<BuildRecord> sorted = requireChronological(dataset, "distinct sliding window");
        LocalDateTime min = sorted.get(0).createdAt();
        LocalDateTime max = sorted.get(sorted.size() - 1).createdAt();
        Duration width = Duration.ofDays(widthDays);

        List<Long> counts = new ArrayList<>();
        List<LocalDateTime> ends = new ArrayList<>();
        LocalDateTime current = min.plus(width);
        while (current.isBefore(max)) {
            counts.add(distinctIn(sorted, current.minus(width), current, selector));
            ends.add(current);
            current = current.plus(SLIDING_STEP);
        }
        LOG.debug("Sliding window width={}d produced {} points over [{}, {}]", widthDays, counts.size(), min, max);
        return new CountSeries(counts, ends);
    }

    /**
     * Distinct values of {@code selector} among all timestamped records in {@code [start, end)}.
     */
    public static Set<Object> distinctValues(
            Dataset dataset,
            Function<BuildRecord, ?> selector,
            LocalDateTime start,
            LocalDateTime end) {
        return valuesIn(dataset.chronological(), start, end, selector);
    }

    private static CountSeries distinctPerWindow(
            List<BuildRecord> sorted,
            List<Window> buckets,
            Function<BuildRecord, ?> selector) {
        List<Long> counts = new ArrayList<>(buckets.size());
        List<LocalDateTime> starts = new ArrayList<>(buckets.size());
        for (Window bucket : buckets) {
            counts.add(distinctIn(sorted, bucket.start(), bucket.end(), selector));
            starts.add(bucket.start());
        }
        return new CountSeries(counts, starts);
    }

    private static CountSeries recordsPerWindow(List<BuildRecord> sorted, List<Window> buckets) {
        List<Long> counts = new ArrayList<>(buckets.size());
        List<LocalDateTime> starts = new ArrayList<>(buckets.size());
        for (Window bucket : buckets) {
            counts.add((long) (lowerBound(sorted, bucket.end()) - lowerBound(sorted, bucket.start())));
            starts.add(bucket.start());
        }
        return new CountSeries(counts, starts);
    }

    private static long distinctIn(
            List<BuildRecord> sorted,
            LocalDateTime start,
            LocalDateTime end,
            Function<BuildRecord, ?> selector) {
        return valuesIn(sorted, start, end, selector).size();
    }

    private static Set<Object> valuesIn(
            List<BuildRecord> sorted,
            LocalDateTime start,
            LocalDateTime end,
            Function<BuildRecord, ?> selector) {
        Set<Object> values = new HashSet<>();
        int to = lowerBound(sorted, end);
        for (int i = lowerBound(sorted, start); i < to; i++) {
            Object value = selector.apply(sorted.get(i));
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    // Index of the first record with createdAt >= ts.
    private static int lowerBound(List<BuildRecord> sorted, LocalDateTime ts) {
        int lo = 0;
        int hi = sorted.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted.get(mid).createdAt().isBefore(ts)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private static List<BuildRecord> requireChronological(Dataset dataset, String operation) {
        List<BuildRecord> sorted = dataset.chronological();
        if (sorted.isEmpty()) {
            throw new EmptyDatasetException(operation);
        }
        return sorted;
    }
}
