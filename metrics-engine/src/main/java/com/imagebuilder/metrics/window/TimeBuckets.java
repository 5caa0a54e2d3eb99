package com.imagebuilder.metrics.window;

import com.imagebuilder.metrics.error.InvalidWindowSpecException;
import com.imagebuilder.metrics.model.Dataset;
import com.imagebuilder.metrics.model.Window;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Partitions a timestamp range into ordered, non-overlapping, half-open buckets.
 *
 * <p>Calendar-month buckets start at midnight on the first of the month containing the minimum
 * timestamp and end at the first of the month after the one containing the maximum, so every
 * bucket is exactly one calendar month wide.
 *
 * <p>Fixed-period buckets are anchored at an arbitrary start and are not aligned to calendar
 * weeks. See {@link TailPolicy} for the treatment of the final period.
 */
public final class TimeBuckets {
    private TimeBuckets() {}

    public static List<Window> calendarMonths(Dataset dataset) {
        return calendarMonths(dataset.minCreatedAt(), dataset.maxCreatedAt());
    }

    public static List<Window> calendarMonths(LocalDateTime min, LocalDateTime max) {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        if (max.isBefore(min)) {
            throw new InvalidWindowSpecException("Range end " + max + " is before start " + min);
        }
        LocalDateTime end = startOfMonth(max).plusMonths(1);
        List<Window> buckets = new ArrayList<>();
        LocalDateTime current = startOfMonth(min);
        while (current.isBefore(end)) {
            LocalDateTime next = current.plusMonths(1);
            buckets.add(new Window(current, next));
            current = next;
        }
        return buckets;
    }

    public static List<Window> fixedPeriods(Dataset dataset, Duration period, TailPolicy tailPolicy) {
        return fixedPeriods(dataset.minCreatedAt(), dataset.maxCreatedAt(), period, tailPolicy);
    }

    public static List<Window> fixedPeriods(
            LocalDateTime start,
            LocalDateTime end,
            Duration period,
            TailPolicy tailPolicy) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(tailPolicy, "tailPolicy");
        requirePositive(period, "period");

        List<Window> buckets = new ArrayList<>();
        LocalDateTime current = start;
        while (emits(current, end, period, tailPolicy)) {
            LocalDateTime next = current.plus(period);
            buckets.add(new Window(current, next));
            current = next;
        }
        return buckets;
    }

    public static LocalDateTime startOfMonth(LocalDateTime ts) {
        return ts.toLocalDate().withDayOfMonth(1).atStartOfDay();
    }

    /**
     * Midnight of the Monday on or before {@code ts}.
     */
    public static LocalDateTime mondayOnOrBefore(LocalDateTime ts) {
        return ts.toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).atStartOfDay();
    }

    public static void requirePositive(Duration period, String name) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new InvalidWindowSpecException(name + " must be positive, got " + period);
        }
    }

    private static boolean emits(LocalDateTime current, LocalDateTime end, Duration period, TailPolicy tailPolicy) {
        switch (tailPolicy) {
            case DROP_PARTIAL:
                return current.plus(period).isBefore(end);
            case INCLUDE_PARTIAL:
                return current.isBefore(end);
            default:
                throw new IllegalArgumentException("Unsupported tail policy: " + tailPolicy);
        }
    }
}
