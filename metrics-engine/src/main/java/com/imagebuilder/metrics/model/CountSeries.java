package com.imagebuilder.metrics.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parallel counts and timestamps. Labels are bucket starts for calendar and fixed-period series
 * and window ends for sliding series.
 */
public final class CountSeries {
    private final List<Long> counts;
    private final List<LocalDateTime> labels;

    public CountSeries(List<Long> counts, List<LocalDateTime> labels) {
        if (counts.size() != labels.size()) {
            throw new IllegalArgumentException(
                    "Counts and labels differ in length: " + counts.size() + " != " + labels.size());
        }
        this.counts = Collections.unmodifiableList(new ArrayList<>(counts));
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
    }

    public List<Long> counts() {
        return counts;
    }

    public List<LocalDateTime> labels() {
        return labels;
    }

    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public long count(int index) {
        return counts.get(index);
    }

    public LocalDateTime label(int index) {
        return labels.get(index);
    }

    public long total() {
        long sum = 0L;
        for (Long count : counts) {
            sum += count;
        }
        return sum;
    }

    public double[] toArray() {
        double[] out = new double[counts.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = counts.get(i);
        }
        return out;
    }

    /**
     * The last {@code n} points of this series.
     */
    public CountSeries tail(int n) {
        if (n < 0 || n > size()) {
            throw new IllegalArgumentException("Cannot take tail of " + n + " from series of " + size());
        }
        int from = size() - n;
        return new CountSeries(counts.subList(from, size()), labels.subList(from, size()));
    }

    @Override
    public String toString() {
        return "CountSeries{counts=" + counts + ", labels=" + labels + "}";
    }
}
