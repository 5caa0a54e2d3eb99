package com.imagebuilder.metrics.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parallel ratios and window-end timestamps.
 */
public final class RatioSeries {
    private final List<Double> ratios;
    private final List<LocalDateTime> labels;

    public RatioSeries(List<Double> ratios, List<LocalDateTime> labels) {
        if (ratios.size() != labels.size()) {
            throw new IllegalArgumentException(
                    "Ratios and labels differ in length: " + ratios.size() + " != " + labels.size());
        }
        this.ratios = Collections.unmodifiableList(new ArrayList<>(ratios));
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
    }

    public List<Double> ratios() {
        return ratios;
    }

    public List<LocalDateTime> labels() {
        return labels;
    }

    public int size() {
        return ratios.size();
    }

    public double ratio(int index) {
        return ratios.get(index);
    }

    public LocalDateTime label(int index) {
        return labels.get(index);
    }
}
