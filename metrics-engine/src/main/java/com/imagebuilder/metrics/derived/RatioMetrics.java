package com.imagebuilder.metrics.derived;

import com.imagebuilder.metrics.model.CountSeries;
import com.imagebuilder.metrics.model.Dataset;
import com.imagebuilder.metrics.model.RatioSeries;
import com.imagebuilder.metrics.window.Attributes;
import com.imagebuilder.metrics.window.WindowAggregator;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Ratios composed from sliding-window distinct-org counts.
 */
public final class RatioMetrics {
    public static final int DAU_WIDTH_DAYS = 1;
    public static final int MAU_WIDTH_DAYS = 30;

    private RatioMetrics() {}

    /**
     * Daily active orgs over orgs active in the preceding 30 days, labelled by window end. DAU has
     * more points than MAU and is cut to its tail before dividing.
     */
    public static RatioSeries dauOverMau(Dataset dataset) {
        CountSeries dau = WindowAggregator.distinctSliding(dataset, Attributes.ORG_ID, DAU_WIDTH_DAYS);
        CountSeries mau = WindowAggregator.distinctSliding(dataset, Attributes.ORG_ID, MAU_WIDTH_DAYS);
        return tailAlignedRatio(dau, mau);
    }

    /**
     * Elementwise {@code numerator / denominator} after dropping the leading numerator points so both
     * series end together. Labels come from the denominator. A zero denominator is an error.
     */
    public static RatioSeries tailAlignedRatio(CountSeries numerator, CountSeries denominator) {
        if (numerator.size() < denominator.size()) {
            throw new IllegalArgumentException("Numerator series (" + numerator.size()
                    + " points) is shorter than denominator series (" + denominator.size() + " points)");
        }
        CountSeries aligned = numerator.tail(denominator.size());
        List<Double> ratios = new ArrayList<>(denominator.size());
        List<LocalDateTime> labels = new ArrayList<>(denominator.size());
        for (int i = 0; i < denominator.size(); i++) {
            long den = denominator.count(i);
            if (den == 0L) {
                throw new IllegalStateException("Zero denominator at window ending " + denominator.label(i));
            }
            ratios.add((double) aligned.count(i) / den);
            labels.add(denominator.label(i));
        }
        return new RatioSeries(ratios, labels);
    }
}
