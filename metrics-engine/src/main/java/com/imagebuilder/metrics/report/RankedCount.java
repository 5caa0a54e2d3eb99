package com.imagebuilder.metrics.report;

/**
 * One line of a frequency table.
 */
public final class RankedCount {
    public final String label;
    public final long count;

    public RankedCount(String label, long count) {
        this.label = label;
        this.count = count;
    }

    @Override
    public String toString() {
        return label + "=" + count;
    }
}
