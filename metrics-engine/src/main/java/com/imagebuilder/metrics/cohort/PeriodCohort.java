package com.imagebuilder.metrics.cohort;

import java.time.LocalDateTime;

/**
 * Organization counts for one bucket, split into first-time and returning organizations.
 */
public final class PeriodCohort {
    private final LocalDateTime start;
    private final long allOrgs;
    private final long newOrgs;

    public PeriodCohort(LocalDateTime start, long allOrgs, long newOrgs) {
        if (newOrgs < 0 || allOrgs < 0) {
            throw new IllegalArgumentException("Negative org count for bucket " + start);
        }
        if (newOrgs > allOrgs) {
            throw new IllegalStateException("New org count " + newOrgs + " exceeds all orgs " + allOrgs
                    + " for bucket " + start + "; first-seen tracking over-counted");
        }
        this.start = start;
        this.allOrgs = allOrgs;
        this.newOrgs = newOrgs;
    }

    public LocalDateTime start() {
        return start;
    }

    public long allOrgs() {
        return allOrgs;
    }

    public long newOrgs() {
        return newOrgs;
    }

    public long returningOrgs() {
        return allOrgs - newOrgs;
    }

    @Override
    public String toString() {
        return "PeriodCohort{start=" + start + ", all=" + allOrgs + ", new=" + newOrgs + "}";
    }
}
