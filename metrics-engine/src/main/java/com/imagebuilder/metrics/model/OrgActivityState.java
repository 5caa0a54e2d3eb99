package com.imagebuilder.metrics.model;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Ascending build timestamps of a single organization.
 */
public final class OrgActivityState {
    private final String orgId;
    private final List<LocalDateTime> buildTimes;

    public OrgActivityState(String orgId, List<LocalDateTime> buildTimes) {
        if (buildTimes == null || buildTimes.isEmpty()) {
            throw new IllegalArgumentException("Organization " + orgId + " has no timestamped builds");
        }
        List<LocalDateTime> sorted = new ArrayList<>(buildTimes);
        Collections.sort(sorted);
        this.orgId = orgId;
        this.buildTimes = Collections.unmodifiableList(sorted);
    }

    public String orgId() {
        return orgId;
    }

    public List<LocalDateTime> buildTimes() {
        return buildTimes;
    }

    public int buildCount() {
        return buildTimes.size();
    }

    public LocalDateTime firstBuild() {
        return buildTimes.get(0);
    }

    public LocalDateTime lastBuild() {
        return buildTimes.get(buildTimes.size() - 1);
    }

    /**
     * Inter-arrival gaps {@code t[i+1] - t[i]}; one fewer than the number of builds.
     */
    public List<Duration> gaps() {
        List<Duration> gaps = new ArrayList<>(Math.max(0, buildTimes.size() - 1));
        for (int i = 1; i < buildTimes.size(); i++) {
            gaps.add(Duration.between(buildTimes.get(i - 1), buildTimes.get(i)));
        }
        return gaps;
    }

    /**
     * Distinct calendar days with at least one build.
     */
    public SortedSet<LocalDate> buildDays() {
        SortedSet<LocalDate> days = new TreeSet<>();
        for (LocalDateTime ts : buildTimes) {
            days.add(ts.toLocalDate());
        }
        return Collections.unmodifiableSortedSet(days);
    }
}
