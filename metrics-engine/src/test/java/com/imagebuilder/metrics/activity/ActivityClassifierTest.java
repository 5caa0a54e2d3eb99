package com.imagebuilder.metrics.activity;

import com.imagebuilder.metrics.error.InvalidWindowSpecException;
import com.imagebuilder.metrics.model.Dataset;
import com.imagebuilder.metrics.model.OrgActivityState;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

import static com.imagebuilder.metrics.support.Builds.at;
import static com.imagebuilder.metrics.support.Builds.build;
import static com.imagebuilder.metrics.support.Builds.day;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActivityClassifierTest {

    @Test
    void orgWithDailyBuildsIsRepeatForTwoDayPeriod() {
        Dataset dataset = Dataset.of(
                build("A", at("2023-01-01T09:00:00")),
                build("A", at("2023-01-02T09:00:00")),
                build("A", at("2023-01-03T09:00:00")));

        assertEquals(Set.of("A"), ActivityClassifier.repeatOrgs(dataset, 2, Duration.ofDays(2)));
    }

    @Test
    void orgWithFewerThanMinBuildsNeverQualifies() {
        Dataset dataset = Dataset.of(
                build("A", at("2023-01-01T09:00:00")),
                build("A", at("2023-01-01T09:00:01")));

        assertTrue(ActivityClassifier.repeatOrgs(dataset, 3, Duration.ofDays(3650)).isEmpty());
    }

    @Test
    void spanEqualToPeriodDoesNotQualify() {
        Dataset dataset = Dataset.of(
                build("A", day(2023, 1, 1)),
                build("A", day(2023, 1, 3)));

        assertTrue(ActivityClassifier.repeatOrgs(dataset, 2, Duration.ofDays(2)).isEmpty());
        assertEquals(Set.of("A"), ActivityClassifier.repeatOrgs(dataset, 2, Duration.ofDays(2).plusSeconds(1)));
    }

    @Test
    void denseRunLaterInHistoryQualifies() {
        Dataset dataset = Dataset.of(
                build("A", at("2023-01-11T00:00:00")),
                build("A", at("2023-01-01T00:00:00")),
                build("A", at("2023-01-10T12:00:00")),
                build("A", at("2023-01-10T00:00:00")),
                build("B", at("2023-01-01T00:00:00")),
                build("B", at("2023-01-05T00:00:00")),
                build("B", at("2023-01-09T00:00:00")));

        assertEquals(Set.of("A"), ActivityClassifier.repeatOrgs(dataset, 3, Duration.ofDays(2)));
    }

    @Test
    void shortTrailingRunDoesNotStandInForFullRun() {
        Dataset dataset = Dataset.of(
                build("A", at("2023-01-01T00:00:00")),
                build("A", at("2023-01-11T00:00:00")),
                build("A", at("2023-01-11T01:00:00")));

        assertTrue(ActivityClassifier.repeatOrgs(dataset, 3, Duration.ofDays(2)).isEmpty());
    }

    @Test
    void repeatThresholdsAreValidated() {
        Dataset dataset = Dataset.of(build("A", day(2023, 1, 1)));

        assertThrows(InvalidWindowSpecException.class,
                () -> ActivityClassifier.repeatOrgs(dataset, 1, Duration.ofDays(2)));
        assertThrows(InvalidWindowSpecException.class,
                () -> ActivityClassifier.repeatOrgs(dataset, 0, Duration.ofDays(2)));
        assertThrows(InvalidWindowSpecException.class,
                () -> ActivityClassifier.repeatOrgs(dataset, 2, Duration.ZERO));
    }

    @Test
    void activeOrgsNeedEnoughDistinctDaysAndRecentBuild() {
        Dataset dataset = Dataset.of(
                build("A", at("2023-02-20T10:00:00")),
                build("A", at("2023-02-25T10:00:00")),
                build("A", at("2023-02-28T23:00:00")),
                build("B", at("2023-02-28T08:00:00")),
                build("B", at("2023-02-28T09:00:00")),
                build("B", at("2023-02-28T10:00:00")),
                build("C", at("2023-01-01T10:00:00")),
                build("C", at("2023-01-02T10:00:00")),
                build("C", at("2023-01-03T10:00:00")));

        SortedSet<String> active = ActivityClassifier.activeOrgs(dataset, 3, 7, at("2023-03-01T12:00:00"));

        assertEquals(Set.of("A"), active);
    }

    @Test
    void mostRecentDayIsComparedAtMidnightAndStrictly() {
        Dataset dataset = Dataset.of(
                build("A", at("2023-02-27T10:00:00")),
                build("A", at("2023-02-28T23:59:00")));

        assertTrue(ActivityClassifier.activeOrgs(dataset, 2, 1, at("2023-03-01T00:00:00")).isEmpty());
        assertEquals(Set.of("A"), ActivityClassifier.activeOrgs(dataset, 2, 1, at("2023-02-28T23:00:00")));
    }

    @Test
    void clockOverloadUsesInjectedReferenceTime() {
        Dataset dataset = Dataset.of(
                build("A", at("2023-02-27T10:00:00")),
                build("A", at("2023-02-28T10:00:00")));
        Clock clock = Clock.fixed(at("2023-03-01T12:00:00").toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

        assertEquals(Set.of("A"), ActivityClassifier.activeOrgs(dataset, 2, 7, clock));
    }

    @Test
    void activeThresholdsAreValidated() {
        Dataset dataset = Dataset.of(build("A", day(2023, 1, 1)));

        assertThrows(InvalidWindowSpecException.class,
                () -> ActivityClassifier.activeOrgs(dataset, 0, 7, day(2023, 1, 2)));
        assertThrows(InvalidWindowSpecException.class,
                () -> ActivityClassifier.activeOrgs(dataset, 1, -1, day(2023, 1, 2)));
    }

    @Test
    void buildDaysAndGapsComeFromSortedTimestamps() {
        Dataset dataset = Dataset.of(
                build("A", at("2023-01-03T10:00:00")),
                build("A", at("2023-01-01T10:00:00")),
                build("A", at("2023-01-01T22:00:00")));

        Map<String, OrgActivityState> states = ActivityClassifier.activityStates(dataset);
        OrgActivityState state = states.get("A");

        assertEquals(List.of(Duration.ofHours(12), Duration.ofHours(36)), state.gaps());
        assertEquals(at("2023-01-01T10:00:00"), state.firstBuild());
        assertEquals(Set.of(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 1, 3)),
                ActivityClassifier.orgBuildDays(dataset).get("A"));
        assertFalse(states.containsKey("B"));
    }
}
