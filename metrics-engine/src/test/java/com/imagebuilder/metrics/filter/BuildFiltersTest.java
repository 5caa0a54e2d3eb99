package com.imagebuilder.metrics.filter;

import com.imagebuilder.metrics.error.AmbiguousLookupException;
import com.imagebuilder.metrics.model.BuildRecord;
import com.imagebuilder.metrics.model.Dataset;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.imagebuilder.metrics.support.Builds.build;
import static com.imagebuilder.metrics.support.Builds.day;
import static com.imagebuilder.metrics.support.Builds.noon;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BuildFiltersTest {
    private final OrgDirectory directory = new OrgDirectory(List.of(
            new OrgDirectoryEntry("Red Hat Test Account", "acct-rh", "rh"),
            new OrgDirectoryEntry("Acme Corp", "acct-acme", "acme"),
            new OrgDirectoryEntry(null, "acct-anon", "anon")));

    private final Dataset dataset = Dataset.of(
            build("rh", noon(2023, 1, 1)),
            build("acme", noon(2023, 1, 2)),
            build("anon", noon(2023, 1, 3)),
            BuildRecord.orgAt("late", null));

    @Test
    void filterOrgsRemovesListedIds() {
        Dataset out = BuildFilters.filterOrgs(dataset, Set.of("rh", "anon"));

        assertEquals(Set.of("acme", "late"), out.orgIds());
        assertSame(dataset, BuildFilters.filterOrgs(dataset, List.of()));
    }

    @Test
    void filterUsersMatchesNamesCaseInsensitivelyFromTheStart() {
        Dataset out = BuildFilters.filterUsers(dataset, directory, List.of("red hat"));

        assertEquals(Set.of("acme", "anon", "late"), out.orgIds());
        assertEquals(dataset.size(), BuildFilters.filterUsers(dataset, directory, List.of("hat")).size());
    }

    @Test
    void filterUsersWithoutDirectoryOrPatternsIsNoop() {
        assertSame(dataset, BuildFilters.filterUsers(dataset, OrgDirectory.empty(), List.of("acme")));
        assertSame(dataset, BuildFilters.filterUsers(dataset, directory, List.of()));
    }

    @Test
    void sliceTimeKeepsInclusiveRange() {
        Dataset out = BuildFilters.sliceTime(dataset, noon(2023, 1, 2), noon(2023, 1, 3));

        assertEquals(Set.of("acme", "anon"), out.orgIds());
        assertEquals(3, BuildFilters.sliceTime(dataset, null, day(2023, 2, 1)).size());
        assertSame(dataset, BuildFilters.sliceTime(dataset, null, null));
    }

    @Test
    void directoryResolvesIdsAndNames() {
        assertEquals(Set.of("anon"), directory.matchingOrgIds(List.of("---")));
        assertEquals(Set.of("rh", "acme"), directory.matchingOrgIds(List.of("RED", "acme", "")));
        assertEquals("Acme Corp", directory.nameFor("acct-acme"));
        assertEquals("acct-unknown", directory.nameFor("acct-unknown"));
    }

    @Test
    void duplicateAccountNumbersAreAHardFailure() {
        OrgDirectory duplicated = new OrgDirectory(List.of(
                new OrgDirectoryEntry("One", "acct-1", "o1"),
                new OrgDirectoryEntry("Other", "acct-1", "o2")));

        AmbiguousLookupException ex = assertThrows(AmbiguousLookupException.class,
                () -> duplicated.nameFor("acct-1"));
        assertEquals(2, ex.matches());
        assertEquals("acct-1", ex.identifier());
    }
}
