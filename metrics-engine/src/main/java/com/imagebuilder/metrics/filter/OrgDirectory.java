package com.imagebuilder.metrics.filter;

import com.imagebuilder.metrics.error.AmbiguousLookupException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lookup of organization names by account number and of identifiers by name pattern.
 *
 * <p>Patterns are case-insensitive regular expressions anchored at the start of the name.
 * Entries without a name match as {@code "---"}.
 */
public final class OrgDirectory {
    private static final OrgDirectory EMPTY = new OrgDirectory(List.of());

    private final List<OrgDirectoryEntry> entries;

    public OrgDirectory(List<OrgDirectoryEntry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static OrgDirectory empty() {
        return EMPTY;
    }

    public List<OrgDirectoryEntry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Display name for an account number: the account number itself when unknown, the single
     * matching name otherwise.
     *
     * @throws AmbiguousLookupException when several entries share the account number
     */
    public String nameFor(String accountNumber) {
        List<OrgDirectoryEntry> matches = new ArrayList<>(1);
        for (OrgDirectoryEntry entry : entries) {
            if (entry.accountNumber() != null && entry.accountNumber().equals(accountNumber)) {
                matches.add(entry);
            }
        }
        if (matches.isEmpty()) {
            return accountNumber;
        }
        if (matches.size() > 1) {
            throw new AmbiguousLookupException(accountNumber, matches.size());
        }
        return matches.get(0).name();
    }

    public Set<String> matchingOrgIds(List<String> patterns) {
        Set<String> ids = new LinkedHashSet<>();
        for (OrgDirectoryEntry entry : matching(patterns)) {
            if (entry.orgId() != null) {
                ids.add(entry.orgId());
            }
        }
        return ids;
    }

    public Set<String> matchingAccountNumbers(List<String> patterns) {
        Set<String> ids = new LinkedHashSet<>();
        for (OrgDirectoryEntry entry : matching(patterns)) {
            if (entry.accountNumber() != null) {
                ids.add(entry.accountNumber());
            }
        }
        return ids;
    }

    private List<OrgDirectoryEntry> matching(List<String> patterns) {
        List<OrgDirectoryEntry> out = new ArrayList<>();
        if (patterns == null) {
            return out;
        }
        for (String raw : patterns) {
            if (raw == null || raw.isEmpty()) {
                continue;
            }
            Pattern pattern = Pattern.compile(raw, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            for (OrgDirectoryEntry entry : entries) {
                if (pattern.matcher(entry.name()).lookingAt()) {
                    out.add(entry);
                }
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "OrgDirectory{entries=%d}", entries.size());
    }
}
