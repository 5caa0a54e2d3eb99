package com.imagebuilder.metrics.filter;

import com.imagebuilder.metrics.model.BuildRecord;
import com.imagebuilder.metrics.model.Dataset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes records ahead of metric computation. Every filter returns a new dataset.
 */
public final class BuildFilters {
    private static final Logger LOG = LoggerFactory.getLogger(BuildFilters.class);

    private BuildFilters() {}

    public static Dataset filterOrgs(Dataset dataset, Collection<String> orgIds) {
        if (orgIds == null || orgIds.isEmpty()) {
            return dataset;
        }
        Set<String> drop = new HashSet<>(orgIds);
        Dataset out = dataset.filter(record -> !drop.contains(record.orgId()));
        LOG.info("Org filter removed {} of {} records", dataset.size() - out.size(), dataset.size());
        return out;
    }

    /**
     * Drops builds whose account number belongs to a directory entry with a name matching any pattern.
     */
    public static Dataset filterUsers(Dataset dataset, OrgDirectory directory, List<String> patterns) {
        if (directory == null || directory.isEmpty() || patterns == null || patterns.isEmpty()) {
            return dataset;
        }
        Set<String> accounts = directory.matchingAccountNumbers(patterns);
        Dataset out = dataset.filter(record -> !accounts.contains(record.accountNumber()));
        LOG.info("User filter matched {} accounts and removed {} of {} records",
                accounts.size(), dataset.size() - out.size(), dataset.size());
        return out;
    }

    /**
     * Keeps builds with {@code start <= created_at <= end}; either bound may be null for an open range.
     * Records without a timestamp are dropped when any bound is given.
     */
    public static Dataset sliceTime(Dataset dataset, LocalDateTime start, LocalDateTime end) {
        if (start == null && end == null) {
            return dataset;
        }
        return dataset.filter(record -> withinRange(record, start, end));
    }

    private static boolean withinRange(BuildRecord record, LocalDateTime start, LocalDateTime end) {
        if (!record.hasTimestamp()) {
            return false;
        }
        if (start != null && record.createdAt().isBefore(start)) {
            return false;
        }
        return end == null || !record.createdAt().isAfter(end);
    }
}
