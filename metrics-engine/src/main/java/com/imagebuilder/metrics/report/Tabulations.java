package com.imagebuilder.metrics.report;

import com.imagebuilder.metrics.filter.OrgDirectory;
import com.imagebuilder.metrics.model.BuildRecord;
import com.imagebuilder.metrics.model.Dataset;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Frequency tables over categorical build attributes, ordered by descending count then label.
 */
public final class Tabulations {
    private static final Comparator<RankedCount> BY_COUNT_DESC =
            Comparator.<RankedCount>comparingLong(r -> r.count).reversed().thenComparing(r -> r.label);

    private Tabulations() {}

    /**
     * Packages counted once per build that selects them.
     */
    public static List<RankedCount> frequentPackages(Dataset dataset, int limit) {
        Map<String, Long> counts = new HashMap<>();
        for (BuildRecord record : dataset.records()) {
            for (String pkg : new LinkedHashSet<>(record.packages())) {
                counts.merge(pkg, 1L, Long::sum);
            }
        }
        return ranked(counts, limit);
    }

    public static List<RankedCount> imageTypeCounts(Dataset dataset) {
        Map<String, Long> counts = new HashMap<>();
        for (BuildRecord record : dataset.records()) {
            if (record.imageType() != null) {
                counts.merge(record.imageType(), 1L, Long::sum);
            }
        }
        return ranked(counts, Integer.MAX_VALUE);
    }

    /**
     * Builds per account number, labelled with the directory name where one is known.
     *
     * @throws com.imagebuilder.metrics.error.AmbiguousLookupException when an account number has
     *         several directory entries
     */
    public static List<RankedCount> frequentOrgs(Dataset dataset, OrgDirectory directory, int limit) {
        Map<String, Long> counts = new HashMap<>();
        for (BuildRecord record : dataset.records()) {
            if (record.accountNumber() != null) {
                counts.merge(record.accountNumber(), 1L, Long::sum);
            }
        }
        List<RankedCount> ranked = ranked(counts, limit);
        List<RankedCount> named = new ArrayList<>(ranked.size());
        for (RankedCount row : ranked) {
            named.add(new RankedCount(directory.nameFor(row.label), row.count));
        }
        return named;
    }

    public static String format(String title, List<RankedCount> rows) {
        StringBuilder sb = new StringBuilder();
        sb.append("## ").append(title).append('\n');
        for (int i = 0; i < rows.size(); i++) {
            RankedCount row = rows.get(i);
            sb.append(String.format(Locale.ROOT, "%3d. %-40s %5d", i + 1, row.label, row.count)).append('\n');
        }
        sb.append("---------------------------------");
        return sb.toString();
    }

    private static List<RankedCount> ranked(Map<String, Long> counts, int limit) {
        List<RankedCount> rows = new ArrayList<>(counts.size());
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            rows.add(new RankedCount(entry.getKey(), entry.getValue()));
        }
        rows.sort(BY_COUNT_DESC);
        return rows.size() > limit ? new ArrayList<>(rows.subList(0, limit)) : rows;
    }
}
