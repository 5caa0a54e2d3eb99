package com.imagebuilder.metrics.footprint;

import com.imagebuilder.metrics.model.BuildRecord;
import com.imagebuilder.metrics.model.Dataset;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Replaces each record's image type with its footprint. Stateless and order independent;
 * unmapped image types pass through unchanged.
 */
public final class FootprintMapper {
    private final FootprintCatalog catalog;

    public FootprintMapper(FootprintCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public FootprintCatalog catalog() {
        return catalog;
    }

    public Dataset apply(Dataset dataset) {
        return dataset.withImageTypes(catalog::resolve);
    }

    /**
     * Organizations that only ever built a single footprint, mapped to that footprint.
     */
    public SortedMap<String, String> singleFootprintOrgs(Dataset dataset) {
        Map<String, Set<String>> footprintsByOrg = new LinkedHashMap<>();
        for (BuildRecord record : dataset.records()) {
            if (record.orgId() == null || record.imageType() == null) {
                continue;
            }
            footprintsByOrg.computeIfAbsent(record.orgId(), k -> new HashSet<>())
                    .add(catalog.resolve(record.imageType()));
        }
        SortedMap<String, String> single = new TreeMap<>();
        for (Map.Entry<String, Set<String>> entry : footprintsByOrg.entrySet()) {
            if (entry.getValue().size() == 1) {
                single.put(entry.getKey(), entry.getValue().iterator().next());
            }
        }
        return single;
    }

    /**
     * Number of single-footprint organizations per footprint.
     */
    public SortedMap<String, Long> singleFootprintDistribution(Dataset dataset) {
        SortedMap<String, Long> counts = new TreeMap<>();
        for (String footprint : singleFootprintOrgs(dataset).values()) {
            counts.merge(footprint, 1L, Long::sum);
        }
        return counts;
    }
}
