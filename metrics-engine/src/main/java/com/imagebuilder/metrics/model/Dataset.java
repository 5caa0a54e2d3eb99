package com.imagebuilder.metrics.model;

import com.imagebuilder.metrics.error.EmptyDatasetException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Immutable snapshot of build records. Record order is preserved but carries no meaning; window
 * computations go through {@link #timestamped()} so records without a timestamp are never counted.
 */
public final class Dataset {
    private static final Dataset EMPTY = new Dataset(List.of());

    private final List<BuildRecord> records;

    private Dataset(List<BuildRecord> records) {
        this.records = records;
    }

    public static Dataset of(List<BuildRecord> records) {
        if (records == null || records.isEmpty()) {
            return EMPTY;
        }
        return new Dataset(Collections.unmodifiableList(new ArrayList<>(records)));
    }

    public static Dataset of(BuildRecord... records) {
        return of(List.of(records));
    }

    public static Dataset empty() {
        return EMPTY;
    }

    public List<BuildRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Records with a valid {@code createdAt}.
     */
    public List<BuildRecord> timestamped() {
        List<BuildRecord> out = new ArrayList<>(records.size());
        for (BuildRecord record : records) {
            if (record.hasTimestamp()) {
                out.add(record);
            }
        }
        return out;
    }

    /**
     * Timestamped records in ascending {@code createdAt} order.
     */
    public List<BuildRecord> chronological() {
        List<BuildRecord> out = timestamped();
        out.sort(Comparator.comparing(BuildRecord::createdAt));
        return out;
    }

    public LocalDateTime minCreatedAt() {
        LocalDateTime min = null;
        for (BuildRecord record : records) {
            if (record.hasTimestamp() && (min == null || record.createdAt().isBefore(min))) {
                min = record.createdAt();
            }
        }
        if (min == null) {
            throw new EmptyDatasetException("minimum created_at");
        }
        return min;
    }

    public LocalDateTime maxCreatedAt() {
        LocalDateTime max = null;
        for (BuildRecord record : records) {
            if (record.hasTimestamp() && (max == null || record.createdAt().isAfter(max))) {
                max = record.createdAt();
            }
        }
        if (max == null) {
            throw new EmptyDatasetException("maximum created_at");
        }
        return max;
    }

    /**
     * Distinct organization identifiers in first-encounter order.
     */
    public Set<String> orgIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (BuildRecord record : records) {
            if (record.orgId() != null) {
                ids.add(record.orgId());
            }
        }
        return ids;
    }

    public Dataset filter(Predicate<BuildRecord> keep) {
        List<BuildRecord> out = new ArrayList<>(records.size());
        for (BuildRecord record : records) {
            if (keep.test(record)) {
                out.add(record);
            }
        }
        return out.size() == records.size() ? this : of(out);
    }

    public Dataset map(UnaryOperator<BuildRecord> mapper) {
        List<BuildRecord> out = new ArrayList<>(records.size());
        for (BuildRecord record : records) {
            out.add(mapper.apply(record));
        }
        return of(out);
    }

    public Dataset withImageTypes(UnaryOperator<String> mapping) {
        return map(record -> record.withImageType(mapping.apply(record.imageType())));
    }
}
