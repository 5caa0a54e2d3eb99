package com.imagebuilder.metrics.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import com.imagebuilder.metrics.model.BuildRecord;
import com.imagebuilder.metrics.model.Dataset;
import com.imagebuilder.metrics.util.JsonSupport;
import com.imagebuilder.metrics.util.StringSemantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads build records from a pipe-delimited database dump.
 *
 * <p>{@code created_at} accepts {@code yyyy-MM-dd HH:mm:ss[.fraction]} with an optional 'T' and
 * an optional trailing offset, which is ignored. Unparseable timestamps become null so the record
 * is excluded from window computations. The list columns hold JSON arrays; an empty cell is an
 * empty list and non-text elements are kept as their JSON text.
 */
public final class DumpReader implements BuildRecordSource {
    private static final Logger LOG = LoggerFactory.getLogger(DumpReader.class);

    static final DateTimeFormatter CREATED_AT_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendPattern("XXX").optionalEnd()
            .optionalStart().appendPattern("X").optionalEnd()
            .toFormatter();

    private final Path path;

    public DumpReader(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public Dataset read() {
        return toDataset(DumpTable.read(path), path.toString());
    }

    static Dataset toDataset(DumpTable table, String source) {
        List<BuildRecord> records = new ArrayList<>(table.rows().size());
        int missingTimestamps = 0;
        for (Map<String, String> row : table.rows()) {
            LocalDateTime createdAt = parseCreatedAt(row.get("created_at"));
            if (createdAt == null) {
                missingTimestamps++;
            }
            records.add(new BuildRecord(
                    StringSemantics.blankToNull(row.get("org_id")),
                    createdAt,
                    StringSemantics.blankToNull(row.get("job_id")),
                    StringSemantics.blankToNull(row.get("image_type")),
                    parseList(row.get("packages"), "packages"),
                    parseList(row.get("filesystem"), "filesystem"),
                    parseList(row.get("payload_repositories"), "payload_repositories"),
                    StringSemantics.blankToNull(row.get("account_number"))));
        }
        if (missingTimestamps > 0) {
            LOG.warn("{} of {} records in {} have no valid created_at and are excluded from windows",
                    missingTimestamps, records.size(), source);
        }
        return Dataset.of(records);
    }

    static LocalDateTime parseCreatedAt(String value) {
        if (StringSemantics.isBlank(value)) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), CREATED_AT_FORMAT);
        } catch (DateTimeParseException ex) {
            LOG.debug("Unparseable created_at '{}': {}", value, ex.getMessage());
            return null;
        }
    }

    static List<String> parseList(String value, String column) {
        List<String> out = new ArrayList<>();
        if (StringSemantics.isBlank(value)) {
            return out;
        }
        JsonNode node;
        try {
            node = JsonSupport.MAPPER.readTree(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Column " + column + " is not valid JSON: " + value, ex);
        }
        if (node == null || node.isNull()) {
            return out;
        }
        if (!node.isArray()) {
            throw new IllegalStateException("Column " + column + " is not a JSON array: " + value);
        }
        for (JsonNode element : node) {
            out.add(element.isTextual() ? element.asText() : element.toString());
        }
        return out;
    }
}
