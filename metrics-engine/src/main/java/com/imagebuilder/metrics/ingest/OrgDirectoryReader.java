package com.imagebuilder.metrics.ingest;

import com.fasterxml.jackson.databind.JsonNode;

import com.imagebuilder.metrics.filter.OrgDirectory;
import com.imagebuilder.metrics.filter.OrgDirectoryEntry;
import com.imagebuilder.metrics.util.JsonSupport;
import com.imagebuilder.metrics.util.StringSemantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads organization names from a JSON array of records with {@code name}, {@code accountNumber}
 * and {@code org_id} fields. Numeric values are read as their text form.
 */
public final class OrgDirectoryReader {
    private static final Logger LOG = LoggerFactory.getLogger(OrgDirectoryReader.class);

    private OrgDirectoryReader() {}

    public static OrgDirectory read(Path path) {
        try {
            if (!Files.exists(path)) {
                throw new IllegalStateException("Users file not found: " + path);
            }
            OrgDirectory directory = toDirectory(JsonSupport.MAPPER.readTree(path.toFile()));
            LOG.info("Loaded {} org directory entries from {}", directory.entries().size(), path);
            return directory;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read users file: " + path, ex);
        }
    }

    static OrgDirectory toDirectory(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new IllegalStateException("Users file is not a JSON array of records");
        }
        List<OrgDirectoryEntry> entries = new ArrayList<>(root.size());
        for (JsonNode record : root) {
            if (!record.isObject()) {
                throw new IllegalStateException("Users file entry is not a JSON object: " + record);
            }
            entries.add(new OrgDirectoryEntry(
                    text(record, "name"),
                    text(record, "accountNumber"),
                    text(record, "org_id")));
        }
        return new OrgDirectory(entries);
    }

    private static String text(JsonNode record, String field) {
        JsonNode value = record.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return StringSemantics.blankToNull(value.asText());
    }
}
