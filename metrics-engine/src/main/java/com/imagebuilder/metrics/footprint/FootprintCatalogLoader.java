package com.imagebuilder.metrics.footprint;

import com.fasterxml.jackson.databind.JsonNode;

import com.imagebuilder.metrics.util.JsonSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the footprint catalog from classpath or filesystem.
 *
 * Lookup order:
 * 1) JVM property `ibmetrics.footprint.catalog.path`
 * 2) classpath resource `reference/footprint_catalog.v1.json`
 * 3) built-in table {@link FootprintCatalog#defaults()}
 */
public final class FootprintCatalogLoader {
    public static final String CATALOG_PROPERTY = "ibmetrics.footprint.catalog.path";
    public static final String DEFAULT_CLASSPATH_RESOURCE = "reference/footprint_catalog.v1.json";

    private static final Logger LOG = LoggerFactory.getLogger(FootprintCatalogLoader.class);

    private FootprintCatalogLoader() {}

    public static FootprintCatalog loadDefault() {
        String overridePath = System.getProperty(CATALOG_PROPERTY);
        if (overridePath != null && !overridePath.isBlank()) {
            return loadFromFile(Path.of(overridePath));
        }

        FootprintCatalog fromClasspath = loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        LOG.warn("Footprint catalog resource {} not found; using built-in table", DEFAULT_CLASSPATH_RESOURCE);
        return FootprintCatalog.defaults();
    }

    static FootprintCatalog loadFromClasspath(String resourcePath) {
        try (InputStream in = FootprintCatalogLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                return null;
            }
            JsonNode root = JsonSupport.MAPPER.readTree(in);
            return parseCatalog(root);
        } catch (IOException | RuntimeException ex) {
            throw new IllegalStateException("Failed to load footprint catalog from classpath: " + resourcePath, ex);
        }
    }

    static FootprintCatalog loadFromFile(Path path) {
        try {
            if (!Files.exists(path)) {
                throw new IllegalStateException("Footprint catalog file not found: " + path);
            }
            JsonNode root = JsonSupport.MAPPER.readTree(path.toFile());
            FootprintCatalog catalog = parseCatalog(root);
            LOG.info("Loaded footprint catalog version={} entries={} from {}",
                    catalog.version(), catalog.size(), path);
            return catalog;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load footprint catalog from file: " + path, ex);
        }
    }

    static FootprintCatalog parseCatalog(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Footprint catalog is not a JSON object");
        }

        String version = root.path("catalog_version").asText("unknown");
        JsonNode footprints = root.path("footprints");
        if (!footprints.isArray()) {
            throw new IllegalStateException("Footprint catalog missing footprints array");
        }

        Map<String, String> byImageType = new LinkedHashMap<>();
        for (JsonNode entry : footprints) {
            if (!entry.isObject()) {
                continue;
            }
            String imageType = entry.path("image_type").asText("");
            String footprint = entry.path("footprint").asText("");
            if (imageType.isBlank() || footprint.isBlank()) {
                LOG.warn("Skipping incomplete footprint catalog entry: {}", entry);
                continue;
            }
            String previous = byImageType.put(imageType, footprint);
            if (previous != null && !previous.equals(footprint)) {
                throw new IllegalStateException("Image type " + imageType + " mapped to both " + previous
                        + " and " + footprint);
            }
        }

        return new FootprintCatalog(version, byImageType);
    }
}
