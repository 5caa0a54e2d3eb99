package com.imagebuilder.metrics.footprint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Many-to-one grouping of image types into deployment footprints.
 *
 * <p>The mapping is open: image types without an entry resolve to themselves. A footprint may
 * only appear as a key if it maps to itself, so resolving twice equals resolving once.
 */
public final class FootprintCatalog {
    private static final Map<String, String> DEFAULT_TABLE = defaultTable();

    private final String version;
    private final Map<String, String> byImageType;

    public FootprintCatalog(String version, Map<String, String> byImageType) {
        this.version = version == null || version.isBlank() ? "unknown" : version;
        Map<String, String> copy = new LinkedHashMap<>(byImageType);
        for (Map.Entry<String, String> entry : copy.entrySet()) {
            String footprint = entry.getValue();
            if (footprint == null || footprint.isBlank()) {
                throw new IllegalArgumentException("Image type " + entry.getKey() + " has no footprint");
            }
            String chained = copy.get(footprint);
            if (chained != null && !chained.equals(footprint)) {
                throw new IllegalArgumentException("Footprint " + footprint + " of image type " + entry.getKey()
                        + " is itself mapped to " + chained);
            }
        }
        this.byImageType = Collections.unmodifiableMap(copy);
    }

    public static FootprintCatalog defaults() {
        return new FootprintCatalog("builtin", DEFAULT_TABLE);
    }

    public String version() {
        return version;
    }

    public String resolve(String imageType) {
        if (imageType == null) {
            return null;
        }
        return byImageType.getOrDefault(imageType, imageType);
    }

    public Map<String, String> entries() {
        return byImageType;
    }

    public int size() {
        return byImageType.size();
    }

    private static Map<String, String> defaultTable() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("rhel-edge-commit", "edge");
        table.put("rhel-edge-installer", "edge");
        table.put("vsphere", "private-cloud");
        table.put("guest-image", "private-cloud");
        table.put("image-installer", "bare-metal");
        table.put("gcp", "gcp");
        table.put("aws", "aws");
        table.put("azure", "azure");
        table.put("vhd", "azure");
        return Collections.unmodifiableMap(table);
    }
}
