package com.imagebuilder.metrics.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared string semantics for blank handling and list-valued settings.
 */
public final class StringSemantics {
    private StringSemantics() {}

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }

    public static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }

    /**
     * Splits a comma separated value into trimmed, non-blank entries.
     */
    public static List<String> splitCsv(String value) {
        List<String> out = new ArrayList<>();
        if (isBlank(value)) {
            return out;
        }
        for (String part : value.split(",")) {
            if (!isBlank(part)) {
                out.add(part.trim());
            }
        }
        return out;
    }
}
