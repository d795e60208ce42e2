package com.finanzas.ops.taxonomy.domain.model;

import java.util.Map;

/**
 * Text helpers shared by the loader, the diff engine and the record builders.
 */
public final class TaxonomyText {

    private TaxonomyText() {
    }

    /**
     * Trimmed string form of a value; {@code ""} for {@code null}.
     */
    public static String normalize(Object value) {
        return value == null ? "" : value.toString().trim();
    }

    public static boolean isBlank(Object value) {
        return normalize(value).isEmpty();
    }

    /**
     * First value that is not blank, trimmed; {@code ""} when all are blank.
     */
    public static String firstNonBlank(Object... values) {
        for (Object value : values) {
            String normalized = normalize(value);
            if (!normalized.isEmpty()) {
                return normalized;
            }
        }
        return "";
    }

    /**
     * First non-blank attribute among the given names.
     */
    public static String firstAttribute(Map<String, Object> item, String... names) {
        for (String name : names) {
            String normalized = normalize(item.get(name));
            if (!normalized.isEmpty()) {
                return normalized;
            }
        }
        return "";
    }
}
