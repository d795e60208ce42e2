package com.finanzas.ops.taxonomy.source;

import java.util.Locale;

/**
 * Format of a canonical source document.
 */
public enum SourceFormat {
    JSON,
    TYPESCRIPT;

    /**
     * Format implied by a file name: {@code .ts} / {@code .tsx} are TypeScript, everything else JSON.
     */
    public static SourceFormat fromName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".ts") || lower.endsWith(".tsx") ? TYPESCRIPT : JSON;
    }
}
