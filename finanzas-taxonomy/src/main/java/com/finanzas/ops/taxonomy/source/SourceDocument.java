package com.finanzas.ops.taxonomy.source;

/**
 * Raw content of a canonical source together with where it came from.
 */
public record SourceDocument(String origin, String content, SourceFormat format) {
}
