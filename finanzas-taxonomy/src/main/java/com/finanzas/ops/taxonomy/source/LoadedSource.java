package com.finanzas.ops.taxonomy.source;

/**
 * Parsed value of the source that won a provider chain.
 */
public record LoadedSource<T>(T value, String origin) {
}
