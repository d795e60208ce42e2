package com.finanzas.ops.taxonomy.source;

/**
 * Turns a source document into a typed value.
 *
 * @param <T> parsed type
 */
@FunctionalInterface
public interface SourceParser<T> {

    /**
     * @throws TaxonomyParseException when the declarative shape is missing or malformed
     */
    T parse(SourceDocument document);
}
