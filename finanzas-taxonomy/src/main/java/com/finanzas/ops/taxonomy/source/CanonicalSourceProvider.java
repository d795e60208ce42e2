package com.finanzas.ops.taxonomy.source;

import java.util.Optional;

/**
 * One candidate location for a canonical source.
 */
public interface CanonicalSourceProvider {

    /**
     * Human readable location, used in logs and reports.
     */
    String describe();

    /**
     * Read the source.
     *
     * @return empty when the source is not present at this location
     * @throws TaxonomyParseException when the source is present but cannot be read
     */
    Optional<SourceDocument> fetch();
}
