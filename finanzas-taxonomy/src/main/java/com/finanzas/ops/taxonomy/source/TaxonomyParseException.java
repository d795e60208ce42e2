package com.finanzas.ops.taxonomy.source;

import com.finanzas.ops.taxonomy.TaxonomyOpsException;
import lombok.Getter;

/**
 * A canonical source was found but could not be read into the expected shape. Always fatal:
 * nothing is compared or written against a partially understood taxonomy.
 */
@Getter
public class TaxonomyParseException extends TaxonomyOpsException {

    private final String origin;

    public TaxonomyParseException(String origin, String message) {
        super(origin + ": " + message);
        this.origin = origin;
    }

    public TaxonomyParseException(String origin, String message, Throwable cause) {
        super(origin + ": " + message, cause);
        this.origin = origin;
    }
}
