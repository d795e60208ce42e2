package com.finanzas.ops.taxonomy;

/**
 * Root of the taxonomy tooling exception hierarchy.
 */
public class TaxonomyOpsException extends RuntimeException {

    public TaxonomyOpsException(String message) {
        super(message);
    }

    public TaxonomyOpsException(String message, Throwable cause) {
        super(message, cause);
    }
}
