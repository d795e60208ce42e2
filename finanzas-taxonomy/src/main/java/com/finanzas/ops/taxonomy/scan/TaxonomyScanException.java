package com.finanzas.ops.taxonomy.scan;

import com.finanzas.ops.taxonomy.TaxonomyOpsException;

/**
 * A table scan could not be completed. Fatal for the run.
 */
public class TaxonomyScanException extends TaxonomyOpsException {

    public TaxonomyScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
