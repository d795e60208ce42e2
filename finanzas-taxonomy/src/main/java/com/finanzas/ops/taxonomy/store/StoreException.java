package com.finanzas.ops.taxonomy.store;

import com.finanzas.ops.taxonomy.TaxonomyOpsException;

/**
 * A store call failed.
 */
public class StoreException extends TaxonomyOpsException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
