package com.finanzas.ops.taxonomy.store;

/**
 * A write to the store failed. Scoped to one item; batch operations record it and go on.
 */
public class StoreWriteException extends StoreException {

    public StoreWriteException(String message) {
        super(message);
    }

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
