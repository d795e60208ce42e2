package com.finanzas.ops.taxonomy.store;

import lombok.Getter;

/**
 * A conditional write was rejected because its precondition did not hold.
 */
@Getter
public class ConditionFailedException extends StoreWriteException {

    private final StoreKey key;

    public ConditionFailedException(StoreKey key, String message) {
        super(message);
        this.key = key;
    }

    public ConditionFailedException(StoreKey key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }
}
