package com.finanzas.ops.taxonomy.backup;

import com.finanzas.ops.taxonomy.TaxonomyOpsException;

/**
 * A pre-image backup could not be made durable. The item it belongs to must not be mutated.
 */
public class BackupException extends TaxonomyOpsException {

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
