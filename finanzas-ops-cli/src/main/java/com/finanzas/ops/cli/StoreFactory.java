package com.finanzas.ops.cli;

import com.finanzas.ops.taxonomy.config.TaxonomyOpsProperties;
import com.finanzas.ops.taxonomy.store.KeyValueStore;

/**
 * Opens key-value tables for a command.
 */
public interface StoreFactory extends AutoCloseable {

    /**
     * @param properties run configuration
     * @param tableName  physical table name
     * @param mutating   whether the command will write; mutating commands need an explicit region
     */
    KeyValueStore open(TaxonomyOpsProperties properties, String tableName, boolean mutating);

    @Override
    default void close() {
    }
}
