package com.finanzas.ops.taxonomy.backup;

import com.finanzas.ops.taxonomy.store.StoreKey;

import java.util.Map;

/**
 * Durable storage for item pre-images taken before a mutation.
 */
public interface BackupStore {

    /**
     * Persist the pre-image. Returns only once the copy is durable.
     *
     * @param table table the item belongs to
     * @param key   key of the item
     * @param item  item content; {@code null} when there is no pre-image (creation)
     * @return reference to the backup, recorded in the remediation log
     * @throws BackupException when the backup cannot be written
     */
    String backup(String table, StoreKey key, Map<String, Object> item);
}
