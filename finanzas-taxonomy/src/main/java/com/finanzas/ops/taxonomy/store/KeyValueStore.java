package com.finanzas.ops.taxonomy.store;

import java.util.Map;
import java.util.Optional;

/**
 * Minimal key-value table contract used by the taxonomy tooling.
 * <p>
 * Items are plain attribute maps holding their own key attributes (see {@link #keySchema()}).
 * Every call blocks until the store has answered. Read failures surface as {@link StoreException};
 * write failures as {@link StoreWriteException}.
 */
public interface KeyValueStore {

    String tableName();

    KeySchema keySchema();

    Optional<Map<String, Object>> get(StoreKey key);

    /**
     * Write the item, replacing whatever is stored under its key.
     */
    void put(Map<String, Object> item);

    /**
     * Write the item only when its key is free.
     *
     * @return {@code false} when an item already exists under the key
     */
    boolean putIfAbsent(Map<String, Object> item);

    /**
     * Apply a partial update.
     *
     * @return the item as stored after the update
     * @throws ConditionFailedException when the update requires an existing item and there is none
     */
    Map<String, Object> update(StoreKey key, AttributeUpdate update);

    void delete(StoreKey key);

    /**
     * Read one page of the table.
     *
     * @param exclusiveStartKey continuation key of the previous page, {@code null} for the first page
     * @param pageSize          maximum number of items in the page
     */
    ScanPage scan(StoreKey exclusiveStartKey, int pageSize);
}
