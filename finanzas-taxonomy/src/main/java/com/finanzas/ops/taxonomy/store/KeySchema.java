package com.finanzas.ops.taxonomy.store;

import com.finanzas.ops.taxonomy.domain.model.TaxonomyText;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Names of the key attributes of a table.
 */
public record KeySchema(String partitionKey, String sortKey) {

    public static final KeySchema DEFAULT = new KeySchema("pk", "sk");

    /**
     * Key of an item, or empty when the partition key attribute is missing.
     */
    public Optional<StoreKey> keyOf(Map<String, Object> item) {
        if (item == null || TaxonomyText.isBlank(item.get(partitionKey))) {
            return Optional.empty();
        }
        Object sk = sortKey == null ? null : item.get(sortKey);
        return Optional.of(new StoreKey(item.get(partitionKey).toString(),
                sk == null ? null : sk.toString()));
    }

    /**
     * Copy of the item with its key attributes replaced by {@code key}.
     */
    public Map<String, Object> withKey(Map<String, Object> item, StoreKey key) {
        Map<String, Object> copy = new LinkedHashMap<>(item);
        copy.put(partitionKey, key.pk());
        if (sortKey != null) {
            if (key.sk() == null) {
                copy.remove(sortKey);
            } else {
                copy.put(sortKey, key.sk());
            }
        }
        return copy;
    }

    public boolean isKeyAttribute(String name) {
        return name.equals(partitionKey) || name.equals(sortKey);
    }
}
