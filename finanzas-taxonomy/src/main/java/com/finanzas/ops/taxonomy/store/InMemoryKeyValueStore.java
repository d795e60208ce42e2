package com.finanzas.ops.taxonomy.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory table with the same semantics as the DynamoDB adapter. Scans walk keys in sorted
 * order so that paging is deterministic.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final String tableName;
    private final KeySchema keySchema;
    private final NavigableMap<StoreKey, Map<String, Object>> items = new ConcurrentSkipListMap<>();

    public InMemoryKeyValueStore(String tableName) {
        this(tableName, KeySchema.DEFAULT);
    }

    public InMemoryKeyValueStore(String tableName, KeySchema keySchema) {
        this.tableName = tableName;
        this.keySchema = keySchema;
    }

    @Override
    public String tableName() {
        return tableName;
    }

    @Override
    public KeySchema keySchema() {
        return keySchema;
    }

    @Override
    public Optional<Map<String, Object>> get(StoreKey key) {
        return Optional.ofNullable(items.get(key)).map(LinkedHashMap::new);
    }

    @Override
    public void put(Map<String, Object> item) {
        items.put(requireKey(item), new LinkedHashMap<>(item));
    }

    @Override
    public boolean putIfAbsent(Map<String, Object> item) {
        return items.putIfAbsent(requireKey(item), new LinkedHashMap<>(item)) == null;
    }

    @Override
    public Map<String, Object> update(StoreKey key, AttributeUpdate update) {
        Map<String, Object> current = items.get(key);
        if (current == null) {
            if (update.isExistingRequired()) {
                throw new ConditionFailedException(key, "No item under " + key + " in " + tableName);
            }
            current = keySchema.withKey(Map.of(), key);
        }
        Map<String, Object> updated = update.applyTo(current);
        items.put(key, updated);
        return new LinkedHashMap<>(updated);
    }

    @Override
    public void delete(StoreKey key) {
        items.remove(key);
    }

    @Override
    public ScanPage scan(StoreKey exclusiveStartKey, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        NavigableMap<StoreKey, Map<String, Object>> view = exclusiveStartKey == null
                ? items
                : items.tailMap(exclusiveStartKey, false);
        List<Map<String, Object>> page = new ArrayList<>();
        StoreKey last = null;
        for (Map.Entry<StoreKey, Map<String, Object>> entry : view.entrySet()) {
            if (page.size() == pageSize) {
                break;
            }
            page.add(new LinkedHashMap<>(entry.getValue()));
            last = entry.getKey();
        }
        boolean more = last != null && items.higherKey(last) != null;
        return new ScanPage(page, more ? last : null);
    }

    public int size() {
        return items.size();
    }

    public List<Map<String, Object>> snapshot() {
        List<Map<String, Object>> copy = new ArrayList<>();
        items.values().forEach(item -> copy.add(new LinkedHashMap<>(item)));
        return copy;
    }

    private StoreKey requireKey(Map<String, Object> item) {
        return keySchema.keyOf(item).orElseThrow(() -> new StoreWriteException(
                "Item for " + tableName + " has no '" + keySchema.partitionKey() + "' attribute"));
    }
}
