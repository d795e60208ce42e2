package com.finanzas.ops.taxonomy.scan;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persisted taxonomy records grouped by canonical id.
 * <p>
 * Several rows may share an id (duplicates or mis-keyed copies). Rows with no recoverable id are
 * kept apart in {@link #getUnindexed()}.
 */
@Getter
public final class StoreIndex {

    private final String tableName;
    private final Map<String, List<Map<String, Object>>> byId;
    private final List<Map<String, Object>> unindexed;
    private final List<Map<String, Object>> items;

    public StoreIndex(String tableName, Map<String, List<Map<String, Object>>> byId,
                      List<Map<String, Object>> unindexed, List<Map<String, Object>> items) {
        this.tableName = tableName;
        this.byId = Collections.unmodifiableMap(byId);
        this.unindexed = Collections.unmodifiableList(unindexed);
        this.items = Collections.unmodifiableList(items);
    }

    public Set<String> ids() {
        return byId.keySet();
    }

    public List<Map<String, Object>> rows(String id) {
        return byId.getOrDefault(id, List.of());
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public int scannedItems() {
        return items.size();
    }
}
