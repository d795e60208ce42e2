package com.finanzas.ops.cli;

import com.finanzas.ops.taxonomy.config.TaxonomyOpsProperties;
import com.finanzas.ops.taxonomy.store.InMemoryKeyValueStore;
import com.finanzas.ops.taxonomy.store.KeyValueStore;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One in-memory table per name; tables survive across commands of a test.
 */
class InMemoryStoreFactory implements StoreFactory {

    private final Map<String, InMemoryKeyValueStore> tables = new HashMap<>();
    private final Set<String> openedForWrite = new LinkedHashSet<>();

    InMemoryKeyValueStore table(String name) {
        return tables.computeIfAbsent(name, InMemoryKeyValueStore::new);
    }

    Set<String> openedForWrite() {
        return openedForWrite;
    }

    @Override
    public KeyValueStore open(TaxonomyOpsProperties properties, String tableName, boolean mutating) {
        if (mutating) {
            openedForWrite.add(tableName);
        }
        return table(tableName);
    }
}
