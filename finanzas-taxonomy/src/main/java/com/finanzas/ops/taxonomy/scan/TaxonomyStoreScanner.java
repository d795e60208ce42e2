package com.finanzas.ops.taxonomy.scan;

import com.finanzas.ops.taxonomy.domain.model.TaxonomyText;
import com.finanzas.ops.taxonomy.key.TaxonomyKeyCodec;
import com.finanzas.ops.taxonomy.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reads the whole taxonomy table into a {@link StoreIndex}.
 * <p>
 * A row's id is its {@code linea_codigo} attribute ({@code lineaCodigo} for rows written by older
 * tooling), or else the id decoded from its key.
 */
@Slf4j
public class TaxonomyStoreScanner {

    private final TableScanner tableScanner;

    public TaxonomyStoreScanner(TableScanner tableScanner) {
        this.tableScanner = tableScanner;
    }

    public StoreIndex scan(KeyValueStore store) {
        Map<String, List<Map<String, Object>>> byId = new TreeMap<>();
        List<Map<String, Object>> unindexed = new ArrayList<>();
        List<Map<String, Object>> items = new ArrayList<>();

        tableScanner.scan(store, item -> {
            items.add(item);
            Optional<String> id = idOf(store, item);
            if (id.isPresent()) {
                byId.computeIfAbsent(id.get(), k -> new ArrayList<>()).add(item);
            } else {
                unindexed.add(item);
            }
        });

        if (!unindexed.isEmpty()) {
            log.warn("{} item(s) in {} have neither linea_codigo nor a canonical key", unindexed.size(),
                    store.tableName());
        }
        long duplicated = byId.values().stream().filter(rows -> rows.size() > 1).count();
        if (duplicated > 0) {
            log.warn("{} id(s) in {} are stored in more than one row", duplicated, store.tableName());
        }
        return new StoreIndex(store.tableName(), byId, unindexed, items);
    }

    /**
     * Id a stored row answers to, the same way the index groups it.
     */
    public static Optional<String> idOf(KeyValueStore store, Map<String, Object> item) {
        String fromAttribute = TaxonomyText.firstAttribute(item, "linea_codigo", "lineaCodigo");
        if (!fromAttribute.isEmpty()) {
            return Optional.of(fromAttribute);
        }
        return store.keySchema().keyOf(item).flatMap(TaxonomyKeyCodec::decode);
    }
}
