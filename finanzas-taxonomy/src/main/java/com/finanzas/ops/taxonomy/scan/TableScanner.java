package com.finanzas.ops.taxonomy.scan;

import com.finanzas.ops.taxonomy.store.KeyValueStore;
import com.finanzas.ops.taxonomy.store.ScanPage;
import com.finanzas.ops.taxonomy.store.StoreException;
import com.finanzas.ops.taxonomy.store.StoreKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Full-table scan that follows continuation keys until the store reports no more pages.
 * <p>
 * Pages are fetched one at a time; there is no consistency guarantee across pages.
 */
@Slf4j
public class TableScanner {

    public static final int DEFAULT_PAGE_SIZE = 1000;

    private final int pageSize;

    public TableScanner() {
        this(DEFAULT_PAGE_SIZE);
    }

    public TableScanner(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.pageSize = pageSize;
    }

    /**
     * Visit every item of the table.
     *
     * @return number of items visited
     * @throws TaxonomyScanException when any page cannot be read
     */
    public long scan(KeyValueStore store, Consumer<Map<String, Object>> visitor) {
        StoreKey startKey = null;
        long count = 0;
        int pages = 0;
        do {
            ScanPage page;
            try {
                page = store.scan(startKey, pageSize);
            } catch (StoreException e) {
                throw new TaxonomyScanException("Scan of " + store.tableName() + " failed after "
                        + count + " items: " + e.getMessage(), e);
            }
            pages++;
            for (Map<String, Object> item : page.items()) {
                visitor.accept(item);
                count++;
            }
            startKey = page.lastEvaluatedKey();
        } while (startKey != null);
        log.info("Scanned {} items from {} in {} page(s)", count, store.tableName(), pages);
        return count;
    }

    public List<Map<String, Object>> scanAll(KeyValueStore store) {
        List<Map<String, Object>> items = new ArrayList<>();
        scan(store, items::add);
        return items;
    }
}
