package com.finanzas.ops.taxonomy.store;

import java.util.List;
import java.util.Map;

/**
 * One page of a scan. {@code lastEvaluatedKey} is {@code null} on the final page.
 */
public record ScanPage(List<Map<String, Object>> items, StoreKey lastEvaluatedKey) {

    public ScanPage {
        items = List.copyOf(items);
    }

    public boolean hasMore() {
        return lastEvaluatedKey != null;
    }
}
