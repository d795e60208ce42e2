package com.finanzas.ops.taxonomy.migration;

import com.finanzas.ops.taxonomy.store.KeyValueStore;

/**
 * A table holding references to rubros.
 *
 * @param name  logical name used by {@code --table} ({@code allocations}, {@code project_rubros})
 * @param store the table
 */
public record MigrationTarget(String name, KeyValueStore store) {

    public static final String ALLOCATIONS = "allocations";
    public static final String PROJECT_RUBROS = "project_rubros";

    /**
     * Whether this target is selected by a {@code --table} filter. The filter matches the logical
     * name or the physical table name; a blank filter selects everything.
     */
    public boolean matches(String filter) {
        return filter == null || filter.isBlank()
                || filter.equals(name) || filter.equals(store.tableName());
    }
}
