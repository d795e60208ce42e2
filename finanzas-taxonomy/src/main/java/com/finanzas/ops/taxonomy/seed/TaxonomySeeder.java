package com.finanzas.ops.taxonomy.seed;

import com.finanzas.ops.taxonomy.TaxonomyOpsException;
import com.finanzas.ops.taxonomy.backup.BackupStore;
import com.finanzas.ops.taxonomy.config.ExecutionMode;
import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomy;
import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomyEntry;
import com.finanzas.ops.taxonomy.domain.model.TaxonomyRecords;
import com.finanzas.ops.taxonomy.key.TaxonomyKeyCodec;
import com.finanzas.ops.taxonomy.observability.TaxonomyOpsMetrics;
import com.finanzas.ops.taxonomy.scan.StoreIndex;
import com.finanzas.ops.taxonomy.scan.TaxonomyStoreScanner;
import com.finanzas.ops.taxonomy.store.KeyValueStore;
import com.finanzas.ops.taxonomy.store.StoreKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Creates taxonomy records for canonical ids that have none.
 * <p>
 * Ids already present in the table, under any key, are left alone; the seeder never touches
 * drifted rows. Records are created with a conditional put, so re-running is harmless.
 * Backend-only ids get a placeholder record when {@code includeBackendIds} is set.
 */
@Slf4j
public class TaxonomySeeder {

    private final KeyValueStore store;
    private final BackupStore backupStore;
    private final ExecutionMode mode;
    private final TaxonomyOpsMetrics metrics;
    private final Clock clock;

    public TaxonomySeeder(KeyValueStore store, BackupStore backupStore, ExecutionMode mode,
                          TaxonomyOpsMetrics metrics, Clock clock) {
        this.store = store;
        this.backupStore = backupStore;
        this.mode = mode;
        this.metrics = metrics;
        this.clock = clock;
    }

    public SeedResult seed(CanonicalTaxonomy taxonomy, StoreIndex index, boolean includeBackendIds) {
        Set<String> ids = new TreeSet<>(taxonomy.getFrontendEntries().keySet());
        if (includeBackendIds) {
            ids.addAll(taxonomy.getBackendIds());
        }

        List<String> created = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        List<String> existing = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();

        for (String id : ids) {
            if (index.contains(id)) {
                existing.add(id);
                continue;
            }
            CanonicalTaxonomyEntry entry = taxonomy.getFrontendEntries().get(id);
            Map<String, Object> record = entry != null
                    ? TaxonomyRecords.fromEntry(entry, store.keySchema())
                    : TaxonomyRecords.placeholder(id, store.keySchema());

            StoreKey key = TaxonomyKeyCodec.encode(id);
            Optional<String> occupant;
            try {
                occupant = occupantOf(key, id);
            } catch (TaxonomyOpsException e) {
                log.warn("Could not read {} before seeding {}: {}", key, id, e.getMessage());
                failed.put(id, e.getMessage());
                continue;
            }
            if (occupant.isPresent()) {
                log.warn("Cannot seed {}: {} is occupied by {}", id, key, occupant.get());
                failed.put(id, "target key " + key + " occupied by " + occupant.get() + ", manual review");
                continue;
            }

            if (!mode.isApply()) {
                log.info("Would seed {} ({})", id, entry != null ? "canonical" : "placeholder");
                created.add(id);
                if (entry == null) {
                    placeholders.add(id);
                }
                continue;
            }

            try {
                backupStore.backup(store.tableName(), key, null);
                if (store.putIfAbsent(record)) {
                    log.info("Seeded {} at {}", id, key);
                    metrics.recordSeeded();
                    created.add(id);
                    if (entry == null) {
                        placeholders.add(id);
                    }
                } else {
                    existing.add(id);
                }
            } catch (TaxonomyOpsException e) {
                log.warn("Could not seed {}: {}", id, e.getMessage());
                failed.put(id, e.getMessage());
            }
        }

        log.info("Seeding {} done: created={}, placeholders={}, existing={}, failed={}",
                store.tableName(), created.size(), placeholders.size(), existing.size(), failed.size());
        return SeedResult.builder()
                .timestamp(clock.instant())
                .mode(mode.isApply() ? "apply" : "dry-run")
                .table(store.tableName())
                .created(created)
                .placeholders(placeholders)
                .existing(existing)
                .failed(failed)
                .build();
    }

    /**
     * Id of a row already holding {@code key} under a different id; empty when the key is free or
     * holds {@code id} itself.
     */
    private Optional<String> occupantOf(StoreKey key, String id) {
        return store.get(key)
                .map(row -> TaxonomyStoreScanner.idOf(store, row).orElse("(unknown id)"))
                .filter(occupant -> !occupant.equals(id));
    }
}
