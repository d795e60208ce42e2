package com.finanzas.ops.taxonomy.migration;

import com.finanzas.ops.taxonomy.TaxonomyOpsException;
import com.finanzas.ops.taxonomy.backup.BackupStore;
import com.finanzas.ops.taxonomy.canonical.RubroCanonicalizer;
import com.finanzas.ops.taxonomy.config.ExecutionMode;
import com.finanzas.ops.taxonomy.observability.TaxonomyAuditLogger;
import com.finanzas.ops.taxonomy.observability.TaxonomyAuditLogger.MigrationEventType;
import com.finanzas.ops.taxonomy.observability.TaxonomyOpsMetrics;
import com.finanzas.ops.taxonomy.scan.TableScanner;
import com.finanzas.ops.taxonomy.store.AttributeUpdate;
import com.finanzas.ops.taxonomy.store.ConditionFailedException;
import com.finanzas.ops.taxonomy.store.StoreKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.finanzas.ops.taxonomy.migration.ReferencingFields.CANONICAL_RUBRO_ID;
import static com.finanzas.ops.taxonomy.migration.ReferencingFields.LEGACY_RUBRO_TOKEN;
import static com.finanzas.ops.taxonomy.migration.ReferencingFields.RUBRO_ID;

/**
 * Rewrites rubro references on allocation and project-rubro records to canonical ids.
 * <p>
 * Per record: resolve the raw identifier, skip records already canonical, stage
 * {@code rubro_id = canonical_rubro_id = c} and keep the first raw value seen in
 * {@code legacy_rubro_token}. Apply mode backs up each record before its update and throttles
 * writes in fixed batches. Dry-run mode reads only.
 */
@Slf4j
public class ReferencingRecordMigrator {

    private final RubroCanonicalizer canonicalizer;
    private final TableScanner scanner;
    private final BackupStore backupStore;
    private final BatchThrottle throttle;
    private final ExecutionMode mode;
    private final TaxonomyOpsMetrics metrics;
    private final TaxonomyAuditLogger audit;
    private final Clock clock;

    public ReferencingRecordMigrator(RubroCanonicalizer canonicalizer,
                                     TableScanner scanner,
                                     BackupStore backupStore,
                                     BatchThrottle throttle,
                                     ExecutionMode mode,
                                     TaxonomyOpsMetrics metrics,
                                     TaxonomyAuditLogger audit,
                                     Clock clock) {
        this.canonicalizer = canonicalizer;
        this.scanner = scanner;
        this.backupStore = backupStore;
        this.throttle = throttle;
        this.mode = mode;
        this.metrics = metrics;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Migrate every target in order.
     *
     * @throws com.finanzas.ops.taxonomy.scan.TaxonomyScanException when a table cannot be scanned
     */
    public MigrationReport migrate(List<MigrationTarget> targets) {
        List<MigrationReport.Change> changes = new ArrayList<>();
        List<MigrationReport.Failure> failures = new ArrayList<>();
        Map<String, MigrationReport.Summary> perTable = new LinkedHashMap<>();
        List<String> tables = new ArrayList<>();

        for (MigrationTarget target : targets) {
            tables.add(target.store().tableName());
            log.info("Migrating rubro references in {} ({}) [{}]", target.name(), target.store().tableName(), mode);
            TableRun run = new TableRun(target, changes, failures);
            scanner.scan(target.store(), run::process);
            perTable.put(target.name(), run.summary());
            log.info("{}: scanned={}, toUpdate={}, updated={}, alreadyCanonical={}, noIdentifier={}, failed={}",
                    target.name(), run.scanned, run.toUpdate, run.updated, run.alreadyCanonical,
                    run.noIdentifier, run.failed);
        }

        MigrationReport.Summary total = MigrationReport.Summary.builder()
                .totalScanned(perTable.values().stream().mapToLong(MigrationReport.Summary::getTotalScanned).sum())
                .toUpdate(perTable.values().stream().mapToLong(MigrationReport.Summary::getToUpdate).sum())
                .updated(perTable.values().stream().mapToLong(MigrationReport.Summary::getUpdated).sum())
                .alreadyCanonical(perTable.values().stream()
                        .mapToLong(MigrationReport.Summary::getAlreadyCanonical).sum())
                .noIdentifier(perTable.values().stream().mapToLong(MigrationReport.Summary::getNoIdentifier).sum())
                .failed(perTable.values().stream().mapToLong(MigrationReport.Summary::getFailed).sum())
                .batchPauses(throttle.getPauses())
                .build();

        return MigrationReport.builder()
                .timestamp(clock.instant())
                .mode(mode.isApply() ? "apply" : "dry-run")
                .tables(tables)
                .summary(total)
                .perTable(perTable)
                .changes(changes)
                .failures(failures)
                .build();
    }

    /**
     * Counters and processing for one table.
     */
    private final class TableRun {
        private final MigrationTarget target;
        private final List<MigrationReport.Change> changes;
        private final List<MigrationReport.Failure> failures;
        private long scanned;
        private long toUpdate;
        private long updated;
        private long alreadyCanonical;
        private long noIdentifier;
        private long failed;

        private TableRun(MigrationTarget target, List<MigrationReport.Change> changes,
                         List<MigrationReport.Failure> failures) {
            this.target = target;
            this.changes = changes;
            this.failures = failures;
        }

        void process(Map<String, Object> item) {
            scanned++;
            String table = target.store().tableName();
            Optional<StoreKey> key = target.store().keySchema().keyOf(item);
            String keyText = key.map(StoreKey::toString).orElse("(no key)");
            String raw = ReferencingFields.rawIdentifier(item);

            if (raw.isEmpty()) {
                noIdentifier++;
                record(MigrationEventType.SKIPPED, keyText, "No rubro identifier", Map.of("reason", "no_identifier"));
                return;
            }
            Optional<String> canonical = canonicalizer.canonicalize(raw);
            if (canonical.isEmpty()) {
                fail(key, raw, "no_canonical_mapping", MigrationEventType.NO_MAPPING);
                return;
            }
            String c = canonical.get();
            if (c.equals(item.get(RUBRO_ID)) && c.equals(item.get(CANONICAL_RUBRO_ID))) {
                alreadyCanonical++;
                record(MigrationEventType.SKIPPED, keyText, "Already canonical", Map.of("canonical", c));
                return;
            }
            if (key.isEmpty()) {
                fail(key, raw, "item has no key", MigrationEventType.FAILED);
                return;
            }

            AttributeUpdate update = AttributeUpdate.create()
                    .set(RUBRO_ID, c)
                    .set(CANONICAL_RUBRO_ID, c)
                    .setIfAbsent(LEGACY_RUBRO_TOKEN, raw)
                    .requireExisting();
            Map<String, Object> before = references(item);
            Map<String, Object> after = references(update.applyTo(item));
            toUpdate++;

            MigrationReport.Change.ChangeBuilder change = MigrationReport.Change.builder()
                    .table(table)
                    .pk(key.get().pk())
                    .sk(key.get().sk())
                    .raw(raw)
                    .canonical(c)
                    .before(before)
                    .after(after);

            if (!mode.isApply()) {
                changes.add(change.dryRun(true).build());
                record(MigrationEventType.STAGED, keyText, "Would canonicalize " + raw + " -> " + c,
                        Map.of("raw", raw, "canonical", c));
                return;
            }

            boolean written = false;
            try {
                String backupRef = backupStore.backup(table, key.get(), item);
                change.backupRef(backupRef);
                written = true;
                Map<String, Object> stored = target.store().update(key.get(), update);
                updated++;
                changes.add(change.after(references(stored)).applied(true).build());
                record(MigrationEventType.UPDATED, keyText, "Canonicalized " + raw + " -> " + c,
                        Map.of("raw", raw, "canonical", c, "backup", backupRef));
            } catch (ConditionFailedException e) {
                changes.add(change.error("item no longer exists").build());
                fail(key, raw, "item no longer exists", MigrationEventType.FAILED);
            } catch (TaxonomyOpsException e) {
                changes.add(change.error(e.getMessage()).build());
                fail(key, raw, e.getMessage(), MigrationEventType.FAILED);
            } finally {
                if (written) {
                    throttle.afterWrite();
                }
            }
        }

        private void fail(Optional<StoreKey> key, String raw, String reason, MigrationEventType eventType) {
            failed++;
            String keyText = key.map(StoreKey::toString).orElse("(no key)");
            failures.add(MigrationReport.Failure.builder()
                    .table(target.store().tableName())
                    .pk(key.map(StoreKey::pk).orElse(null))
                    .sk(key.map(StoreKey::sk).orElse(null))
                    .raw(raw)
                    .reason(reason)
                    .build());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("raw", raw);
            details.put("reason", reason);
            record(eventType, keyText, "Reference not migrated", details);
        }

        private void record(MigrationEventType eventType, String keyText, String message,
                            Map<String, Object> details) {
            metrics.recordMigration(target.name(), eventType.name());
            audit.logMigrationEvent(target.store().tableName(), keyText, eventType, message, details);
        }

        private MigrationReport.Summary summary() {
            return MigrationReport.Summary.builder()
                    .totalScanned(scanned)
                    .toUpdate(toUpdate)
                    .updated(updated)
                    .alreadyCanonical(alreadyCanonical)
                    .noIdentifier(noIdentifier)
                    .failed(failed)
                    .build();
        }
    }

    private static Map<String, Object> references(Map<String, Object> item) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put(RUBRO_ID, item.get(RUBRO_ID));
        view.put(CANONICAL_RUBRO_ID, item.get(CANONICAL_RUBRO_ID));
        view.put(LEGACY_RUBRO_TOKEN, item.get(LEGACY_RUBRO_TOKEN));
        return view;
    }
}
