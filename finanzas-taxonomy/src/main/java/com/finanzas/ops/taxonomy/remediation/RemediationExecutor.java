package com.finanzas.ops.taxonomy.remediation;

import com.finanzas.ops.taxonomy.backup.BackupException;
import com.finanzas.ops.taxonomy.backup.BackupStore;
import com.finanzas.ops.taxonomy.config.ExecutionMode;
import com.finanzas.ops.taxonomy.domain.model.TaxonomyText;
import com.finanzas.ops.taxonomy.observability.TaxonomyAuditLogger;
import com.finanzas.ops.taxonomy.observability.TaxonomyAuditLogger.RemediationEventType;
import com.finanzas.ops.taxonomy.observability.TaxonomyOpsMetrics;
import com.finanzas.ops.taxonomy.scan.TaxonomyStoreScanner;
import com.finanzas.ops.taxonomy.store.AttributeUpdate;
import com.finanzas.ops.taxonomy.store.ConditionFailedException;
import com.finanzas.ops.taxonomy.store.KeyValueStore;
import com.finanzas.ops.taxonomy.store.StoreException;
import com.finanzas.ops.taxonomy.store.StoreKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies planned changes to the taxonomy table, one at a time and in tier order.
 * <p>
 * For every mutating change the sequence is: read the current state, ask for approval, write
 * the pre-image backup, mutate. A change whose backup fails is not applied. A failure on one
 * item is recorded and the run moves on to the next item. Every processed item is appended to
 * the {@link RemediationLog} before the next one starts.
 */
@Slf4j
public class RemediationExecutor {

    private final KeyValueStore store;
    private final BackupStore backupStore;
    private final ApprovalPolicy approvalPolicy;
    private final ExecutionMode mode;
    private final RemediationLog remediationLog;
    private final TaxonomyOpsMetrics metrics;
    private final TaxonomyAuditLogger audit;
    private final Clock clock;

    public RemediationExecutor(KeyValueStore store,
                               BackupStore backupStore,
                               ApprovalPolicy approvalPolicy,
                               ExecutionMode mode,
                               RemediationLog remediationLog,
                               TaxonomyOpsMetrics metrics,
                               TaxonomyAuditLogger audit,
                               Clock clock) {
        this.store = store;
        this.backupStore = backupStore;
        this.approvalPolicy = approvalPolicy;
        this.mode = mode;
        this.remediationLog = remediationLog;
        this.metrics = metrics;
        this.audit = audit;
        this.clock = clock;
    }

    public RemediationSummary execute(List<PlannedChange> changes) {
        List<PlannedChange> ordered = new ArrayList<>(changes);
        ordered.sort(PlannedChange.APPLY_ORDER);

        log.info("Remediating {} change(s) on {} in {} mode with {} approval", ordered.size(),
                store.tableName(), mode, approvalPolicy.name());
        RemediationSummary summary = new RemediationSummary();
        for (PlannedChange change : ordered) {
            RemediationLogEntry entry = process(change);
            remediationLog.append(entry);
            summary.record(entry);
            metrics.recordRemediation(change.getTier().getPriority(), entry.getOutcome().name());
        }
        log.info("Remediation finished: {} applied, {} no-op, {} declined, {} failed, {} planned only",
                summary.count(ItemState.APPLIED), summary.count(ItemState.SKIPPED_NO_OP),
                summary.count(ItemState.SKIPPED_DECLINED), summary.count(ItemState.FAILED),
                summary.count(ItemState.PLANNED));
        return summary;
    }

    RemediationLogEntry process(PlannedChange change) {
        Item item = new Item(change);
        try {
            switch (change.getTier()) {
                case KEY_SHAPE -> moveKey(item);
                case MISSING_RECORD -> createRecord(item);
                case ATTRIBUTE_DRIFT -> updateAttributes(item);
                case ORPHAN -> reportOrphan(item);
            }
        } catch (BackupException e) {
            item.fail("backup failed, item not modified: " + e.getMessage());
        } catch (StoreException e) {
            item.fail("store error: " + e.getMessage());
        }
        return item.toEntry();
    }

    private void moveKey(Item item) {
        PlannedChange change = item.change;
        Optional<Map<String, Object>> source = store.get(change.getSourceKey());
        Optional<Map<String, Object>> target = store.get(change.getTargetKey());
        if (source.isEmpty()) {
            if (target.isPresent()) {
                item.noOp("already moved to " + change.getTargetKey());
            } else {
                item.fail("row " + change.getSourceKey() + " no longer exists");
            }
            return;
        }
        item.before = source.get();
        if (target.isPresent()) {
            item.fail("target key " + change.getTargetKey() + " is occupied (duplicate rows for "
                    + change.getId() + "), left untouched for manual review");
            return;
        }

        Map<String, Object> copy = store.keySchema().withKey(source.get(), change.getTargetKey());
        if (TaxonomyText.isBlank(copy.get("linea_codigo"))) {
            copy.put("linea_codigo", change.getId());
        }
        item.after = copy;
        if (!approved(item)) {
            return;
        }
        backup(item, change.getSourceKey(), source.get());

        if (!store.putIfAbsent(copy)) {
            item.fail("target key " + change.getTargetKey() + " was taken before the copy");
            return;
        }
        Optional<Map<String, Object>> written = store.get(change.getTargetKey());
        if (written.isEmpty() || !sameContent(copy, written.get())) {
            item.fail("copy at " + change.getTargetKey() + " did not verify, old key kept");
            return;
        }
        try {
            store.delete(change.getSourceKey());
        } catch (StoreException e) {
            item.fail("copied to " + change.getTargetKey() + " but could not delete "
                    + change.getSourceKey() + ": " + e.getMessage());
            return;
        }
        item.applied("moved to " + change.getTargetKey());
    }

    private void createRecord(Item item) {
        PlannedChange change = item.change;
        Optional<Map<String, Object>> occupant = store.get(change.getTargetKey());
        if (occupant.isPresent()) {
            Optional<String> occupantId = TaxonomyStoreScanner.idOf(store, occupant.get());
            if (occupantId.filter(change.getId()::equals).isPresent()) {
                item.noOp("record already exists");
            } else {
                item.before = occupant.get();
                item.fail("target key " + change.getTargetKey() + " occupied by "
                        + occupantId.orElse("(unknown id)") + ", manual review");
            }
            return;
        }
        item.after = change.getRecord();
        if (!approved(item)) {
            return;
        }
        backup(item, change.getTargetKey(), null);
        if (!store.putIfAbsent(change.getRecord())) {
            item.noOp("record was created concurrently");
            return;
        }
        item.applied("created");
    }

    private void updateAttributes(Item item) {
        PlannedChange change = item.change;
        Optional<Map<String, Object>> current = store.get(change.getTargetKey());
        if (current.isEmpty() && !mode.isApply() && change.getSourceKey() != null
                && !change.getSourceKey().equals(change.getTargetKey())) {
            // preview against the row a planned move would bring to the target key
            current = store.get(change.getSourceKey());
        }
        if (current.isEmpty()) {
            item.fail("target row " + change.getTargetKey() + " no longer exists");
            return;
        }
        Map<String, Object> row = current.get();
        item.before = row;

        Map<String, Object> pending = new LinkedHashMap<>();
        change.getUpdates().forEach((attribute, value) -> {
            if (!TaxonomyText.normalize(row.get(attribute)).equals(TaxonomyText.normalize(value))) {
                pending.put(attribute, value);
            }
        });
        if (pending.isEmpty()) {
            item.noOp("attributes already canonical");
            return;
        }
        Map<String, Object> preview = new LinkedHashMap<>(row);
        preview.putAll(pending);
        item.after = preview;
        if (!approved(item)) {
            return;
        }
        backup(item, change.getTargetKey(), row);
        try {
            item.after = store.update(change.getTargetKey(),
                    AttributeUpdate.create().setAll(pending).requireExisting());
        } catch (ConditionFailedException e) {
            item.fail("target row " + change.getTargetKey() + " vanished before the update");
            return;
        }
        item.applied("updated " + pending.keySet());
    }

    private void reportOrphan(Item item) {
        item.before = item.change.getReportedRow();
        item.noOp("orphan id " + item.change.getId() + " not in canonical catalog, manual review (not deleted)");
    }

    /**
     * Dry-run and approval gate. Returns {@code true} when the mutation may proceed.
     */
    private boolean approved(Item item) {
        if (!mode.isApply()) {
            item.message = "dry-run: would " + item.change.describe();
            return false;
        }
        if (!approvalPolicy.approve(item.change)) {
            item.transition(ItemState.SKIPPED_DECLINED, "declined (" + approvalPolicy.name() + ")");
            return false;
        }
        return true;
    }

    private void backup(Item item, StoreKey key, Map<String, Object> preImage) {
        item.backupRef = backupStore.backup(store.tableName(), key, preImage);
        item.transition(ItemState.BACKED_UP, null);
    }

    static boolean sameContent(Map<String, Object> expected, Map<String, Object> actual) {
        if (!expected.keySet().equals(actual.keySet())) {
            return false;
        }
        for (Map.Entry<String, Object> entry : expected.entrySet()) {
            Object other = actual.get(entry.getKey());
            if (!Objects.equals(entry.getValue(), other)
                    && !TaxonomyText.normalize(entry.getValue()).equals(TaxonomyText.normalize(other))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Mutable progress of one change through its lifecycle.
     */
    private final class Item {
        private final PlannedChange change;
        private ItemState state = ItemState.PLANNED;
        private Map<String, Object> before;
        private Map<String, Object> after;
        private String backupRef;
        private String message;

        private Item(PlannedChange change) {
            this.change = change;
            this.before = change.getReportedRow();
        }

        void transition(ItemState next, String note) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal transition " + state + " -> " + next
                        + " for " + change.describe());
            }
            state = next;
            if (note != null) {
                message = note;
            }
        }

        void applied(String note) {
            transition(ItemState.APPLIED, note);
        }

        void noOp(String note) {
            transition(ItemState.SKIPPED_NO_OP, note);
        }

        void fail(String note) {
            transition(ItemState.FAILED, note);
        }

        String keyText() {
            StoreKey key = change.subjectKey();
            return key == null ? change.getId() : key.toString();
        }

        private RemediationEventType eventType() {
            if (change.getTier() == FixTier.ORPHAN) {
                return RemediationEventType.MANUAL_REVIEW;
            }
            return switch (state) {
                case APPLIED -> RemediationEventType.APPLIED;
                case FAILED -> RemediationEventType.FAILED;
                case SKIPPED_DECLINED -> RemediationEventType.DECLINED;
                case SKIPPED_NO_OP -> RemediationEventType.NO_OP;
                case BACKED_UP -> RemediationEventType.BACKED_UP;
                case PLANNED -> RemediationEventType.DRY_RUN;
            };
        }

        RemediationLogEntry toEntry() {
            RemediationEventType eventType = eventType();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("tier", change.getTier().getPriority());
            details.put("id", change.getId());
            details.put("outcome", state.name());
            if (backupRef != null) {
                details.put("backup", backupRef);
            }
            audit.logRemediationEvent(store.tableName(), keyText(), eventType,
                    message != null ? message : change.describe(), details);

            return RemediationLogEntry.builder()
                    .timestamp(clock.instant())
                    .table(store.tableName())
                    .key(keyText())
                    .id(change.getId())
                    .tier(change.getTier())
                    .outcome(state)
                    .before(before)
                    .after(after)
                    .backupRef(backupRef)
                    .message(message)
                    .build();
        }
    }
}
