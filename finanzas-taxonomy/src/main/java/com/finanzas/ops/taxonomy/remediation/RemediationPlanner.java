package com.finanzas.ops.taxonomy.remediation;

import com.finanzas.ops.taxonomy.diff.AttributeMismatch;
import com.finanzas.ops.taxonomy.diff.DiffAttribute;
import com.finanzas.ops.taxonomy.diff.DiffReport;
import com.finanzas.ops.taxonomy.diff.FieldDiff;
import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomyEntry;
import com.finanzas.ops.taxonomy.domain.model.TaxonomyRecords;
import com.finanzas.ops.taxonomy.key.TaxonomyKeyCodec;
import com.finanzas.ops.taxonomy.store.KeySchema;
import com.finanzas.ops.taxonomy.store.StoreKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a diff report into an ordered list of changes.
 * <p>
 * Key-shape moves come first so that attribute updates on the same row can target the corrected
 * key. Orphans are planned last and are never mutated.
 */
@Slf4j
public class RemediationPlanner {

    private final KeySchema keySchema;

    public RemediationPlanner(KeySchema keySchema) {
        this.keySchema = keySchema;
    }

    public List<PlannedChange> plan(DiffReport report) {
        List<PlannedChange> changes = new ArrayList<>();

        report.getAttributeMismatches().forEach((id, mismatches) -> {
            for (AttributeMismatch mismatch : mismatches) {
                planMismatch(id, mismatch, changes);
            }
        });

        for (String id : report.getMissingInStore()) {
            CanonicalTaxonomyEntry entry = report.getCanonicalEntries().get(id);
            Map<String, Object> record = entry != null
                    ? TaxonomyRecords.fromEntry(entry, keySchema)
                    : TaxonomyRecords.placeholder(id, keySchema);
            if (entry == null) {
                log.warn("Report has no canonical entry for missing id {}; planning a placeholder record", id);
            }
            changes.add(PlannedChange.builder()
                    .tier(FixTier.MISSING_RECORD)
                    .id(id)
                    .targetKey(TaxonomyKeyCodec.encode(id))
                    .record(record)
                    .build());
        }

        for (String id : report.getExtraInStore()) {
            List<StoreKey> keys = report.getExtraRecordKeys().getOrDefault(id, List.of());
            if (keys.isEmpty()) {
                changes.add(PlannedChange.builder().tier(FixTier.ORPHAN).id(id).build());
            }
            for (StoreKey key : keys) {
                changes.add(PlannedChange.builder().tier(FixTier.ORPHAN).id(id).sourceKey(key).build());
            }
        }

        changes.sort(PlannedChange.APPLY_ORDER);
        log.info("Planned {} change(s): {}", changes.size(), countByTier(changes));
        return changes;
    }

    private void planMismatch(String id, AttributeMismatch mismatch, List<PlannedChange> changes) {
        StoreKey canonicalKey = TaxonomyKeyCodec.encode(id);
        StoreKey rowKey = mismatch.getKey();
        boolean moves = mismatch.hasKeyShapeDiff() && rowKey != null && !rowKey.equals(canonicalKey);

        if (moves) {
            changes.add(PlannedChange.builder()
                    .tier(FixTier.KEY_SHAPE)
                    .id(id)
                    .sourceKey(rowKey)
                    .targetKey(canonicalKey)
                    .reportedRow(mismatch.getSample())
                    .diffs(mismatch.getDiffs().stream().filter(d -> d.getAttr().isKeyShape()).toList())
                    .build());
        }

        List<FieldDiff> attributeDiffs = mismatch.attributeDiffs();
        if (attributeDiffs.isEmpty()) {
            return;
        }
        StoreKey target = moves ? canonicalKey : rowKey;
        if (target == null) {
            log.warn("Skipping attribute drift of {}: row {} has no key", id, mismatch.getSampleKey());
            return;
        }
        changes.add(PlannedChange.builder()
                .tier(FixTier.ATTRIBUTE_DRIFT)
                .id(id)
                .sourceKey(rowKey)
                .targetKey(target)
                .reportedRow(mismatch.getSample())
                .updates(updatesFor(attributeDiffs))
                .diffs(attributeDiffs)
                .build());
    }

    static Map<String, Object> updatesFor(List<FieldDiff> diffs) {
        Map<String, Object> updates = new LinkedHashMap<>();
        for (FieldDiff diff : diffs) {
            String attribute = storedAttribute(diff.getAttr());
            if (attribute != null && diff.getFrontend() != null) {
                updates.put(attribute, diff.getFrontend());
            }
        }
        return updates;
    }

    static String storedAttribute(DiffAttribute attribute) {
        return switch (attribute) {
            case DESCRIPTION -> "descripcion";
            case CATEGORY_CODE -> "categoria_codigo";
            case CATEGORY -> "categoria";
            case SOURCE_REFERENCE -> "fuente_referencia";
            case PARTITION_KEY, SORT_KEY -> null;
        };
    }

    private static Map<FixTier, Long> countByTier(List<PlannedChange> changes) {
        Map<FixTier, Long> counts = new LinkedHashMap<>();
        for (FixTier tier : FixTier.values()) {
            long count = changes.stream().filter(c -> c.getTier() == tier).count();
            if (count > 0) {
                counts.put(tier, count);
            }
        }
        return counts;
    }
}
