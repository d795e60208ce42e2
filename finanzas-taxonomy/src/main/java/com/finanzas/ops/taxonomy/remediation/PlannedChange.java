package com.finanzas.ops.taxonomy.remediation;

import com.finanzas.ops.taxonomy.diff.FieldDiff;
import com.finanzas.ops.taxonomy.store.StoreKey;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * One change derived from a diff report.
 * <ul>
 *     <li>{@code KEY_SHAPE}: move {@code sourceKey} to {@code targetKey}</li>
 *     <li>{@code MISSING_RECORD}: create {@code record} under {@code targetKey}</li>
 *     <li>{@code ATTRIBUTE_DRIFT}: set {@code updates} on {@code targetKey}</li>
 *     <li>{@code ORPHAN}: report {@code sourceKey}</li>
 * </ul>
 */
@Value
@Builder
public class PlannedChange {

    public static final Comparator<PlannedChange> APPLY_ORDER = Comparator
            .comparing(PlannedChange::getTier)
            .thenComparing(PlannedChange::getId)
            .thenComparing(change -> change.getSourceKey() == null ? "" : change.getSourceKey().toString());

    FixTier tier;
    String id;
    StoreKey sourceKey;
    StoreKey targetKey;

    /** Row content as captured in the report */
    Map<String, Object> reportedRow;

    /** Full record to create */
    Map<String, Object> record;

    /** Attributes to set */
    @Singular
    Map<String, Object> updates;

    @Singular
    List<FieldDiff> diffs;

    public String describe() {
        return switch (tier) {
            case KEY_SHAPE -> tier.getPriority() + " move " + id + " from " + sourceKey + " to " + targetKey;
            case MISSING_RECORD -> tier.getPriority() + " create " + id + " at " + targetKey;
            case ATTRIBUTE_DRIFT -> tier.getPriority() + " update " + id + " at " + targetKey + " set " + updates;
            case ORPHAN -> tier.getPriority() + " orphan " + id + " at " + sourceKey + " (manual review)";
        };
    }

    /**
     * Key the change acts on, for logging.
     */
    public StoreKey subjectKey() {
        return sourceKey != null ? sourceKey : targetKey;
    }
}
