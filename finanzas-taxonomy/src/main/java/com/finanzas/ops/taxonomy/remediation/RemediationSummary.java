package com.finanzas.ops.taxonomy.remediation;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome counts of a remediation run.
 */
public class RemediationSummary {

    private final Map<FixTier, Map<ItemState, Integer>> counts = new EnumMap<>(FixTier.class);
    @Getter
    private final List<RemediationLogEntry> failures = new ArrayList<>();

    void record(RemediationLogEntry entry) {
        counts.computeIfAbsent(entry.getTier(), t -> new EnumMap<>(ItemState.class))
                .merge(entry.getOutcome(), 1, Integer::sum);
        if (entry.getOutcome() == ItemState.FAILED) {
            failures.add(entry);
        }
    }

    public int count(FixTier tier, ItemState state) {
        return counts.getOrDefault(tier, Collections.emptyMap()).getOrDefault(state, 0);
    }

    public int count(ItemState state) {
        int total = 0;
        for (FixTier tier : FixTier.values()) {
            total += count(tier, state);
        }
        return total;
    }

    public int total() {
        int total = 0;
        for (ItemState state : ItemState.values()) {
            total += count(state);
        }
        return total;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Fixed-width table, one row per tier.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-18s %8s %8s %8s %8s %8s%n", "tier", "planned", "applied", "no-op",
                "declined", "failed"));
        for (FixTier tier : FixTier.values()) {
            sb.append(String.format("%-18s %8d %8d %8d %8d %8d%n",
                    tier.getPriority() + " " + tier.name(),
                    count(tier, ItemState.PLANNED),
                    count(tier, ItemState.APPLIED),
                    count(tier, ItemState.SKIPPED_NO_OP),
                    count(tier, ItemState.SKIPPED_DECLINED),
                    count(tier, ItemState.FAILED)));
        }
        sb.append(String.format("%-18s %8d %8d %8d %8d %8d%n", "total",
                count(ItemState.PLANNED), count(ItemState.APPLIED), count(ItemState.SKIPPED_NO_OP),
                count(ItemState.SKIPPED_DECLINED), count(ItemState.FAILED)));
        return sb.toString();
    }
}
