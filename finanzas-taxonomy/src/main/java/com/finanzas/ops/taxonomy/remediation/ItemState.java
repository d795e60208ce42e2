package com.finanzas.ops.taxonomy.remediation;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one planned change.
 * <p>
 * {@code PLANNED -> BACKED_UP -> APPLIED | FAILED}. Outcomes that never mutate the store
 * (no-op, declined, failed precondition) are reached from {@code PLANNED} directly. In dry-run
 * mode an item that would be applied stays {@code PLANNED}.
 */
public enum ItemState {
    PLANNED,
    BACKED_UP,
    APPLIED,
    FAILED,
    SKIPPED_NO_OP,
    SKIPPED_DECLINED;

    public boolean isTerminal() {
        return this != PLANNED && this != BACKED_UP;
    }

    public boolean canTransitionTo(ItemState next) {
        return allowedNext().contains(next);
    }

    private Set<ItemState> allowedNext() {
        return switch (this) {
            case PLANNED -> EnumSet.of(BACKED_UP, FAILED, SKIPPED_NO_OP, SKIPPED_DECLINED);
            case BACKED_UP -> EnumSet.of(APPLIED, FAILED, SKIPPED_NO_OP);
            default -> EnumSet.noneOf(ItemState.class);
        };
    }
}
