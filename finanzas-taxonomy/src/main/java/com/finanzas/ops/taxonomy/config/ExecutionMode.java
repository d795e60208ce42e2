package com.finanzas.ops.taxonomy.config;

/**
 * Whether a run may write to the store.
 */
public enum ExecutionMode {
    /** Plan and report only */
    DRY_RUN,
    /** Plan, back up and write */
    APPLY;

    public boolean isApply() {
        return this == APPLY;
    }
}
