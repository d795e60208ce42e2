package com.finanzas.ops.taxonomy.remediation;

import lombok.Getter;

/**
 * Remediation tiers, applied in declaration order.
 */
@Getter
public enum FixTier {
    /** Row stored under a key that does not match its id */
    KEY_SHAPE("P1"),
    /** Canonical id with no stored row */
    MISSING_RECORD("P2"),
    /** Stored attributes differ from the canonical entry */
    ATTRIBUTE_DRIFT("P3"),
    /** Stored id unknown to the canonical catalog; reported, never deleted */
    ORPHAN("P4");

    private final String priority;

    FixTier(String priority) {
        this.priority = priority;
    }
}
