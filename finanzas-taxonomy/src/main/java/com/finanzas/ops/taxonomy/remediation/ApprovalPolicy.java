package com.finanzas.ops.taxonomy.remediation;

/**
 * Decides whether a planned change may be applied.
 */
public interface ApprovalPolicy {

    boolean approve(PlannedChange change);

    /**
     * Short name written to the remediation log.
     */
    String name();
}
