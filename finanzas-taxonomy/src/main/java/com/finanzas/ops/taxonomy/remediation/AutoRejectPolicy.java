package com.finanzas.ops.taxonomy.remediation;

/**
 * Declines every change.
 */
public class AutoRejectPolicy implements ApprovalPolicy {

    @Override
    public boolean approve(PlannedChange change) {
        return false;
    }

    @Override
    public String name() {
        return "reject";
    }
}
