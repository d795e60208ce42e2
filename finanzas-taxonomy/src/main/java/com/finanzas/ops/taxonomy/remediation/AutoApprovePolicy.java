package com.finanzas.ops.taxonomy.remediation;

/**
 * Approves every change. Used by {@code remediate --auto}.
 */
public class AutoApprovePolicy implements ApprovalPolicy {

    @Override
    public boolean approve(PlannedChange change) {
        return true;
    }

    @Override
    public String name() {
        return "auto";
    }
}
