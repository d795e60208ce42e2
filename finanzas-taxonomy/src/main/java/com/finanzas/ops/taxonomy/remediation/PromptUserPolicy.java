package com.finanzas.ops.taxonomy.remediation;

import com.finanzas.ops.taxonomy.TaxonomyOpsException;
import com.finanzas.ops.taxonomy.diff.FieldDiff;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Asks the operator about each change. Only {@code y} or {@code yes} approves; anything else,
 * including end of input, declines.
 */
public class PromptUserPolicy implements ApprovalPolicy {

    private final BufferedReader in;
    private final PrintStream out;

    public PromptUserPolicy(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public boolean approve(PlannedChange change) {
        out.println();
        out.println(change.describe());
        for (FieldDiff diff : change.getDiffs()) {
            out.printf("    %-24s store=%s -> canonical=%s%n", diff.getAttr().getLabel(),
                    diff.getTable(), diff.getFrontend());
        }
        if (change.getRecord() != null) {
            out.println("    record: " + change.getRecord());
        }
        out.print("Apply this change? [y/N] ");
        out.flush();
        try {
            String answer = in.readLine();
            if (answer == null) {
                return false;
            }
            String normalized = answer.trim().toLowerCase(Locale.ROOT);
            return normalized.equals("y") || normalized.equals("yes");
        } catch (IOException e) {
            throw new TaxonomyOpsException("Could not read approval answer: " + e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return "interactive";
    }
}
