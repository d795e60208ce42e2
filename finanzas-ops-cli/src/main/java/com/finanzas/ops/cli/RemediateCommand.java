package com.finanzas.ops.cli;

import com.finanzas.ops.taxonomy.backup.FileBackupStore;
import com.finanzas.ops.taxonomy.config.ExecutionMode;
import com.finanzas.ops.taxonomy.config.TaxonomyOpsProperties;
import com.finanzas.ops.taxonomy.diff.DiffReport;
import com.finanzas.ops.taxonomy.remediation.ApprovalPolicy;
import com.finanzas.ops.taxonomy.remediation.AutoApprovePolicy;
import com.finanzas.ops.taxonomy.remediation.AutoRejectPolicy;
import com.finanzas.ops.taxonomy.remediation.PlannedChange;
import com.finanzas.ops.taxonomy.remediation.PromptUserPolicy;
import com.finanzas.ops.taxonomy.remediation.RemediationExecutor;
import com.finanzas.ops.taxonomy.remediation.RemediationLog;
import com.finanzas.ops.taxonomy.remediation.RemediationPlanner;
import com.finanzas.ops.taxonomy.remediation.RemediationSummary;
import com.finanzas.ops.taxonomy.report.OpsJson;
import com.finanzas.ops.taxonomy.report.ReportWriter;
import com.finanzas.ops.taxonomy.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies tiered fixes from a drift report.
 */
@Slf4j
@Command(name = "remediate", mixinStandardHelpOptions = true,
        description = "Plan and apply P1-P4 fixes from a taxonomy drift report. Orphans are reported, never deleted.")
class RemediateCommand extends OpsCommand {

    @Parameters(index = "0", paramLabel = "REPORT", description = "Drift report written by validate")
    Path report;

    @ArgGroup(exclusive = true)
    Approval approval;

    @Option(names = "--dry-run", description = "Preview the plan without writing")
    boolean dryRun;

    static class Approval {
        @Option(names = "--interactive", description = "Ask before each change (default)")
        boolean interactive;

        @Option(names = "--auto", description = "Apply every change without asking")
        boolean auto;

        @Option(names = "--review-only", description = "Decline every change; log what would be done")
        boolean reviewOnly;
    }

    RemediateCommand(OpsContext context) {
        super(context);
    }

    @Override
    protected String commandName() {
        return "remediate";
    }

    @Override
    protected int execute(TaxonomyOpsProperties properties) {
        if (!Files.isRegularFile(report)) {
            context.getErr().println("ERROR: report not found: " + report);
            context.getErr().println("Hint: run `finanzas-ops validate` first");
            return ExitCodes.FATAL;
        }
        ExecutionMode mode = dryRun ? ExecutionMode.DRY_RUN : ExecutionMode.APPLY;
        String table = properties.getStore().requireTaxonomyTable("remediate");
        KeyValueStore store = context.getStoreFactory().open(properties, table, mode.isApply());

        ReportWriter writer = reportWriter(properties);
        DiffReport diffReport = writer.read(report, DiffReport.class);
        if (diffReport.getMeta() != null && diffReport.getMeta().getTable() != null
                && !diffReport.getMeta().getTable().equals(table)) {
            log.warn("Report was generated for table {} but TAXONOMY_TABLE is {}",
                    diffReport.getMeta().getTable(), table);
        }

        List<PlannedChange> plan = new RemediationPlanner(keySchema(properties)).plan(diffReport);
        ApprovalPolicy policy = approvalPolicy();
        if (mode.isApply()) {
            context.getErr().println("APPLY mode: changes will be written to " + table
                    + ". Each item is backed up under " + properties.getReports().backupDirectory());
        }

        Map<String, Object> header = new LinkedHashMap<>();
        header.put("runId", context.getAudit().currentRunId());
        header.put("report", report.toString());
        header.put("table", table);
        header.put("mode", mode.name());
        header.put("approval", policy.name());
        header.put("startedAt", context.getClock().instant());
        RemediationLog remediationLog = RemediationLog.create(writer, header);

        RemediationExecutor executor = new RemediationExecutor(store,
                new FileBackupStore(properties.getReports().backupDirectory(), OpsJson.mapper(), context.getClock()),
                policy, mode, remediationLog, context.getMetrics(), context.getAudit(), context.getClock());
        RemediationSummary summary = executor.execute(plan);

        context.getOut().println(summary.render());
        context.getOut().println("Remediation log: " + remediationLog.getPath());
        return ExitCodes.OK;
    }

    private ApprovalPolicy approvalPolicy() {
        if (approval != null && approval.auto) {
            return new AutoApprovePolicy();
        }
        if (approval != null && approval.reviewOnly) {
            return new AutoRejectPolicy();
        }
        return new PromptUserPolicy(context.getIn(), context.getOut());
    }
}
