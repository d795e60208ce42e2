package com.finanzas.ops.cli;

import com.finanzas.ops.taxonomy.backup.FileBackupStore;
import com.finanzas.ops.taxonomy.canonical.RubroCanonicalizer;
import com.finanzas.ops.taxonomy.config.ExecutionMode;
import com.finanzas.ops.taxonomy.config.TaxonomyOpsProperties;
import com.finanzas.ops.taxonomy.migration.BatchThrottle;
import com.finanzas.ops.taxonomy.migration.MigrationReport;
import com.finanzas.ops.taxonomy.migration.MigrationTarget;
import com.finanzas.ops.taxonomy.migration.ReferencingRecordMigrator;
import com.finanzas.ops.taxonomy.report.OpsJson;
import com.finanzas.ops.taxonomy.report.ReportWriter;
import com.finanzas.ops.taxonomy.scan.TableScanner;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Rewrites rubro references in the allocation and project-rubro tables to canonical ids.
 */
@Command(name = "migrate-referencing", mixinStandardHelpOptions = true,
        description = "Canonicalize rubro references in the allocations and project_rubros tables.")
class MigrateReferencingCommand extends OpsCommand {

    private static final int MAX_FAILURES_PRINTED = 50;

    @ArgGroup(exclusive = true)
    Mode modeOptions;

    @Option(names = "--batch", paramLabel = "N", description = "Writes per batch before pausing")
    Integer batch;

    @Option(names = "--table", paramLabel = "NAME",
            description = "Only this table (allocations, project_rubros or a physical name)")
    String table;

    @Mixin
    SourceOptions sources = new SourceOptions();

    static class Mode {
        @Option(names = "--dryrun", description = "Preview changes (default)")
        boolean dryRun;

        @Option(names = "--apply", description = "Write changes; back up the tables first")
        boolean apply;
    }

    MigrateReferencingCommand(OpsContext context) {
        super(context);
    }

    @Override
    protected String commandName() {
        return "migrate-referencing";
    }

    @Override
    protected int execute(TaxonomyOpsProperties properties) {
        ExecutionMode mode = modeOptions != null && modeOptions.apply ? ExecutionMode.APPLY : ExecutionMode.DRY_RUN;
        if (batch != null) {
            if (batch <= 0) {
                context.getErr().println("ERROR: --batch must be positive");
                return ExitCodes.FATAL;
            }
            properties.getMigration().setBatchSize(batch);
        }

        List<MigrationTarget> targets = referencingTargets(properties, mode.isApply(), table);
        if (mode.isApply()) {
            context.getErr().println("APPLY mode: rubro references will be rewritten. "
                    + "Make sure you have a backup of the tables before proceeding.");
        } else {
            context.getErr().println("DRY RUN: no changes will be written. Use --apply to update the tables.");
        }

        RubroCanonicalizer canonicalizer = RubroCanonicalizer.of(sources.loader().load());
        TaxonomyOpsProperties.Migration migration = properties.getMigration();
        ReferencingRecordMigrator migrator = new ReferencingRecordMigrator(
                canonicalizer,
                new TableScanner(properties.getStore().getScanPageSize()),
                new FileBackupStore(properties.getReports().backupDirectory(), OpsJson.mapper(), context.getClock()),
                new BatchThrottle(migration.getBatchSize(), migration.getBatchPause(), context.getSleeper(),
                        context.getMetrics()),
                mode,
                context.getMetrics(),
                context.getAudit(),
                context.getClock());

        MigrationReport report = migrator.migrate(targets);
        ReportWriter writer = reportWriter(properties);
        Path path = writer.write(writer.timestamped("migration-report"), report);
        print(report, path);

        return mode.isApply() && report.hasFailures() ? ExitCodes.ITEM_FAILURES : ExitCodes.OK;
    }

    private void print(MigrationReport report, Path path) {
        PrintStream out = context.getOut();
        MigrationReport.Summary summary = report.getSummary();
        out.println("Migration report: " + path);
        out.printf("  mode=%s tables=%s%n", report.getMode(), report.getTables());
        out.printf("  scanned=%d toUpdate=%d updated=%d alreadyCanonical=%d noIdentifier=%d failed=%d pauses=%d%n",
                summary.getTotalScanned(), summary.getToUpdate(), summary.getUpdated(),
                summary.getAlreadyCanonical(), summary.getNoIdentifier(), summary.getFailed(),
                summary.getBatchPauses());
        List<MigrationReport.Failure> failures = report.getFailures();
        for (int i = 0; i < Math.min(failures.size(), MAX_FAILURES_PRINTED); i++) {
            MigrationReport.Failure failure = failures.get(i);
            out.printf("  %d. %s/%s raw=\"%s\" reason=%s%n", i + 1, failure.getPk(), failure.getSk(),
                    failure.getRaw(), failure.getReason());
        }
        if (failures.size() > MAX_FAILURES_PRINTED) {
            out.printf("  ... and %d more (see %s)%n", failures.size() - MAX_FAILURES_PRINTED, path.getFileName());
        }
    }
}
