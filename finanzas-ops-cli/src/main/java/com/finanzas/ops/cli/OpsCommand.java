package com.finanzas.ops.cli;

import com.finanzas.ops.taxonomy.TaxonomyOpsException;
import com.finanzas.ops.taxonomy.config.MissingConfigurationException;
import com.finanzas.ops.taxonomy.config.TaxonomyOpsProperties;
import com.finanzas.ops.taxonomy.migration.MigrationTarget;
import com.finanzas.ops.taxonomy.observability.TaxonomyAuditLogger;
import com.finanzas.ops.taxonomy.report.OpsJson;
import com.finanzas.ops.taxonomy.report.ReportWriter;
import com.finanzas.ops.taxonomy.scan.TaxonomyScanException;
import com.finanzas.ops.taxonomy.source.TaxonomyParseException;
import com.finanzas.ops.taxonomy.store.KeySchema;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Shared plumbing for subcommands: run id, configuration, fatal error handling and the end-of-run
 * metrics line.
 */
@Slf4j
abstract class OpsCommand implements Callable<Integer> {

    protected final OpsContext context;

    @Option(names = "--report-dir", paramLabel = "DIR",
            description = "Directory for reports and backups (default: $TAXONOMY_REPORT_DIR or tmp)")
    Path reportDir;

    protected OpsCommand(OpsContext context) {
        this.context = context;
    }

    @Override
    public final Integer call() {
        try (TaxonomyAuditLogger.MDCScope ignored = context.getAudit().startRun(commandName())) {
            try {
                return execute(properties());
            } catch (MissingConfigurationException e) {
                return fatal(e, "set " + e.getVariable() + " env var");
            } catch (TaxonomyParseException e) {
                return fatal(e, "check the canonical source at " + e.getOrigin());
            } catch (TaxonomyScanException e) {
                return fatal(e, "check AWS credentials, region and table name");
            } catch (TaxonomyOpsException e) {
                return fatal(e, null);
            } finally {
                log.info("Metrics: {}", context.getMetrics().describe());
                context.getStoreFactory().close();
            }
        }
    }

    protected abstract String commandName();

    protected abstract int execute(TaxonomyOpsProperties properties);

    protected TaxonomyOpsProperties properties() {
        TaxonomyOpsProperties properties = context.properties();
        if (reportDir != null) {
            properties.getReports().setDirectory(reportDir);
        }
        return properties;
    }

    protected ReportWriter reportWriter(TaxonomyOpsProperties properties) {
        return new ReportWriter(properties.getReports().getDirectory(), OpsJson.mapper(), context.getClock());
    }

    protected static KeySchema keySchema(TaxonomyOpsProperties properties) {
        return new KeySchema(properties.getStore().getPartitionKey(), properties.getStore().getSortKey());
    }

    /**
     * Tables holding rubro references, filtered by {@code --table}. Writers must name both tables
     * explicitly; readers fall back to the default names.
     */
    protected List<MigrationTarget> referencingTargets(TaxonomyOpsProperties properties, boolean mutating,
                                                       String filter) {
        TaxonomyOpsProperties.Store store = properties.getStore();
        String allocations = mutating
                ? store.requireAllocationsTable(commandName() + " --apply")
                : store.allocationsTableOrDefault();
        String projectRubros = mutating
                ? store.requireProjectRubrosTable(commandName() + " --apply")
                : store.projectRubrosTableOrDefault();

        List<MigrationTarget> targets = new ArrayList<>();
        for (MigrationTarget target : List.of(
                new MigrationTarget(MigrationTarget.ALLOCATIONS,
                        context.getStoreFactory().open(properties, allocations, mutating)),
                new MigrationTarget(MigrationTarget.PROJECT_RUBROS,
                        context.getStoreFactory().open(properties, projectRubros, mutating)))) {
            if (target.matches(filter)) {
                targets.add(target);
            }
        }
        if (targets.isEmpty()) {
            throw new TaxonomyOpsException("No referencing table matches --table=" + filter
                    + " (expected " + MigrationTarget.ALLOCATIONS + ", " + MigrationTarget.PROJECT_RUBROS
                    + " or a physical table name)");
        }
        return targets;
    }

    protected int fatal(Exception e, String hint) {
        log.error("{} failed: {}", commandName(), e.getMessage(), e);
        context.getErr().println("ERROR: " + e.getMessage());
        if (hint != null) {
            context.getErr().println("Hint: " + hint);
        }
        return ExitCodes.FATAL;
    }
}
