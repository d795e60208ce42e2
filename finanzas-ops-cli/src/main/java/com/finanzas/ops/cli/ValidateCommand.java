package com.finanzas.ops.cli;

import com.finanzas.ops.taxonomy.config.TaxonomyOpsProperties;
import com.finanzas.ops.taxonomy.diff.DiffReport;
import com.finanzas.ops.taxonomy.diff.TaxonomyDiffEngine;
import com.finanzas.ops.taxonomy.diff.TaxonomyDriftValidator;
import com.finanzas.ops.taxonomy.scan.TableScanner;
import com.finanzas.ops.taxonomy.scan.TaxonomyStoreScanner;
import com.finanzas.ops.taxonomy.store.KeyValueStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Read-only drift detection between the canonical taxonomy and the taxonomy table.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Diff the canonical taxonomy against the taxonomy table and write a drift report.")
class ValidateCommand extends OpsCommand {

    @Mixin
    SourceOptions sources = new SourceOptions();

    ValidateCommand(OpsContext context) {
        super(context);
    }

    @Override
    protected String commandName() {
        return "validate";
    }

    @Override
    protected int execute(TaxonomyOpsProperties properties) {
        TaxonomyOpsProperties.Store storeProps = properties.getStore();
        KeyValueStore store = context.getStoreFactory()
                .open(properties, storeProps.taxonomyTableOrDefault(), false);

        TaxonomyDriftValidator validator = new TaxonomyDriftValidator(
                sources.loader(),
                new TaxonomyStoreScanner(new TableScanner(storeProps.getScanPageSize())),
                new TaxonomyDiffEngine(properties.getDiff().getSampleRowsPerId(),
                        properties.getDiff().getReportSampleSize(), keySchema(properties),
                        storeProps.regionOrDefault(), context.getClock()),
                reportWriter(properties),
                context.getMetrics(),
                context.getClock());

        TaxonomyDriftValidator.Result result = validator.validate(store, properties.getReports().diffReportPath());
        print(result.report(), result.path());
        return ExitCodes.OK;
    }

    private void print(DiffReport report, Path path) {
        PrintStream out = context.getOut();
        out.println("Taxonomy drift report: " + path);
        out.printf("  table=%s scanned=%d frontend=%d backend=%d%n", report.getMeta().getTable(),
                report.getMeta().getScannedItems(), report.getMeta().getFrontendCount(),
                report.getMeta().getBackendDerivedCount());
        out.printf("  missingInStore=%d extraInStore=%d backendMissingFrontend=%d "
                        + "frontendMissingBackend=%d attributeMismatches=%d%n",
                report.getMissingInStore().size(), report.getExtraInStore().size(),
                report.getBackendMissingFrontend().size(), report.getFrontendMissingBackend().size(),
                report.getAttributeMismatches().size());
        out.println(report.isClean() ? "No drift detected." : "Drift detected; review the report, then run remediate.");
    }
}
