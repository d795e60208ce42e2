package com.finanzas.ops.cli;

import com.finanzas.ops.taxonomy.backup.FileBackupStore;
import com.finanzas.ops.taxonomy.config.ExecutionMode;
import com.finanzas.ops.taxonomy.config.TaxonomyOpsProperties;
import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomy;
import com.finanzas.ops.taxonomy.report.OpsJson;
import com.finanzas.ops.taxonomy.report.ReportWriter;
import com.finanzas.ops.taxonomy.scan.StoreIndex;
import com.finanzas.ops.taxonomy.scan.TableScanner;
import com.finanzas.ops.taxonomy.scan.TaxonomyStoreScanner;
import com.finanzas.ops.taxonomy.seed.SeedResult;
import com.finanzas.ops.taxonomy.seed.TaxonomySeeder;
import com.finanzas.ops.taxonomy.store.KeyValueStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Creates missing taxonomy records. Existing rows are never touched.
 */
@Command(name = "seed", mixinStandardHelpOptions = true,
        description = "Create taxonomy records for canonical ids that have none.")
class SeedCommand extends OpsCommand {

    @Option(names = "--include-backend", description = "Also seed backend-only ids with a placeholder record")
    boolean includeBackend;

    @Option(names = "--dry-run", description = "List what would be created without writing")
    boolean dryRun;

    @Mixin
    SourceOptions sources = new SourceOptions();

    SeedCommand(OpsContext context) {
        super(context);
    }

    @Override
    protected String commandName() {
        return "seed";
    }

    @Override
    protected int execute(TaxonomyOpsProperties properties) {
        ExecutionMode mode = dryRun ? ExecutionMode.DRY_RUN : ExecutionMode.APPLY;
        String table = mode.isApply()
                ? properties.getStore().requireTaxonomyTable("seed")
                : properties.getStore().taxonomyTableOrDefault();
        KeyValueStore store = context.getStoreFactory().open(properties, table, mode.isApply());

        CanonicalTaxonomy taxonomy = sources.loader().load();
        StoreIndex index = new TaxonomyStoreScanner(new TableScanner(properties.getStore().getScanPageSize()))
                .scan(store);
        TaxonomySeeder seeder = new TaxonomySeeder(store,
                new FileBackupStore(properties.getReports().backupDirectory(), OpsJson.mapper(), context.getClock()),
                mode, context.getMetrics(), context.getClock());
        SeedResult result = seeder.seed(taxonomy, index, includeBackend);

        ReportWriter writer = reportWriter(properties);
        Path path = writer.write(writer.timestamped("seed-result"), result);
        context.getOut().println("Seed result: " + path);
        context.getOut().printf("  mode=%s created=%d placeholders=%d existing=%d failed=%d%n", result.getMode(),
                result.getCreated().size(), result.getPlaceholders().size(), result.getExisting().size(),
                result.getFailed().size());
        return result.hasFailures() ? ExitCodes.ITEM_FAILURES : ExitCodes.OK;
    }
}
