package com.finanzas.ops.cli;

import com.finanzas.ops.taxonomy.canonical.RubroCanonicalizer;
import com.finanzas.ops.taxonomy.config.TaxonomyOpsProperties;
import com.finanzas.ops.taxonomy.report.ReportWriter;
import com.finanzas.ops.taxonomy.scan.TableScanner;
import com.finanzas.ops.taxonomy.validation.ReferencingValidationReport;
import com.finanzas.ops.taxonomy.validation.ReferencingValidator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Read-only check that referencing records only point at canonical rubros.
 */
@Command(name = "validate-referencing", mixinStandardHelpOptions = true,
        description = "Report rubro references that are not canonical ids. Exits 2 when any are found.")
class ValidateReferencingCommand extends OpsCommand {

    @Option(names = "--table", paramLabel = "NAME",
            description = "Only this table (allocations, project_rubros or a physical name)")
    String table;

    @Mixin
    SourceOptions sources = new SourceOptions();

    ValidateReferencingCommand(OpsContext context) {
        super(context);
    }

    @Override
    protected String commandName() {
        return "validate-referencing";
    }

    @Override
    protected int execute(TaxonomyOpsProperties properties) {
        ReferencingValidator validator = new ReferencingValidator(
                RubroCanonicalizer.of(sources.loader().load()),
                new TableScanner(properties.getStore().getScanPageSize()),
                context.getClock());
        ReferencingValidationReport report = validator.validate(referencingTargets(properties, false, table));

        ReportWriter writer = reportWriter(properties);
        Path path = writer.write(writer.timestamped("referencing-validation"), report);

        context.getOut().println("Referencing validation report: " + path);
        for (ReferencingValidationReport.TableResult result : report.getTables()) {
            context.getOut().printf("  %s: total=%d valid=%d invalid=%d noIdentifier=%d%n", result.getTable(),
                    result.getTotalItems(), result.getValidItems(), result.getInvalidItems(),
                    result.getNoIdentifier());
        }
        if (report.isClean()) {
            context.getOut().println("All rubro references are canonical.");
            return ExitCodes.OK;
        }
        context.getErr().println(report.invalidItems() + " non-canonical reference(s) found; "
                + "run migrate-referencing --dryrun to preview the fix");
        return ExitCodes.FATAL;
    }
}
