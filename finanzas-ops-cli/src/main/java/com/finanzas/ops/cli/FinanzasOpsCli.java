package com.finanzas.ops.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Operator CLI for the rubro taxonomy: drift validation, remediation, reference migration and
 * seeding.
 */
@Command(
        name = "finanzas-ops",
        mixinStandardHelpOptions = true,
        version = "0.3.0",
        description = "Reconcile the Finanzas rubro taxonomy table with the canonical catalog."
)
public class FinanzasOpsCli implements Runnable {

    private final OpsContext context;

    @Spec
    CommandSpec spec;

    public FinanzasOpsCli(OpsContext context) {
        this.context = context;
    }

    public static void main(String[] args) {
        int exit = commandLine(OpsContext.system()).execute(args);
        System.exit(exit);
    }

    /**
     * Root command with every subcommand bound to {@code context}.
     */
    public static CommandLine commandLine(OpsContext context) {
        CommandLine commandLine = new CommandLine(new FinanzasOpsCli(context))
                .addSubcommand(new ValidateCommand(context))
                .addSubcommand(new RemediateCommand(context))
                .addSubcommand(new MigrateReferencingCommand(context))
                .addSubcommand(new ValidateReferencingCommand(context))
                .addSubcommand(new SeedCommand(context));
        commandLine.setOut(new PrintWriter(context.getOut(), true));
        commandLine.setErr(new PrintWriter(context.getErr(), true));
        return commandLine;
    }

    @Override
    public void run() {
        spec.commandLine().usage(context.getOut());
    }
}
