package com.finanzas.ops.cli;

import com.finanzas.ops.taxonomy.key.TaxonomyKeyCodec;
import com.finanzas.ops.taxonomy.observability.TaxonomyAuditLogger;
import com.finanzas.ops.taxonomy.observability.TaxonomyOpsMetrics;
import com.finanzas.ops.taxonomy.store.InMemoryKeyValueStore;
import com.finanzas.ops.taxonomy.store.StoreKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FinanzasOpsCliTest {

    private static final String TAXONOMY_TABLE = "finz_rubros_taxonomia_test";
    private static final String ALLOCATIONS_TABLE = "finz_allocations_test";
    private static final String PROJECT_RUBROS_TABLE = "finz_project_rubros_test";

    @TempDir
    Path dir;

    private final Map<String, String> env = new HashMap<>();
    private final InMemoryStoreFactory stores = new InMemoryStoreFactory();
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Path frontend;
    private Path backend;
    private Path reportDir;

    @BeforeEach
    void setUp() throws IOException {
        reportDir = dir.resolve("reports");
        env.put("TAXONOMY_REPORT_DIR", reportDir.toString());
        frontend = Files.writeString(dir.resolve("rubros.taxonomy.json"), """
                {"items": [
                  {"linea_codigo": "MOD-ING", "linea_gasto": "Ingenieros de soporte",
                   "categoria": "Mano de Obra Directa", "categoria_codigo": "MOD"},
                  {"linea_codigo": "GSV-REU", "linea_gasto": "Reuniones de seguimiento",
                   "categoria": "Gestión del Servicio", "categoria_codigo": "GSV"}
                ]}
                """);
        backend = Files.writeString(dir.resolve("rubros.aliases.json"), """
                {"roleToLinea": {"Ingeniero Delivery": "MOD-ING"},
                 "nonLaborCategories": {"Reuniones": "GSV-REU"},
                 "legacyAliases": {"RB0001": "MOD-ING"}}
                """);
    }

    private int runWithInput(String stdin, String... args) {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        OpsContext context = OpsContext.builder()
                .environment(env)
                .storeFactory(stores)
                .clock(Clock.fixed(Instant.parse("2026-01-15T10:15:00Z"), ZoneOffset.UTC))
                .sleeper(duration -> { })
                .in(new BufferedReader(new StringReader(stdin)))
                .out(new PrintStream(out, true, StandardCharsets.UTF_8))
                .err(new PrintStream(err, true, StandardCharsets.UTF_8))
                .metrics(TaxonomyOpsMetrics.standalone())
                .audit(new TaxonomyAuditLogger())
                .build();
        return FinanzasOpsCli.commandLine(context).execute(args);
    }

    private int run(String... args) {
        return runWithInput("", args);
    }

    private String[] withSources(String... args) {
        List<String> all = new ArrayList<>(List.of(args));
        all.add("--frontend-source=" + frontend);
        all.add("--backend-source=" + backend);
        return all.toArray(new String[0]);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static Map<String, Object> row(String pk, String sk, String... attributes) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("pk", pk);
        row.put("sk", sk);
        for (int i = 0; i + 1 < attributes.length; i += 2) {
            row.put(attributes[i], attributes[i + 1]);
        }
        return row;
    }

    private List<Path> reports(String prefix) throws IOException {
        try (Stream<Path> files = Files.list(reportDir)) {
            return files.filter(file -> file.getFileName().toString().startsWith(prefix)).toList();
        }
    }

    @Test
    void noSubcommandPrintsUsage() {
        assertThat(run()).isZero();
        assertThat(stdout()).contains("validate", "remediate", "migrate-referencing", "validate-referencing", "seed");
    }

    @Nested
    @DisplayName("validate and remediate")
    class Taxonomy {

        private InMemoryKeyValueStore taxonomyTable;

        @BeforeEach
        void seedTable() {
            env.put("TAXONOMY_TABLE", TAXONOMY_TABLE);
            taxonomyTable = stores.table(TAXONOMY_TABLE);
            StoreKey key = TaxonomyKeyCodec.encode("MOD-ING");
            taxonomyTable.put(row(key.pk(), key.sk(), "linea_codigo", "MOD-ING",
                    "linea_gasto", "Ingenieros de soporte", "categoria", "Mano de Obra", "categoria_codigo", "MOD"));
        }

        @Test
        void validateWritesDriftReportWithoutWriting() {
            int exit = run(withSources("validate"));

            assertThat(exit).isEqualTo(ExitCodes.OK);
            assertThat(reportDir.resolve("taxonomy_report_full.json")).exists();
            assertThat(stdout()).contains("missingInStore=1", "Drift detected");
            assertThat(stores.openedForWrite()).isEmpty();
        }

        @Test
        void autoRemediationConvergesTheTable() throws IOException {
            run(withSources("validate"));
            Path report = reportDir.resolve("taxonomy_report_full.json");

            int exit = run("remediate", report.toString(), "--auto");

            assertThat(exit).isEqualTo(ExitCodes.OK);
            assertThat(stdout()).contains("Remediation log:");
            assertThat(reports("remediation-log")).hasSize(1);
            assertThat(taxonomyTable.get(TaxonomyKeyCodec.encode("GSV-REU"))).isPresent();
            assertThat(taxonomyTable.get(TaxonomyKeyCodec.encode("MOD-ING")).orElseThrow())
                    .containsEntry("categoria", "Mano de Obra Directa");

            assertThat(run(withSources("validate"))).isZero();
            assertThat(stdout()).contains("No drift detected.");
        }

        @Test
        void reviewOnlyLeavesTableUntouched() {
            run(withSources("validate"));
            List<Map<String, Object>> before = taxonomyTable.snapshot();

            int exit = run("remediate", reportDir.resolve("taxonomy_report_full.json").toString(),
                    "--review-only");

            assertThat(exit).isEqualTo(ExitCodes.OK);
            assertThat(taxonomyTable.snapshot()).isEqualTo(before);
        }

        @Test
        void interactiveDeclinesWithoutAnswer() {
            run(withSources("validate"));
            List<Map<String, Object>> before = taxonomyTable.snapshot();

            int exit = runWithInput("n\n", "remediate", reportDir.resolve("taxonomy_report_full.json").toString());

            assertThat(exit).isEqualTo(ExitCodes.OK);
            assertThat(stdout()).contains("Apply this change? [y/N]");
            assertThat(taxonomyTable.snapshot()).isEqualTo(before);
        }

        @Test
        void remediateNeedsAReport() {
            int exit = run("remediate", dir.resolve("nope.json").toString(), "--auto");

            assertThat(exit).isEqualTo(ExitCodes.FATAL);
            assertThat(stderr()).contains("run `finanzas-ops validate` first");
        }

        @Test
        void remediateNeedsAnExplicitTable() throws IOException {
            env.remove("TAXONOMY_TABLE");
            Path report = Files.writeString(dir.resolve("report.json"), "{}");

            int exit = run("remediate", report.toString(), "--auto");

            assertThat(exit).isEqualTo(ExitCodes.FATAL);
            assertThat(stderr()).contains("Hint: set TAXONOMY_TABLE env var");
            assertThat(stores.openedForWrite()).isEmpty();
        }

        @Test
        void missingExplicitSourceIsFatal() {
            int exit = run("validate", "--frontend-source=" + dir.resolve("missing.ts"));

            assertThat(exit).isEqualTo(ExitCodes.FATAL);
            assertThat(stderr()).contains("explicit source does not exist", "Hint: check the canonical source");
        }
    }

    @Nested
    @DisplayName("referencing records")
    class Referencing {

        private InMemoryKeyValueStore allocations;

        @BeforeEach
        void seedTables() {
            allocations = stores.table(ALLOCATIONS_TABLE);
            allocations.put(row("PROJECT#P1", "ALLOC#1", "rubro_id", "RB0001"));
            allocations.put(row("PROJECT#P1", "ALLOC#2", "rubro_id", "GSV-REU", "canonical_rubro_id", "GSV-REU"));
            stores.table(PROJECT_RUBROS_TABLE).put(row("PROJECT#P1", "RUBRO#1", "line_item_id", "MOD-ING"));
            env.put("ALLOCATIONS_TABLE", ALLOCATIONS_TABLE);
            env.put("PROJECT_RUBROS_TABLE", PROJECT_RUBROS_TABLE);
        }

        @Test
        void migrationDefaultsToDryRun() throws IOException {
            List<Map<String, Object>> before = allocations.snapshot();

            int exit = run(withSources("migrate-referencing"));

            assertThat(exit).isEqualTo(ExitCodes.OK);
            assertThat(allocations.snapshot()).isEqualTo(before);
            assertThat(stdout()).contains("mode=dry-run");
            assertThat(stderr()).contains("DRY RUN");
            assertThat(reports("migration-report")).hasSize(1);
            assertThat(stores.openedForWrite()).isEmpty();
        }

        @Test
        void applyRewritesReferences() {
            int exit = run(withSources("migrate-referencing", "--apply", "--batch", "1"));

            assertThat(exit).isEqualTo(ExitCodes.OK);
            assertThat(allocations.get(new StoreKey("PROJECT#P1", "ALLOC#1")).orElseThrow())
                    .containsEntry("rubro_id", "MOD-ING")
                    .containsEntry("canonical_rubro_id", "MOD-ING")
                    .containsEntry("legacy_rubro_token", "RB0001");
            assertThat(stores.openedForWrite()).containsExactly(ALLOCATIONS_TABLE, PROJECT_RUBROS_TABLE);
            assertThat(stdout()).contains("updated=2", "pauses=2");
        }

        @Test
        void applyReportsUnmappedReferences() {
            allocations.put(row("PROJECT#P9", "ALLOC#1", "rubro_id", "XYZ-404"));

            int exit = run(withSources("migrate-referencing", "--apply", "--table", "allocations"));

            assertThat(exit).isEqualTo(ExitCodes.ITEM_FAILURES);
            assertThat(stdout()).contains("raw=\"XYZ-404\" reason=no_canonical_mapping");
        }

        @Test
        void applyNeedsExplicitTables() {
            env.remove("ALLOCATIONS_TABLE");

            int exit = run(withSources("migrate-referencing", "--apply"));

            assertThat(exit).isEqualTo(ExitCodes.FATAL);
            assertThat(stderr()).contains("Hint: set ALLOCATIONS_TABLE env var");
            assertThat(allocations.get(new StoreKey("PROJECT#P1", "ALLOC#1")).orElseThrow())
                    .containsEntry("rubro_id", "RB0001");
        }

        @Test
        void rejectsNonPositiveBatch() {
            assertThat(run(withSources("migrate-referencing", "--batch", "0"))).isEqualTo(ExitCodes.FATAL);
            assertThat(stderr()).contains("--batch must be positive");
        }

        @Test
        void unknownTableFilterIsFatal() {
            assertThat(run(withSources("migrate-referencing", "--table", "bogus"))).isEqualTo(ExitCodes.FATAL);
            assertThat(stderr()).contains("No referencing table matches --table=bogus");
        }

        @Test
        void validationFailsUntilMigrated() {
            assertThat(run(withSources("validate-referencing"))).isEqualTo(ExitCodes.FATAL);
            assertThat(stderr()).contains("1 non-canonical reference(s) found");

            run(withSources("migrate-referencing", "--apply"));

            assertThat(run(withSources("validate-referencing"))).isEqualTo(ExitCodes.OK);
            assertThat(stdout()).contains("All rubro references are canonical.");
        }
    }

    @Nested
    @DisplayName("seed")
    class Seed {

        @Test
        void dryRunNeedsNoTable() {
            int exit = run(withSources("seed", "--dry-run"));

            assertThat(exit).isEqualTo(ExitCodes.OK);
            assertThat(stdout()).contains("mode=dry-run created=2");
            assertThat(stores.table("finz_rubros_taxonomia").size()).isZero();
        }

        @Test
        void applyNeedsExplicitTable() {
            assertThat(run(withSources("seed"))).isEqualTo(ExitCodes.FATAL);
            assertThat(stderr()).contains("Hint: set TAXONOMY_TABLE env var");
        }

        @Test
        void applyCreatesMissingRecords() {
            env.put("TAXONOMY_TABLE", TAXONOMY_TABLE);

            assertThat(run(withSources("seed"))).isEqualTo(ExitCodes.OK);

            assertThat(stores.table(TAXONOMY_TABLE).size()).isEqualTo(2);
            assertThat(stdout()).contains("mode=apply created=2");
        }
    }
}
