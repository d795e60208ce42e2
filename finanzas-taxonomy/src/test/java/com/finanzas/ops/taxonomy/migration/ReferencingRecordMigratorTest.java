package com.finanzas.ops.taxonomy.migration;

import com.finanzas.ops.taxonomy.TaxonomyFixtures;
import com.finanzas.ops.taxonomy.backup.FileBackupStore;
import com.finanzas.ops.taxonomy.canonical.RubroCanonicalizer;
import com.finanzas.ops.taxonomy.config.ExecutionMode;
import com.finanzas.ops.taxonomy.observability.TaxonomyAuditLogger;
import com.finanzas.ops.taxonomy.observability.TaxonomyOpsMetrics;
import com.finanzas.ops.taxonomy.report.OpsJson;
import com.finanzas.ops.taxonomy.scan.TableScanner;
import com.finanzas.ops.taxonomy.store.InMemoryKeyValueStore;
import com.finanzas.ops.taxonomy.store.KeyValueStore;
import com.finanzas.ops.taxonomy.store.StoreKey;
import com.finanzas.ops.taxonomy.store.StoreWriteException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.finanzas.ops.taxonomy.TaxonomyFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class ReferencingRecordMigratorTest {

    private static final StoreKey RB0001_ROW = new StoreKey("PROJECT#P1", "ALLOC#1");
    private static final StoreKey CASE_ROW = new StoreKey("PROJECT#P2", "ALLOC#1");
    private static final StoreKey PROVENANCE_ROW = new StoreKey("PROJECT#P6", "ALLOC#1");
    private static final StoreKey PARTIAL_ROW = new StoreKey("PROJECT#P5", "ALLOC#1");

    @TempDir
    Path dir;

    private InMemoryKeyValueStore allocations;
    private InMemoryKeyValueStore projectRubros;
    private final List<Duration> pauses = new ArrayList<>();
    private TaxonomyOpsMetrics metrics;

    @BeforeEach
    void setUp() {
        allocations = new InMemoryKeyValueStore("finz_allocations");
        allocations.put(row("PROJECT#P1", "ALLOC#1", "rubro_id", "RB0001", "amount", "1200"));
        allocations.put(row("PROJECT#P1", "ALLOC#2", "rubro_id", "MOD-ING", "canonical_rubro_id", "MOD-ING"));
        allocations.put(row("PROJECT#P2", "ALLOC#1", "rubro_id", " gsv-reu "));
        allocations.put(row("PROJECT#P3", "ALLOC#1", "rubro_id", "UNKNOWN-9"));
        allocations.put(row("PROJECT#P4", "ALLOC#1", "amount", "10"));
        allocations.put(row("PROJECT#P5", "ALLOC#1", "rubro_id", "MOD-ING"));
        allocations.put(row("PROJECT#P6", "ALLOC#1", "rubro_id", "RB0042", "legacy_rubro_token", "OLD-ORIGINAL"));

        projectRubros = new InMemoryKeyValueStore("finz_project_rubros");
        projectRubros.put(row("PROJECT#P1", "RUBRO#1", "line_item_id", "mod-ing-01"));

        metrics = TaxonomyOpsMetrics.standalone();
    }

    private ReferencingRecordMigrator migrator(ExecutionMode mode, int batchSize) {
        return new ReferencingRecordMigrator(
                RubroCanonicalizer.of(TaxonomyFixtures.taxonomy()),
                new TableScanner(3),
                new FileBackupStore(dir, OpsJson.mapper(), TaxonomyFixtures.CLOCK),
                new BatchThrottle(batchSize, Duration.ofMillis(250), pauses::add, metrics),
                mode,
                metrics,
                new TaxonomyAuditLogger(),
                TaxonomyFixtures.CLOCK);
    }

    private List<MigrationTarget> targets(KeyValueStore allocationsStore) {
        return List.of(new MigrationTarget(MigrationTarget.ALLOCATIONS, allocationsStore),
                new MigrationTarget(MigrationTarget.PROJECT_RUBROS, projectRubros));
    }

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        void canonicalizesEveryResolvableReference() {
            MigrationReport report = migrator(ExecutionMode.APPLY, 50).migrate(targets(allocations));

            MigrationReport.Summary allocationSummary = report.getPerTable().get(MigrationTarget.ALLOCATIONS);
            assertThat(allocationSummary.getTotalScanned()).isEqualTo(7);
            assertThat(allocationSummary.getUpdated()).isEqualTo(4);
            assertThat(allocationSummary.getAlreadyCanonical()).isEqualTo(1);
            assertThat(allocationSummary.getNoIdentifier()).isEqualTo(1);
            assertThat(allocationSummary.getFailed()).isEqualTo(1);
            assertThat(report.getSummary().getUpdated()).isEqualTo(5);
            assertThat(report.getMode()).isEqualTo("apply");
            assertThat(report.getTables()).containsExactly("finz_allocations", "finz_project_rubros");

            assertThat(allocations.get(RB0001_ROW).orElseThrow())
                    .containsEntry("rubro_id", "MOD-ING")
                    .containsEntry("canonical_rubro_id", "MOD-ING")
                    .containsEntry("legacy_rubro_token", "RB0001")
                    .containsEntry("amount", "1200");
            assertThat(allocations.get(CASE_ROW).orElseThrow())
                    .containsEntry("rubro_id", "GSV-REU")
                    .containsEntry("legacy_rubro_token", "gsv-reu");
            assertThat(projectRubros.get(new StoreKey("PROJECT#P1", "RUBRO#1")).orElseThrow())
                    .containsEntry("rubro_id", "MOD-ING")
                    .containsEntry("line_item_id", "mod-ing-01")
                    .containsEntry("legacy_rubro_token", "mod-ing-01");
        }

        @Test
        void partiallyCanonicalRecordStillGetsProvenance() {
            migrator(ExecutionMode.APPLY, 50).migrate(targets(allocations));

            assertThat(allocations.get(PARTIAL_ROW).orElseThrow())
                    .containsEntry("rubro_id", "MOD-ING")
                    .containsEntry("canonical_rubro_id", "MOD-ING")
                    .containsEntry("legacy_rubro_token", "MOD-ING");
        }

        @Test
        void firstRecordedProvenanceIsNeverOverwritten() {
            migrator(ExecutionMode.APPLY, 50).migrate(targets(allocations));

            assertThat(allocations.get(PROVENANCE_ROW).orElseThrow())
                    .containsEntry("rubro_id", "GSV-REU")
                    .containsEntry("legacy_rubro_token", "OLD-ORIGINAL");
        }

        @Test
        void secondRunChangesNothing() {
            migrator(ExecutionMode.APPLY, 50).migrate(targets(allocations));
            List<Map<String, Object>> afterFirst = allocations.snapshot();

            MigrationReport second = migrator(ExecutionMode.APPLY, 50).migrate(targets(allocations));

            assertThat(allocations.snapshot()).isEqualTo(afterFirst);
            assertThat(second.getSummary().getUpdated()).isZero();
            assertThat(second.getSummary().getFailed()).isEqualTo(1);
        }

        @Test
        void unknownReferenceIsReportedAsFailure() {
            MigrationReport report = migrator(ExecutionMode.APPLY, 50).migrate(targets(allocations));

            assertThat(report.hasFailures()).isTrue();
            assertThat(report.getFailures()).singleElement().satisfies(failure -> {
                assertThat(failure.getRaw()).isEqualTo("UNKNOWN-9");
                assertThat(failure.getReason()).isEqualTo("no_canonical_mapping");
                assertThat(failure.getPk()).isEqualTo("PROJECT#P3");
            });
            assertThat(allocations.get(new StoreKey("PROJECT#P3", "ALLOC#1")).orElseThrow())
                    .containsEntry("rubro_id", "UNKNOWN-9");
        }

        @Test
        void pausesAfterEveryFullBatch() {
            MigrationReport report = migrator(ExecutionMode.APPLY, 2).migrate(targets(allocations));

            assertThat(pauses).hasSize(2).containsOnly(Duration.ofMillis(250));
            assertThat(report.getSummary().getBatchPauses()).isEqualTo(2);
            assertThat(metrics.getBatchPauses().count()).isEqualTo(2.0);
        }

        @Test
        void writeFailureIsRecordedAndRunContinues() {
            KeyValueStore failing = spy(allocations);
            doThrow(new StoreWriteException("throttled"))
                    .when(failing).update(eq(RB0001_ROW), any());

            MigrationReport report = migrator(ExecutionMode.APPLY, 50).migrate(targets(failing));

            assertThat(report.getPerTable().get(MigrationTarget.ALLOCATIONS).getFailed()).isEqualTo(2);
            assertThat(report.getPerTable().get(MigrationTarget.ALLOCATIONS).getUpdated()).isEqualTo(3);
            assertThat(report.getFailures()).anySatisfy(failure -> assertThat(failure.getReason()).isEqualTo("throttled"));
            assertThat(report.getChanges()).anySatisfy(change -> {
                assertThat(change.getPk()).isEqualTo("PROJECT#P1");
                assertThat(change.getError()).isEqualTo("throttled");
                assertThat(change.isApplied()).isFalse();
            });
        }
    }

    @Nested
    @DisplayName("dry-run")
    class DryRun {

        @Test
        void previewsWithoutWriting() {
            List<Map<String, Object>> before = allocations.snapshot();

            MigrationReport report = migrator(ExecutionMode.DRY_RUN, 2).migrate(targets(allocations));

            assertThat(allocations.snapshot()).isEqualTo(before);
            assertThat(report.getMode()).isEqualTo("dry-run");
            assertThat(report.getSummary().getToUpdate()).isEqualTo(5);
            assertThat(report.getSummary().getUpdated()).isZero();
            assertThat(report.getChanges()).allSatisfy(change -> assertThat(change.isDryRun()).isTrue());
            assertThat(report.getChanges()).anySatisfy(change -> {
                assertThat(change.getRaw()).isEqualTo("RB0001");
                assertThat(change.getAfter()).containsEntry("legacy_rubro_token", "RB0001");
            });
            assertThat(pauses).isEmpty();
        }
    }
}
