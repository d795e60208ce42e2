package com.finanzas.ops.taxonomy.validation;

import com.finanzas.ops.taxonomy.TaxonomyFixtures;
import com.finanzas.ops.taxonomy.canonical.RubroCanonicalizer;
import com.finanzas.ops.taxonomy.migration.MigrationTarget;
import com.finanzas.ops.taxonomy.scan.TableScanner;
import com.finanzas.ops.taxonomy.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.finanzas.ops.taxonomy.TaxonomyFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;

class ReferencingValidatorTest {

    private final ReferencingValidator validator = new ReferencingValidator(
            RubroCanonicalizer.of(TaxonomyFixtures.taxonomy()), new TableScanner(2), TaxonomyFixtures.CLOCK);

    @Test
    void flagsLegacyAndUnknownReferences() {
        InMemoryKeyValueStore allocations = new InMemoryKeyValueStore("finz_allocations");
        allocations.put(row("PROJECT#P1", "ALLOC#1", "rubro_id", "MOD-ING", "canonical_rubro_id", "MOD-ING"));
        allocations.put(row("PROJECT#P1", "ALLOC#2", "rubro_id", "mod-ing"));
        allocations.put(row("PROJECT#P1", "ALLOC#3", "rubro_id", "RB0042"));
        allocations.put(row("PROJECT#P1", "ALLOC#4", "rubro_id", "GSV-REU", "canonical_rubro_id", "BOGUS"));
        allocations.put(row("PROJECT#P1", "ALLOC#5", "amount", "10"));

        ReferencingValidationReport report = validator.validate(
                List.of(new MigrationTarget(MigrationTarget.ALLOCATIONS, allocations)));

        ReferencingValidationReport.TableResult result = report.getTables().get(0);
        assertThat(result.getTable()).isEqualTo("finz_allocations");
        assertThat(result.getTotalItems()).isEqualTo(5);
        assertThat(result.getValidItems()).isEqualTo(2);
        assertThat(result.getInvalidItems()).isEqualTo(2);
        assertThat(result.getNoIdentifier()).isEqualTo(1);
        assertThat(result.getMismatches()).hasSize(2);
        assertThat(result.getMismatches()).anySatisfy(mismatch -> {
            assertThat(mismatch.getSk()).isEqualTo("ALLOC#3");
            assertThat(mismatch.getField()).isEqualTo("rubro_id");
            assertThat(mismatch.getResolvesTo()).isEqualTo("GSV-REU");
            assertThat(mismatch.getReason()).contains("migrate-referencing");
        });
        assertThat(result.getMismatches()).anySatisfy(mismatch -> {
            assertThat(mismatch.getSk()).isEqualTo("ALLOC#4");
            assertThat(mismatch.getField()).isEqualTo("canonical_rubro_id");
            assertThat(mismatch.getResolvesTo()).isNull();
            assertThat(mismatch.getReason()).isEqualTo("not a canonical linea_codigo");
        });
        assertThat(report.isClean()).isFalse();
        assertThat(report.invalidItems()).isEqualTo(2);
        assertThat(report.getTimestamp()).isEqualTo(TaxonomyFixtures.CLOCK.instant());
    }

    @Test
    void cleanTablesPass() {
        InMemoryKeyValueStore projectRubros = new InMemoryKeyValueStore("finz_project_rubros");
        projectRubros.put(row("PROJECT#P1", "RUBRO#1", "line_item_id", "TEC-LIC"));
        projectRubros.put(row("PROJECT#P2", "RUBRO#1", "rubroId", "MOD-LEAD"));

        ReferencingValidationReport report = validator.validate(
                List.of(new MigrationTarget(MigrationTarget.PROJECT_RUBROS, projectRubros)));

        assertThat(report.isClean()).isTrue();
        assertThat(report.getTables().get(0).getValidItems()).isEqualTo(2);
    }
}
