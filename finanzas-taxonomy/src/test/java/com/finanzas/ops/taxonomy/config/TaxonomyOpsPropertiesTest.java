package com.finanzas.ops.taxonomy.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxonomyOpsPropertiesTest {

    @Test
    void readsEnvironment() {
        TaxonomyOpsProperties properties = TaxonomyOpsProperties.fromEnvironment(Map.of(
                "AWS_REGION", "us-east-1",
                "TAXONOMY_TABLE", " finz_rubros_taxonomia_dev ",
                "ALLOCATIONS_TABLE", "finz_allocations_dev",
                "TAXONOMY_REPORT_DIR", "/var/tmp/taxonomy"));

        assertThat(properties.getStore().requireRegion("remediate")).isEqualTo("us-east-1");
        assertThat(properties.getStore().requireTaxonomyTable("remediate")).isEqualTo("finz_rubros_taxonomia_dev");
        assertThat(properties.getStore().allocationsTableOrDefault()).isEqualTo("finz_allocations_dev");
        assertThat(properties.getStore().getProjectRubrosTable()).isNull();
        assertThat(properties.getReports().diffReportPath())
                .isEqualTo(Paths.get("/var/tmp/taxonomy", "taxonomy_report_full.json"));
        assertThat(properties.getReports().backupDirectory()).isEqualTo(Paths.get("/var/tmp/taxonomy", "backups"));
    }

    @Test
    void readOnlyCallersFallBackToDefaults() {
        TaxonomyOpsProperties properties = TaxonomyOpsProperties.fromEnvironment(Map.of("TAXONOMY_TABLE", "  "));

        assertThat(properties.getStore().regionOrDefault()).isEqualTo(TaxonomyOpsProperties.DEFAULT_REGION);
        assertThat(properties.getStore().taxonomyTableOrDefault()).isEqualTo("finz_rubros_taxonomia");
        assertThat(properties.getStore().projectRubrosTableOrDefault()).isEqualTo("project_rubros");
        assertThat(properties.getReports().diffReportPath()).isEqualTo(Paths.get("tmp", "taxonomy_report_full.json"));
        assertThat(properties.getMigration().getBatchSize()).isEqualTo(50);
    }

    @Test
    void mutatingCallersNeverFallBack() {
        TaxonomyOpsProperties properties = TaxonomyOpsProperties.fromEnvironment(Map.of());

        assertThatThrownBy(() -> properties.getStore().requireTaxonomyTable("seed"))
                .isInstanceOf(MissingConfigurationException.class)
                .hasMessageContaining("TAXONOMY_TABLE is required for seed")
                .extracting("variable").isEqualTo("TAXONOMY_TABLE");
        assertThatThrownBy(() -> properties.getStore().requireAllocationsTable("migrate-referencing"))
                .isInstanceOf(MissingConfigurationException.class);
    }
}
