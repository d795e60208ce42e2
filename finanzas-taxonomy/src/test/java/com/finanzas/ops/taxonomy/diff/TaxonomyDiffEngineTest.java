package com.finanzas.ops.taxonomy.diff;

import com.finanzas.ops.taxonomy.TaxonomyFixtures;
import com.finanzas.ops.taxonomy.scan.StoreIndex;
import com.finanzas.ops.taxonomy.scan.TableScanner;
import com.finanzas.ops.taxonomy.scan.TaxonomyStoreScanner;
import com.finanzas.ops.taxonomy.store.InMemoryKeyValueStore;
import com.finanzas.ops.taxonomy.store.KeySchema;
import com.finanzas.ops.taxonomy.store.StoreKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.finanzas.ops.taxonomy.TaxonomyFixtures.canonicalRow;
import static com.finanzas.ops.taxonomy.TaxonomyFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;

class TaxonomyDiffEngineTest {

    private InMemoryKeyValueStore store;
    private TaxonomyDiffEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore("finz_rubros_taxonomia");
        engine = new TaxonomyDiffEngine(3, 5, KeySchema.DEFAULT, "us-east-2", TaxonomyFixtures.CLOCK);
    }

    private DiffReport diff() {
        StoreIndex index = new TaxonomyStoreScanner(new TableScanner()).scan(store);
        return engine.diff(TaxonomyFixtures.taxonomy(), index);
    }

    private void storeCanonicalModIng() {
        store.put(canonicalRow("MOD-ING",
                "descripcion", "Ingenieros de soporte (mensual)",
                "categoria_codigo", "MOD",
                "categoria", "Mano de Obra Directa",
                "fuente_referencia", "MSP"));
    }

    @Nested
    @DisplayName("set differences")
    class SetDifferences {

        @Test
        void classifiesMissingExtraAndBackendGaps() {
            storeCanonicalModIng();
            store.put(canonicalRow("GSV-REU", "linea_gasto", "Reuniones de seguimiento",
                    "categoria_codigo", "GSV", "categoria", "Gestión del Servicio"));
            store.put(canonicalRow("OLD-X", "categoria", "Obsoleto"));

            DiffReport report = diff();

            assertThat(report.getMissingInStore()).containsExactly("TEC-LIC");
            assertThat(report.getExtraInStore()).containsExactly("OLD-X");
            assertThat(report.getBackendMissingFrontend()).containsExactly("MOD-LEAD");
            assertThat(report.getFrontendMissingBackend()).containsExactly("TEC-LIC");
            assertThat(report.getAttributeMismatches()).isEmpty();
            assertThat(report.getExtraRecordKeys().get("OLD-X"))
                    .containsExactly(new StoreKey("TAXONOMY", "RUBRO#OLD-X"));
            assertThat(report.getCanonicalEntries()).containsOnlyKeys("TEC-LIC");
            assertThat(report.getCounts().getMissingInStore()).isEqualTo(1);
            assertThat(report.isClean()).isFalse();
        }

        @Test
        void metaDescribesTheRun() {
            storeCanonicalModIng();
            store.put(row("MISC", "CONFIG"));

            DiffReport.Meta meta = diff().getMeta();

            assertThat(meta.getGeneratedAt()).isEqualTo(TaxonomyFixtures.CLOCK.instant());
            assertThat(meta.getTable()).isEqualTo("finz_rubros_taxonomia");
            assertThat(meta.getRegion()).isEqualTo("us-east-2");
            assertThat(meta.getScannedItems()).isEqualTo(2);
            assertThat(meta.getUnindexedItems()).isEqualTo(1);
            assertThat(meta.getFrontendCount()).isEqualTo(3);
            assertThat(meta.getBackendDerivedCount()).isEqualTo(3);
            assertThat(meta.getFrontendSource()).isEqualTo("test:frontend");
        }
    }

    @Nested
    @DisplayName("attribute and key-shape drift")
    class Drift {

        @Test
        void reportsKeyShapeAndDescriptionDrift() {
            storeCanonicalModIng();
            store.put(row("LINEA#GSV-REU", "METADATA",
                    "linea_codigo", "GSV-REU",
                    "linea_gasto", "Reuniones",
                    "categoria_codigo", "GSV",
                    "categoria", "Gestión del Servicio"));

            DiffReport report = diff();

            assertThat(report.getAttributeMismatches()).containsOnlyKeys("GSV-REU");
            AttributeMismatch mismatch = report.getAttributeMismatches().get("GSV-REU").get(0);
            assertThat(mismatch.getSampleKey()).isEqualTo("LINEA#GSV-REU|METADATA");
            assertThat(mismatch.getKey()).isEqualTo(new StoreKey("LINEA#GSV-REU", "METADATA"));
            assertThat(mismatch.getDiffs()).extracting(FieldDiff::getAttr)
                    .containsExactly(DiffAttribute.DESCRIPTION, DiffAttribute.PARTITION_KEY, DiffAttribute.SORT_KEY);
            assertThat(mismatch.diff(DiffAttribute.DESCRIPTION)).get()
                    .satisfies(d -> {
                        assertThat(d.getFrontend()).isEqualTo("Reuniones de seguimiento");
                        assertThat(d.getTable()).isEqualTo("Reuniones");
                    });
            assertThat(mismatch.hasKeyShapeDiff()).isTrue();
            assertThat(mismatch.attributeDiffs()).hasSize(1);
            assertThat(report.getCanonicalEntries()).containsKeys("GSV-REU", "TEC-LIC");
        }

        @Test
        void comparisonIsCaseSensitiveAndTrimmed() {
            List<FieldDiff> diffs = engine.compare("MOD-ING", TaxonomyFixtures.MOD_ING, canonicalRow("MOD-ING",
                    "descripcion", "  Ingenieros de soporte (mensual) ",
                    "categoria_codigo", "MOD",
                    "categoria", "mano de obra directa"));

            assertThat(diffs).extracting(FieldDiff::getAttr)
                    .containsExactly(DiffAttribute.CATEGORY, DiffAttribute.SOURCE_REFERENCE);
            assertThat(diffs.get(1).getTable()).isNull();
        }

        @Test
        void onlySampledRowsAreCompared() {
            engine = new TaxonomyDiffEngine(2, 5, KeySchema.DEFAULT, "us-east-2", TaxonomyFixtures.CLOCK);
            for (String pk : List.of("A", "B", "C")) {
                store.put(row(pk, "METADATA", "linea_codigo", "TEC-LIC"));
            }

            DiffReport report = diff();

            assertThat(report.getAttributeMismatches().get("TEC-LIC")).hasSize(2);
            assertThat(report.getCounts().getMismatchedRows()).isEqualTo(2);
        }
    }
}
