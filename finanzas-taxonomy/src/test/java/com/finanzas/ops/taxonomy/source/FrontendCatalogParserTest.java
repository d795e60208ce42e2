package com.finanzas.ops.taxonomy.source;

import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomyEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrontendCatalogParserTest {

    private final FrontendCatalogParser parser = new FrontendCatalogParser();

    private static SourceDocument json(String content) {
        return new SourceDocument("test.json", content, SourceFormat.JSON);
    }

    private static SourceDocument ts(String content) {
        return new SourceDocument("catalogo-rubros.ts", content, SourceFormat.TYPESCRIPT);
    }

    @Nested
    @DisplayName("JSON catalog")
    class Json {

        @Test
        void parsesItemsArray() {
            Map<String, CanonicalTaxonomyEntry> entries = parser.parse(json("""
                    {"version": "2026-01", "items": [
                      {"linea_codigo": "MOD-ING", "linea_gasto": "Ingenieros de soporte",
                       "categoria": "Mano de Obra Directa", "categoria_codigo": "MOD"},
                      {"id": "GSV-REU", "descripcion": " Reuniones ", "categoria_codigo": "GSV"}
                    ]}
                    """));

            assertThat(entries).containsOnlyKeys("MOD-ING", "GSV-REU");
            assertThat(entries.get("MOD-ING").getCategoria()).isEqualTo("Mano de Obra Directa");
            assertThat(entries.get("MOD-ING").effectiveDescription()).isEqualTo("Ingenieros de soporte");
            assertThat(entries.get("GSV-REU").getDescripcion()).isEqualTo("Reuniones");
        }

        @Test
        void acceptsTopLevelArray() {
            assertThat(parser.parse(json("[{\"linea_codigo\": \"TEC-LIC\"}]"))).containsOnlyKeys("TEC-LIC");
        }

        @Test
        void duplicateIdKeepsLastDeclaration() {
            Map<String, CanonicalTaxonomyEntry> entries = parser.parse(json("""
                    {"items": [
                      {"linea_codigo": "MOD-ING", "categoria": "old"},
                      {"linea_codigo": "MOD-ING", "categoria": "new"}
                    ]}
                    """));

            assertThat(entries).hasSize(1);
            assertThat(entries.get("MOD-ING").getCategoria()).isEqualTo("new");
        }

        @Test
        void malformedJsonIsFatal() {
            assertThatThrownBy(() -> parser.parse(json("{\"items\": [")))
                    .isInstanceOf(TaxonomyParseException.class)
                    .hasMessageContaining("test.json");
        }

        @Test
        void missingItemsIsFatal() {
            assertThatThrownBy(() -> parser.parse(json("{\"rubros\": []}")))
                    .isInstanceOf(TaxonomyParseException.class)
                    .hasMessageContaining("items");
        }

        @Test
        void itemWithoutIdIsFatal() {
            assertThatThrownBy(() -> parser.parse(json("{\"items\": [{\"categoria\": \"x\"}]}")))
                    .isInstanceOf(TaxonomyParseException.class)
                    .hasMessageContaining("#0");
        }

        @Test
        void emptyCatalogIsFatal() {
            assertThatThrownBy(() -> parser.parse(json("{\"items\": []}")))
                    .isInstanceOf(TaxonomyParseException.class)
                    .hasMessageContaining("no canonical entries");
        }
    }

    @Nested
    @DisplayName("TypeScript catalog")
    class TypeScript {

        @Test
        void collectsAttributesOfEachObject() {
            Map<String, CanonicalTaxonomyEntry> entries = parser.parse(ts("""
                    export const CATALOGO_RUBROS: Rubro[] = [
                      {
                        id: "MOD-ING",
                        categoria_codigo: "MOD",
                        categoria: "Mano de Obra Directa",
                        linea_codigo: "MOD-ING",
                        linea_gasto: "Ingenieros de soporte",
                        fuente_referencia: "MSP",
                      },
                      {
                        categoria_codigo: "GSV",
                        id: 'GSV-REU',
                        linea_gasto: 'Reuniones de seguimiento',
                      },
                    ];
                    """));

            assertThat(entries).containsOnlyKeys("MOD-ING", "GSV-REU");
            CanonicalTaxonomyEntry mod = entries.get("MOD-ING");
            assertThat(mod.getCategoriaCodigo()).isEqualTo("MOD");
            assertThat(mod.getLineaGasto()).isEqualTo("Ingenieros de soporte");
            assertThat(mod.getFuenteReferencia()).isEqualTo("MSP");

            CanonicalTaxonomyEntry gsv = entries.get("GSV-REU");
            assertThat(gsv.getCategoriaCodigo()).isEqualTo("GSV");
            assertThat(gsv.getLineaGasto()).isEqualTo("Reuniones de seguimiento");
            assertThat(gsv.getCategoria()).isNull();
            assertThat(gsv.getFuenteReferencia()).isNull();
        }

        @Test
        void fileWithoutIdsIsFatal() {
            assertThatThrownBy(() -> parser.parse(ts("export const X = 1;")))
                    .isInstanceOf(TaxonomyParseException.class);
        }
    }
}
