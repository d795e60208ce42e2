package com.finanzas.ops.taxonomy.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One rubro of the canonical catalog, as compiled into the frontend.
 * <p>
 * The identifier is the {@code linea_codigo}; all other attributes are descriptive and are
 * compared against the persisted catalog by the diff engine.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CanonicalTaxonomyEntry {

    @JsonProperty("linea_codigo")
    String id;

    @JsonProperty("linea_gasto")
    String lineaGasto;

    @JsonProperty("descripcion")
    String descripcion;

    @JsonProperty("categoria")
    String categoria;

    @JsonProperty("categoria_codigo")
    String categoriaCodigo;

    @JsonProperty("fuente_referencia")
    String fuenteReferencia;

    @JsonProperty("tipo_ejecucion")
    String tipoEjecucion;

    @JsonProperty("tipo_costo")
    String tipoCosto;

    /**
     * Description used for comparison: {@code descripcion}, falling back to {@code linea_gasto}.
     */
    @JsonIgnore
    public String effectiveDescription() {
        return TaxonomyText.firstNonBlank(descripcion, lineaGasto);
    }
}
