package com.finanzas.ops.taxonomy.domain.model;

import com.finanzas.ops.taxonomy.key.TaxonomyKeyCodec;
import com.finanzas.ops.taxonomy.store.KeySchema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds persisted taxonomy records.
 */
public final class TaxonomyRecords {

    /** categoria of records seeded for ids the frontend catalog does not describe */
    public static final String PLACEHOLDER_CATEGORY = "Sin clasificar";

    private TaxonomyRecords() {
    }

    /**
     * Minimal record for a canonical entry, keyed by {@link TaxonomyKeyCodec}. Blank attributes
     * are left out.
     */
    public static Map<String, Object> fromEntry(CanonicalTaxonomyEntry entry, KeySchema keySchema) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("linea_codigo", entry.getId());
        putIfPresent(record, "linea_gasto", entry.getLineaGasto());
        putIfPresent(record, "descripcion", entry.getDescripcion());
        putIfPresent(record, "categoria", entry.getCategoria());
        putIfPresent(record, "categoria_codigo", entry.getCategoriaCodigo());
        putIfPresent(record, "fuente_referencia", entry.getFuenteReferencia());
        putIfPresent(record, "tipo_ejecucion", entry.getTipoEjecucion());
        putIfPresent(record, "tipo_costo", entry.getTipoCosto());
        return keySchema.withKey(record, TaxonomyKeyCodec.encode(entry.getId()));
    }

    /**
     * Placeholder record for an id known only by its code. The category code is the id prefix
     * before the first dash ({@code GSV-REU} gives {@code GSV}).
     */
    public static Map<String, Object> placeholder(String id, KeySchema keySchema) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("linea_codigo", id);
        record.put("linea_gasto", id);
        record.put("categoria", PLACEHOLDER_CATEGORY);
        record.put("categoria_codigo", categoryCodeOf(id));
        return keySchema.withKey(record, TaxonomyKeyCodec.encode(id));
    }

    public static String categoryCodeOf(String id) {
        int dash = id.indexOf('-');
        return dash > 0 ? id.substring(0, dash) : id;
    }

    private static void putIfPresent(Map<String, Object> record, String name, String value) {
        if (!TaxonomyText.isBlank(value)) {
            record.put(name, value.trim());
        }
    }
}
