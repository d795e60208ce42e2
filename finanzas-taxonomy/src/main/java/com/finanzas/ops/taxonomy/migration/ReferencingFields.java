package com.finanzas.ops.taxonomy.migration;

import com.finanzas.ops.taxonomy.domain.model.TaxonomyText;

import java.util.Map;

/**
 * Attribute names of rubro references on allocation and project-rubro records.
 */
public final class ReferencingFields {

    public static final String RUBRO_ID = "rubro_id";
    public static final String CANONICAL_RUBRO_ID = "canonical_rubro_id";
    public static final String LEGACY_RUBRO_TOKEN = "legacy_rubro_token";
    public static final String LINE_ITEM_ID = "line_item_id";
    public static final String RUBRO_ID_CAMEL = "rubroId";

    private ReferencingFields() {
    }

    /**
     * Raw rubro identifier of a record: {@code rubro_id}, then {@code line_item_id}, then
     * {@code rubroId}. Empty when none is set.
     */
    public static String rawIdentifier(Map<String, Object> item) {
        return TaxonomyText.firstAttribute(item, RUBRO_ID, LINE_ITEM_ID, RUBRO_ID_CAMEL);
    }
}
