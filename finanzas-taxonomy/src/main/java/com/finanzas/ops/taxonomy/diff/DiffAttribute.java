package com.finanzas.ops.taxonomy.diff;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Attributes compared between a canonical entry and a stored row.
 */
@Getter
public enum DiffAttribute {
    DESCRIPTION("descripcion/linea_gasto", false),
    CATEGORY_CODE("categoria_codigo", false),
    CATEGORY("categoria", false),
    SOURCE_REFERENCE("fuente_referencia", false),
    PARTITION_KEY("pk", true),
    SORT_KEY("sk", true);

    private final String label;
    private final boolean keyShape;

    DiffAttribute(String label, boolean keyShape) {
        this.label = label;
        this.keyShape = keyShape;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static DiffAttribute fromLabel(String label) {
        for (DiffAttribute attribute : values()) {
            if (attribute.label.equals(label) || attribute.name().equals(label)) {
                return attribute;
            }
        }
        throw new IllegalArgumentException("Unknown diff attribute: " + label);
    }
}
