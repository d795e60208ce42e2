package com.finanzas.ops.taxonomy.key;

import com.finanzas.ops.taxonomy.store.StoreKey;

import java.util.Optional;

/**
 * Single source of truth for the storage key of a taxonomy record.
 * <p>
 * Every record lives under partition {@value #PARTITION} with sort key
 * {@value #SORT_PREFIX}{@code <linea_codigo>}.
 */
public final class TaxonomyKeyCodec {

    public static final String PARTITION = "TAXONOMY";
    public static final String SORT_PREFIX = "RUBRO#";

    private TaxonomyKeyCodec() {
    }

    public static StoreKey encode(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Taxonomy id must not be blank");
        }
        return new StoreKey(PARTITION, SORT_PREFIX + id.trim());
    }

    /**
     * Id encoded in a key, or empty when the key does not have the canonical shape.
     */
    public static Optional<String> decode(StoreKey key) {
        if (key == null || !PARTITION.equals(key.pk()) || key.sk() == null
                || !key.sk().startsWith(SORT_PREFIX)) {
            return Optional.empty();
        }
        String id = key.sk().substring(SORT_PREFIX.length());
        return id.isBlank() ? Optional.empty() : Optional.of(id);
    }

    public static boolean hasCanonicalShape(StoreKey key, String id) {
        return key != null && id != null && !id.isBlank() && encode(id).equals(key);
    }
}
