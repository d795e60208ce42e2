package com.finanzas.ops.taxonomy.store;

import java.util.Comparator;
import java.util.Objects;

/**
 * Composite (partition, sort) key of a key-value store item.
 */
public record StoreKey(String pk, String sk) implements Comparable<StoreKey> {

    private static final Comparator<StoreKey> ORDER = Comparator
            .comparing(StoreKey::pk, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(StoreKey::sk, Comparator.nullsFirst(Comparator.naturalOrder()));

    public StoreKey {
        Objects.requireNonNull(pk, "pk");
    }

    public static StoreKey of(String pk, String sk) {
        return new StoreKey(pk, sk);
    }

    /**
     * File-name friendly rendering, used for backup names.
     */
    public String toFileToken() {
        String raw = sk == null ? pk : pk + "__" + sk;
        return raw.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    @Override
    public int compareTo(StoreKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return sk == null ? pk : pk + "/" + sk;
    }
}
