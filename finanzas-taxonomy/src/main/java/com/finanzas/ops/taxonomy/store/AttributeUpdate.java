package com.finanzas.ops.taxonomy.store;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of an existing item.
 * <p>
 * {@link #set} overwrites an attribute; {@link #setIfAbsent} only writes when the attribute is
 * not present yet (first write wins). With {@link #requireExisting()} the update fails instead
 * of creating a new item.
 */
@Getter
public final class AttributeUpdate {

    private final Map<String, Object> sets = new LinkedHashMap<>();
    private final Map<String, Object> setsIfAbsent = new LinkedHashMap<>();
    private boolean existingRequired;

    public static AttributeUpdate create() {
        return new AttributeUpdate();
    }

    public AttributeUpdate set(String attribute, Object value) {
        sets.put(attribute, value);
        return this;
    }

    public AttributeUpdate setAll(Map<String, ?> values) {
        sets.putAll(values);
        return this;
    }

    public AttributeUpdate setIfAbsent(String attribute, Object value) {
        setsIfAbsent.put(attribute, value);
        return this;
    }

    public AttributeUpdate requireExisting() {
        this.existingRequired = true;
        return this;
    }

    public Map<String, Object> getSets() {
        return Collections.unmodifiableMap(sets);
    }

    public Map<String, Object> getSetsIfAbsent() {
        return Collections.unmodifiableMap(setsIfAbsent);
    }

    public boolean isEmpty() {
        return sets.isEmpty() && setsIfAbsent.isEmpty();
    }

    /**
     * Apply this update to a copy of {@code current}.
     */
    public Map<String, Object> applyTo(Map<String, Object> current) {
        Map<String, Object> updated = new LinkedHashMap<>(current);
        updated.putAll(sets);
        setsIfAbsent.forEach(updated::putIfAbsent);
        return updated;
    }

    @Override
    public String toString() {
        return "AttributeUpdate{set=" + sets + ", setIfAbsent=" + setsIfAbsent
                + ", requireExisting=" + existingRequired + "}";
    }
}
