package com.finanzas.ops.taxonomy.diff;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.finanzas.ops.taxonomy.store.StoreKey;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Differences found on one stored row of a canonical id.
 */
@Value
@Builder
@Jacksonized
public class AttributeMismatch {

    /** {@code pk|sk} of the row, {@code nopk} / {@code nosk} for missing parts */
    String sampleKey;

    StoreKey key;

    @Singular
    List<FieldDiff> diffs;

    /** Row as it was read */
    Map<String, Object> sample;

    @JsonIgnore
    public boolean hasKeyShapeDiff() {
        return diffs.stream().anyMatch(d -> d.getAttr() != null && d.getAttr().isKeyShape());
    }

    @JsonIgnore
    public List<FieldDiff> attributeDiffs() {
        return diffs.stream().filter(d -> d.getAttr() != null && !d.getAttr().isKeyShape()).toList();
    }

    @JsonIgnore
    public Optional<FieldDiff> diff(DiffAttribute attribute) {
        return diffs.stream().filter(d -> d.getAttr() == attribute).findFirst();
    }
}
