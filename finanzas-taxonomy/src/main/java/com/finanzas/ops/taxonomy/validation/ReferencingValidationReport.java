package com.finanzas.ops.taxonomy.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Referencing records whose rubro reference is not a canonical id.
 */
@Value
@Builder
@Jacksonized
public class ReferencingValidationReport {

    Instant timestamp;
    List<TableResult> tables;

    @JsonIgnore
    public long invalidItems() {
        return tables.stream().mapToLong(TableResult::getInvalidItems).sum();
    }

    @JsonIgnore
    public boolean isClean() {
        return invalidItems() == 0;
    }

    @Value
    @Builder
    @Jacksonized
    public static class TableResult {
        String table;
        long totalItems;
        long validItems;
        long invalidItems;
        long noIdentifier;
        List<Mismatch> mismatches;
    }

    @Value
    @Builder
    @Jacksonized
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Mismatch {
        String pk;
        String sk;
        String field;
        String value;
        /** Canonical id the value resolves to, when it is a known legacy alias */
        String resolvesTo;
        String reason;
    }
}
