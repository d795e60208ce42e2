package com.finanzas.ops.taxonomy.diff;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One differing attribute. {@code table} is {@code null} when the stored row lacks the value.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldDiff {
    DiffAttribute attr;
    String frontend;
    String table;
    String note;
}
