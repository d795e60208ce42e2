package com.finanzas.ops.taxonomy.remediation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Audit record of one processed change.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RemediationLogEntry {
    Instant timestamp;
    String table;
    String key;
    String id;
    FixTier tier;
    ItemState outcome;
    Map<String, Object> before;
    Map<String, Object> after;
    String backupRef;
    String message;
}
