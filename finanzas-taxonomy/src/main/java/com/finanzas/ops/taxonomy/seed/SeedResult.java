package com.finanzas.ops.taxonomy.seed;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a seeding run.
 */
@Value
@Builder
@Jacksonized
public class SeedResult {
    Instant timestamp;
    String mode;
    String table;
    /** Ids seeded (apply) or that would be seeded (dry-run) */
    List<String> created;
    /** Ids that were seeded with the placeholder category */
    List<String> placeholders;
    /** Ids that already had a record */
    List<String> existing;
    /** Ids whose write failed, with the reason */
    Map<String, String> failed;

    @JsonIgnore
    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
