package com.finanzas.ops.taxonomy.migration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of a referencing-record migration, written as {@code migration-report-<timestamp>.json}.
 */
@Value
@Builder
@Jacksonized
public class MigrationReport {

    Instant timestamp;
    String mode;
    List<String> tables;
    Summary summary;
    Map<String, Summary> perTable;
    List<Change> changes;
    List<Failure> failures;

    @JsonIgnore
    public boolean hasFailures() {
        return summary.getFailed() > 0;
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Summary {
        long totalScanned;
        /** Items needing an update (dry-run) or attempted (apply) */
        long toUpdate;
        long updated;
        long alreadyCanonical;
        long noIdentifier;
        long failed;
        int batchPauses;
    }

    @Value
    @Builder
    @Jacksonized
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Change {
        String table;
        String pk;
        String sk;
        String raw;
        String canonical;
        Map<String, Object> before;
        Map<String, Object> after;
        boolean applied;
        boolean dryRun;
        String backupRef;
        String error;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Failure {
        String table;
        String pk;
        String sk;
        String raw;
        String reason;
    }
}
