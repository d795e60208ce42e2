package com.finanzas.ops.taxonomy.diff;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomyEntry;
import com.finanzas.ops.taxonomy.store.StoreKey;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Drift between the canonical sources and the persisted catalog.
 * <p>
 * Written as {@code taxonomy_report_full.json} by {@code validate} and read back by
 * {@code remediate}. It carries the canonical entries of every id that needs a write, so
 * remediation does not depend on the sources still being reachable.
 */
@Value
@Builder
@Jacksonized
public class DiffReport {

    Meta meta;
    Counts counts;

    @Builder.Default
    List<String> missingInStore = List.of();

    @Builder.Default
    List<String> extraInStore = List.of();

    @Builder.Default
    List<String> backendMissingFrontend = List.of();

    @Builder.Default
    List<String> frontendMissingBackend = List.of();

    @Builder.Default
    Map<String, List<AttributeMismatch>> attributeMismatches = Map.of();

    /** Keys of the rows behind each id in {@link #extraInStore} */
    @Builder.Default
    Map<String, List<StoreKey>> extraRecordKeys = Map.of();

    /** Canonical entries for ids that are missing or mismatched */
    @Builder.Default
    Map<String, CanonicalTaxonomyEntry> canonicalEntries = Map.of();

    Samples samples;

    @JsonIgnore
    public boolean isClean() {
        return missingInStore.isEmpty()
                && extraInStore.isEmpty()
                && backendMissingFrontend.isEmpty()
                && frontendMissingBackend.isEmpty()
                && attributeMismatches.isEmpty();
    }

    @Value
    @Builder
    @Jacksonized
    public static class Meta {
        Instant generatedAt;
        String region;
        String table;
        int scannedItems;
        int unindexedItems;
        int frontendCount;
        int backendDerivedCount;
        String frontendSource;
        String backendSource;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Counts {
        int missingInStore;
        int extraInStore;
        int backendMissingFrontend;
        int frontendMissingBackend;
        int mismatchedIds;
        int mismatchedRows;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Samples {
        @Builder.Default
        List<CanonicalTaxonomyEntry> frontendSample = List.of();
        @Builder.Default
        List<Map<String, Object>> tableSamples = List.of();
    }
}
