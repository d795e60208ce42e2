package com.finanzas.ops.taxonomy.diff;

import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomy;
import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomyEntry;
import com.finanzas.ops.taxonomy.domain.model.TaxonomyText;
import com.finanzas.ops.taxonomy.key.TaxonomyKeyCodec;
import com.finanzas.ops.taxonomy.scan.StoreIndex;
import com.finanzas.ops.taxonomy.store.KeySchema;
import com.finanzas.ops.taxonomy.store.StoreKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compares the canonical taxonomy with the persisted catalog.
 * <p>
 * Read-only and deterministic for a given input: id lists are sorted and only the first
 * {@code sampleRowsPerId} rows of each id are compared. An attribute differs when both sides
 * have a value and the trimmed values are not equal, or when only the canonical side has one.
 * Comparison is case sensitive.
 */
@Slf4j
public class TaxonomyDiffEngine {

    private final int sampleRowsPerId;
    private final int reportSampleSize;
    private final KeySchema keySchema;
    private final String region;
    private final Clock clock;

    public TaxonomyDiffEngine(int sampleRowsPerId, int reportSampleSize, KeySchema keySchema,
                              String region, Clock clock) {
        this.sampleRowsPerId = sampleRowsPerId;
        this.reportSampleSize = reportSampleSize;
        this.keySchema = keySchema;
        this.region = region;
        this.clock = clock;
    }

    public DiffReport diff(CanonicalTaxonomy taxonomy, StoreIndex index) {
        Set<String> frontendIds = new TreeSet<>(taxonomy.getFrontendEntries().keySet());
        Set<String> backendIds = new TreeSet<>(taxonomy.getBackendIds());
        Set<String> storedIds = new TreeSet<>(index.ids());

        List<String> missingInStore = minus(frontendIds, storedIds);
        List<String> extraInStore = minus(storedIds, frontendIds);
        List<String> backendMissingFrontend = minus(backendIds, frontendIds);
        List<String> frontendMissingBackend = minus(frontendIds, backendIds);

        Map<String, List<AttributeMismatch>> mismatches = new TreeMap<>();
        int mismatchedRows = 0;
        for (String id : frontendIds) {
            List<Map<String, Object>> rows = index.rows(id);
            if (rows.isEmpty()) {
                continue;
            }
            CanonicalTaxonomyEntry entry = taxonomy.getFrontendEntries().get(id);
            for (Map<String, Object> row : rows.subList(0, Math.min(sampleRowsPerId, rows.size()))) {
                List<FieldDiff> diffs = compare(id, entry, row);
                if (!diffs.isEmpty()) {
                    mismatches.computeIfAbsent(id, k -> new ArrayList<>()).add(AttributeMismatch.builder()
                            .sampleKey(sampleKey(row))
                            .key(keySchema.keyOf(row).orElse(null))
                            .diffs(diffs)
                            .sample(row)
                            .build());
                    mismatchedRows++;
                }
            }
        }

        Map<String, CanonicalTaxonomyEntry> canonicalEntries = new TreeMap<>();
        missingInStore.forEach(id -> canonicalEntries.put(id, taxonomy.getFrontendEntries().get(id)));
        mismatches.keySet().forEach(id -> canonicalEntries.put(id, taxonomy.getFrontendEntries().get(id)));

        Map<String, List<StoreKey>> extraRecordKeys = new TreeMap<>();
        for (String id : extraInStore) {
            List<StoreKey> keys = new ArrayList<>();
            index.rows(id).forEach(row -> keySchema.keyOf(row).ifPresent(keys::add));
            extraRecordKeys.put(id, keys);
        }

        DiffReport report = DiffReport.builder()
                .meta(DiffReport.Meta.builder()
                        .generatedAt(clock.instant())
                        .region(region)
                        .table(index.getTableName())
                        .scannedItems(index.scannedItems())
                        .unindexedItems(index.getUnindexed().size())
                        .frontendCount(frontendIds.size())
                        .backendDerivedCount(backendIds.size())
                        .frontendSource(taxonomy.getFrontendSource())
                        .backendSource(taxonomy.getBackendSource())
                        .build())
                .counts(DiffReport.Counts.builder()
                        .missingInStore(missingInStore.size())
                        .extraInStore(extraInStore.size())
                        .backendMissingFrontend(backendMissingFrontend.size())
                        .frontendMissingBackend(frontendMissingBackend.size())
                        .mismatchedIds(mismatches.size())
                        .mismatchedRows(mismatchedRows)
                        .build())
                .missingInStore(missingInStore)
                .extraInStore(extraInStore)
                .backendMissingFrontend(backendMissingFrontend)
                .frontendMissingBackend(frontendMissingBackend)
                .attributeMismatches(mismatches)
                .extraRecordKeys(extraRecordKeys)
                .canonicalEntries(canonicalEntries)
                .samples(DiffReport.Samples.builder()
                        .frontendSample(taxonomy.getFrontendEntries().values().stream()
                                .limit(reportSampleSize).toList())
                        .tableSamples(index.getItems().stream().limit(reportSampleSize).toList())
                        .build())
                .build();

        log.info("Diff complete: missingInStore={}, extraInStore={}, backendMissingFrontend={}, "
                        + "frontendMissingBackend={}, mismatchedIds={}",
                missingInStore.size(), extraInStore.size(), backendMissingFrontend.size(),
                frontendMissingBackend.size(), mismatches.size());
        return report;
    }

    List<FieldDiff> compare(String id, CanonicalTaxonomyEntry entry, Map<String, Object> row) {
        List<FieldDiff> diffs = new ArrayList<>();
        compareValue(diffs, DiffAttribute.DESCRIPTION, entry.effectiveDescription(),
                TaxonomyText.firstAttribute(row, "descripcion", "linea_gasto"));
        compareValue(diffs, DiffAttribute.CATEGORY_CODE, entry.getCategoriaCodigo(),
                TaxonomyText.firstAttribute(row, "categoria_codigo", "categoriaCode"));
        compareValue(diffs, DiffAttribute.CATEGORY, entry.getCategoria(),
                TaxonomyText.firstAttribute(row, "categoria"));
        compareValue(diffs, DiffAttribute.SOURCE_REFERENCE, entry.getFuenteReferencia(),
                TaxonomyText.firstAttribute(row, "fuente_referencia", "fuente"));

        StoreKey expected = TaxonomyKeyCodec.encode(id);
        String pk = TaxonomyText.normalize(row.get(keySchema.partitionKey()));
        String sk = TaxonomyText.normalize(row.get(keySchema.sortKey()));
        if (!pk.isEmpty() && !pk.equals(expected.pk())) {
            diffs.add(FieldDiff.builder()
                    .attr(DiffAttribute.PARTITION_KEY)
                    .frontend(expected.pk())
                    .table(pk)
                    .note("pk is \"" + pk + "\" but expected " + expected.pk())
                    .build());
        }
        if (!sk.isEmpty() && !sk.equals(expected.sk())) {
            diffs.add(FieldDiff.builder()
                    .attr(DiffAttribute.SORT_KEY)
                    .frontend(expected.sk())
                    .table(sk)
                    .note("sk is \"" + sk + "\" but expected " + expected.sk())
                    .build());
        }
        return diffs;
    }

    private static void compareValue(List<FieldDiff> diffs, DiffAttribute attribute, String canonical,
                                     String stored) {
        String expected = TaxonomyText.normalize(canonical);
        String actual = TaxonomyText.normalize(stored);
        if (expected.isEmpty() || expected.equals(actual)) {
            return;
        }
        diffs.add(FieldDiff.builder()
                .attr(attribute)
                .frontend(expected)
                .table(actual.isEmpty() ? null : actual)
                .build());
    }

    private String sampleKey(Map<String, Object> row) {
        String pk = TaxonomyText.normalize(row.get(keySchema.partitionKey()));
        String sk = TaxonomyText.normalize(row.get(keySchema.sortKey()));
        return (pk.isEmpty() ? "nopk" : pk) + "|" + (sk.isEmpty() ? "nosk" : sk);
    }

    private static List<String> minus(Set<String> left, Set<String> right) {
        List<String> result = new ArrayList<>();
        for (String value : left) {
            if (!right.contains(value)) {
                result.add(value);
            }
        }
        return result;
    }
}
