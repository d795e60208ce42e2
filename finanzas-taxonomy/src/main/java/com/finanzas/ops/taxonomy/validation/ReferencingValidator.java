package com.finanzas.ops.taxonomy.validation;

import com.finanzas.ops.taxonomy.canonical.RubroCanonicalizer;
import com.finanzas.ops.taxonomy.domain.model.TaxonomyText;
import com.finanzas.ops.taxonomy.migration.MigrationTarget;
import com.finanzas.ops.taxonomy.migration.ReferencingFields;
import com.finanzas.ops.taxonomy.scan.TableScanner;
import com.finanzas.ops.taxonomy.store.KeySchema;
import com.finanzas.ops.taxonomy.store.StoreKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only check that referencing records point at canonical ids.
 * <p>
 * Both {@code canonical_rubro_id} and the raw reference ({@code rubro_id}, {@code line_item_id},
 * {@code rubroId}) are checked; ids are compared ignoring case. Records with no reference at all
 * are counted but not flagged.
 */
@Slf4j
public class ReferencingValidator {

    private final RubroCanonicalizer canonicalizer;
    private final TableScanner scanner;
    private final Clock clock;

    public ReferencingValidator(RubroCanonicalizer canonicalizer, TableScanner scanner, Clock clock) {
        this.canonicalizer = canonicalizer;
        this.scanner = scanner;
        this.clock = clock;
    }

    public ReferencingValidationReport validate(List<MigrationTarget> targets) {
        List<ReferencingValidationReport.TableResult> results = new ArrayList<>();
        for (MigrationTarget target : targets) {
            results.add(validate(target));
        }
        return ReferencingValidationReport.builder()
                .timestamp(clock.instant())
                .tables(results)
                .build();
    }

    private ReferencingValidationReport.TableResult validate(MigrationTarget target) {
        KeySchema keySchema = target.store().keySchema();
        List<ReferencingValidationReport.Mismatch> mismatches = new ArrayList<>();
        long[] counts = new long[3];

        long total = scanner.scan(target.store(), item -> {
            String raw = ReferencingFields.rawIdentifier(item);
            String canonicalField = TaxonomyText.normalize(item.get(ReferencingFields.CANONICAL_RUBRO_ID));
            if (raw.isEmpty() && canonicalField.isEmpty()) {
                counts[2]++;
                return;
            }
            Optional<StoreKey> key = keySchema.keyOf(item);
            boolean valid = true;
            if (!canonicalField.isEmpty() && !canonicalizer.isCanonicalIgnoreCase(canonicalField)) {
                mismatches.add(mismatch(key, ReferencingFields.CANONICAL_RUBRO_ID, canonicalField));
                valid = false;
            }
            if (!raw.isEmpty() && !canonicalizer.isCanonicalIgnoreCase(raw)) {
                mismatches.add(mismatch(key, ReferencingFields.RUBRO_ID, raw));
                valid = false;
            }
            counts[valid ? 0 : 1]++;
        });

        log.info("Validated {} ({}): {} valid, {} invalid, {} without reference", target.name(),
                target.store().tableName(), counts[0], counts[1], counts[2]);
        return ReferencingValidationReport.TableResult.builder()
                .table(target.store().tableName())
                .totalItems(total)
                .validItems(counts[0])
                .invalidItems(counts[1])
                .noIdentifier(counts[2])
                .mismatches(mismatches)
                .build();
    }

    private ReferencingValidationReport.Mismatch mismatch(Optional<StoreKey> key, String field, String value) {
        Optional<String> resolved = canonicalizer.canonicalize(value);
        return ReferencingValidationReport.Mismatch.builder()
                .pk(key.map(StoreKey::pk).orElse(null))
                .sk(key.map(StoreKey::sk).orElse(null))
                .field(field)
                .value(value)
                .resolvesTo(resolved.orElse(null))
                .reason(resolved.isPresent()
                        ? "legacy alias, run migrate-referencing"
                        : "not a canonical linea_codigo")
                .build();
    }
}
