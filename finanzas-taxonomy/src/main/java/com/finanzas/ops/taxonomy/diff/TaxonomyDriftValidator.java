package com.finanzas.ops.taxonomy.diff;

import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomy;
import com.finanzas.ops.taxonomy.observability.TaxonomyOpsMetrics;
import com.finanzas.ops.taxonomy.report.ReportWriter;
import com.finanzas.ops.taxonomy.scan.StoreIndex;
import com.finanzas.ops.taxonomy.scan.TaxonomyStoreScanner;
import com.finanzas.ops.taxonomy.source.CanonicalSourceLoader;
import com.finanzas.ops.taxonomy.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Load, scan, diff and write the report. The sources are fully parsed before the table is read.
 */
@Slf4j
public class TaxonomyDriftValidator {

    private final CanonicalSourceLoader loader;
    private final TaxonomyStoreScanner scanner;
    private final TaxonomyDiffEngine diffEngine;
    private final ReportWriter reportWriter;
    private final TaxonomyOpsMetrics metrics;
    private final Clock clock;

    public TaxonomyDriftValidator(CanonicalSourceLoader loader,
                                  TaxonomyStoreScanner scanner,
                                  TaxonomyDiffEngine diffEngine,
                                  ReportWriter reportWriter,
                                  TaxonomyOpsMetrics metrics,
                                  Clock clock) {
        this.loader = loader;
        this.scanner = scanner;
        this.diffEngine = diffEngine;
        this.reportWriter = reportWriter;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @throws com.finanzas.ops.taxonomy.source.TaxonomyParseException when a source is missing or malformed
     * @throws com.finanzas.ops.taxonomy.scan.TaxonomyScanException    when the table cannot be read
     */
    public Result validate(KeyValueStore store, Path reportPath) {
        Instant start = clock.instant();
        CanonicalTaxonomy taxonomy = loader.load();
        StoreIndex index = scanner.scan(store);
        DiffReport report = diffEngine.diff(taxonomy, index);
        Path written = reportWriter.write(reportPath, report);

        int drift = report.getMissingInStore().size() + report.getExtraInStore().size()
                + report.getBackendMissingFrontend().size() + report.getFrontendMissingBackend().size()
                + report.getAttributeMismatches().size();
        metrics.recordDiff(drift, Duration.between(start, clock.instant()));
        log.info("Diff report written to {} ({})", written, report.isClean() ? "clean" : drift + " drift entries");
        return new Result(report, written);
    }

    public record Result(DiffReport report, Path path) {
    }
}
