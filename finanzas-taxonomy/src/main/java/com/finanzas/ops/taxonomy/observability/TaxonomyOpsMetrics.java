package com.finanzas.ops.taxonomy.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Getter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counters for the taxonomy tooling.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Diff runs and drift found</li>
 *     <li>Remediation items per tier and outcome</li>
 *     <li>Referencing-record migration updates, skips and failures</li>
 *     <li>Batch throttling pauses</li>
 * </ul>
 */
public class TaxonomyOpsMetrics {

    private static final String PREFIX = "finanzas.taxonomy";

    @Getter
    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter diffRuns;
    private final Counter driftFound;
    private final Timer diffDuration;

    private final Map<String, Counter> remediationOutcomes = new ConcurrentHashMap<>();
    private final Map<String, Counter> migrationOutcomes = new ConcurrentHashMap<>();

    @Getter
    private final Counter batchPauses;
    @Getter
    private final Counter seededRecords;

    public TaxonomyOpsMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.diffRuns = Counter.builder(PREFIX + ".diff.runs")
                .description("Diff runs completed")
                .register(meterRegistry);
        this.driftFound = Counter.builder(PREFIX + ".diff.drift")
                .description("Drift entries found by diff runs")
                .register(meterRegistry);
        this.diffDuration = Timer.builder(PREFIX + ".diff.duration")
                .description("Scan and diff duration")
                .register(meterRegistry);
        this.batchPauses = Counter.builder(PREFIX + ".migration.pauses")
                .description("Pauses taken between write batches")
                .register(meterRegistry);
        this.seededRecords = Counter.builder(PREFIX + ".seed.records")
                .description("Taxonomy records created by the seeder")
                .register(meterRegistry);
    }

    /**
     * Metrics over a private registry, for tests and one-off runs.
     */
    public static TaxonomyOpsMetrics standalone() {
        return new TaxonomyOpsMetrics(new SimpleMeterRegistry());
    }

    public void recordDiff(int driftEntries, Duration duration) {
        diffRuns.increment();
        driftFound.increment(driftEntries);
        diffDuration.record(duration);
    }

    public void recordRemediation(String tier, String outcome) {
        remediationOutcomes.computeIfAbsent(tier + "|" + outcome, k -> Counter.builder(PREFIX + ".remediation.items")
                .description("Remediation items by tier and outcome")
                .tag("tier", tier)
                .tag("outcome", outcome)
                .register(meterRegistry)).increment();
    }

    public void recordMigration(String table, String outcome) {
        migrationOutcomes.computeIfAbsent(table + "|" + outcome, k -> Counter.builder(PREFIX + ".migration.items")
                .description("Referencing records by table and outcome")
                .tag("table", table)
                .tag("outcome", outcome)
                .register(meterRegistry)).increment();
    }

    public void recordBatchPause() {
        batchPauses.increment();
    }

    public void recordSeeded() {
        seededRecords.increment();
    }

    public double remediationCount(String tier, String outcome) {
        Counter counter = remediationOutcomes.get(tier + "|" + outcome);
        return counter == null ? 0 : counter.count();
    }

    public double migrationCount(String table, String outcome) {
        Counter counter = migrationOutcomes.get(table + "|" + outcome);
        return counter == null ? 0 : counter.count();
    }

    /**
     * Non-zero counter values keyed by meter name and tags, for the end-of-run log line.
     */
    public Map<String, Double> snapshot() {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Meter meter : meterRegistry.getMeters()) {
            if (meter instanceof Counter counter && counter.count() > 0) {
                StringBuilder name = new StringBuilder(meter.getId().getName());
                meter.getId().getTags().forEach(tag -> name.append(',').append(tag.getKey())
                        .append('=').append(tag.getValue()));
                values.put(name.toString(), counter.count());
            }
        }
        return values;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        for (Entry<String, Double> entry : snapshot().entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue().longValue());
        }
        return sb.toString();
    }
}
