package com.finanzas.ops.taxonomy.migration;

import com.finanzas.ops.taxonomy.TaxonomyOpsException;
import com.finanzas.ops.taxonomy.observability.TaxonomyOpsMetrics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Fixed-size write batches with a fixed pause after each full batch.
 */
@Slf4j
public class BatchThrottle {

    private final int batchSize;
    private final Duration pause;
    private final Sleeper sleeper;
    private final TaxonomyOpsMetrics metrics;

    @Getter
    private long writes;
    @Getter
    private int pauses;

    public BatchThrottle(int batchSize, Duration pause, Sleeper sleeper, TaxonomyOpsMetrics metrics) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = batchSize;
        this.pause = pause;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * Count one write and pause when it completes a batch.
     */
    public void afterWrite() {
        writes++;
        if (writes % batchSize != 0) {
            return;
        }
        log.info("Batch of {} writes done ({} total), pausing {} ms", batchSize, writes, pause.toMillis());
        pauses++;
        metrics.recordBatchPause();
        try {
            sleeper.sleep(pause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaxonomyOpsException("Interrupted during batch pause after " + writes + " writes", e);
        }
    }
}
