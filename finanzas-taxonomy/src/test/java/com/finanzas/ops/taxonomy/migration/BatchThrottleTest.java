package com.finanzas.ops.taxonomy.migration;

import com.finanzas.ops.taxonomy.TaxonomyOpsException;
import com.finanzas.ops.taxonomy.observability.TaxonomyOpsMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchThrottleTest {

    private final List<Duration> pauses = new ArrayList<>();
    private final TaxonomyOpsMetrics metrics = TaxonomyOpsMetrics.standalone();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void pausesOnlyAfterFullBatches() {
        BatchThrottle throttle = new BatchThrottle(3, Duration.ofSeconds(1), pauses::add, metrics);

        for (int i = 0; i < 7; i++) {
            throttle.afterWrite();
        }

        assertThat(throttle.getWrites()).isEqualTo(7);
        assertThat(throttle.getPauses()).isEqualTo(2);
        assertThat(pauses).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1));
        assertThat(metrics.getBatchPauses().count()).isEqualTo(2.0);
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        assertThatThrownBy(() -> new BatchThrottle(0, Duration.ZERO, pauses::add, metrics))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void interruptionStopsTheRun() {
        BatchThrottle throttle = new BatchThrottle(1, Duration.ofMillis(5), duration -> {
            throw new InterruptedException("stop");
        }, metrics);

        assertThatThrownBy(throttle::afterWrite)
                .isInstanceOf(TaxonomyOpsException.class)
                .hasMessageContaining("after 1 writes");
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}
