package com.finanzas.ops.cli;

import com.finanzas.ops.taxonomy.config.TaxonomyOpsProperties;
import com.finanzas.ops.taxonomy.migration.Sleeper;
import com.finanzas.ops.taxonomy.observability.TaxonomyAuditLogger;
import com.finanzas.ops.taxonomy.observability.TaxonomyOpsMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Builder;
import lombok.Getter;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;

/**
 * Everything a command needs from the outside world. Tests substitute the store factory, the
 * streams, the clock and the sleeper.
 */
@Getter
@Builder
public class OpsContext {

    private final Map<String, String> environment;
    private final StoreFactory storeFactory;
    private final Clock clock;
    private final Sleeper sleeper;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;
    private final TaxonomyOpsMetrics metrics;
    private final TaxonomyAuditLogger audit;

    public static OpsContext system() {
        return OpsContext.builder()
                .environment(System.getenv())
                .storeFactory(new DynamoDbStoreFactory())
                .clock(Clock.systemUTC())
                .sleeper(Sleeper.THREAD)
                .in(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)))
                .out(System.out)
                .err(System.err)
                .metrics(new TaxonomyOpsMetrics(new SimpleMeterRegistry()))
                .audit(new TaxonomyAuditLogger())
                .build();
    }

    public TaxonomyOpsProperties properties() {
        return TaxonomyOpsProperties.fromEnvironment(environment);
    }
}
