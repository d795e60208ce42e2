package com.finanzas.ops.taxonomy.migration;

import java.time.Duration;

/**
 * Pauses the calling thread.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
