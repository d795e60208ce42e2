package com.finanzas.ops.cli;

import com.finanzas.ops.taxonomy.source.CanonicalSourceLoader;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Canonical source overrides shared by the commands that load the taxonomy.
 */
class SourceOptions {

    @Option(names = "--frontend-source", paramLabel = "FILE",
            description = "Frontend catalog (JSON or TypeScript). Must exist when given.")
    Path frontendSource;

    @Option(names = "--backend-source", paramLabel = "FILE",
            description = "Backend alias catalog (JSON or TypeScript). Must exist when given.")
    Path backendSource;

    CanonicalSourceLoader loader() {
        return CanonicalSourceLoader.withDefaults(frontendSource, backendSource);
    }
}
