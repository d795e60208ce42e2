package com.finanzas.ops.taxonomy.source;

import com.finanzas.ops.taxonomy.domain.model.BackendAliasCatalog;
import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomyEntry;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Default provider chains.
 * <p>
 * Frontend: explicit override, {@code data/rubros.taxonomy.json}, bundled resource.
 * Backend: explicit override, {@code data/rubros.aliases.json}, bundled resource.
 */
public final class CanonicalSourceChains {

    public static final String FRONTEND_RESOURCE = "taxonomy/rubros.taxonomy.json";
    public static final String BACKEND_RESOURCE = "taxonomy/rubros.aliases.json";
    public static final Path FRONTEND_DATA_FILE = Paths.get("data", "rubros.taxonomy.json");
    public static final Path BACKEND_DATA_FILE = Paths.get("data", "rubros.aliases.json");

    private CanonicalSourceChains() {
    }

    public static CanonicalSourceChain<Map<String, CanonicalTaxonomyEntry>> frontend(Path override) {
        return new CanonicalSourceChain<>("frontend", providers(override, FRONTEND_DATA_FILE, FRONTEND_RESOURCE),
                new FrontendCatalogParser());
    }

    public static CanonicalSourceChain<BackendAliasCatalog> backend(Path override) {
        return new CanonicalSourceChain<>("backend", providers(override, BACKEND_DATA_FILE, BACKEND_RESOURCE),
                new BackendAliasParser());
    }

    private static List<CanonicalSourceProvider> providers(Path override, Path dataFile, String resource) {
        List<CanonicalSourceProvider> providers = new ArrayList<>();
        if (override != null) {
            providers.add(new ExplicitFileSourceProvider(override));
        }
        providers.add(new FileSourceProvider(dataFile));
        providers.add(new ClasspathSourceProvider(resource));
        return providers;
    }
}
