package com.finanzas.ops.taxonomy.source;

import com.finanzas.ops.taxonomy.domain.model.BackendAliasCatalog;
import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomy;
import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomyEntry;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Map;

/**
 * Loads both canonical sources and merges them into one immutable {@link CanonicalTaxonomy}.
 */
@Slf4j
public class CanonicalSourceLoader {

    private final CanonicalSourceChain<Map<String, CanonicalTaxonomyEntry>> frontendChain;
    private final CanonicalSourceChain<BackendAliasCatalog> backendChain;

    public CanonicalSourceLoader(CanonicalSourceChain<Map<String, CanonicalTaxonomyEntry>> frontendChain,
                                 CanonicalSourceChain<BackendAliasCatalog> backendChain) {
        this.frontendChain = frontendChain;
        this.backendChain = backendChain;
    }

    /**
     * Loader over the default chains, with optional explicit overrides.
     */
    public static CanonicalSourceLoader withDefaults(Path frontendOverride, Path backendOverride) {
        return new CanonicalSourceLoader(CanonicalSourceChains.frontend(frontendOverride),
                CanonicalSourceChains.backend(backendOverride));
    }

    /**
     * @throws TaxonomyParseException when either source is absent everywhere or malformed
     */
    public CanonicalTaxonomy load() {
        LoadedSource<Map<String, CanonicalTaxonomyEntry>> frontend = frontendChain.resolve();
        LoadedSource<BackendAliasCatalog> backend = backendChain.resolve();
        CanonicalTaxonomy taxonomy = new CanonicalTaxonomy(frontend.value(), backend.value(),
                frontend.origin(), backend.origin());
        log.info("Canonical taxonomy loaded: {} frontend ids ({}), {} backend-derived ids ({})",
                taxonomy.getFrontendEntries().size(), frontend.origin(),
                taxonomy.getBackendIds().size(), backend.origin());
        return taxonomy;
    }
}
