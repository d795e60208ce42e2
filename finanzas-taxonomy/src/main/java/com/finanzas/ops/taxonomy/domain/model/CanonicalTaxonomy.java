package com.finanzas.ops.taxonomy.domain.model;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable canonical view for one run: the frontend catalog, the ids derived from the backend
 * maps, and the alias catalog used for canonicalization.
 */
@Getter
public final class CanonicalTaxonomy {

    private final Map<String, CanonicalTaxonomyEntry> frontendEntries;
    private final Set<String> backendIds;
    private final BackendAliasCatalog aliases;
    private final String frontendSource;
    private final String backendSource;

    public CanonicalTaxonomy(Map<String, CanonicalTaxonomyEntry> frontendEntries,
                             BackendAliasCatalog aliases,
                             String frontendSource,
                             String backendSource) {
        this.frontendEntries = Collections.unmodifiableMap(new LinkedHashMap<>(frontendEntries));
        this.aliases = aliases;
        this.backendIds = Collections.unmodifiableSet(aliases.derivedIds());
        this.frontendSource = frontendSource;
        this.backendSource = backendSource;
    }

    public Set<String> frontendIds() {
        return Collections.unmodifiableSet(new TreeSet<>(frontendEntries.keySet()));
    }

    public Optional<CanonicalTaxonomyEntry> entry(String id) {
        return Optional.ofNullable(frontendEntries.get(id));
    }

    /**
     * Union of frontend and backend ids.
     */
    public Set<String> allIds() {
        Set<String> ids = new TreeSet<>(frontendEntries.keySet());
        ids.addAll(backendIds);
        return Collections.unmodifiableSet(ids);
    }
}
