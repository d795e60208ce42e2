package com.finanzas.ops.taxonomy.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Backend view of the taxonomy: legacy aliases plus the role, category and default maps that
 * resolve to canonical ids.
 */
@Value
@Builder
@Jacksonized
public class BackendAliasCatalog {

    @Singular("roleMapping")
    Map<String, String> roleToLinea;

    @Singular("nonLaborCategory")
    Map<String, String> nonLaborCategories;

    @Singular("defaultRubro")
    Map<String, String> defaults;

    @Singular("legacyAlias")
    Map<String, String> legacyAliases;

    /**
     * Ids the backend can emit: values of the role map, the category map and the defaults.
     * Legacy alias targets are deliberately left out; they are resolved, not emitted.
     */
    @JsonIgnore
    public Set<String> derivedIds() {
        Set<String> ids = new TreeSet<>();
        addValues(ids, roleToLinea);
        addValues(ids, nonLaborCategories);
        addValues(ids, defaults);
        return ids;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return roleToLinea.isEmpty() && nonLaborCategories.isEmpty()
                && defaults.isEmpty() && legacyAliases.isEmpty();
    }

    private static void addValues(Set<String> target, Map<String, String> source) {
        source.values().stream()
                .map(TaxonomyText::normalize)
                .filter(v -> !v.isEmpty())
                .forEach(target::add);
    }
}
