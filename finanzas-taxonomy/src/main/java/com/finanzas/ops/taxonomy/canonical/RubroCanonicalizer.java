package com.finanzas.ops.taxonomy.canonical;

import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomy;
import com.finanzas.ops.taxonomy.domain.model.TaxonomyText;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves any known rubro identifier to its canonical id.
 * <p>
 * Lookup order:
 * <ol>
 *     <li>exact legacy alias</li>
 *     <li>legacy alias, ignoring case and surrounding whitespace</li>
 *     <li>canonical id, ignoring case and surrounding whitespace</li>
 * </ol>
 * Anything else is unknown. No fuzzy matching is attempted.
 */
public class RubroCanonicalizer {

    private final Map<String, String> exactAliases;
    private final Map<String, String> foldedAliases = new HashMap<>();
    private final Map<String, String> foldedCanonicalIds = new HashMap<>();
    private final Set<String> canonicalIds;

    public RubroCanonicalizer(Map<String, String> legacyAliases, Set<String> canonicalIds) {
        this.exactAliases = Collections.unmodifiableMap(new HashMap<>(legacyAliases));
        this.canonicalIds = Set.copyOf(canonicalIds);
        canonicalIds.forEach(id -> foldedCanonicalIds.putIfAbsent(fold(id), id));
        // first declaration wins when aliases collide after folding
        legacyAliases.forEach((alias, target) -> foldedAliases.putIfAbsent(fold(alias), target));
    }

    /**
     * Canonicalizer over every id the taxonomy knows: frontend ids, backend-derived ids and alias
     * targets.
     */
    public static RubroCanonicalizer of(CanonicalTaxonomy taxonomy) {
        Set<String> ids = new TreeSet<>(taxonomy.allIds());
        ids.addAll(taxonomy.getAliases().getLegacyAliases().values());
        return new RubroCanonicalizer(taxonomy.getAliases().getLegacyAliases(), ids);
    }

    public Optional<String> canonicalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String exact = exactAliases.get(raw);
        if (exact != null) {
            return Optional.of(exact);
        }
        String folded = fold(raw);
        String alias = foldedAliases.get(folded);
        if (alias != null) {
            return Optional.of(alias);
        }
        return Optional.ofNullable(foldedCanonicalIds.get(folded));
    }

    public boolean isCanonical(String id) {
        return id != null && canonicalIds.contains(id);
    }

    /**
     * Whether {@code id} is a canonical id, ignoring case and surrounding whitespace.
     */
    public boolean isCanonicalIgnoreCase(String id) {
        return id != null && foldedCanonicalIds.containsKey(fold(id));
    }

    private static String fold(String value) {
        return TaxonomyText.normalize(value).toUpperCase(Locale.ROOT);
    }
}
