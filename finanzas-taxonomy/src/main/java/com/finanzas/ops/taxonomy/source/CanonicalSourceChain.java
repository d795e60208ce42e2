package com.finanzas.ops.taxonomy.source;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of providers for one canonical source.
 * <p>
 * Providers are tried in order and the first one whose source is present wins. A present source
 * that fails to parse stops the chain with {@link TaxonomyParseException}; lower priority
 * providers are not consulted.
 *
 * @param <T> parsed type
 */
@Slf4j
public class CanonicalSourceChain<T> {

    @Getter
    private final String name;
    private final List<CanonicalSourceProvider> providers;
    private final SourceParser<T> parser;

    public CanonicalSourceChain(String name, List<CanonicalSourceProvider> providers, SourceParser<T> parser) {
        this.name = name;
        this.providers = List.copyOf(providers);
        this.parser = parser;
    }

    public LoadedSource<T> resolve() {
        List<String> attempted = new ArrayList<>();
        for (CanonicalSourceProvider provider : providers) {
            attempted.add(provider.describe());
            Optional<SourceDocument> document = provider.fetch();
            if (document.isEmpty()) {
                log.info("{} source not present at {}", name, provider.describe());
                continue;
            }
            log.info("{} source found at {} ({})", name, provider.describe(), document.get().format());
            T value = parser.parse(document.get());
            return new LoadedSource<>(value, provider.describe());
        }
        throw new TaxonomyParseException(name, "no source present, tried " + attempted);
    }

    public List<String> describeProviders() {
        return providers.stream().map(CanonicalSourceProvider::describe).toList();
    }
}
