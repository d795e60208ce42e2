package com.finanzas.ops.taxonomy.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Source compiled into the jar.
 */
public class ClasspathSourceProvider implements CanonicalSourceProvider {

    private final String resource;
    private final ClassLoader classLoader;

    public ClasspathSourceProvider(String resource) {
        this(resource, ClasspathSourceProvider.class.getClassLoader());
    }

    public ClasspathSourceProvider(String resource, ClassLoader classLoader) {
        this.resource = resource;
        this.classLoader = classLoader;
    }

    @Override
    public String describe() {
        return "classpath:" + resource;
    }

    @Override
    public Optional<SourceDocument> fetch() {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return Optional.of(new SourceDocument(describe(), content, SourceFormat.fromName(resource)));
        } catch (IOException e) {
            throw new TaxonomyParseException(describe(), "unreadable: " + e.getMessage(), e);
        }
    }
}
