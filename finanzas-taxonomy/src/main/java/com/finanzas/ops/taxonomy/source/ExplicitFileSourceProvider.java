package com.finanzas.ops.taxonomy.source;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * File named explicitly by the operator. Unlike the default locations it must exist.
 */
public class ExplicitFileSourceProvider extends FileSourceProvider {

    private final Path path;

    public ExplicitFileSourceProvider(Path path) {
        super(path);
        this.path = path;
    }

    @Override
    public Optional<SourceDocument> fetch() {
        if (!Files.isRegularFile(path)) {
            throw new TaxonomyParseException(describe(), "explicit source does not exist");
        }
        return super.fetch();
    }
}
