package com.finanzas.ops.taxonomy.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Source read from a file on disk. The format follows the file extension.
 */
public class FileSourceProvider implements CanonicalSourceProvider {

    private final Path path;

    public FileSourceProvider(Path path) {
        this.path = path;
    }

    @Override
    public String describe() {
        return "file:" + path;
    }

    @Override
    public Optional<SourceDocument> fetch() {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            return Optional.of(new SourceDocument(describe(), content,
                    SourceFormat.fromName(path.getFileName().toString())));
        } catch (IOException e) {
            throw new TaxonomyParseException(describe(), "unreadable: " + e.getMessage(), e);
        }
    }
}
