package com.finanzas.ops.taxonomy.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finanzas.ops.taxonomy.TaxonomyOpsException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Writes JSON artifacts into the report directory.
 * <p>
 * Files are written to a sibling temp file first and moved into place, so a reader never sees a
 * half-written report.
 */
@Slf4j
public class ReportWriter {

    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final Path directory;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ReportWriter(Path directory) {
        this(directory, OpsJson.mapper(), Clock.systemUTC());
    }

    public ReportWriter(Path directory, ObjectMapper mapper, Clock clock) {
        this.directory = directory;
        this.mapper = mapper;
        this.clock = clock;
    }

    public Path getDirectory() {
        return directory;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Timestamp token used in artifact names, e.g. {@code 20260115T101500.123Z}.
     */
    public String timestamp() {
        return FILE_STAMP.format(clock.instant());
    }

    /**
     * Path of a timestamped artifact: {@code <dir>/<prefix>-<timestamp>.json}.
     */
    public Path timestamped(String prefix) {
        return directory.resolve(prefix + "-" + timestamp() + ".json");
    }

    public Path write(String fileName, Object value) {
        return write(directory.resolve(fileName), value);
    }

    public Path write(Path target, Object value) {
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), value);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote {}", target);
            return target;
        } catch (IOException e) {
            throw new TaxonomyOpsException("Could not write report " + target + ": " + e.getMessage(), e);
        }
    }

    public <T> T read(Path source, Class<T> type) {
        try {
            return mapper.readValue(source.toFile(), type);
        } catch (IOException e) {
            throw new TaxonomyOpsException("Could not read report " + source + ": " + e.getMessage(), e);
        }
    }
}
