package com.finanzas.ops.taxonomy.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finanzas.ops.taxonomy.report.OpsJson;
import com.finanzas.ops.taxonomy.store.StoreKey;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes one JSON file per backed-up item under the backup directory.
 * <p>
 * Files are named {@code <pk>__<sk>__<timestamp>.json}. An existing backup is never overwritten:
 * when a name is taken a numeric suffix is appended. Writes are synced to disk before
 * {@link #backup} returns.
 */
@Slf4j
public class FileBackupStore implements BackupStore {

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final int MAX_SUFFIX = 1000;

    private final Path directory;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FileBackupStore(Path directory) {
        this(directory, OpsJson.mapper(), Clock.systemUTC());
    }

    public FileBackupStore(Path directory, ObjectMapper mapper, Clock clock) {
        this.directory = directory;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public String backup(String table, StoreKey key, Map<String, Object> item) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("table", table);
        envelope.put("key", key);
        envelope.put("takenAt", clock.instant());
        envelope.put("item", item);

        byte[] content;
        try {
            content = mapper.writeValueAsBytes(envelope);
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new BackupException("Could not prepare backup of " + key + ": " + e.getMessage(), e);
        }

        String base = key.toFileToken() + "__" + STAMP.format(clock.instant());
        for (int attempt = 0; attempt < MAX_SUFFIX; attempt++) {
            Path target = directory.resolve(attempt == 0 ? base + ".json" : base + "-" + attempt + ".json");
            try {
                Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE,
                        StandardOpenOption.DSYNC);
                log.debug("Backed up {} to {}", key, target);
                return target.toString();
            } catch (FileAlreadyExistsException e) {
                log.debug("Backup name {} taken, trying next suffix", target.getFileName());
            } catch (IOException e) {
                throw new BackupException("Could not write backup of " + key + " to " + target
                        + ": " + e.getMessage(), e);
            }
        }
        throw new BackupException("No free backup name for " + key + " under " + directory, null);
    }
}
