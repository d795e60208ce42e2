package com.finanzas.ops.taxonomy.remediation;

import com.finanzas.ops.taxonomy.report.ReportWriter;
import lombok.Getter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only remediation log. The whole log is rewritten to disk after every entry, so the file
 * reflects every processed item even if the run dies midway.
 */
public class RemediationLog {

    private final ReportWriter writer;
    @Getter
    private final Path path;
    private final Map<String, Object> header = new LinkedHashMap<>();
    private final List<RemediationLogEntry> entries = new ArrayList<>();

    public RemediationLog(ReportWriter writer, Path path, Map<String, Object> header) {
        this.writer = writer;
        this.path = path;
        this.header.putAll(header);
        this.header.putIfAbsent("startedAt", writer.now());
    }

    /**
     * Log at {@code <dir>/remediation-log-<timestamp>.json}.
     */
    public static RemediationLog create(ReportWriter writer, Map<String, Object> header) {
        return new RemediationLog(writer, writer.timestamped("remediation-log"), header);
    }

    public synchronized void append(RemediationLogEntry entry) {
        entries.add(entry);
        flush();
    }

    public synchronized List<RemediationLogEntry> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized void flush() {
        Map<String, Object> document = new LinkedHashMap<>(header);
        document.put("entries", entries);
        writer.write(path, document);
    }
}
