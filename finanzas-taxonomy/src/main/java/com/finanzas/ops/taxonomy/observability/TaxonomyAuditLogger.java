package com.finanzas.ops.taxonomy.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit events for remediation and migration.
 * <p>
 * Every event is one log line of the form {@code message | data={...}} with the run id, and the
 * item key when there is one, also placed in the MDC.
 */
@Slf4j
public class TaxonomyAuditLogger {

    public static final String MDC_RUN_ID = "runId";
    public static final String MDC_ITEM_KEY = "itemKey";
    public static final String MDC_TABLE = "table";

    /**
     * Open a run scope. The returned scope must be closed when the run ends.
     */
    public MDCScope startRun(String command) {
        String runId = command + "-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_RUN_ID, runId);
        log.info("Run started | data={}", format(Map.of("event", "RUN_STARTED", "command", command,
                "runId", runId)));
        return new MDCScope(MDC_RUN_ID);
    }

    public String currentRunId() {
        return MDC.get(MDC_RUN_ID);
    }

    /**
     * Log a remediation item event.
     */
    public void logRemediationEvent(String table, String itemKey, RemediationEventType eventType,
                                    String message, Map<String, Object> details) {
        try (MDCScope scope = withContext(Map.of(MDC_TABLE, table, MDC_ITEM_KEY, itemKey))) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("event", eventType.name());
            data.put("table", table);
            data.put("key", itemKey);
            if (details != null) {
                data.putAll(details);
            }
            switch (eventType) {
                case FAILED -> log.error("{} | data={}", message, format(data));
                case DECLINED, MANUAL_REVIEW -> log.warn("{} | data={}", message, format(data));
                default -> log.info("{} | data={}", message, format(data));
            }
        }
    }

    /**
     * Log a referencing-record migration event.
     */
    public void logMigrationEvent(String table, String itemKey, MigrationEventType eventType,
                                  String message, Map<String, Object> details) {
        try (MDCScope scope = withContext(Map.of(MDC_TABLE, table, MDC_ITEM_KEY, itemKey))) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("event", eventType.name());
            data.put("table", table);
            data.put("key", itemKey);
            if (details != null) {
                data.putAll(details);
            }
            switch (eventType) {
                case FAILED, NO_MAPPING -> log.warn("{} | data={}", message, format(data));
                case SKIPPED -> log.debug("{} | data={}", message, format(data));
                default -> log.info("{} | data={}", message, format(data));
            }
        }
    }

    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    static String format(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append('"').append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append('"').append(escapeJson(value.toString())).append('"');
            }
        }
        return sb.append('}').toString();
    }

    private static String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    public enum RemediationEventType {
        PLANNED, BACKED_UP, APPLIED, FAILED, NO_OP, DECLINED, DRY_RUN, MANUAL_REVIEW
    }

    public enum MigrationEventType {
        STAGED, UPDATED, SKIPPED, NO_MAPPING, FAILED
    }

    /**
     * Auto-closeable MDC scope.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
