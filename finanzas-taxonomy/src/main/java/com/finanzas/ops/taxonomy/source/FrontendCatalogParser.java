package com.finanzas.ops.taxonomy.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finanzas.ops.taxonomy.domain.model.CanonicalTaxonomyEntry;
import com.finanzas.ops.taxonomy.domain.model.TaxonomyText;
import com.finanzas.ops.taxonomy.report.OpsJson;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the frontend canonical catalog.
 * <p>
 * JSON documents must carry an {@code items} array (or be an array themselves). TypeScript
 * documents are read by pattern: each {@code id:} / {@code linea_codigo:} string literal opens an
 * entry, and its attributes are collected from the following lines (at most
 * {@value #WINDOW} lines, never past the next entry or the closing brace), then from the
 * preceding ones up to the previous closing brace for attributes still missing.
 */
@Slf4j
public class FrontendCatalogParser implements SourceParser<Map<String, CanonicalTaxonomyEntry>> {

    static final int WINDOW = 12;

    private static final Pattern ID = Pattern.compile("\\b(?:id|linea_codigo)\\s*:\\s*['\"]([^'\"]+)['\"]");
    private static final List<String> ATTRIBUTES = List.of(
            "linea_gasto", "descripcion", "categoria", "categoria_codigo",
            "fuente_referencia", "tipo_ejecucion", "tipo_costo");
    private static final Map<String, Pattern> ATTRIBUTE_PATTERNS = new HashMap<>();

    static {
        for (String attribute : ATTRIBUTES) {
            ATTRIBUTE_PATTERNS.put(attribute,
                    Pattern.compile("\\b" + attribute + "\\s*:\\s*['\"]([^'\"]+)['\"]"));
        }
    }

    private final ObjectMapper mapper;

    public FrontendCatalogParser() {
        this(OpsJson.mapper());
    }

    public FrontendCatalogParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Map<String, CanonicalTaxonomyEntry> parse(SourceDocument document) {
        Map<String, CanonicalTaxonomyEntry> entries = document.format() == SourceFormat.TYPESCRIPT
                ? parseTypeScript(document)
                : parseJson(document);
        if (entries.isEmpty()) {
            throw new TaxonomyParseException(document.origin(), "no canonical entries found");
        }
        log.info("Parsed {} frontend canonical entries from {}", entries.size(), document.origin());
        return entries;
    }

    private Map<String, CanonicalTaxonomyEntry> parseJson(SourceDocument document) {
        JsonNode root;
        try {
            root = mapper.readTree(document.content());
        } catch (JsonProcessingException e) {
            throw new TaxonomyParseException(document.origin(), "malformed JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode items = root != null && root.isArray() ? root : root == null ? null : root.get("items");
        if (items == null || !items.isArray()) {
            throw new TaxonomyParseException(document.origin(), "missing 'items' array");
        }

        Map<String, CanonicalTaxonomyEntry> entries = new LinkedHashMap<>();
        int index = 0;
        for (JsonNode item : items) {
            String id = TaxonomyText.firstNonBlank(text(item, "linea_codigo"), text(item, "id"));
            if (id.isEmpty()) {
                throw new TaxonomyParseException(document.origin(),
                        "item #" + index + " has no linea_codigo");
            }
            CanonicalTaxonomyEntry entry = CanonicalTaxonomyEntry.builder()
                    .id(id)
                    .lineaGasto(text(item, "linea_gasto"))
                    .descripcion(text(item, "descripcion"))
                    .categoria(text(item, "categoria"))
                    .categoriaCodigo(text(item, "categoria_codigo"))
                    .fuenteReferencia(text(item, "fuente_referencia"))
                    .tipoEjecucion(text(item, "tipo_ejecucion"))
                    .tipoCosto(text(item, "tipo_costo"))
                    .build();
            putEntry(entries, entry, document.origin());
            index++;
        }
        return entries;
    }

    private Map<String, CanonicalTaxonomyEntry> parseTypeScript(SourceDocument document) {
        String[] lines = document.content().split("\\r?\\n", -1);
        List<Integer> idLines = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = ID.matcher(lines[i]);
            if (!matcher.find()) {
                continue;
            }
            String id = matcher.group(1).trim();
            int last = ids.size() - 1;
            if (last >= 0 && ids.get(last).equals(id) && i - idLines.get(last) <= WINDOW) {
                // same object declares both id and linea_codigo
                continue;
            }
            idLines.add(i);
            ids.add(id);
        }

        Map<String, CanonicalTaxonomyEntry> entries = new LinkedHashMap<>();
        for (int n = 0; n < idLines.size(); n++) {
            int line = idLines.get(n);
            int previous = n > 0 ? idLines.get(n - 1) : -1;
            int next = n + 1 < idLines.size() ? idLines.get(n + 1) : lines.length;

            Map<String, String> attributes = new HashMap<>();
            int forwardEnd = Math.min(lines.length - 1, Math.min(line + WINDOW, next - 1));
            for (int j = line; j <= forwardEnd; j++) {
                collect(lines[j], attributes, true);
                if (j > line && lines[j].contains("}")) {
                    break;
                }
            }
            int backwardStart = Math.max(0, Math.max(line - WINDOW, previous + 1));
            for (int j = line - 1; j >= backwardStart; j--) {
                if (lines[j].contains("}")) {
                    break;
                }
                collect(lines[j], attributes, false);
            }

            putEntry(entries, CanonicalTaxonomyEntry.builder()
                    .id(ids.get(n))
                    .lineaGasto(attributes.get("linea_gasto"))
                    .descripcion(attributes.get("descripcion"))
                    .categoria(attributes.get("categoria"))
                    .categoriaCodigo(attributes.get("categoria_codigo"))
                    .fuenteReferencia(attributes.get("fuente_referencia"))
                    .tipoEjecucion(attributes.get("tipo_ejecucion"))
                    .tipoCosto(attributes.get("tipo_costo"))
                    .build(), document.origin());
        }
        return entries;
    }

    private static void collect(String line, Map<String, String> attributes, boolean overwrite) {
        for (Map.Entry<String, Pattern> pattern : ATTRIBUTE_PATTERNS.entrySet()) {
            Matcher matcher = pattern.getValue().matcher(line);
            if (matcher.find() && (overwrite || !attributes.containsKey(pattern.getKey()))) {
                attributes.put(pattern.getKey(), matcher.group(1));
            }
        }
    }

    private static void putEntry(Map<String, CanonicalTaxonomyEntry> entries, CanonicalTaxonomyEntry entry,
                                 String origin) {
        if (entries.put(entry.getId(), entry) != null) {
            log.warn("Duplicate canonical id {} in {}; keeping the last declaration", entry.getId(), origin);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
