package com.finanzas.ops.taxonomy.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finanzas.ops.taxonomy.domain.model.BackendAliasCatalog;
import com.finanzas.ops.taxonomy.report.OpsJson;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the backend alias catalog.
 * <p>
 * JSON documents use the sections {@code roleToLinea}, {@code nonLaborCategories},
 * {@code defaults} and {@code legacyAliases}. TypeScript documents are read by pattern from the
 * {@code MOD_ROLE_TO_LINEA_CODIGO}, {@code NON_LABOR_CATEGORY_MAP} and {@code LEGACY_RUBRO_ID_MAP}
 * object literals and the {@code DEFAULT_LABOR_RUBRO} / {@code DEFAULT_NON_LABOR_RUBRO} constants.
 * A document with none of these is rejected.
 */
@Slf4j
public class BackendAliasParser implements SourceParser<BackendAliasCatalog> {

    public static final String DEFAULT_LABOR_RUBRO = "DEFAULT_LABOR_RUBRO";
    public static final String DEFAULT_NON_LABOR_RUBRO = "DEFAULT_NON_LABOR_RUBRO";

    private static final Pattern ENTRY = Pattern.compile(
            "(?:['\"]([^'\"]+)['\"]|([A-Za-z_$][\\w$-]*))\\s*:\\s*['\"]([^'\"]+)['\"]");

    private final ObjectMapper mapper;

    public BackendAliasParser() {
        this(OpsJson.mapper());
    }

    public BackendAliasParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public BackendAliasCatalog parse(SourceDocument document) {
        BackendAliasCatalog catalog = document.format() == SourceFormat.TYPESCRIPT
                ? parseTypeScript(document)
                : parseJson(document);
        if (catalog.isEmpty()) {
            throw new TaxonomyParseException(document.origin(), "no alias or role/category maps found");
        }
        log.info("Parsed backend catalog from {}: {} roles, {} categories, {} defaults, {} legacy aliases",
                document.origin(), catalog.getRoleToLinea().size(), catalog.getNonLaborCategories().size(),
                catalog.getDefaults().size(), catalog.getLegacyAliases().size());
        return catalog;
    }

    private BackendAliasCatalog parseJson(SourceDocument document) {
        JsonNode root;
        try {
            root = mapper.readTree(document.content());
        } catch (JsonProcessingException e) {
            throw new TaxonomyParseException(document.origin(), "malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new TaxonomyParseException(document.origin(), "expected a JSON object");
        }
        return BackendAliasCatalog.builder()
                .roleToLinea(section(root, "roleToLinea", document))
                .nonLaborCategories(section(root, "nonLaborCategories", document))
                .defaults(section(root, "defaults", document))
                .legacyAliases(section(root, "legacyAliases", document))
                .build();
    }

    private static Map<String, String> section(JsonNode root, String name, SourceDocument document) {
        JsonNode node = root.get(name);
        Map<String, String> values = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (!node.isObject()) {
            throw new TaxonomyParseException(document.origin(), "'" + name + "' must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new TaxonomyParseException(document.origin(),
                        "'" + name + "." + field.getKey() + "' must be a string");
            }
            values.put(field.getKey(), field.getValue().asText().trim());
        }
        return values;
    }

    private BackendAliasCatalog parseTypeScript(SourceDocument document) {
        String content = document.content();
        Map<String, String> defaults = new LinkedHashMap<>();
        constant(content, DEFAULT_LABOR_RUBRO).ifPresent(value -> defaults.put(DEFAULT_LABOR_RUBRO, value));
        constant(content, DEFAULT_NON_LABOR_RUBRO).ifPresent(value -> defaults.put(DEFAULT_NON_LABOR_RUBRO, value));
        return BackendAliasCatalog.builder()
                .roleToLinea(block(content, "MOD_ROLE_TO_LINEA_CODIGO"))
                .nonLaborCategories(block(content, "NON_LABOR_CATEGORY_MAP"))
                .defaults(defaults)
                .legacyAliases(block(content, "LEGACY_RUBRO_ID_MAP"))
                .build();
    }

    static Map<String, String> block(String content, String constant) {
        Pattern pattern = Pattern.compile("(?:export\\s+)?const\\s+" + constant
                + "\\s*(?::\\s*[^=]+)?=\\s*\\{([\\s\\S]*?)\\}\\s*(?:as\\s+const\\s*)?;");
        Matcher block = pattern.matcher(content);
        Map<String, String> values = new LinkedHashMap<>();
        if (!block.find()) {
            return values;
        }
        Matcher entry = ENTRY.matcher(stripLineComments(block.group(1)));
        while (entry.find()) {
            String key = entry.group(1) != null ? entry.group(1) : entry.group(2);
            values.put(key, entry.group(3).trim());
        }
        return values;
    }

    static Optional<String> constant(String content, String name) {
        Matcher matcher = Pattern.compile("(?:export\\s+)?const\\s+" + name
                + "\\s*(?::\\s*[^=]+)?=\\s*['\"]([^'\"]+)['\"]").matcher(content);
        return matcher.find() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
    }

    private static String stripLineComments(String body) {
        return body.replaceAll("(?m)^\\s*//.*$", "");
    }
}
