package tech.noetzold.gateway_api.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers for resource-view identifiers. Identifiers compare by their unprefixed suffix,
 * so {@code "labeliq.master_safety_risk"} and {@code "master_safety_risk"} are the same view.
 */
public final class ResourceViews {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResourceViews() {
    }

    public static String normalize(String identifier) {
        if (identifier == null) {
            return "";
        }
        String trimmed = identifier.trim();
        int dot = trimmed.lastIndexOf('.');
        String view = dot >= 0 ? trimmed.substring(dot + 1) : trimmed;
        // engines sometimes quote identifiers: "db"."view"
        return view.replace("\"", "").replace("`", "").trim();
    }

    /** Normalized, de-duplicated, in first-seen order; blanks dropped. */
    public static Set<String> normalizeAll(Collection<String> identifiers) {
        Set<String> out = new LinkedHashSet<>();
        if (identifiers == null) {
            return out;
        }
        for (String id : identifiers) {
            String view = normalize(id);
            if (!view.isEmpty()) {
                out.add(view);
            }
        }
        return out;
    }

    /**
     * Reads {@code tables_used} as the engine sends it: a native array, a JSON-encoded
     * array string, or a plain comma-separated string. Missing or null yields an empty list.
     */
    public static List<String> parseTablesUsed(JsonNode node) {
        List<String> tables = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return tables;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isTextual() && !element.asText().isBlank()) {
                    tables.add(element.asText().trim());
                }
            }
            return tables;
        }
        if (!node.isTextual()) {
            throw new IllegalArgumentException("tables_used must be a string or an array, got " + node.getNodeType());
        }
        String raw = node.asText().trim();
        if (raw.isEmpty()) {
            return tables;
        }
        if (raw.startsWith("[")) {
            try {
                return parseTablesUsed(MAPPER.readTree(raw));
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("tables_used is not a valid JSON array: " + e.getOriginalMessage(), e);
            }
        }
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                tables.add(part.trim());
            }
        }
        return tables;
    }
}
