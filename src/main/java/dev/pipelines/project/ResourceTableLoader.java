package dev.pipelines.project;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pipelines.model.ResourceKind;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads a resource table from JSON. Two layouts are accepted:
 *
 * <pre>
 * { "Fetcher": "agent", "process_data": "function" }
 *
 * { "agents": ["Fetcher"], "workflows": [], "functions": ["process_data"] }
 * </pre>
 *
 * The grouped layout is recognised by array values. If a name is listed
 * twice the first entry wins.
 */
public final class ResourceTableLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResourceTableLoader() {}

    public static Map<String, ResourceKind> loadFromFile(Path path) throws IOException {
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parseTable(MAPPER.readTree(reader));
        }
    }

    public static Map<String, ResourceKind> loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseTable(root);
    }

    private static Map<String, ResourceKind> parseTable(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Resource table must be a JSON object");
        }
        var table = new LinkedHashMap<String, ResourceKind>();
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode value = entry.getValue();
            if (value.isArray()) {
                ResourceKind kind = parseKind(entry.getKey());
                value.forEach(name -> table.putIfAbsent(requireName(name), kind));
            } else if (value.isTextual()) {
                table.putIfAbsent(entry.getKey(), parseKind(value.asText()));
            } else {
                throw new IllegalArgumentException("Unsupported resource table entry: " + entry.getKey());
            }
        }
        return Collections.unmodifiableMap(table);
    }

    private static ResourceKind parseKind(String label) {
        ResourceKind kind = ResourceKind.fromLabel(label);
        if (kind == ResourceKind.UNKNOWN) {
            throw new IllegalArgumentException("Resource table cannot declare kind 'unknown'");
        }
        return kind;
    }

    private static String requireName(JsonNode node) {
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new IllegalArgumentException("Resource names must be non-empty strings: " + node);
        }
        return node.asText();
    }
}
