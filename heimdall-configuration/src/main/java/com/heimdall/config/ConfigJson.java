package com.heimdall.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of configuration layers. Files are nested objects ({@code {"executor":{"pool_size":2}}});
 * inside the runtime every layer is a flat map of dotted keys ({@code executor.pool_size → 2}).
 */
public final class ConfigJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ConfigJson() {
    }

    /**
     * Parses a JSON object and flattens nested objects into dotted keys. Arrays and scalars are kept as values.
     *
     * @throws IOException when the text is not a JSON object
     */
    public static Map<String, Object> parseFlat(String json) throws IOException {
        Map<String, Object> nested = MAPPER.readValue(json, MAP_TYPE);
        Map<String, Object> flat = new LinkedHashMap<>();
        if (nested != null) {
            flatten("", nested, flat);
        }
        return flat;
    }

    /**
     * Serializes a flat dotted-key map as nested, pretty-printed JSON.
     */
    public static String toNestedJson(Map<String, Object> flat) {
        try {
            return MAPPER.writeValueAsString(nest(flat));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    private static void flatten(String prefix, Map<?, ?> nested, Map<String, Object> out) {
        for (Map.Entry<?, ?> e : nested.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(e.getKey()) : prefix + "." + e.getKey();
            Object v = e.getValue();
            if (v instanceof Map<?, ?> child && !child.isEmpty()) {
                flatten(key, child, out);
            } else {
                out.put(key, v);
            }
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> nest(Map<String, Object> flat) {
        Map<String, Object> root = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : flat.entrySet()) {
            String[] parts = e.getKey().split("\\.");
            Map<String, Object> node = root;
            for (int i = 0; i < parts.length - 1; i++) {
                Object child = node.get(parts[i]);
                if (!(child instanceof Map)) {
                    child = new LinkedHashMap<String, Object>();
                    node.put(parts[i], child);
                }
                node = (Map<String, Object>) child;
            }
            String leaf = parts[parts.length - 1];
            if (!(node.get(leaf) instanceof Map)) {
                node.put(leaf, e.getValue());
            }
        }
        return root;
    }
}
