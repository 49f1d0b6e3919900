package com.heimdall.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One layer of configuration as read from a single source: an ordered, flat {@code section.key → value}
 * mapping plus the tag and rank of the source it came from.
 */
public record ConfigNode(String sourceTag, ConfigLayer layer, Map<String, Object> values) {

    public ConfigNode {
        Objects.requireNonNull(sourceTag, "sourceTag");
        Objects.requireNonNull(layer, "layer");
        values = values != null ? Collections.unmodifiableMap(new LinkedHashMap<>(values)) : Map.of();
    }

    public static ConfigNode empty(String sourceTag, ConfigLayer layer) {
        return new ConfigNode(sourceTag, layer, Map.of());
    }
}
