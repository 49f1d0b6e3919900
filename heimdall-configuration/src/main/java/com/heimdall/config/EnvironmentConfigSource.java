package com.heimdall.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Environment variables with a fixed prefix. {@code APP_SECTION_KEY_PART=value} maps to key
 * {@code section.key_part}: the first segment after the prefix is the section, the remaining segments
 * form the key. Variables with no key segment (e.g. {@code APP_HOME}) are ignored. Values are parsed
 * with {@link ConfigValues#parseRaw(String)}.
 */
public final class EnvironmentConfigSource implements ConfigSource {

    public static final String DEFAULT_PREFIX = "APP_";

    private final String prefix;
    private final Supplier<Map<String, String>> environment;

    public EnvironmentConfigSource() {
        this(DEFAULT_PREFIX);
    }

    public EnvironmentConfigSource(String prefix) {
        this(prefix, System::getenv);
    }

    /**
     * @param prefix      variable prefix including the trailing underscore (e.g. {@code APP_})
     * @param environment supplier of the variables; {@code System::getenv} outside tests
     */
    public EnvironmentConfigSource(String prefix, Supplier<Map<String, String>> environment) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public String tag() {
        return "env:" + prefix + "*";
    }

    @Override
    public ConfigLayer layer() {
        return ConfigLayer.ENVIRONMENT;
    }

    @Override
    public ConfigNode read() {
        Map<String, String> env = environment.get();
        Map<String, Object> values = new LinkedHashMap<>();
        // sorted so the resulting layer is deterministic regardless of the environment's iteration order
        for (Map.Entry<String, String> e : new TreeMap<>(env != null ? env : Map.of()).entrySet()) {
            String key = toConfigKey(e.getKey());
            if (key != null) {
                values.put(key, ConfigValues.parseRaw(e.getValue()));
            }
        }
        return new ConfigNode(tag(), ConfigLayer.ENVIRONMENT, values);
    }

    /**
     * Maps a variable name to a configuration key, or returns null when the name does not belong to this source.
     */
    String toConfigKey(String variable) {
        if (variable == null || !variable.startsWith(prefix)) return null;
        String rest = variable.substring(prefix.length()).toLowerCase(Locale.ROOT);
        int sep = rest.indexOf('_');
        if (sep <= 0 || sep == rest.length() - 1) return null;
        return rest.substring(0, sep) + "." + rest.substring(sep + 1);
    }
}
