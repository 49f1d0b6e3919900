package com.heimdall.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON configuration file. Nested objects are flattened to dotted keys. The file is read again on each
 * reload.
 */
public final class FileConfigSource implements ConfigSource {

    private final Path path;
    private final boolean required;

    public FileConfigSource(Path path) {
        this(path, false);
    }

    /**
     * @param path     JSON file
     * @param required when true a missing or unparsable file fails the load instead of being skipped
     */
    public FileConfigSource(Path path, boolean required) {
        this.path = Objects.requireNonNull(path, "path");
        this.required = required;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String tag() {
        return "file:" + path;
    }

    @Override
    public ConfigLayer layer() {
        return ConfigLayer.FILE;
    }

    @Override
    public boolean isRequired() {
        return required;
    }

    @Override
    public ConfigNode read() {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException(ConfigException.Kind.SOURCE_UNREADABLE, tag(), "Configuration file not found: " + path);
        }
        try {
            String json = Files.readString(path);
            if (json.isBlank()) {
                return ConfigNode.empty(tag(), ConfigLayer.FILE);
            }
            return new ConfigNode(tag(), ConfigLayer.FILE, ConfigJson.parseFlat(json));
        } catch (IOException e) {
            throw new ConfigException(ConfigException.Kind.SOURCE_UNREADABLE, tag(),
                    "Failed to read configuration file " + path + ": " + e.getMessage(), e);
        }
    }
}
