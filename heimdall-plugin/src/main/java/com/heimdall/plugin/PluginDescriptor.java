package com.heimdall.plugin;

import com.heimdall.annotations.HeimdallPlugin;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static plugin metadata, known before any plugin code runs.
 *
 * @param id           unique plugin id
 * @param version      plugin version
 * @param displayName  name for reports; defaults to the id
 * @param dependencies declared dependencies
 * @param capabilities capability flags (see {@link PluginCapability})
 */
public record PluginDescriptor(String id, SemanticVersion version, String displayName,
                               List<Dependency> dependencies, Set<String> capabilities) {

    public PluginDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(version, "version");
        if (id.isBlank()) {
            throw new IllegalArgumentException("plugin id must be non-blank");
        }
        displayName = displayName == null || displayName.isBlank() ? id : displayName;
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        capabilities = capabilities != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(capabilities))
                : Set.of();
    }

    public static PluginDescriptor of(String id, String version, Dependency... dependencies) {
        return new PluginDescriptor(id, SemanticVersion.parse(version), null, Arrays.asList(dependencies), Set.of());
    }

    public PluginDescriptor withCapabilities(String... flags) {
        return new PluginDescriptor(id, version, displayName, dependencies, new LinkedHashSet<>(Arrays.asList(flags)));
    }

    /**
     * Reads the descriptor from a {@link HeimdallPlugin} annotation.
     *
     * @throws IllegalArgumentException when the version or a range is malformed
     */
    public static PluginDescriptor fromAnnotation(HeimdallPlugin annotation) {
        Dependency[] deps = Arrays.stream(annotation.dependsOn())
                .map(d -> Dependency.on(d.id(), d.version()))
                .toArray(Dependency[]::new);
        return new PluginDescriptor(annotation.id(), SemanticVersion.parse(annotation.version()),
                annotation.displayName(), Arrays.asList(deps), new LinkedHashSet<>(Arrays.asList(annotation.capabilities())));
    }

    public boolean hasCapability(String flag) {
        return capabilities.contains(flag);
    }

    @Override
    public String toString() {
        return id + "@" + version;
    }
}
