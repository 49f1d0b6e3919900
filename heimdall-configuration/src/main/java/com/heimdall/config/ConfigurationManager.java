package com.heimdall.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads configuration layers, merges them key-by-key into an {@link EffectiveConfig} and replaces the
 * snapshot atomically on reload.
 * <p>
 * Precedence: sources are ordered by {@link ConfigLayer} (defaults, file, environment, override); within
 * one layer a later source wins. Runtime {@link #set(String, Object)} calls go to an override layer owned
 * by the manager, which ranks after every other source.
 * <p>
 * Declared {@link ConfigRequirement}s are validated on every load and reload. A failed validation throws
 * {@link ConfigException} and leaves the current snapshot in place. Read failures of optional sources are
 * recorded as issues on the snapshot and do not fail the load.
 * <p>
 * Readers call {@link #current()} (or the {@link ConfigReader} methods, which delegate to it) and never
 * observe a partially merged state.
 */
public final class ConfigurationManager implements ConfigReader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationManager.class);

    private final Object reloadLock = new Object();
    private final AtomicReference<EffectiveConfig> snapshot = new AtomicReference<>(EffectiveConfig.empty());
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, ConfigRequirement> requirements = new LinkedHashMap<>();
    private final OverrideConfigSource runtimeOverrides = new OverrideConfigSource("runtime");
    private List<ConfigSource> sources = List.of();

    public ConfigurationManager() {
        this(List.of());
    }

    public ConfigurationManager(Collection<ConfigRequirement> requirements) {
        if (requirements != null) {
            requirements.forEach(this::require);
        }
    }

    /**
     * Declares a key to validate on subsequent loads. A later declaration of the same key replaces the earlier one.
     */
    public void require(ConfigRequirement requirement) {
        Objects.requireNonNull(requirement, "requirement");
        synchronized (reloadLock) {
            requirements.put(requirement.key(), requirement);
        }
    }

    /**
     * Loads the given sources and makes their merge the current snapshot.
     *
     * @param sources ordered sources; stable-sorted by layer so a file listed before defaults still ranks above them
     * @return the new snapshot
     * @throws ConfigException when a required source is unreadable or a declared key is missing or mistyped
     */
    public EffectiveConfig load(List<? extends ConfigSource> sources) {
        Objects.requireNonNull(sources, "sources");
        List<ConfigSource> ordered = new ArrayList<>(sources);
        ordered.sort(Comparator.comparing(ConfigSource::layer));
        synchronized (reloadLock) {
            EffectiveConfig next = apply(ordered);
            this.sources = List.copyOf(ordered);
            log.info("Configuration loaded | version={} | keys={} | sources={} | issues={}",
                    next.version(), next.keys().size(), ordered.size(), next.getIssues().size());
            return next;
        }
    }

    /**
     * Re-reads every source. When the merged values equal the current ones the current snapshot is
     * returned unchanged (same version) and no listener is called.
     *
     * @throws ConfigException when validation fails; the previous snapshot stays current
     */
    public EffectiveConfig reload() {
        synchronized (reloadLock) {
            return apply(sources);
        }
    }

    /**
     * Sets a runtime override and reloads.
     */
    public EffectiveConfig set(String key, Object value) {
        synchronized (reloadLock) {
            runtimeOverrides.put(key, value);
            return apply(sources);
        }
    }

    /**
     * Removes a runtime override (if present) and reloads.
     */
    public EffectiveConfig clearOverride(String key) {
        synchronized (reloadLock) {
            if (!runtimeOverrides.remove(key)) {
                return snapshot.get();
            }
            return apply(sources);
        }
    }

    /**
     * Registers a listener called after every reload that produced a new version. Listener failures are
     * logged and do not affect other listeners or the reload.
     */
    public void watch(ConfigChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void unwatch(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    /** The current snapshot; never null (empty with version 0 before the first load). */
    public EffectiveConfig current() {
        return snapshot.get();
    }

    /** Paths of all file layers currently loaded, for {@link ConfigFileWatcher}. */
    public List<Path> watchedFiles() {
        List<Path> files = new ArrayList<>();
        for (ConfigSource source : sources) {
            if (source instanceof FileConfigSource file) {
                files.add(file.getPath());
            }
        }
        return files;
    }

    /**
     * Writes the current effective configuration as nested JSON.
     */
    public void saveTo(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, ConfigJson.toNestedJson(current().asMap()));
        log.info("Configuration saved | path={} | version={}", path, current().version());
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        return current().get(key, type);
    }

    @Override
    public boolean contains(String key) {
        return current().contains(key);
    }

    @Override
    public long version() {
        return current().version();
    }

    @Override
    public Set<String> keys() {
        return current().keys();
    }

    /** Must be called with {@link #reloadLock} held. */
    private EffectiveConfig apply(List<ConfigSource> ordered) {
        EffectiveConfig previous = snapshot.get();
        EffectiveConfig merged = merge(ordered, previous.version() + 1);
        if (previous.version() > 0 && previous.asMap().equals(merged.asMap())) {
            log.debug("Configuration reloaded without changes | version={}", previous.version());
            return previous;
        }
        snapshot.set(merged);
        if (previous.version() > 0) {
            ConfigDiff diff = previous.diff(merged);
            log.info("Configuration changed | version={}->{} | added={} | removed={} | changed={}",
                    diff.fromVersion(), diff.toVersion(), diff.added(), diff.removed(), diff.changed());
            notifyListeners(merged, diff);
        }
        return merged;
    }

    private EffectiveConfig merge(List<ConfigSource> ordered, long version) {
        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, String> origins = new LinkedHashMap<>();
        List<ConfigIssue> issues = new ArrayList<>();
        List<ConfigIssue> fatal = new ArrayList<>();

        List<ConfigSource> all = new ArrayList<>(ordered);
        all.add(runtimeOverrides);
        for (ConfigSource source : all) {
            ConfigNode node;
            try {
                node = source.read();
            } catch (ConfigException e) {
                ConfigIssue issue = new ConfigIssue(source.tag(), ConfigException.Kind.SOURCE_UNREADABLE,
                        source.tag(), e.getMessage());
                if (source.isRequired()) {
                    fatal.add(issue);
                } else {
                    log.warn("Skipping configuration source | source={} | reason={}", source.tag(), e.getMessage());
                    issues.add(issue);
                }
                continue;
            }
            for (Map.Entry<String, Object> e : node.values().entrySet()) {
                values.put(e.getKey(), e.getValue());
                origins.put(e.getKey(), node.sourceTag());
            }
        }

        for (ConfigRequirement req : requirements.values()) {
            if (!values.containsKey(req.key())) {
                if (req.required()) {
                    fatal.add(new ConfigIssue(req.key(), ConfigException.Kind.MISSING_KEY, null,
                            "Required key " + req.key() + " is not set"));
                }
                continue;
            }
            Object value = values.get(req.key());
            if (!ConfigValues.isCoercible(value, req.type())) {
                fatal.add(new ConfigIssue(req.key(), ConfigException.Kind.TYPE_MISMATCH, origins.get(req.key()),
                        "Value " + value + " is not a " + req.type().getSimpleName()));
            } else if (req.isBelowMinimum(value)) {
                fatal.add(new ConfigIssue(req.key(), ConfigException.Kind.TYPE_MISMATCH, origins.get(req.key()),
                        "Value " + value + " is below the minimum " + req.minimum()));
            }
        }

        if (!fatal.isEmpty()) {
            List<ConfigIssue> reported = new ArrayList<>(fatal);
            reported.addAll(issues);
            throw new ConfigException(reported);
        }
        return new EffectiveConfig(version, values, origins, issues, Instant.now());
    }

    private void notifyListeners(EffectiveConfig config, ConfigDiff diff) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onChange(config, diff);
            } catch (RuntimeException e) {
                log.warn("Configuration listener failed | version={} | error={}", config.version(), e.getMessage(), e);
            }
        }
    }
}
