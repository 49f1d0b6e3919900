package com.heimdall.config;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keys that differ between two effective snapshots. Carried as the payload of {@code config.changed}.
 */
public record ConfigDiff(long fromVersion, long toVersion, Set<String> added, Set<String> removed, Set<String> changed) {

    public ConfigDiff {
        added = Collections.unmodifiableSet(new TreeSet<>(added != null ? added : Set.of()));
        removed = Collections.unmodifiableSet(new TreeSet<>(removed != null ? removed : Set.of()));
        changed = Collections.unmodifiableSet(new TreeSet<>(changed != null ? changed : Set.of()));
    }

    /** Computes the key-level difference from {@code before} to {@code after}. */
    public static ConfigDiff between(long fromVersion, Map<String, Object> before,
                                     long toVersion, Map<String, Object> after) {
        Set<String> added = new TreeSet<>();
        Set<String> removed = new TreeSet<>();
        Set<String> changed = new TreeSet<>();
        for (Map.Entry<String, Object> e : after.entrySet()) {
            if (!before.containsKey(e.getKey())) {
                added.add(e.getKey());
            } else if (!Objects.equals(before.get(e.getKey()), e.getValue())) {
                changed.add(e.getKey());
            }
        }
        for (String key : before.keySet()) {
            if (!after.containsKey(key)) removed.add(key);
        }
        return new ConfigDiff(fromVersion, toVersion, added, removed, changed);
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
    }

    /** True if {@code key} was added, removed or changed. */
    public boolean touches(String key) {
        return added.contains(key) || removed.contains(key) || changed.contains(key);
    }

    /** All affected keys, sorted. */
    public Set<String> keys() {
        Set<String> all = new TreeSet<>(added);
        all.addAll(removed);
        all.addAll(changed);
        return Collections.unmodifiableSet(all);
    }
}
