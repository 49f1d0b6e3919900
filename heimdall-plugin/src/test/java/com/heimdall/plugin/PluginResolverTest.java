package com.heimdall.plugin;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginResolverTest {

    private final PluginResolver resolver = new PluginResolver();

    private static List<String> ids(List<PluginDescriptor> descriptors) {
        return descriptors.stream().map(PluginDescriptor::id).toList();
    }

    @Test
    void resolve_dependenciesComeFirstAndTiesKeepDiscoveryOrder() {
        PluginResolver.Resolution r = resolver.resolve(List.of(
                PluginDescriptor.of("report", "1.0.0", Dependency.on("finance", "^1.0.0")),
                PluginDescriptor.of("finance", "1.4.2", Dependency.on("market-data")),
                PluginDescriptor.of("market-data", "2.0.0"),
                PluginDescriptor.of("theme", "0.3.0")));

        assertTrue(r.failures().isEmpty());
        assertEquals(List.of("market-data", "finance", "report", "theme"), ids(r.order()));
    }

    @Test
    void resolve_cycleFailsMembersButIndependentPluginResolves() {
        PluginResolver.Resolution r = resolver.resolve(List.of(
                PluginDescriptor.of("a", "1.0.0", Dependency.on("b")),
                PluginDescriptor.of("b", "1.0.0", Dependency.on("a")),
                PluginDescriptor.of("c", "1.0.0")));

        assertEquals(List.of("c"), ids(r.order()));
        assertEquals(PluginLoadException.Kind.CYCLIC_DEPENDENCY, r.failures().get("a").getKind());
        assertEquals(PluginLoadException.Kind.CYCLIC_DEPENDENCY, r.failures().get("b").getKind());
        assertEquals(List.of("a", "b", "a"), r.failures().get("a").getChain());
        assertEquals(List.of("b", "a", "b"), r.failures().get("b").getChain());
    }

    @Test
    void resolve_selfDependencyIsACycle() {
        PluginResolver.Resolution r = resolver.resolve(List.of(
                PluginDescriptor.of("loop", "1.0.0", Dependency.on("loop"))));

        assertEquals(PluginLoadException.Kind.CYCLIC_DEPENDENCY, r.failures().get("loop").getKind());
        assertTrue(r.order().isEmpty());
    }

    @Test
    void resolve_missingDependencyNamesIt() {
        PluginResolver.Resolution r = resolver.resolve(List.of(
                PluginDescriptor.of("finance", "1.0.0", Dependency.on("market-data"))));

        PluginLoadException failure = r.failures().get("finance");
        assertEquals(PluginLoadException.Kind.MISSING_DEPENDENCY, failure.getKind());
        assertEquals(List.of("finance", "market-data"), failure.getChain());
    }

    @Test
    void resolve_versionOutsideRangeIsMismatch() {
        PluginResolver.Resolution r = resolver.resolve(List.of(
                PluginDescriptor.of("finance", "1.0.0", Dependency.on("market-data", "^2.0.0")),
                PluginDescriptor.of("market-data", "1.9.0")));

        assertEquals(PluginLoadException.Kind.VERSION_MISMATCH, r.failures().get("finance").getKind());
        assertEquals(List.of("market-data"), ids(r.order()));
    }

    @Test
    void resolve_failurePropagatesToDependentsWithChain() {
        PluginResolver.Resolution r = resolver.resolve(List.of(
                PluginDescriptor.of("report", "1.0.0", Dependency.on("finance")),
                PluginDescriptor.of("finance", "1.0.0", Dependency.on("market-data"))));

        PluginLoadException failure = r.failures().get("report");
        assertEquals(PluginLoadException.Kind.MISSING_DEPENDENCY, failure.getKind());
        assertEquals(List.of("report", "finance", "market-data"), failure.getChain());
        assertEquals(List.of("report", "finance"), List.copyOf(r.failures().keySet()));
    }

    @Test
    void resolve_duplicateIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(List.of(
                PluginDescriptor.of("a", "1.0.0"), PluginDescriptor.of("a", "2.0.0"))));
    }
}
