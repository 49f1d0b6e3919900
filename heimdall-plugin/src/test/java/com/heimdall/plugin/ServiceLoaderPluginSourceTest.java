package com.heimdall.plugin;

import com.heimdall.plugin.fixtures.AnnotatedFixturePlugin;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceLoaderPluginSourceTest {

    @Test
    void discover_readsAnnotationAndSkipsUnannotatedProviders() throws Exception {
        List<PluginCandidate> candidates = new ServiceLoaderPluginSource().discover();

        assertEquals(1, candidates.size());
        PluginCandidate candidate = candidates.get(0);
        PluginDescriptor descriptor = candidate.descriptor();
        assertEquals("fixture.annotated", descriptor.id());
        assertEquals(SemanticVersion.of(1, 2, 0), descriptor.version());
        assertEquals("Annotated fixture", descriptor.displayName());
        assertEquals(List.of(Dependency.on("fixture.base", "^1.0.0")), descriptor.dependencies());
        assertTrue(descriptor.hasCapability(PluginCapability.OBSERVER));
        assertEquals("classpath", candidate.sourceName());
        assertInstanceOf(AnnotatedFixturePlugin.class, candidate.factory().create());
    }
}
