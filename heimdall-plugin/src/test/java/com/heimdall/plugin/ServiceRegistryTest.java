package com.heimdall.plugin;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceRegistryTest {

    private final ServiceRegistry registry = new ServiceRegistry();

    @Test
    void registerAll_conflictRegistersNothing() {
        registry.register(new ServiceRegistryEntry("finance.quotes", "finance", CharSequence.class, "q"));

        assertThrows(IllegalArgumentException.class, () -> registry.registerAll(List.of(
                new ServiceRegistryEntry("report.summary", "report", CharSequence.class, "s"),
                new ServiceRegistryEntry("finance.quotes", "report", CharSequence.class, "other"))));

        assertEquals(1, registry.size());
        assertTrue(registry.find("report.summary").isEmpty());
    }

    @Test
    void resolve_wrongTypeOrMissingNameThrows() {
        registry.register(new ServiceRegistryEntry("finance.quotes", "finance", CharSequence.class, "q"));

        assertEquals("q", registry.resolve("finance.quotes", String.class));
        ServiceNotFoundException missing = assertThrows(ServiceNotFoundException.class,
                () -> registry.resolve("nope", Object.class));
        assertEquals("nope", missing.getServiceName());
        assertThrows(ServiceNotFoundException.class, () -> registry.resolve("finance.quotes", Integer.class));
    }

    @Test
    void findByCapability_includesSubtypes() {
        registry.register(new ServiceRegistryEntry("a", "p", String.class, "x"));
        registry.register(new ServiceRegistryEntry("b", "p", Integer.class, 3));

        assertEquals(List.of("a"), registry.findByCapability(CharSequence.class).stream()
                .map(ServiceRegistryEntry::name).toList());
    }

    @Test
    void unregisterOwner_removesOnlyThatOwner() {
        registry.register(new ServiceRegistryEntry("a", "p1", String.class, "x"));
        registry.register(new ServiceRegistryEntry("b", "p2", String.class, "y"));

        assertEquals(1, registry.unregisterOwner("p1"));
        assertEquals(List.of("b"), registry.entries().stream().map(ServiceRegistryEntry::name).toList());
    }

    @Test
    void entry_instanceMustMatchCapability() {
        assertThrows(IllegalArgumentException.class,
                () -> new ServiceRegistryEntry("a", "p", Integer.class, "not a number"));
    }
}
