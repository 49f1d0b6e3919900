package com.heimdall.plugin;

import java.util.Objects;

/**
 * A named service offered by a plugin.
 *
 * @param name       registry-wide unique name
 * @param ownerId    id of the owning plugin
 * @param capability interface the service is looked up by
 * @param instance   the service
 */
public record ServiceRegistryEntry(String name, String ownerId, Class<?> capability, Object instance) {

    public ServiceRegistryEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(capability, "capability");
        Objects.requireNonNull(instance, "instance");
        if (name.isBlank()) {
            throw new IllegalArgumentException("service name must be non-blank");
        }
        if (!capability.isInstance(instance)) {
            throw new IllegalArgumentException("Service " + name + " is not a " + capability.getName());
        }
    }

    @Override
    public String toString() {
        return name + " (" + capability.getSimpleName() + ", owner " + ownerId + ")";
    }
}
