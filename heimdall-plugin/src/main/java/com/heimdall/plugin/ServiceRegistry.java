package com.heimdall.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide directory of named services offered by active plugins. Names are unique. A batch
 * registration is all-or-nothing, so readers never observe part of a plugin's services.
 */
public final class ServiceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final Map<String, ServiceRegistryEntry> byName = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public void register(ServiceRegistryEntry entry) {
        registerAll(List.of(entry));
    }

    /**
     * Registers all entries or none.
     *
     * @throws IllegalArgumentException when a name is already registered or repeated within the batch
     */
    public void registerAll(Collection<ServiceRegistryEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        lock.writeLock().lock();
        try {
            Set<String> names = new HashSet<>();
            for (ServiceRegistryEntry e : entries) {
                ServiceRegistryEntry existing = byName.get(e.name());
                if (existing != null) {
                    throw new IllegalArgumentException("Service already registered: " + e.name()
                            + " (owner " + existing.ownerId() + ")");
                }
                if (!names.add(e.name())) {
                    throw new IllegalArgumentException("Service registered twice in one batch: " + e.name());
                }
            }
            for (ServiceRegistryEntry e : entries) {
                byName.put(e.name(), e);
                log.debug("Service registered | {}", e);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes all services of {@code ownerId}.
     *
     * @return number removed
     */
    public int unregisterOwner(String ownerId) {
        lock.writeLock().lock();
        try {
            int before = byName.size();
            byName.values().removeIf(e -> e.ownerId().equals(ownerId));
            return before - byName.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ServiceRegistryEntry> find(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byName.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** The service under {@code name} if it implements {@code type}. */
    public <T> Optional<T> find(String name, Class<T> type) {
        return find(name).filter(e -> type.isInstance(e.instance())).map(e -> type.cast(e.instance()));
    }

    /**
     * @throws ServiceNotFoundException when absent or not a {@code type}
     */
    public <T> T resolve(String name, Class<T> type) {
        ServiceRegistryEntry entry = find(name)
                .orElseThrow(() -> new ServiceNotFoundException(name, "No service registered under " + name));
        if (!type.isInstance(entry.instance())) {
            throw new ServiceNotFoundException(name, "Service " + name + " is a " + entry.capability().getName()
                    + ", not a " + type.getName());
        }
        return type.cast(entry.instance());
    }

    /** Entries whose capability is {@code capability} or a subtype of it, in registration order. */
    public List<ServiceRegistryEntry> findByCapability(Class<?> capability) {
        lock.readLock().lock();
        try {
            List<ServiceRegistryEntry> out = new ArrayList<>();
            for (ServiceRegistryEntry e : byName.values()) {
                if (capability.isAssignableFrom(e.capability())) out.add(e);
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ServiceRegistryEntry> entriesOwnedBy(String ownerId) {
        lock.readLock().lock();
        try {
            return byName.values().stream().filter(e -> e.ownerId().equals(ownerId)).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ServiceRegistryEntry> entries() {
        lock.readLock().lock();
        try {
            return List.copyOf(byName.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return byName.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
