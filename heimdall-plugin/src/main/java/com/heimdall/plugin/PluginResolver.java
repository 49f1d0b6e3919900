package com.heimdall.plugin;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Builds the dependency graph of discovered plugins and computes an initialization order in which every
 * plugin follows its dependencies. Failures are per plugin:
 * <ol>
 *   <li>a dependency that was not discovered: MISSING_DEPENDENCY</li>
 *   <li>a dependency whose version is outside the declared range: VERSION_MISMATCH</li>
 *   <li>membership in a dependency cycle: CYCLIC_DEPENDENCY (all members)</li>
 *   <li>a dependency that failed for any of the above: MISSING_DEPENDENCY with the chain down to the cause</li>
 * </ol>
 * Plugins unrelated to a failure are ordered normally. Ties are broken by discovery order.
 */
public final class PluginResolver {

    /**
     * @param order    resolvable plugins, dependencies first
     * @param failures failed plugins by id, in discovery order
     */
    public record Resolution(List<PluginDescriptor> order, Map<String, PluginLoadException> failures) {

        public Resolution {
            order = List.copyOf(order);
            failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        }
    }

    /**
     * @param descriptors discovered plugins with unique ids, in discovery order
     */
    public Resolution resolve(List<PluginDescriptor> descriptors) {
        Map<String, PluginDescriptor> byId = new LinkedHashMap<>();
        Map<String, Integer> index = new HashMap<>();
        for (PluginDescriptor d : descriptors) {
            if (byId.putIfAbsent(d.id(), d) != null) {
                throw new IllegalArgumentException("Duplicate plugin id: " + d.id());
            }
            index.put(d.id(), index.size());
        }

        Map<String, PluginLoadException> failures = new HashMap<>();
        checkDependencies(byId, failures);
        findCycles(byId, index, failures);
        propagate(byId, failures);

        List<PluginDescriptor> order = topologicalOrder(byId, index, failures.keySet());
        Map<String, PluginLoadException> ordered = new LinkedHashMap<>();
        for (String id : byId.keySet()) {
            if (failures.containsKey(id)) ordered.put(id, failures.get(id));
        }
        return new Resolution(order, ordered);
    }

    private static void checkDependencies(Map<String, PluginDescriptor> byId, Map<String, PluginLoadException> failures) {
        for (PluginDescriptor d : byId.values()) {
            for (Dependency dep : d.dependencies()) {
                PluginDescriptor target = byId.get(dep.pluginId());
                if (target == null) {
                    failures.put(d.id(), new PluginLoadException(PluginLoadException.Kind.MISSING_DEPENDENCY, d.id(),
                            List.of(d.id(), dep.pluginId()),
                            "Plugin " + d.id() + " requires " + dep + " which is not installed"));
                    break;
                }
                if (!dep.range().matches(target.version())) {
                    failures.put(d.id(), new PluginLoadException(PluginLoadException.Kind.VERSION_MISMATCH, d.id(),
                            List.of(d.id(), dep.pluginId()),
                            "Plugin " + d.id() + " requires " + dep.pluginId() + " " + dep.range()
                                    + " but found " + target.version()));
                    break;
                }
            }
        }
    }

    /** Tarjan's strongly connected components over edges plugin → dependency. */
    private static void findCycles(Map<String, PluginDescriptor> byId, Map<String, Integer> index,
                                   Map<String, PluginLoadException> failures) {
        Tarjan tarjan = new Tarjan(byId);
        for (String id : byId.keySet()) {
            if (!tarjan.indexOf.containsKey(id)) {
                tarjan.visit(id);
            }
        }
        for (List<String> component : tarjan.components) {
            boolean selfLoop = component.size() == 1 && byId.get(component.get(0)).dependencies().stream()
                    .anyMatch(dep -> dep.pluginId().equals(component.get(0)));
            if (component.size() < 2 && !selfLoop) continue;
            List<String> members = new ArrayList<>(component);
            members.sort(Comparator.comparing(index::get));
            for (String id : members) {
                List<String> chain = cycleChainFrom(id, members, byId);
                failures.putIfAbsent(id, new PluginLoadException(PluginLoadException.Kind.CYCLIC_DEPENDENCY, id, chain,
                        "Plugin " + id + " is part of a dependency cycle: " + String.join(" -> ", chain)));
            }
        }
    }

    /** Walks dependencies inside the component from {@code start} until it returns to {@code start}. */
    private static List<String> cycleChainFrom(String start, List<String> members, Map<String, PluginDescriptor> byId) {
        Set<String> inComponent = new HashSet<>(members);
        List<String> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String current = start;
        while (current != null && seen.add(current)) {
            chain.add(current);
            String next = null;
            for (Dependency dep : byId.get(current).dependencies()) {
                if (dep.pluginId().equals(start)) {
                    chain.add(start);
                    return chain;
                }
                if (next == null && inComponent.contains(dep.pluginId()) && !seen.contains(dep.pluginId())) {
                    next = dep.pluginId();
                }
            }
            current = next;
        }
        chain.add(start);
        return chain;
    }

    private static void propagate(Map<String, PluginDescriptor> byId, Map<String, PluginLoadException> failures) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (PluginDescriptor d : byId.values()) {
                if (failures.containsKey(d.id())) continue;
                for (Dependency dep : d.dependencies()) {
                    PluginLoadException cause = failures.get(dep.pluginId());
                    if (cause != null) {
                        List<String> chain = new ArrayList<>();
                        chain.add(d.id());
                        chain.addAll(cause.getChain());
                        failures.put(d.id(), new PluginLoadException(PluginLoadException.Kind.MISSING_DEPENDENCY, d.id(),
                                chain, "Plugin " + d.id() + " requires " + dep.pluginId() + " which failed: "
                                + cause.getMessage()));
                        changed = true;
                        break;
                    }
                }
            }
        }
    }

    private static List<PluginDescriptor> topologicalOrder(Map<String, PluginDescriptor> byId, Map<String, Integer> index,
                                                           Set<String> failed) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (PluginDescriptor d : byId.values()) {
            if (failed.contains(d.id())) continue;
            Set<String> distinct = new HashSet<>();
            for (Dependency dep : d.dependencies()) {
                if (distinct.add(dep.pluginId())) {
                    dependents.computeIfAbsent(dep.pluginId(), k -> new ArrayList<>()).add(d.id());
                }
            }
            inDegree.put(d.id(), distinct.size());
        }
        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparing(index::get));
        inDegree.forEach((id, deg) -> {
            if (deg == 0) ready.add(id);
        });
        List<PluginDescriptor> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(byId.get(id));
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) ready.add(dependent);
            }
        }
        return order;
    }

    private static final class Tarjan {
        private final Map<String, PluginDescriptor> byId;
        private final Map<String, Integer> indexOf = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter;

        Tarjan(Map<String, PluginDescriptor> byId) {
            this.byId = byId;
        }

        void visit(String id) {
            indexOf.put(id, counter);
            lowLink.put(id, counter);
            counter++;
            stack.push(id);
            onStack.add(id);
            for (Dependency dep : byId.get(id).dependencies()) {
                String next = dep.pluginId();
                if (!byId.containsKey(next)) continue;
                if (!indexOf.containsKey(next)) {
                    visit(next);
                    lowLink.put(id, Math.min(lowLink.get(id), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(id, Math.min(lowLink.get(id), indexOf.get(next)));
                }
            }
            if (lowLink.get(id).equals(indexOf.get(id))) {
                List<String> component = new ArrayList<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(id));
                components.add(component);
            }
        }
    }
}
