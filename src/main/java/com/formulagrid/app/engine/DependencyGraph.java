package com.formulagrid.app.engine;

import com.formulagrid.app.models.CellAddress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks which cells read which other cells, in both directions.
 * The two maps are kept as exact inverses:
 * b in dependsOn[a] if and only if a in dependedOnBy[b].
 * <p>
 * Not thread-safe; each {@link FormulaEngine} owns its own graph.
 */
public class DependencyGraph {

    // Forward adjacency: cell -> cells it reads
    private final Map<CellAddress, Set<CellAddress>> dependsOn = new LinkedHashMap<>();
    // Reverse adjacency: cell -> cells that read it
    private final Map<CellAddress, Set<CellAddress>> dependedOnBy = new LinkedHashMap<>();

    /**
     * Records that {@code from} reads {@code to}.
     */
    public void addDependency(CellAddress from, CellAddress to) {
        dependsOn.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        dependedOnBy.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
    }

    /**
     * Drops every edge sourced from {@code cell}, on both sides.
     */
    public void removeDependencies(CellAddress cell) {
        Set<CellAddress> targets = dependsOn.remove(cell);
        if (targets == null) {
            return;
        }
        for (CellAddress target : targets) {
            Set<CellAddress> readers = dependedOnBy.get(target);
            if (readers != null) {
                readers.remove(cell);
                if (readers.isEmpty()) {
                    dependedOnBy.remove(target);
                }
            }
        }
    }

    public Set<CellAddress> getDependencies(CellAddress cell) {
        return Collections.unmodifiableSet(dependsOn.getOrDefault(cell, Collections.emptySet()));
    }

    public Set<CellAddress> getDependents(CellAddress cell) {
        return Collections.unmodifiableSet(dependedOnBy.getOrDefault(cell, Collections.emptySet()));
    }

    /**
     * Whether adding the edge from -> to would close a cycle: either it is a
     * self reference, or {@code from} is already reachable from {@code to}.
     * Safe to call on a graph that already contains cycles.
     */
    public boolean hasCycle(CellAddress from, CellAddress to) {
        if (from.equals(to)) {
            return true;
        }
        Set<CellAddress> visited = new HashSet<>();
        Deque<CellAddress> pending = new ArrayDeque<>();
        visited.add(to);
        pending.push(to);
        while (!pending.isEmpty()) {
            for (CellAddress dep : dependsOn.getOrDefault(pending.pop(), Collections.emptySet())) {
                if (dep.equals(from)) {
                    return true;
                }
                if (visited.add(dep)) {
                    pending.push(dep);
                }
            }
        }
        return false;
    }

    /**
     * Orders the given cells (and whatever they read) so that every cell comes
     * after its dependencies, by post-order depth-first traversal.
     * Valid for acyclic parts of the graph; cycles don't make it fail, they are
     * caught during evaluation instead.
     */
    public List<CellAddress> getEvaluationOrder(Collection<CellAddress> cells) {
        List<CellAddress> order = new ArrayList<>();
        Set<CellAddress> visited = new HashSet<>();
        // Explicit stack: reference chains can be as long as the sheet
        Deque<CellAddress> path = new ArrayDeque<>();
        Deque<Iterator<CellAddress>> pendingDeps = new ArrayDeque<>();

        for (CellAddress cell : cells) {
            if (!visited.add(cell)) {
                continue;
            }
            path.push(cell);
            pendingDeps.push(dependsOn.getOrDefault(cell, Collections.emptySet()).iterator());

            while (!path.isEmpty()) {
                Iterator<CellAddress> deps = pendingDeps.peek();
                if (deps.hasNext()) {
                    CellAddress dep = deps.next();
                    if (visited.add(dep)) {
                        path.push(dep);
                        pendingDeps.push(dependsOn.getOrDefault(dep, Collections.emptySet()).iterator());
                    }
                } else {
                    pendingDeps.pop();
                    order.add(path.pop());
                }
            }
        }
        return order;
    }

    public void clear() {
        dependsOn.clear();
        dependedOnBy.clear();
    }

    /**
     * Read-only copy of the forward adjacency, keyed by address text.
     */
    public Map<String, List<String>> forwardView() {
        return view(dependsOn);
    }

    /**
     * Read-only copy of the reverse adjacency, keyed by address text.
     */
    public Map<String, List<String>> reverseView() {
        return view(dependedOnBy);
    }

    private static Map<String, List<String>> view(Map<CellAddress, Set<CellAddress>> adjacency) {
        Map<String, List<String>> view = new LinkedHashMap<>();
        for (Map.Entry<CellAddress, Set<CellAddress>> entry : adjacency.entrySet()) {
            List<String> targets = new ArrayList<>();
            for (CellAddress target : entry.getValue()) {
                targets.add(target.toString());
            }
            view.put(entry.getKey().toString(), Collections.unmodifiableList(targets));
        }
        return Collections.unmodifiableMap(view);
    }
}
