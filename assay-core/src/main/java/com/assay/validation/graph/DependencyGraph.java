/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.graph;

import com.assay.validation.api.exceptions.ConfigurationException;
import com.assay.validation.api.model.ErrorCodes;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Directed dependency graph over named items (rules or validators).
 *
 * <p>Invariants:
 * <ul>
 *   <li>names are unique;</li>
 *   <li>the graph is acyclic: an insertion that would close a cycle is rejected and
 *       leaves the graph exactly as it was;</li>
 *   <li>a dependency on a name that is not registered is ignored for ordering until
 *       that name is added.</li>
 * </ul>
 *
 * <p>The topological order is computed with Kahn's algorithm, ties broken by priority
 * (descending) then registration order, memoized and invalidated on every structural
 * change. Thread-safe.
 */
public final class DependencyGraph {

    private static final Logger logger = Logger.getLogger(DependencyGraph.class.getName());

    private static final Comparator<DependencyNode> EXECUTION_ORDER =
            Comparator.comparingInt(DependencyNode::priority).reversed()
                    .thenComparingLong(DependencyNode::sequence);

    private final String kind;
    private final String duplicateCode;
    private final Map<String, DependencyNode> nodes = new LinkedHashMap<>();
    private long sequence;
    private List<String> topologicalOrder;

    /**
     * @param kind          item kind used in messages, e.g. {@code "Rule"}
     * @param duplicateCode error code raised for duplicate names
     */
    public DependencyGraph(String kind, String duplicateCode) {
        this.kind = kind;
        this.duplicateCode = duplicateCode;
    }

    public static DependencyGraph forRules() {
        return new DependencyGraph("Rule", ErrorCodes.DUPLICATE_RULE);
    }

    public static DependencyGraph forValidators() {
        return new DependencyGraph("Validator", ErrorCodes.DUPLICATE_VALIDATOR);
    }

    /**
     * Inserts a node and wires its edges.
     *
     * @throws ConfigurationException on a duplicate name or when the node would close a cycle
     */
    public synchronized DependencyNode add(String name, Collection<String> dependencies, int priority) {
        if (nodes.containsKey(name)) {
            throw new ConfigurationException(duplicateCode,
                    String.format("%s '%s' is already registered", kind, name));
        }

        DependencyNode node = new DependencyNode(name, new HashSet<>(dependencies), priority, sequence);
        nodes.put(name, node);
        wire(node);

        Optional<List<String>> cycle = findCycle();
        if (cycle.isPresent()) {
            unwire(node);
            nodes.remove(name);
            throw new ConfigurationException(ErrorCodes.CIRCULAR_DEPENDENCY, String.format(
                    "Circular dependency detected while adding %s '%s': %s",
                    kind.toLowerCase(), name, String.join(" -> ", cycle.get())));
        }

        sequence++;
        topologicalOrder = null;
        logger.fine(String.format("%s '%s' added to dependency graph (dependencies=%s, priority=%d)",
                kind, name, node.dependencies(), priority));
        return node;
    }

    /**
     * Removes a node and every edge touching it.
     *
     * @return true if the node was present
     */
    public synchronized boolean remove(String name) {
        DependencyNode node = nodes.get(name);
        if (node == null) {
            return false;
        }
        unwire(node);
        nodes.remove(name);
        topologicalOrder = null;
        return true;
    }

    public synchronized boolean contains(String name) {
        return nodes.containsKey(name);
    }

    public synchronized Optional<DependencyNode> node(String name) {
        topologicalOrder();
        return Optional.ofNullable(nodes.get(name));
    }

    public synchronized int size() {
        return nodes.size();
    }

    /**
     * Returns every registered name in a dependency-respecting order.
     */
    public synchronized List<String> topologicalOrder() {
        if (topologicalOrder != null) {
            return topologicalOrder;
        }

        Map<String, Integer> inDegree = new HashMap<>();
        PriorityQueue<DependencyNode> ready = new PriorityQueue<>(EXECUTION_ORDER);
        for (DependencyNode node : nodes.values()) {
            int degree = (int) node.dependencies().stream().filter(nodes::containsKey).count();
            inDegree.put(node.name(), degree);
            if (degree == 0) {
                ready.add(node);
            }
        }

        List<String> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            DependencyNode node = ready.poll();
            node.setOrder(order.size());
            order.add(node.name());
            for (String dependent : node.dependents()) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(nodes.get(dependent));
                }
            }
        }

        if (order.size() != nodes.size()) {
            // add() rejects cycles, so this means the graph was corrupted
            throw new IllegalStateException("Dependency graph contains a cycle");
        }

        topologicalOrder = List.copyOf(order);
        return topologicalOrder;
    }

    /**
     * Groups {@code subset} into execution levels.
     *
     * <p>A node's level is one more than the highest level among its dependencies that
     * are part of the subset, or zero if there are none. Within a level nodes are ordered
     * by priority (descending) then registration order. Names that are not registered
     * are ignored.
     */
    public synchronized List<List<String>> levels(Collection<String> subset) {
        Set<String> members = new HashSet<>(subset);
        Map<String, Integer> levelOf = new HashMap<>();
        TreeMap<Integer, List<DependencyNode>> grouped = new TreeMap<>();

        for (String name : topologicalOrder()) {
            if (!members.contains(name)) {
                continue;
            }
            DependencyNode node = nodes.get(name);
            int level = 0;
            for (String dependency : node.dependencies()) {
                Integer dependencyLevel = levelOf.get(dependency);
                if (dependencyLevel != null) {
                    level = Math.max(level, dependencyLevel + 1);
                }
            }
            levelOf.put(name, level);
            grouped.computeIfAbsent(level, l -> new ArrayList<>()).add(node);
        }

        List<List<String>> levels = new ArrayList<>(grouped.size());
        for (List<DependencyNode> level : grouped.values()) {
            level.sort(EXECUTION_ORDER);
            levels.add(level.stream().map(DependencyNode::name).toList());
        }
        return levels;
    }

    private void wire(DependencyNode node) {
        for (String dependency : node.dependencies()) {
            DependencyNode target = nodes.get(dependency);
            if (target != null) {
                target.addDependent(node.name());
            }
        }
        for (DependencyNode other : nodes.values()) {
            if (other != node && other.dependencies().contains(node.name())) {
                node.addDependent(other.name());
            }
        }
    }

    private void unwire(DependencyNode node) {
        for (String dependency : node.dependencies()) {
            DependencyNode target = nodes.get(dependency);
            if (target != null) {
                target.removeDependent(node.name());
            }
        }
    }

    /**
     * Depth-first search with recursion-stack marking. Returns the cycle path, first
     * node repeated at the end, if one exists.
     */
    private Optional<List<String>> findCycle() {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        for (String name : nodes.keySet()) {
            if (!visited.contains(name)) {
                Optional<List<String>> cycle = visit(name, visited, onStack, stack);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<List<String>> visit(String name, Set<String> visited, Set<String> onStack, Deque<String> stack) {
        visited.add(name);
        onStack.add(name);
        stack.addLast(name);

        for (String dependency : nodes.get(name).dependencies()) {
            if (!nodes.containsKey(dependency)) {
                continue;
            }
            if (onStack.contains(dependency)) {
                List<String> path = new ArrayList<>();
                boolean inCycle = false;
                for (String entry : stack) {
                    inCycle |= entry.equals(dependency);
                    if (inCycle) {
                        path.add(entry);
                    }
                }
                path.add(dependency);
                return Optional.of(path);
            }
            if (!visited.contains(dependency)) {
                Optional<List<String>> cycle = visit(dependency, visited, onStack, stack);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }

        stack.removeLast();
        onStack.remove(name);
        return Optional.empty();
    }
}
