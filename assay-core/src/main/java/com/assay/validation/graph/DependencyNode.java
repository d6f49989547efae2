/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Node of a {@link DependencyGraph}.
 *
 * <p>{@code dependencies} are the names the node declared, registered or not.
 * {@code dependents} only lists registered nodes. {@code order} is the topological
 * rank, or -1 until the graph order has been computed.
 */
public final class DependencyNode {

    private final String name;
    private final int priority;
    private final long sequence;
    private final Set<String> dependencies;
    private final Set<String> dependents = new LinkedHashSet<>();
    private int order = -1;

    DependencyNode(String name, Set<String> dependencies, int priority, long sequence) {
        this.name = name;
        this.priority = priority;
        this.sequence = sequence;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    public String name() {
        return name;
    }

    public int priority() {
        return priority;
    }

    /**
     * Registration sequence, used to break priority ties.
     */
    public long sequence() {
        return sequence;
    }

    public Set<String> dependencies() {
        return dependencies;
    }

    public Set<String> dependents() {
        return Collections.unmodifiableSet(dependents);
    }

    public int order() {
        return order;
    }

    void addDependent(String dependent) {
        dependents.add(dependent);
    }

    void removeDependent(String dependent) {
        dependents.remove(dependent);
    }

    void setOrder(int order) {
        this.order = order;
    }

    @Override
    public String toString() {
        return "DependencyNode{name='" + name + "', dependencies=" + dependencies
                + ", priority=" + priority + ", order=" + order + "}";
    }
}
