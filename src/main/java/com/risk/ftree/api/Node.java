package com.risk.ftree.api;

import com.risk.ftree.node.Gate;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A node in the fault tree.
 *
 * Every element that can appear as a gate argument -- a gate, a basic event, a
 * house event or an undefined reference -- extends this class.
 *
 * Key Responsibilities:
 *
 * 1. Identity: Every node has a name that is unique within a model. The name is
 * what the MEF and shorthand exports use to refer to the node.
 *
 * 2. Parent tracking: The node remembers every gate that lists it as an
 * argument. The "tree" is really a DAG, so a node referenced by several gates
 * is a legal "common" node. Parents are registered by
 * {@link Gate#addArgument(Node)}; callers never register them by hand.
 *
 * 3. Classification: {@link #kind()} is the closed tag gates use to sort their
 * arguments into typed collections.
 *
 * Nodes compare by identity. The model is append-only: there is no way to
 * remove a parent once registered.
 */
public abstract class Node {
    private final String name;

    // Insertion ordered so exports and diagnostics are deterministic.
    private final Set<Gate> parents = new LinkedHashSet<>();

    protected Node(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty())
            throw new IllegalArgumentException("Node name must not be empty");
        this.name = name;
    }

    /** Returns the unique name of this node. */
    public final String name() {
        return name;
    }

    /** Returns the kind tag used for argument classification. */
    public abstract NodeKind kind();

    /**
     * Registers a gate as a parent of this node.
     *
     * @param gate The gate where this node appears as an argument.
     * @throws IllegalStateException if the gate is already a parent. This is a
     *                               logic error in the caller, not a recoverable
     *                               condition.
     */
    public final void addParent(Gate gate) {
        Objects.requireNonNull(gate, "gate");
        if (!parents.add(gate))
            throw new IllegalStateException(
                    "Gate " + gate.name() + " is already a parent of " + name);
    }

    /** Read-only view of the gates referencing this node. */
    public final Set<Gate> parents() {
        return Collections.unmodifiableSet(parents);
    }

    /** Indicates if this node appears in several places. */
    public final boolean isCommon() {
        return parents.size() > 1;
    }

    /** Determines if the node is parentless. */
    public final boolean isOrphan() {
        return parents.isEmpty();
    }

    public final int numParents() {
        return parents.size();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
