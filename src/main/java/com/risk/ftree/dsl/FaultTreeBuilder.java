package com.risk.ftree.dsl;

import com.risk.ftree.FaultTree;
import com.risk.ftree.api.CcfModel;
import com.risk.ftree.api.Node;
import com.risk.ftree.api.Operator;
import com.risk.ftree.node.BasicEvent;
import com.risk.ftree.node.CcfGroup;
import com.risk.ftree.node.Gate;
import com.risk.ftree.node.HouseEvent;
import com.risk.ftree.node.UndefinedEvent;

import java.util.*;

/**
 * Fault Tree Builder -- fluent construction API.
 *
 * Usage Pattern:
 * 1. Create a builder: FaultTreeBuilder b = FaultTree.builder("pumps");
 * 2. Define events: var e1 = b.basicEvent("E1", 0.01);
 * 3. Define gates over existing nodes: var top = b.gate("TOP", Operator.OR, e1, e2);
 * 4. Build: FaultTree tree = b.build();
 *
 * Gates are usually defined bottom-up, so their arguments already exist. A gate
 * created with no arguments can be wired later with
 * {@link Gate#addArgument(Node)}.
 */
public final class FaultTreeBuilder {
    private final String treeName;

    private final Map<String, Node> nodesByName = new HashMap<>();
    private final List<Gate> gates = new ArrayList<>();
    private final List<BasicEvent> basicEvents = new ArrayList<>();
    private final List<HouseEvent> houseEvents = new ArrayList<>();
    private final List<UndefinedEvent> undefinedEvents = new ArrayList<>();
    private final Map<String, CcfGroup> ccfGroups = new LinkedHashMap<>();

    // Flag to prevent modification after building
    private boolean built;

    private FaultTreeBuilder(String treeName) {
        this.treeName = Objects.requireNonNull(treeName, "treeName");
    }

    public static FaultTreeBuilder create(String treeName) {
        return new FaultTreeBuilder(treeName);
    }

    // ── Events ──────────────────────────────────────────────────

    public BasicEvent basicEvent(String name, double probability) {
        checkNotBuilt();
        var event = new BasicEvent(name, probability);
        register(event);
        basicEvents.add(event);
        return event;
    }

    public HouseEvent houseEvent(String name, boolean state) {
        checkNotBuilt();
        var event = new HouseEvent(name, state);
        register(event);
        houseEvents.add(event);
        return event;
    }

    /** Declares a name that is referenced but defined outside the model. */
    public UndefinedEvent undefinedEvent(String name) {
        checkNotBuilt();
        var event = new UndefinedEvent(name);
        register(event);
        undefinedEvents.add(event);
        return event;
    }

    // ── Gates ───────────────────────────────────────────────────

    /**
     * Creates a gate over existing nodes.
     *
     * @param name      Unique name of the gate.
     * @param operator  Any operator except {@link Operator#ATLEAST}; use
     *                  {@link #atleast(String, int, Node...)} for that one.
     * @param arguments Argument nodes, wired in order.
     */
    public Gate gate(String name, Operator operator, Node... arguments) {
        checkNotBuilt();
        return wire(new Gate(name, operator), arguments);
    }

    /** Creates a k-out-of-n gate over existing nodes. */
    public Gate atleast(String name, int kNum, Node... arguments) {
        checkNotBuilt();
        return wire(new Gate(name, Operator.ATLEAST, kNum), arguments);
    }

    private Gate wire(Gate gate, Node... arguments) {
        register(gate);
        gates.add(gate);
        for (Node argument : arguments)
            gate.addArgument(argument);
        return gate;
    }

    // ── CCF groups ──────────────────────────────────────────────

    /**
     * Groups existing basic events under a common-cause failure model.
     *
     * @param factors Model factors, starting at level 2.
     */
    public CcfGroup ccfGroup(String name, CcfModel model, double probability, List<Double> factors,
            BasicEvent... members) {
        checkNotBuilt();
        if (ccfGroups.containsKey(name))
            throw new IllegalArgumentException("Duplicate CCF group name: " + name);
        var group = new CcfGroup(name);
        group.setModel(model);
        group.setProbability(probability);
        group.setFactors(factors);
        for (BasicEvent member : members)
            group.addMember(member);
        ccfGroups.put(name, group);
        return group;
    }

    /**
     * Retrieve a node by name during the build phase.
     * Useful for wiring up complex dependencies.
     */
    @SuppressWarnings("unchecked")
    public <T extends Node> T getNode(String name) {
        return (T) nodesByName.get(name);
    }

    /**
     * Finalizes the model.
     *
     * @throws IllegalStateException if the gates contain a cycle, or the
     *                               builder was already used.
     */
    public FaultTree build() {
        checkNotBuilt();
        built = true;
        var tree = new FaultTree(treeName, gates, basicEvents, houseEvents, undefinedEvents,
                new ArrayList<>(ccfGroups.values()));
        // Fail fast on cycles introduced through late wiring.
        tree.topology();
        return tree;
    }

    // Internal helper to register a node and check for duplicates
    private void register(Node node) {
        if (nodesByName.containsKey(node.name()))
            throw new IllegalArgumentException("Duplicate node name: " + node.name());
        nodesByName.put(node.name(), node);
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Fault tree already built");
    }
}
