package com.risk.ftree;

import com.risk.ftree.api.Node;
import com.risk.ftree.dsl.FaultTreeBuilder;
import com.risk.ftree.engine.TopologicalOrder;
import com.risk.ftree.node.BasicEvent;
import com.risk.ftree.node.CcfGroup;
import com.risk.ftree.node.Gate;
import com.risk.ftree.node.HouseEvent;
import com.risk.ftree.node.UndefinedEvent;
import com.risk.ftree.util.XmlText;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * A complete fault tree model: gates, events and CCF groups under one name.
 *
 * <p>
 * The container does not own the graph edges; those live on the gates and
 * nodes themselves. It adds name lookup, top gate discovery and whole-model
 * export in OpenPSA MEF XML and in shorthand notation.
 *
 * <p>
 * Build one with {@link #builder(String)}, or from a JSON definition with
 * {@link com.risk.ftree.io.FaultTreeCompiler}.
 */
@Log4j2
public final class FaultTree {
    private final String name;
    private final List<Gate> gates;
    private final List<BasicEvent> basicEvents;
    private final List<HouseEvent> houseEvents;
    private final List<UndefinedEvent> undefinedEvents;
    private final List<CcfGroup> ccfGroups;
    private final Map<String, Node> nodesByName;

    public FaultTree(String name, List<Gate> gates, List<BasicEvent> basicEvents,
            List<HouseEvent> houseEvents, List<UndefinedEvent> undefinedEvents, List<CcfGroup> ccfGroups) {
        this.name = Objects.requireNonNull(name, "name");
        this.gates = List.copyOf(gates);
        this.basicEvents = List.copyOf(basicEvents);
        this.houseEvents = List.copyOf(houseEvents);
        this.undefinedEvents = List.copyOf(undefinedEvents);
        this.ccfGroups = List.copyOf(ccfGroups);

        Map<String, Node> byName = new LinkedHashMap<>();
        List<Node> all = new ArrayList<>();
        all.addAll(this.gates);
        all.addAll(this.basicEvents);
        all.addAll(this.houseEvents);
        all.addAll(this.undefinedEvents);
        for (Node node : all) {
            if (byName.putIfAbsent(node.name(), node) != null)
                throw new IllegalArgumentException("Duplicate node name: " + node.name());
        }
        this.nodesByName = Collections.unmodifiableMap(byName);
    }

    /** Entry point: create a new fault tree builder. */
    public static FaultTreeBuilder builder(String name) {
        return FaultTreeBuilder.create(name);
    }

    public String name() {
        return name;
    }

    public List<Gate> gates() {
        return gates;
    }

    public List<BasicEvent> basicEvents() {
        return basicEvents;
    }

    public List<HouseEvent> houseEvents() {
        return houseEvents;
    }

    public List<UndefinedEvent> undefinedEvents() {
        return undefinedEvents;
    }

    public List<CcfGroup> ccfGroups() {
        return ccfGroups;
    }

    public Map<String, Node> nodesByName() {
        return nodesByName;
    }

    /** Resolves any node of the model by name. */
    public Node node(String nodeName) {
        Node node = nodesByName.get(nodeName);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + nodeName);
        return node;
    }

    public Gate gate(String gateName) {
        if (node(gateName) instanceof Gate gate)
            return gate;
        throw new IllegalArgumentException("Not a gate: " + gateName);
    }

    /** Gates with no parents, in definition order. */
    public List<Gate> topGates() {
        return gates.stream().filter(Node::isOrphan).toList();
    }

    /**
     * Sorts all gates from the top gates.
     *
     * @throws IllegalStateException if the gates contain a cycle.
     */
    public TopologicalOrder topology() {
        return TopologicalOrder.builder().addGates(gates).addRoots(topGates()).build();
    }

    /**
     * Produces the complete OpenPSA MEF document of the model.
     *
     * <p>
     * Gates are defined in topological order. Basic events that belong to a
     * CCF group are defined by the group and left out of the model data.
     *
     * @param nest The number of argument gate levels to inline into each gate
     *             definition. Gates that end up fully inlined get no
     *             definition of their own.
     */
    public String toXml(int nest) {
        if (nest < 0)
            throw new IllegalArgumentException("Negative nest level: " + nest);
        TopologicalOrder topology = topology();
        Set<Gate> defined = referencedGates(nest);

        StringBuilder sb = new StringBuilder(4096);
        sb.append("<?xml version=\"1.0\"?>\n<opsa-mef>\n")
                .append("<define-fault-tree name=\"").append(XmlText.escape(name)).append("\">\n");
        for (Gate gate : topology.gates()) {
            if (defined.contains(gate))
                sb.append(gate.toXml(nest));
        }
        for (CcfGroup group : ccfGroups)
            sb.append(group.toXml());
        sb.append("</define-fault-tree>\n<model-data>\n");
        for (BasicEvent event : nonCcfEvents())
            sb.append(event.toXml());
        for (HouseEvent event : houseEvents)
            sb.append(event.toXml());
        return sb.append("</model-data>\n</opsa-mef>\n").toString();
    }

    public String toXml() {
        return toXml(0);
    }

    /**
     * Produces the shorthand form of the model: the name line, gate formulas
     * in topological order, then basic and house events.
     */
    public String toShorthand() {
        if (!ccfGroups.isEmpty())
            log.warn("Fault tree {}: {} CCF groups have no shorthand form and are skipped", name,
                    ccfGroups.size());
        StringBuilder sb = new StringBuilder(2048);
        sb.append(name).append('\n');
        for (Gate gate : topology().gates())
            sb.append(gate.toShorthand());
        for (BasicEvent event : basicEvents)
            sb.append(event.toShorthand());
        for (HouseEvent event : houseEvents)
            sb.append(event.toShorthand());
        return sb.toString();
    }

    /** Basic events not claimed by any CCF group, in definition order. */
    public List<BasicEvent> nonCcfEvents() {
        Set<BasicEvent> members = Collections.newSetFromMap(new IdentityHashMap<>());
        for (CcfGroup group : ccfGroups)
            members.addAll(group.members());
        return basicEvents.stream().filter(e -> !members.contains(e)).toList();
    }

    // Gates still referenced by name once formulas are inlined to the nest level.
    private Set<Gate> referencedGates(int nest) {
        Set<Gate> defined = new LinkedHashSet<>(topGates());
        Deque<Gate> pending = new ArrayDeque<>(defined);
        while (!pending.isEmpty())
            collectReferences(pending.poll(), nest, defined, pending);
        return defined;
    }

    private static void collectReferences(Gate gate, int nest, Set<Gate> defined, Deque<Gate> pending) {
        for (Gate arg : gate.gateArguments()) {
            if (nest > 0)
                collectReferences(arg, nest - 1, defined, pending);
            else if (defined.add(arg))
                pending.add(arg);
        }
    }

    @Override
    public String toString() {
        return "FaultTree(" + name + ", " + gates.size() + " gates, " + basicEvents.size() + " basic events)";
    }
}
