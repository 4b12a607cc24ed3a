package com.risk.ftree.util;

import com.risk.ftree.FaultTree;
import com.risk.ftree.api.Node;
import com.risk.ftree.engine.TopologicalOrder;
import com.risk.ftree.node.BasicEvent;
import com.risk.ftree.node.Gate;
import com.risk.ftree.node.HouseEvent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Diagnostic utility for inspecting fault tree structure.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging errors, or
 * "toString()" style diagnostics.
 */
public final class FaultTreeExplain {
    private final FaultTree tree;

    public FaultTreeExplain(FaultTree tree) {
        this.tree = tree;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String nodeName) {
        Node node = tree.node(nodeName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeName).append('\n')
                .append("  Kind: ").append(node.kind()).append('\n')
                .append("  Common: ").append(node.isCommon()).append('\n')
                .append("  Orphan: ").append(node.isOrphan()).append('\n')
                .append("  Parents (").append(node.numParents()).append("): ")
                .append(names(node.parents())).append('\n');
        if (node instanceof Gate gate) {
            sb.append("  Operator: ").append(gate.operator().token());
            if (gate.operator().requiresThreshold())
                sb.append(" (min ").append(gate.kNum()).append(')');
            sb.append('\n')
                    .append("  Arguments (").append(gate.numArguments()).append("): ")
                    .append(names(arguments(gate))).append('\n')
                    .append("  Ancestors: ").append(names(gate.getAncestors())).append('\n');
        } else if (node instanceof BasicEvent be) {
            sb.append("  Probability: ").append(be.probability()).append('\n');
        } else if (node instanceof HouseEvent he) {
            sb.append("  State: ").append(he.stateToken()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps the gates in topological order, one line per gate.
     */
    public String dumpTopology() {
        TopologicalOrder topology = tree.topology();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Fault tree ").append(tree.name()).append(" (").append(topology.size()).append(" gates):\n");
        for (int i = 0; i < topology.size(); i++) {
            Gate gate = topology.gate(i);
            sb.append("  [").append(i).append("] ").append(gate.name())
                    .append(" ").append(gate.operator().token());
            if (gate.isOrphan())
                sb.append(" (TOP)");
            if (gate.numArguments() > 0)
                sb.append(" -> ").append(names(arguments(gate)));
            sb.append('\n');
        }
        return sb.toString();
    }

    private static List<Node> arguments(Gate gate) {
        List<Node> args = new ArrayList<>(gate.numArguments());
        args.addAll(gate.houseEventArguments());
        args.addAll(gate.basicEventArguments());
        args.addAll(gate.undefinedArguments());
        args.addAll(gate.gateArguments());
        return args;
    }

    private static String names(Collection<? extends Node> nodes) {
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) {
            if (sb.length() > 0)
                sb.append(", ");
            sb.append(node.name());
        }
        return sb.toString();
    }
}
