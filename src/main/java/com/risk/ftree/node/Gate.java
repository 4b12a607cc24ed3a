package com.risk.ftree.node;

import com.risk.ftree.api.Node;
import com.risk.ftree.api.NodeKind;
import com.risk.ftree.api.Operator;
import com.risk.ftree.util.XmlText;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Internal fault tree node combining its arguments with a logical operator.
 *
 * <h3>Arguments</h3>
 * <p>
 * Arguments are kept in four disjoint collections keyed by {@link NodeKind}:
 * gates, basic events, house events and undefined references.
 * {@link #addArgument(Node)} is the single mutation point; it also registers
 * this gate as a parent of the argument, so the gate-to-argument and
 * argument-to-parent edges always agree. The collections are exposed only as
 * read-only views.
 *
 * <h3>Export</h3>
 * <p>
 * {@link #toXml(int)} writes the MEF definition. The {@code nest} level
 * controls how many levels of argument gates are inlined as nested formulas
 * instead of being emitted as {@code <gate name="..."/>} references.
 */
public final class Gate extends Node {
    private final Operator operator;

    // Meaningful only for ATLEAST.
    private final int kNum;

    private final Set<Gate> gateArguments = new LinkedHashSet<>();
    private final Set<BasicEvent> basicEventArguments = new LinkedHashSet<>();
    private final Set<HouseEvent> houseEventArguments = new LinkedHashSet<>();
    private final Set<Node> undefinedArguments = new LinkedHashSet<>();

    /**
     * Creates a gate with an operator that takes no threshold.
     *
     * @throws IllegalArgumentException if the operator is {@code atleast}.
     */
    public Gate(String name, Operator operator) {
        super(name);
        this.operator = Objects.requireNonNull(operator, "operator");
        if (operator.requiresThreshold())
            throw new IllegalArgumentException("Gate " + name + ": operator atleast requires a min number");
        this.kNum = 0;
    }

    /**
     * Creates a gate with a threshold.
     *
     * @param kNum Min number of arguments that must fail for the
     *             {@code atleast} combination.
     * @throws IllegalArgumentException if the operator is not {@code atleast}.
     */
    public Gate(String name, Operator operator, int kNum) {
        super(name);
        this.operator = Objects.requireNonNull(operator, "operator");
        if (!operator.requiresThreshold())
            throw new IllegalArgumentException(
                    "Gate " + name + ": operator " + operator.token() + " takes no min number");
        this.kNum = kNum;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GATE;
    }

    public Operator operator() {
        return operator;
    }

    /** Threshold of an {@code atleast} gate; 0 for every other operator. */
    public int kNum() {
        return kNum;
    }

    /**
     * Adds an argument to the matching collection and registers this gate as
     * its parent.
     *
     * <p>
     * All checks run before the parent is registered, and the parent is
     * registered before the argument is stored, so a rejected argument leaves
     * both sides of the edge untouched.
     *
     * @throws IllegalArgumentException if the argument is this gate, or its
     *                                  {@link Node#kind()} does not match its
     *                                  class.
     * @throws IllegalStateException    if the argument is already an argument
     *                                  of this gate.
     */
    public void addArgument(Node argument) {
        Objects.requireNonNull(argument, "argument");
        if (argument == this)
            throw new IllegalArgumentException("Self-argument not allowed: " + name());
        Class<?> expected = switch (argument.kind()) {
            case GATE -> Gate.class;
            case BASIC_EVENT -> BasicEvent.class;
            case HOUSE_EVENT -> HouseEvent.class;
            case UNDEFINED -> Node.class;
        };
        if (!expected.isInstance(argument))
            throw new IllegalArgumentException("Argument " + argument.name() + " of kind " + argument.kind()
                    + " is a " + argument.getClass().getName() + ", not a " + expected.getSimpleName());
        argument.addParent(this);
        switch (argument.kind()) {
            case GATE -> gateArguments.add((Gate) argument);
            case BASIC_EVENT -> basicEventArguments.add((BasicEvent) argument);
            case HOUSE_EVENT -> houseEventArguments.add((HouseEvent) argument);
            case UNDEFINED -> undefinedArguments.add(argument);
        }
    }

    /** Returns the number of arguments across all collections. */
    public int numArguments() {
        return gateArguments.size() + basicEventArguments.size()
                + houseEventArguments.size() + undefinedArguments.size();
    }

    public Set<Gate> gateArguments() {
        return Collections.unmodifiableSet(gateArguments);
    }

    public Set<BasicEvent> basicEventArguments() {
        return Collections.unmodifiableSet(basicEventArguments);
    }

    public Set<HouseEvent> houseEventArguments() {
        return Collections.unmodifiableSet(houseEventArguments);
    }

    public Set<Node> undefinedArguments() {
        return Collections.unmodifiableSet(undefinedArguments);
    }

    /**
     * Collects this gate and every gate reachable by following parent edges.
     *
     * <p>
     * Breadth-first. A gate is expanded only the first time it is seen, which
     * handles re-converging paths and also terminates on a malformed model
     * whose parent edges form a cycle.
     *
     * @return insertion-ordered set of ancestors, starting with this gate.
     */
    public Set<Gate> getAncestors() {
        Set<Gate> ancestors = new LinkedHashSet<>();
        ancestors.add(this);
        Deque<Gate> queue = new ArrayDeque<>(parents());
        while (!queue.isEmpty()) {
            Gate parent = queue.poll();
            if (ancestors.add(parent))
                queue.addAll(parent.parents());
        }
        return ancestors;
    }

    /** Produces the MEF definition with argument gates as references. */
    public String toXml() {
        return toXml(0);
    }

    /**
     * Produces the OpenPSA MEF XML definition of the gate.
     *
     * @param nest The number of argument gate levels to inline as nested
     *             formulas. At 0 argument gates are emitted as references.
     */
    public String toXml(int nest) {
        if (nest < 0)
            throw new IllegalArgumentException("Negative nest level: " + nest);
        StringBuilder sb = new StringBuilder(256);
        sb.append("<define-gate name=\"").append(XmlText.escape(name())).append("\">\n");
        appendFormula(sb, this, nest);
        return sb.append("</define-gate>\n").toString();
    }

    private static void appendFormula(StringBuilder sb, Gate gate, int nest) {
        boolean wrapped = gate.operator != Operator.NULL;
        if (wrapped) {
            sb.append('<').append(gate.operator.token());
            if (gate.operator == Operator.ATLEAST)
                sb.append(" min=\"").append(gate.kNum).append('"');
            sb.append(">\n");
        }
        for (HouseEvent arg : gate.houseEventArguments)
            sb.append("<house-event name=\"").append(XmlText.escape(arg.name())).append("\"/>\n");
        for (BasicEvent arg : gate.basicEventArguments)
            sb.append("<basic-event name=\"").append(XmlText.escape(arg.name())).append("\"/>\n");
        for (Node arg : gate.undefinedArguments)
            sb.append("<event name=\"").append(XmlText.escape(arg.name())).append("\"/>\n");
        for (Gate arg : gate.gateArguments) {
            if (nest > 0)
                appendFormula(sb, arg, nest - 1);
            else
                sb.append("<gate name=\"").append(XmlText.escape(arg.name())).append("\"/>\n");
        }
        if (wrapped)
            sb.append("</").append(gate.operator.token()).append(">\n");
    }

    /**
     * Produces the shorthand definition of the gate, e.g.
     * {@code G1 := (E1 & E2)} or {@code G2 := @(2, [E1, E2, E3])}.
     *
     * @throws IllegalStateException if a {@code not} or {@code null} gate does
     *                               not have exactly one argument.
     */
    public String toShorthand() {
        List<String> args = argumentNames();
        String formula = switch (operator) {
            case AND -> "(" + String.join(" & ", args) + ")";
            case OR -> "(" + String.join(" | ", args) + ")";
            case XOR -> "(" + String.join(" ^ ", args) + ")";
            case NAND -> "~(" + String.join(" & ", args) + ")";
            case NOR -> "~(" + String.join(" | ", args) + ")";
            case ATLEAST -> "@(" + kNum + ", [" + String.join(", ", args) + "])";
            case NOT -> "~" + singleArgument(args);
            case NULL -> singleArgument(args);
        };
        return name() + " := " + formula + "\n";
    }

    private String singleArgument(List<String> args) {
        if (args.size() != 1)
            throw new IllegalStateException("Gate " + name() + " with operator " + operator.token()
                    + " must have exactly one argument, has " + args.size());
        return args.get(0);
    }

    // Same order as the XML formula.
    private List<String> argumentNames() {
        List<String> names = new ArrayList<>(numArguments());
        houseEventArguments.forEach(arg -> names.add(arg.name()));
        basicEventArguments.forEach(arg -> names.add(arg.name()));
        undefinedArguments.forEach(arg -> names.add(arg.name()));
        gateArguments.forEach(arg -> names.add(arg.name()));
        return names;
    }
}
