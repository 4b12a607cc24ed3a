package com.risk.ftree.engine;

import com.risk.ftree.node.Gate;

import java.util.*;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

/**
 * Topology -- gates of a fault tree in dependency order.
 *
 * This class holds the immutable result of a topological sort over gate
 * arguments.
 *
 * Ordering contract:
 * The sequence is "dependents first". Reading {@link #gates()} front to back,
 * every gate appears before all of its gate arguments, so root gates lead and
 * the deepest sub-gates come last. {@link #evaluationOrder()} is the reverse:
 * every gate appears after all gates it depends on.
 *
 * Algorithm (see {@link Builder#build()}):
 * Depth-first search with three-colour marking, started from each root in the
 * order the roots were added. Marks are local to one build, so no traversal
 * state is ever left on the gates.
 */
@Log4j2
public final class TopologicalOrder {
    // The gates in dependents-first order.
    private final Gate[] order;

    // Lookup map for name resolution
    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(Gate[] order, Map<String, Integer> nameToIndex) {
        this.order = order;
        this.nameToIndex = nameToIndex;
    }

    /**
     * Sorts gates topologically starting from the root gates.
     *
     * @param roots The root gates of the graph, visited in iteration order.
     * @param gates Gates to be sorted. Every one of them must be reachable from
     *              a root.
     * @return the gates in dependents-first order.
     * @throws IllegalStateException    if gate arguments form a cycle, or the
     *                                  gates reached from the roots are not
     *                                  exactly {@code gates}, each listed once.
     * @throws IllegalArgumentException if two distinct gates share a name.
     */
    public static List<Gate> toposortGates(Collection<Gate> roots, Collection<Gate> gates) {
        return builder().addGates(gates).addRoots(roots).build().gates();
    }

    public int size() {
        return order.length;
    }

    /** Returns the gate at the given position. */
    public Gate gate(int index) {
        return order[index];
    }

    /** Resolves a gate name to its position. O(1) hash lookup. */
    public int indexOf(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown gate: " + name);
        return idx;
    }

    /** Dependents first: each gate precedes all of its gate arguments. */
    public List<Gate> gates() {
        return List.of(order);
    }

    /** Dependencies first: each gate follows all of its gate arguments. */
    public List<Gate> evaluationOrder() {
        List<Gate> reversed = new ArrayList<>(Arrays.asList(order));
        Collections.reverse(reversed);
        return Collections.unmodifiableList(reversed);
    }

    public static Builder builder() {
        return new Builder();
    }

    private enum Mark {
        UNMARKED, IN_PROGRESS, DONE
    }

    /** A gate on the DFS stack with its remaining gate arguments. */
    private record Frame(Gate gate, Iterator<Gate> arguments) {
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final Set<Gate> gates = new LinkedHashSet<>();
        private final Map<String, Gate> gatesByName = new HashMap<>();
        private final List<Gate> roots = new ArrayList<>();

        // Input length, counting repeats, so a gate listed twice fails the coverage check.
        private int inputCount;

        /**
         * Adds a gate to be sorted.
         *
         * @throws IllegalArgumentException if a different gate with the same
         *                                  name was already added.
         */
        public Builder addGate(Gate gate) {
            Objects.requireNonNull(gate, "gate");
            Gate existing = gatesByName.putIfAbsent(gate.name(), gate);
            if (existing != null && existing != gate)
                throw new IllegalArgumentException("Duplicate gate name: " + gate.name());
            gates.add(gate);
            inputCount++;
            return this;
        }

        public Builder addGates(Collection<Gate> gates) {
            gates.forEach(this::addGate);
            return this;
        }

        public Builder addRoot(Gate root) {
            roots.add(Objects.requireNonNull(root, "root"));
            return this;
        }

        public Builder addRoots(Collection<Gate> roots) {
            roots.forEach(this::addRoot);
            return this;
        }

        /**
         * Compiles the ordering.
         * <p>
         * Iterative depth-first search so deep trees cannot overflow the call
         * stack. A gate is prepended to the result once all of its gate
         * arguments are done.
         */
        public TopologicalOrder build() {
            Map<Gate, Mark> marks = new HashMap<>(gates.size() * 2);
            for (Gate gate : gates)
                marks.put(gate, Mark.UNMARKED);

            Deque<Gate> sorted = new ArrayDeque<>(gates.size());
            Deque<Frame> stack = new ArrayDeque<>();
            for (Gate root : roots) {
                if (marks.getOrDefault(root, Mark.UNMARKED) == Mark.DONE)
                    continue;
                marks.put(root, Mark.IN_PROGRESS);
                stack.push(new Frame(root, root.gateArguments().iterator()));

                while (!stack.isEmpty()) {
                    Frame top = stack.peek();
                    if (top.arguments().hasNext()) {
                        Gate arg = top.arguments().next();
                        Mark mark = marks.getOrDefault(arg, Mark.UNMARKED);
                        if (mark == Mark.IN_PROGRESS)
                            throw new IllegalStateException("Cycle detected! Gate " + arg.name()
                                    + " is reachable from its own arguments via " + top.gate().name());
                        if (mark == Mark.UNMARKED) {
                            marks.put(arg, Mark.IN_PROGRESS);
                            stack.push(new Frame(arg, arg.gateArguments().iterator()));
                        }
                    } else {
                        stack.pop();
                        marks.put(top.gate(), Mark.DONE);
                        sorted.addFirst(top.gate());
                    }
                }
            }

            if (sorted.size() != inputCount || !gates.containsAll(sorted)) {
                String unreached = gates.stream()
                        .filter(g -> marks.get(g) != Mark.DONE)
                        .map(Gate::name)
                        .collect(Collectors.joining(", "));
                String foreign = sorted.stream()
                        .filter(g -> !gates.contains(g))
                        .map(Gate::name)
                        .collect(Collectors.joining(", "));
                throw new IllegalStateException("Sorted " + sorted.size() + " of " + inputCount
                        + " gates. Unreachable from roots: [" + unreached
                        + "], outside the sorted set: [" + foreign + "], repeated entries: "
                        + (inputCount - gates.size()));
            }

            Gate[] order = sorted.toArray(new Gate[0]);
            Map<String, Integer> nameToIndex = new HashMap<>(order.length * 2);
            for (int i = 0; i < order.length; i++)
                nameToIndex.put(order[i].name(), i);
            log.debug("Sorted {} gates from {} roots", order.length, roots.size());
            return new TopologicalOrder(order, nameToIndex);
        }
    }
}
