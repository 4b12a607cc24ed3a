package com.risk.ftree.engine;

import com.risk.ftree.api.Operator;
import com.risk.ftree.node.BasicEvent;
import com.risk.ftree.node.Gate;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.Assert.*;

public class TopologicalOrderTest {

    // Helper to create a simple gate
    private Gate gate(String name) {
        return new Gate(name, Operator.AND);
    }

    // Every gate must precede all of its gate arguments
    private static void assertDependentsFirst(List<Gate> order) {
        for (int i = 0; i < order.size(); i++) {
            for (Gate arg : order.get(i).gateArguments())
                assertTrue(order.get(i).name() + " must precede " + arg.name(), order.indexOf(arg) > i);
        }
    }

    @Test
    public void testEmptyInput() {
        TopologicalOrder order = TopologicalOrder.builder().build();
        assertEquals(0, order.size());
        assertTrue(TopologicalOrder.toposortGates(List.of(), List.of()).isEmpty());
    }

    @Test
    public void testSingleGate() {
        Gate a = gate("A");
        a.addArgument(new BasicEvent("E1", 0.1));
        TopologicalOrder order = TopologicalOrder.builder().addGate(a).addRoot(a).build();

        assertEquals(1, order.size());
        assertEquals("A", order.gate(0).name());
        assertEquals(0, order.indexOf("A"));
    }

    @Test
    public void testLinearChain() {
        // A -> B -> C
        Gate a = gate("A");
        Gate b = gate("B");
        Gate c = gate("C");
        a.addArgument(b);
        b.addArgument(c);

        List<Gate> sorted = TopologicalOrder.toposortGates(List.of(a), List.of(c, b, a));
        assertEquals(List.of(a, b, c), sorted);

        TopologicalOrder order = TopologicalOrder.builder().addGates(List.of(a, b, c)).addRoot(a).build();
        assertEquals(List.of(c, b, a), order.evaluationOrder());
        assertEquals(2, order.indexOf("C"));
    }

    @Test
    public void testDiamond() {
        // A
        // / \
        // B C
        // \ /
        // D
        Gate a = gate("A");
        Gate b = gate("B");
        Gate c = gate("C");
        Gate d = gate("D");
        a.addArgument(b);
        a.addArgument(c);
        b.addArgument(d);
        c.addArgument(d);

        List<Gate> sorted = TopologicalOrder.toposortGates(List.of(a), List.of(a, b, c, d));

        assertEquals(4, sorted.size());
        assertEquals(4, new HashSet<>(sorted).size());
        assertEquals(a, sorted.get(0));
        assertEquals(d, sorted.get(3));
        assertDependentsFirst(sorted);
    }

    @Test
    public void testMultipleRootsShareSubGate() {
        // R1 -> S, R2 -> S
        Gate r1 = gate("R1");
        Gate r2 = gate("R2");
        Gate s = gate("S");
        r1.addArgument(s);
        r2.addArgument(s);

        List<Gate> sorted = TopologicalOrder.toposortGates(List.of(r1, r2), List.of(r1, r2, s));

        assertEquals(3, sorted.size());
        assertEquals(s, sorted.get(2));
        assertDependentsFirst(sorted);
    }

    @Test
    public void testRootAlreadyVisitedIsSkipped() {
        // A -> B, and B also listed as a root
        Gate a = gate("A");
        Gate b = gate("B");
        a.addArgument(b);

        List<Gate> sorted = TopologicalOrder.toposortGates(List.of(a, b), List.of(a, b));
        assertEquals(List.of(a, b), sorted);
    }

    @Test
    public void testRepeatedSortsAgree() {
        Gate a = gate("A");
        Gate b = gate("B");
        Gate c = gate("C");
        a.addArgument(b);
        a.addArgument(c);
        b.addArgument(c);

        List<Gate> first = TopologicalOrder.toposortGates(List.of(a), List.of(a, b, c));
        List<Gate> second = TopologicalOrder.toposortGates(List.of(a), List.of(a, b, c));
        assertEquals(first, second);
        assertDependentsFirst(first);
    }

    @Test(expected = IllegalStateException.class)
    public void testCycleDetection() {
        // A -> B -> C -> A
        Gate a = gate("A");
        Gate b = gate("B");
        Gate c = gate("C");
        a.addArgument(b);
        b.addArgument(c);
        c.addArgument(a);

        TopologicalOrder.toposortGates(List.of(a), List.of(a, b, c));
    }

    @Test
    public void testCycleBelowRootNamesGate() {
        // R -> A -> B -> A
        Gate r = gate("R");
        Gate a = gate("A");
        Gate b = gate("B");
        r.addArgument(a);
        a.addArgument(b);
        b.addArgument(a);
        try {
            TopologicalOrder.toposortGates(List.of(r), List.of(r, a, b));
            fail("Cycle must be detected");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("Cycle"));
            assertTrue(e.getMessage().contains("A"));
        }
        // No state is left behind: an acyclic sort afterwards still works
        Gate x = gate("X");
        assertEquals(List.of(x), TopologicalOrder.toposortGates(List.of(x), List.of(x)));
    }

    @Test
    public void testUnreachableGateFails() {
        Gate a = gate("A");
        Gate b = gate("B");
        Gate lonely = gate("LONELY");
        a.addArgument(b);
        try {
            TopologicalOrder.toposortGates(List.of(a), List.of(a, b, lonely));
            fail("Incomplete roots must fail");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("LONELY"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testGateOutsideCollectionFails() {
        Gate a = gate("A");
        Gate b = gate("B");
        a.addArgument(b);
        TopologicalOrder.toposortGates(List.of(a), List.of(a));
    }

    @Test
    public void testDeepChainDoesNotOverflow() {
        List<Gate> chain = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            Gate g = gate("G" + i);
            if (i > 0)
                chain.get(i - 1).addArgument(g);
            chain.add(g);
        }
        List<Gate> sorted = TopologicalOrder.toposortGates(List.of(chain.get(0)), chain);
        assertEquals(chain, sorted);
    }

    @Test
    public void testGateListedTwiceFails() {
        Gate a = gate("A");
        try {
            TopologicalOrder.toposortGates(List.of(a), List.of(a, a));
            fail("Repeated input gate must not be merged");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("Sorted 1 of 2"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateGateNameException() {
        Gate a1 = gate("A");
        Gate a2 = gate("A");

        TopologicalOrder.builder()
                .addGate(a1)
                .addGate(a2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidIndexLookup() {
        Gate a = gate("A");
        TopologicalOrder.builder().addGate(a).addRoot(a).build().indexOf("UNKNOWN");
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testResultIsImmutable() {
        Gate a = gate("A");
        TopologicalOrder.builder().addGate(a).addRoot(a).build().gates().clear();
    }
}
