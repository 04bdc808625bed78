package org.qdag.util.graph;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TopologicalOrderTests {
    static class IntGraph implements DiGraph<Integer> {
        final Map<Integer, List<Port<Integer>>> edges = new LinkedHashMap<>();

        IntGraph node(int n) {
            this.edges.putIfAbsent(n, new ArrayList<>());
            return this;
        }

        IntGraph edge(int from, int to) {
            this.node(from).node(to);
            this.edges.get(from).add(new Port<>(to, 0));
            return this;
        }

        @Override
        public Iterable<Integer> getNodes() {
            return this.edges.keySet();
        }

        @Override
        public List<Port<Integer>> getSuccessors(Integer node) {
            return this.edges.get(node);
        }
    }

    @Test
    public void readyNodesComeOutInComparatorOrder() {
        IntGraph graph = new IntGraph()
                .node(5).node(3).node(1)
                .edge(3, 4)
                .edge(1, 2)
                .edge(2, 4);
        TopologicalOrder<Integer> order = new TopologicalOrder<>(graph, Comparator.naturalOrder());
        Assert.assertTrue(order.isComplete());
        Assert.assertEquals(List.of(1, 2, 3, 4, 5), order.getOrder());

        order = new TopologicalOrder<>(graph, Comparator.reverseOrder());
        Assert.assertEquals(List.of(5, 3, 1, 2, 4), order.getOrder());
    }

    @Test
    public void parallelEdgesCountTowardsInDegree() {
        IntGraph graph = new IntGraph()
                .edge(0, 1)
                .edge(0, 1)
                .edge(1, 2);
        TopologicalOrder<Integer> order = new TopologicalOrder<>(graph, Comparator.naturalOrder());
        Assert.assertTrue(order.isComplete());
        Assert.assertEquals(List.of(0, 1, 2), order.getOrder());
        Assert.assertEquals(2, graph.getFanout(0));
    }

    @Test
    public void cycleIsDetected() {
        IntGraph graph = new IntGraph()
                .edge(0, 1)
                .edge(1, 2)
                .edge(2, 1);
        TopologicalOrder<Integer> order = new TopologicalOrder<>(graph, Comparator.naturalOrder());
        Assert.assertFalse(order.isComplete());
        Assert.assertEquals(List.of(0), order.getOrder());
    }
}
