package org.qdag.util.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/** Computes a topological order of a graph.  Among the nodes that are
 * ready at the same time the smallest one according to the comparator
 * is emitted first, so the order is fully determined by the graph
 * and the comparator. */
public class TopologicalOrder<Node> {
    final List<Node> order;
    final int nodeCount;

    public TopologicalOrder(DiGraph<Node> graph, Comparator<Node> tieBreak) {
        this.order = new ArrayList<>();
        Map<Node, Integer> inDegree = new HashMap<>();
        int count = 0;
        for (Node node: graph.getNodes()) {
            inDegree.putIfAbsent(node, 0);
            count++;
            for (Port<Node> p: graph.getSuccessors(node))
                inDegree.merge(p.node(), 1, Integer::sum);
        }
        this.nodeCount = count;

        PriorityQueue<Node> ready = new PriorityQueue<>(tieBreak);
        for (Node node: graph.getNodes())
            if (inDegree.get(node) == 0)
                ready.add(node);
        while (!ready.isEmpty()) {
            Node v = ready.remove();
            this.order.add(v);
            for (Port<Node> p: graph.getSuccessors(v)) {
                Node w = p.node();
                int remaining = inDegree.merge(w, -1, Integer::sum);
                if (remaining == 0)
                    ready.add(w);
            }
        }
    }

    /** False if the graph has a cycle: the nodes on the cycle never become ready. */
    public boolean isComplete() {
        return this.order.size() == this.nodeCount;
    }

    public List<Node> getOrder() {
        return this.order;
    }
}
