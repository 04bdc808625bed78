package org.qdag.util.graph;

import java.util.List;

/** A directed multigraph whose edges carry an integer label.
 * Parallel edges between the same nodes are allowed when their labels differ. */
public interface DiGraph<Node> {
    Iterable<Node> getNodes();

    /** Outgoing edges of a node, one {@link Port} per edge. */
    List<Port<Node>> getSuccessors(Node node);

    /** Number of outgoing edges, counting parallel edges separately. */
    default int getFanout(Node node) {
        return this.getSuccessors(node).size();
    }
}
