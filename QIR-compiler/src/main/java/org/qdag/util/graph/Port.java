package org.qdag.util.graph;

/** The end of an edge: the node it reaches and the index labelling the edge.
 * In a circuit the index is the wire the edge carries, so two ports to the
 * same node are distinct when they travel on different wires. */
public record Port<Node>(Node node, int port) {
    @Override
    public String toString() {
        return this.node + "@" + this.port;
    }
}
