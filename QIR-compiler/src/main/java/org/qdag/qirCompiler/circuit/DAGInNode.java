package org.qdag.qirCompiler.circuit;

import java.util.List;

/** Start of a wire. */
public final class DAGInNode extends DAGNode {
    public final Wire wire;

    public DAGInNode(Wire wire) {
        this.wire = wire;
    }

    @Override
    public List<Wire> getWires() {
        return List.of(this.wire);
    }

    @Override
    public String toString() {
        return this.id + ":in " + this.wire;
    }
}
