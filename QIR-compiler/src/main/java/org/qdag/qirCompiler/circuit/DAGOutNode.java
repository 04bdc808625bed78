package org.qdag.qirCompiler.circuit;

import java.util.List;

/** End of a wire. */
public final class DAGOutNode extends DAGNode {
    public final Wire wire;

    public DAGOutNode(Wire wire) {
        this.wire = wire;
    }

    @Override
    public List<Wire> getWires() {
        return List.of(this.wire);
    }

    @Override
    public String toString() {
        return this.id + ":out " + this.wire;
    }
}
