package org.qdag.qirCompiler.circuit;

import org.qdag.util.ICastable;
import org.qdag.util.IHasId;

import java.util.Comparator;
import java.util.List;

/** Base class for the nodes of a {@link DAGCircuit}.
 * Nodes are compared by identity; the id records creation order. */
public abstract class DAGNode implements IHasId, ICastable {
    static long crtId = 0;
    public final long id;

    /** Orders nodes by creation, which is the insertion order of a circuit. */
    public static final Comparator<DAGNode> CREATION_ORDER = Comparator.comparingLong(DAGNode::getId);

    protected DAGNode() {
        this.id = crtId++;
    }

    @Override
    public long getId() {
        return this.id;
    }

    /** Wires this node is attached to, in operand order. */
    public abstract List<Wire> getWires();
}
