package org.qdag.qirCompiler.circuit;

import org.qdag.qirCompiler.compiler.errors.InternalCompilerError;
import org.qdag.util.Linq;
import org.qdag.util.graph.TopologicalOrder;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Checks the structural invariants of a {@link DAGCircuit}:
 * <ul>
 *     <li>each wire is a single path from its input to its output terminal,
 *     visiting exactly the operations that use the wire</li>
 *     <li>each operation has one incoming and one outgoing edge per operand</li>
 *     <li>the graph is acyclic</li>
 *     <li>program order is deterministic</li>
 * </ul>
 */
public class CircuitInvariants {
    private CircuitInvariants() {}

    /** @throws InternalCompilerError describing the first violation found. */
    public static void check(DAGCircuit circuit) {
        for (DAGNode node: circuit.getNodes()) {
            for (Wire wire: node.getWires()) {
                DAGNode pred = circuit.predecessor(node, wire);
                DAGNode succ = circuit.successor(node, wire);
                boolean isInput = node.is(DAGInNode.class);
                boolean isOutput = node.is(DAGOutNode.class);
                if ((pred == null) != isInput)
                    throw new InternalCompilerError("Node has wrong in-degree on " + wire, node);
                if ((succ == null) != isOutput)
                    throw new InternalCompilerError("Node has wrong out-degree on " + wire, node);
                if (succ != null && circuit.predecessor(succ, wire) != node)
                    throw new InternalCompilerError("Edge on " + wire + " to " + succ + " is not mirrored", node);
            }
        }

        for (Wire wire: circuit.getWires()) {
            Set<DAGNode> onPath = new HashSet<>();
            DAGNode current = circuit.inputNode(wire);
            DAGOutNode out = circuit.outputNode(wire);
            while (current != out) {
                if (!onPath.add(current))
                    throw new InternalCompilerError("Wire " + wire + " loops", current);
                DAGNode succ = circuit.successor(current, wire);
                if (succ == null)
                    throw new InternalCompilerError("Wire " + wire + " does not reach its output", current);
                current = succ;
            }
            int users = Linq.where(circuit.getNodes(),
                    n -> n.is(DAGOpNode.class) && n.getWires().contains(wire)).size();
            // onPath holds the input terminal and the operations on the wire
            if (users != onPath.size() - 1)
                throw new InternalCompilerError("Wire " + wire + " path visits " + (onPath.size() - 1) +
                        " operations, but " + users + " operations use it");
        }

        TopologicalOrder<DAGNode> order = new TopologicalOrder<>(circuit, DAGNode.CREATION_ORDER);
        if (!order.isComplete())
            throw new InternalCompilerError("Circuit " + circuit.getId() + " has a cycle");
        List<DAGNode> first = Linq.list(circuit.topologicalNodes());
        List<DAGNode> second = Linq.list(circuit.topologicalNodes());
        if (!first.equals(second))
            throw new InternalCompilerError("Program order of circuit " + circuit.getId() + " is not deterministic");
    }
}
