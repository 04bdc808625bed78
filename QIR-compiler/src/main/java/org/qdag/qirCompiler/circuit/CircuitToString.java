package org.qdag.qirCompiler.circuit;

import org.qdag.util.IIndentStream;
import org.qdag.util.IndentStream;
import org.qdag.util.Linq;
import org.qdag.util.graph.Port;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Renders a circuit in a canonical textual form.  Nodes are numbered by
 * their position in program order rather than by id, so two circuits
 * built independently print the same when they have the same structure. */
public class CircuitToString {
    private CircuitToString() {}

    public static IIndentStream toString(DAGCircuit circuit, IIndentStream builder) {
        List<DAGNode> order = Linq.list(circuit.topologicalNodes());
        Map<DAGNode, Integer> position = new HashMap<>();
        for (int i = 0; i < order.size(); i++)
            position.put(order.get(i), i);

        builder.append("DAGCircuit(")
                .append(circuit.getQubitCount())
                .append(" qubits) {")
                .increase();
        for (DAGNode node: order) {
            builder.append(position.get(node))
                    .append(": ")
                    .append(describe(node));
            List<Port<DAGNode>> ports = circuit.getSuccessors(node);
            if (!ports.isEmpty())
                builder.append(" ->");
            for (Port<DAGNode> port: ports) {
                builder.append(" q[")
                        .append(port.port())
                        .append("]:")
                        .append(position.get(port.node()));
            }
            builder.newline();
        }
        return builder.decrease().append("}");
    }

    static String describe(DAGNode node) {
        if (node instanceof DAGInNode in)
            return "in " + in.wire;
        if (node instanceof DAGOutNode out)
            return "out " + out.wire;
        return node.to(DAGOpNode.class).toRecord().toString();
    }

    public static String canonical(DAGCircuit circuit) {
        StringBuilder builder = new StringBuilder();
        toString(circuit, new IndentStream(builder));
        return builder.toString();
    }
}
