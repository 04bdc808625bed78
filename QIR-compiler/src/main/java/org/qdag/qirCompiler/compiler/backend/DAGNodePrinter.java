package org.qdag.qirCompiler.compiler.backend;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.DAGInNode;
import org.qdag.qirCompiler.circuit.DAGNode;
import org.qdag.qirCompiler.circuit.DAGOpNode;
import org.qdag.qirCompiler.circuit.DAGOutNode;
import org.qdag.qirCompiler.circuit.Wire;
import org.qdag.qirCompiler.compiler.errors.InternalCompilerError;
import org.qdag.util.IIndentStream;
import org.qdag.util.Linq;

/** Prints the nodes of a circuit in program order, one block per node. */
public class DAGNodePrinter {
    static final String SEPARATOR = "---";

    final IIndentStream stream;

    public DAGNodePrinter(IIndentStream stream) {
        this.stream = stream;
    }

    public void print(DAGNode node) {
        if (node.is(DAGOpNode.class)) {
            DAGOpNode op = node.to(DAGOpNode.class);
            this.stream.append("Name: ").append(op.getName()).newline()
                    .append("Op: ").append(op.getKind().name()).newline()
                    .append("Qubits: ").joinS(", ", Linq.map(op.qubits, Wire::toString)).newline()
                    .append("Params: ").joinS(", ", Linq.map(op.getParams(), d -> Double.toString(d))).newline();
        } else if (node.is(DAGInNode.class)) {
            this.stream.append("Input: ").append(node.to(DAGInNode.class).wire.toString()).newline();
        } else if (node.is(DAGOutNode.class)) {
            this.stream.append("Output: ").append(node.to(DAGOutNode.class).wire.toString()).newline();
        } else {
            throw new InternalCompilerError("Unexpected node " + node, node);
        }
        this.stream.append(SEPARATOR).newline();
    }

    public void print(DAGCircuit circuit) {
        for (DAGNode node: circuit.topologicalNodes())
            this.print(node);
    }
}
