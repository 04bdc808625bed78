package org.qdag.qirCompiler.compiler.errors;

import org.qdag.qirCompiler.circuit.DAGNode;

/** A stale or foreign node was used to query or mutate a circuit.
 * This is a programming error and is never recovered from. */
public final class NodeNotFoundException extends BaseCompilerException {
    public NodeNotFoundException(DAGNode node) {
        super("Node " + node + " is not in the circuit", node);
    }

    @Override
    public String getErrorKind() {
        return "NodeNotFound";
    }
}
