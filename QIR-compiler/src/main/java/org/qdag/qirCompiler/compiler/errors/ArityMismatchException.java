package org.qdag.qirCompiler.compiler.errors;

import org.qdag.qirCompiler.circuit.DAGNode;

/** A substitution would give a node a gate whose operand or parameter
 * count disagrees with the node. */
public final class ArityMismatchException extends RewriteException {
    public ArityMismatchException(String message, DAGNode node) {
        super(message, node);
    }

    @Override
    public String getErrorKind() {
        return "ArityMismatch";
    }
}
