package org.qdag.qirCompiler.compiler.errors;

import org.qdag.qirCompiler.circuit.DAGNode;

/** Attempt to remove a node that cannot be removed, e.g. a wire terminal. */
public final class InvalidRemovalException extends RewriteException {
    public InvalidRemovalException(String message, DAGNode node) {
        super(message, node);
    }

    @Override
    public String getErrorKind() {
        return "InvalidRemoval";
    }
}
