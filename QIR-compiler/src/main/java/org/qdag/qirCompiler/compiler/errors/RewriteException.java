package org.qdag.qirCompiler.compiler.errors;

import org.qdag.qirCompiler.circuit.DAGNode;

/** A mutation of the circuit was refused before any edge was touched.
 * Rules recover from these by skipping the candidate match. */
public abstract class RewriteException extends BaseCompilerException {
    protected RewriteException(String message, DAGNode node) {
        super(message, node);
    }
}
