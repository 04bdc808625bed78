package org.qdag.qirCompiler.compiler.errors;

import org.qdag.qirCompiler.circuit.DAGNode;

public final class TemplateArityMismatchException extends RewriteException {
    public TemplateArityMismatchException(String message, DAGNode node) {
        super(message, node);
    }

    @Override
    public String getErrorKind() {
        return "TemplateArityMismatch";
    }
}
