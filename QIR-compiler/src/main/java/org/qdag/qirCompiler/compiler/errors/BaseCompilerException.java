package org.qdag.qirCompiler.compiler.errors;

import org.qdag.qirCompiler.circuit.DAGNode;

import javax.annotation.Nullable;

/** Base class for exceptions which are thrown by the compiler. */
public abstract class BaseCompilerException extends RuntimeException {
    /** Node the problem is about, if any. */
    @Nullable
    public final DAGNode node;

    protected BaseCompilerException(String message, @Nullable DAGNode node, @Nullable Throwable throwable) {
        super(message, throwable);
        this.node = node;
    }

    protected BaseCompilerException(String message, @Nullable DAGNode node) {
        this(message, node, null);
    }

    protected BaseCompilerException(String message) {
        this(message, null, null);
    }

    public abstract String getErrorKind();
}
