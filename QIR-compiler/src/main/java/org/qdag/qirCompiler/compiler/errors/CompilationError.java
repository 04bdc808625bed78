package org.qdag.qirCompiler.compiler.errors;

import javax.annotation.Nullable;

/** The input circuit or the command line is malformed. */
public final class CompilationError extends BaseCompilerException {
    public CompilationError(String message) {
        super(message);
    }

    public CompilationError(String message, @Nullable Throwable cause) {
        super(message, null, cause);
    }

    @Override
    public String getErrorKind() {
        return "Compilation error";
    }
}
