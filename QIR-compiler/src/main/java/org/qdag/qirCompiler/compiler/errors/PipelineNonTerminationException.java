package org.qdag.qirCompiler.compiler.errors;

/** The optimizer did not reach a fixpoint within the allowed number of iterations.
 * Normally returned to the caller as part of the pipeline result rather than thrown. */
public final class PipelineNonTerminationException extends BaseCompilerException {
    public final int iterations;

    public PipelineNonTerminationException(String transform, int iterations) {
        super("Repeated optimization " + transform + " " + iterations +
                " times without convergence");
        this.iterations = iterations;
    }

    @Override
    public String getErrorKind() {
        return "PipelineNonTermination";
    }
}
