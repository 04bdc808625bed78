package org.qdag.qirCompiler.compiler.optimizer;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.compiler.errors.PipelineNonTerminationException;

import javax.annotation.Nullable;

/**
 * Outcome of running the optimizer.
 *
 * @param circuit        The last state of the circuit.
 * @param iterations     Number of passes over the rules.
 * @param converged      True if the last pass did not change the circuit.
 * @param nonTermination Set when the iteration bound was hit before reaching a fixpoint.
 */
public record PipelineResult(DAGCircuit circuit, int iterations, boolean converged,
                             @Nullable PipelineNonTerminationException nonTermination) {
    public boolean boundExceeded() {
        return this.nonTermination != null;
    }
}
