/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.qdag.qirCompiler.compiler.optimizer;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.compiler.ICompilerComponent;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.errors.PipelineNonTerminationException;
import org.qdag.util.IWritesLogs;
import org.qdag.util.Logger;
import org.qdag.util.Utilities;

/** Applies a CircuitTransform until the circuit stops changing,
 * at most a given number of times. */
public class Repeat implements IWritesLogs, CircuitTransform, ICompilerComponent {
    final QIRCompiler compiler;
    public final CircuitTransform transform;
    public final long id;
    public final int maxIterations;

    public Repeat(QIRCompiler compiler, CircuitTransform transform, int maxIterations) {
        Utilities.enforce(maxIterations > 0, "Iteration bound must be positive, not " + maxIterations);
        this.compiler = compiler;
        this.transform = transform;
        this.id = PeepholeRule.crtId++;
        this.maxIterations = maxIterations;
    }

    public Repeat(QIRCompiler compiler, CircuitTransform transform) {
        this(compiler, transform, compiler.options.optimizerOptions.maxIterations);
    }

    @Override
    public QIRCompiler compiler() {
        return this.compiler;
    }

    /** Run to a fixpoint.  If the bound is hit the result carries the
     * non-termination condition, which is also reported as a warning,
     * unless the options ask for it to be thrown. */
    public PipelineResult repeat(DAGCircuit circuit) {
        int iterations = 0;
        while (true) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Iteration ")
                    .append(iterations)
                    .newline();
            long version = circuit.getVersion();
            DAGCircuit result = this.transform.apply(circuit);
            iterations++;
            if (result == circuit && result.getVersion() == version)
                return new PipelineResult(result, iterations, true, null);
            circuit = result;
            if (iterations == this.maxIterations) {
                PipelineNonTerminationException ex =
                        new PipelineNonTerminationException(this.transform.toString(), iterations);
                if (this.compiler.options.optimizerOptions.throwOnNonTermination)
                    throw ex;
                this.compiler.reportWarning(ex.getErrorKind(), ex.getMessage());
                return new PipelineResult(circuit, iterations, false, ex);
            }
        }
    }

    @Override
    public DAGCircuit apply(DAGCircuit circuit) {
        return this.repeat(circuit).circuit();
    }

    @Override
    public String toString() {
        return this.id + " Repeat " + this.transform;
    }

    @Override
    public String getName() {
        return "Repeat_" + this.transform.getName();
    }
}
