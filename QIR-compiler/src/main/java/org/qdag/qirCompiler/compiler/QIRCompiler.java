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

package org.qdag.qirCompiler.compiler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.compiler.errors.BaseCompilerException;
import org.qdag.qirCompiler.compiler.errors.CompilerMessages;
import org.qdag.qirCompiler.compiler.frontend.CircuitJsonReader;
import org.qdag.qirCompiler.compiler.optimizer.PeepholeOptimizer;
import org.qdag.qirCompiler.compiler.optimizer.PipelineResult;
import org.qdag.util.IWritesLogs;
import org.qdag.util.Logger;
import org.qdag.util.Utilities;

import javax.annotation.Nullable;

/**
 * Entry point of the circuit optimizer as a library.
 * The protocol is:
 * - create a compiler with some options
 * - obtain circuits, either built directly or read from JSON with {@link #readCircuit}
 * - call {@link #optimize} on each circuit
 * Problems are collected in {@link #messages}.
 */
public class QIRCompiler implements IWritesLogs, IErrorReporter, ICompilerComponent {
    public final CompilerOptions options;
    public final CompilerMessages messages;
    public final ObjectMapper mapper;

    public QIRCompiler(CompilerOptions options) {
        this.options = options;
        this.messages = new CompilerMessages();
        this.mapper = Utilities.deterministicObjectMapper();
    }

    public QIRCompiler() {
        this(new CompilerOptions());
    }

    @Override
    public QIRCompiler compiler() {
        return this;
    }

    @Override
    public void reportProblem(boolean warning, String errorType, String message) {
        this.messages.reportProblem(warning, errorType, message);
    }

    public void reportError(BaseCompilerException ex) {
        this.messages.reportError(ex);
    }

    @Override
    public boolean hasErrors() {
        return this.messages.errorCount() > 0;
    }

    /** Parse a circuit in JSON form.
     * @return null if the input is malformed; the problem is in {@link #messages}. */
    @Nullable
    public DAGCircuit readCircuit(String json) {
        try {
            CircuitJsonReader reader = new CircuitJsonReader(this.mapper);
            DAGCircuit circuit = reader.read(json);
            Logger.INSTANCE.belowLevel(this, 2)
                    .append("Read circuit")
                    .newline()
                    .append(circuit)
                    .newline();
            return circuit;
        } catch (BaseCompilerException ex) {
            this.reportError(ex);
            return null;
        }
    }

    /** Run the peephole rules on a circuit, as configured by the options.
     * The circuit is modified in place. */
    public PipelineResult optimize(DAGCircuit circuit) {
        PipelineResult result = new PeepholeOptimizer(this).run(circuit);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Optimized circuit in ")
                .append(result.iterations())
                .append(" iterations, converged: ")
                .append(result.converged())
                .newline();
        return result;
    }
}
