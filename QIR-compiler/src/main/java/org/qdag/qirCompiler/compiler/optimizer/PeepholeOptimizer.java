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
import org.qdag.qirCompiler.circuit.GateKind;
import org.qdag.qirCompiler.compiler.CompilerOptions;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.optimizer.rules.CancelConsecutiveSwaps;
import org.qdag.qirCompiler.compiler.optimizer.rules.HXHToZ;
import org.qdag.qirCompiler.compiler.optimizer.rules.MergeAdjacentSwaps;
import org.qdag.qirCompiler.compiler.optimizer.rules.MergeConsecutiveRotations;
import org.qdag.qirCompiler.compiler.optimizer.rules.RemoveConsecutiveH;
import org.qdag.qirCompiler.compiler.optimizer.rules.TCountTemplateReduction;
import org.qdag.qirCompiler.compiler.optimizer.rules.ToffoliTCountReduction;
import org.qdag.qirCompiler.compiler.optimizer.rules.XHXToHZ;

import java.util.List;

/** The peephole rules applied to circuits, in order.
 * Depending on the options the whole list runs once or until a fixpoint. */
public class PeepholeOptimizer extends Passes {
    public PeepholeOptimizer(QIRCompiler compiler) {
        super("Peephole", compiler, List.of());
        this.createOptimizer();
    }

    /** An optimizer running the given rules instead of the default ones. */
    public PeepholeOptimizer(QIRCompiler compiler, List<CircuitTransform> rules) {
        super("Peephole", compiler, rules);
    }

    void createOptimizer() {
        this.add(new XHXToHZ(compiler));
        this.add(new HXHToZ(compiler));
        this.add(new RemoveConsecutiveH(compiler));
        this.add(new MergeConsecutiveRotations(compiler, GateKind.RX));
        this.add(new MergeConsecutiveRotations(compiler, GateKind.RY));
        this.add(new MergeConsecutiveRotations(compiler, GateKind.RZ));
        this.add(new MergeConsecutiveRotations(compiler, GateKind.P));
        this.add(new TCountTemplateReduction(compiler));
        this.add(new ToffoliTCountReduction(compiler));
        this.add(new CancelConsecutiveSwaps(compiler));
        this.add(new MergeAdjacentSwaps(compiler));
    }

    public PipelineResult run(DAGCircuit circuit) {
        CompilerOptions.Optimizer options = this.compiler.options.optimizerOptions;
        if (options.fixpoint)
            return new Repeat(this.compiler, this, options.maxIterations).repeat(circuit);
        long version = circuit.getVersion();
        DAGCircuit result = this.apply(circuit);
        return new PipelineResult(result, 1, result.getVersion() == version, null);
    }
}
