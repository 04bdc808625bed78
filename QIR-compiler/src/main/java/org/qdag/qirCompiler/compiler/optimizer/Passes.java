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

import org.qdag.qirCompiler.circuit.CircuitInvariants;
import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.compiler.ICompilerComponent;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.util.IWritesLogs;
import org.qdag.util.Linq;
import org.qdag.util.Logger;

import java.util.ArrayList;
import java.util.List;

/** Applies a list of transforms in order, each once. */
public class Passes implements IWritesLogs, CircuitTransform, ICompilerComponent {
    final QIRCompiler compiler;
    public final List<CircuitTransform> passes;
    final long id;
    final String name;

    public Passes(String name, QIRCompiler compiler, CircuitTransform... passes) {
        this(name, compiler, Linq.list(passes));
    }

    public Passes(String name, QIRCompiler compiler, List<CircuitTransform> passes) {
        this.compiler = compiler;
        this.passes = new ArrayList<>(passes);
        this.id = PeepholeRule.crtId++;
        this.name = name;
    }

    @Override
    public QIRCompiler compiler() {
        return this.compiler;
    }

    public void add(CircuitTransform pass) {
        this.passes.add(pass);
    }

    @Override
    public DAGCircuit apply(DAGCircuit circuit) {
        long begin = System.currentTimeMillis();
        boolean check = this.compiler.options.optimizerOptions.checkInvariants;
        Logger.INSTANCE.belowLevel(this, 2)
                .append(this.toString())
                .append(" starting ")
                .append(this.passes.size())
                .append(" passes")
                .increase();
        for (CircuitTransform pass: this.passes) {
            long start = System.currentTimeMillis();
            int before = circuit.operationCount();
            circuit = pass.apply(circuit);
            long end = System.currentTimeMillis();
            if (check)
                CircuitInvariants.check(circuit);
            Logger.INSTANCE.belowLevel(this, 1)
                    .append(pass.toString())
                    .append(" took ")
                    .append(end - start)
                    .append("ms, operations ")
                    .append(before)
                    .append(" -> ")
                    .append(circuit.operationCount())
                    .newline();
            Logger.INSTANCE.belowLevel(this, 4)
                    .append("After ")
                    .append(pass.getName())
                    .newline()
                    .append(circuit)
                    .newline();
        }
        long finish = System.currentTimeMillis();
        Logger.INSTANCE.belowLevel(this, 2)
                .decrease()
                .append(this.toString())
                .append(" done in ")
                .append(finish - begin)
                .append("ms")
                .newline();
        return circuit;
    }

    @Override
    public String toString() {
        return this.name + "#" + this.id + "[" + this.passes.size() + "]";
    }

    @Override
    public String getName() {
        return this.name;
    }
}
