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

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.qdag.util.IValidate;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/** Options of the QIR compiler.  The same object configures the library
 * and is filled in by JCommander from the command line. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions implements IValidate {
    /** Options controlling the optimizer. */
    @SuppressWarnings("CanBeFinal")
    public static class Optimizer implements IValidate {
        @Parameter(names = "--fixpoint",
                description = "Repeat the rewrite rules until the circuit stops changing")
        public boolean fixpoint = false;
        @Parameter(names = "--maxIterations",
                description = "Maximum number of passes over all rules in fixpoint mode")
        public int maxIterations = 20;
        @Parameter(names = "--throwOnNonTermination",
                description = "Fail instead of warning when the fixpoint is not reached")
        public boolean throwOnNonTermination = false;
        /** Check the circuit invariants after each rule; useful for development. */
        public boolean checkInvariants = false;

        @Override
        public boolean validate(IErrorReporter reporter) {
            if (this.maxIterations <= 0) {
                reporter.reportError("Invalid option",
                        "--maxIterations must be positive, not " + this.maxIterations);
                return false;
            }
            return true;
        }

        @Override
        public String toString() {
            return "Optimizer{" +
                    "\n\tfixpoint=" + this.fixpoint +
                    ",\n\tmaxIterations=" + this.maxIterations +
                    ",\n\tthrowOnNonTermination=" + this.throwOnNonTermination +
                    ",\n\tcheckInvariants=" + this.checkInvariants +
                    '}';
        }
    }

    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO implements IValidate {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "-o", description = "Output file; stdout if not specified")
        public String outputFile = "";
        @Parameter(names = "--print", description = "Print the nodes of the optimized circuit instead of JSON")
        public boolean print = false;
        @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array to stderr")
        public boolean emitJsonErrors = false;
        @Parameter(names = "-q", description = "Quiet: do not print warnings")
        public boolean quiet = false;
        @Parameter(description = "Input JSON circuit; stdin if not specified")
        @Nullable
        public String inputFile = null;

        @Override
        public boolean validate(IErrorReporter reporter) {
            if (this.inputFile != null && this.inputFile.equals(this.outputFile)) {
                reporter.reportError("Invalid option",
                        "-o would overwrite the input file " + this.inputFile);
                return false;
            }
            return true;
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\tloggingLevel=" + this.loggingLevel +
                    ",\n\toutputFile=" + this.outputFile +
                    ",\n\tprint=" + this.print +
                    ",\n\temitJsonErrors=" + this.emitJsonErrors +
                    ",\n\tquiet=" + this.quiet +
                    ",\n\tinputFile=" + this.inputFile +
                    '}';
        }
    }

    @ParametersDelegate
    public Optimizer optimizerOptions = new Optimizer();
    @ParametersDelegate
    public IO ioOptions = new IO();
    @Parameter(names = {"-h", "--help", "-"}, help = true, description = "Show this message and exit")
    public boolean help;

    @Override
    public boolean validate(IErrorReporter reporter) {
        return this.optimizerOptions.validate(reporter) &&
                this.ioOptions.validate(reporter);
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "optimizerOptions=" + this.optimizerOptions +
                ", ioOptions=" + this.ioOptions +
                ", help=" + this.help +
                '}';
    }
}
