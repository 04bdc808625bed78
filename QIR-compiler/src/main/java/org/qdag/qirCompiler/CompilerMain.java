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

package org.qdag.qirCompiler;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.compiler.CompilerOptions;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.backend.DAGNodePrinter;
import org.qdag.qirCompiler.compiler.backend.ToJsonCircuit;
import org.qdag.qirCompiler.compiler.errors.BaseCompilerException;
import org.qdag.qirCompiler.compiler.errors.CompilerMessages;
import org.qdag.util.IndentStream;
import org.qdag.util.Logger;
import org.qdag.util.Utilities;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/** Main entry point of the circuit optimizer. */
public class CompilerMain {
    final CompilerOptions options;

    CompilerMain() {
        this.options = new CompilerOptions();
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("qir-peephole");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            commander.usage();
            return 1;
        }

        for (Map.Entry<String, String> entry: this.options.ioOptions.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                System.err.println("-T option must be followed by 'class=number'; could not parse " + entry);
                return 1;
            } catch (BaseCompilerException ex) {
                System.err.println(ex.getMessage());
                return 1;
            }
        }
        return 0;
    }

    PrintStream getOutputStream() throws IOException {
        String outputFile = this.options.ioOptions.outputFile;
        if (outputFile.isEmpty())
            return System.out;
        return new PrintStream(Files.newOutputStream(Paths.get(outputFile)), false, StandardCharsets.UTF_8);
    }

    InputStream getInputFile(@Nullable String inputFile) throws IOException {
        if (inputFile == null)
            return System.in;
        return Files.newInputStream(Paths.get(inputFile));
    }

    /** Run the optimizer on the input, return the messages produced. */
    CompilerMessages run() {
        QIRCompiler compiler = new QIRCompiler(this.options);
        if (!this.options.validate(compiler))
            return compiler.messages;

        String json;
        try (InputStream input = this.getInputFile(this.options.ioOptions.inputFile)) {
            json = new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            compiler.reportError("Error reading file",
                    Utilities.singleQuote(this.options.ioOptions.inputFile) + " " + e.getMessage());
            return compiler.messages;
        }

        DAGCircuit circuit = compiler.readCircuit(json);
        if (circuit == null)
            return compiler.messages;
        try {
            circuit = compiler.optimize(circuit).circuit();
        } catch (BaseCompilerException ex) {
            compiler.reportError(ex);
            return compiler.messages;
        }

        try {
            PrintStream stream = this.getOutputStream();
            if (this.options.ioOptions.print) {
                IndentStream indent = new IndentStream(stream);
                new DAGNodePrinter(indent).print(circuit);
            } else {
                stream.println(ToJsonCircuit.toJsonString(compiler.mapper, circuit));
            }
            stream.flush();
            if (stream != System.out)
                stream.close();
        } catch (IOException e) {
            compiler.reportError("Error writing to output file", e.getMessage());
        }
        return compiler.messages;
    }

    public static CompilerMessages execute(String... argv) {
        CompilerMain main = new CompilerMain();
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0) {
            CompilerMessages result = new CompilerMessages();
            result.exitCode = exitCode;
            return result;
        }
        CompilerMessages messages = main.run();
        if (main.options.ioOptions.emitJsonErrors) {
            System.err.println(messages.toJson(Utilities.deterministicObjectMapper()).toPrettyString());
        } else {
            messages.show(System.err, main.options.ioOptions.quiet);
        }
        return messages;
    }

    public static void main(String[] argv) {
        CompilerMessages messages = execute(argv);
        System.exit(messages.exitCode);
    }
}
