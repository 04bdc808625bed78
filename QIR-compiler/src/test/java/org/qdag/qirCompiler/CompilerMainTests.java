package org.qdag.qirCompiler;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.Assert;
import org.junit.Test;
import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.errors.CompilerMessages;
import org.qdag.qirCompiler.compiler.frontend.CircuitJsonReader;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.qdag.qirCompiler.TestUtilities.program;

public class CompilerMainTests {
    static Path writeTemp(String contents) throws IOException {
        File file = File.createTempFile("circuit", ".json");
        file.deleteOnExit();
        Files.writeString(file.toPath(), contents, StandardCharsets.UTF_8);
        return file.toPath();
    }

    static Path output() throws IOException {
        File file = File.createTempFile("out", ".txt");
        file.deleteOnExit();
        return file.toPath();
    }

    @Test
    public void optimizeFile() throws IOException {
        Path input = writeTemp("""
                {"qubits": 2, "gates": [
                  {"gate": "x", "qubits": [0]},
                  {"gate": "h", "qubits": [0]},
                  {"gate": "x", "qubits": [0]},
                  {"gate": "swap", "qubits": [0, 1]},
                  {"gate": "swap", "qubits": [1, 0]}
                ]}""");
        Path out = output();
        CompilerMessages messages = CompilerMain.execute("-o", out.toString(), input.toString());
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertEquals(0, messages.errorCount());

        QIRCompiler compiler = new QIRCompiler();
        JsonNode json = compiler.mapper.readTree(out.toFile());
        DAGCircuit result = new CircuitJsonReader(compiler.mapper).read(json);
        Assert.assertEquals("h q[0]; z q[0]", program(result));
    }

    @Test
    public void printNodes() throws IOException {
        Path input = writeTemp("{\"qubits\": 1, \"gates\": [{\"gate\": \"h\", \"qubits\": [0]}]}");
        Path out = output();
        CompilerMessages messages = CompilerMain.execute("--print", "--fixpoint", "-o", out.toString(), input.toString());
        Assert.assertEquals(0, messages.exitCode);
        String text = Files.readString(out);
        Assert.assertTrue(text.contains("Name: h"));
        Assert.assertTrue(text.contains("Input: q[0]"));
    }

    @Test
    public void malformedCircuitFails() throws IOException {
        Path input = writeTemp("{\"qubits\": 1, \"gates\": [{\"gate\": \"cx\", \"qubits\": [0]}]}");
        CompilerMessages messages = CompilerMain.execute("-o", output().toString(), input.toString());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.errorCount());
        Assert.assertEquals("Compilation error", messages.getMessage(0).errorType);
    }

    @Test
    public void missingFileFails() {
        CompilerMessages messages = CompilerMain.execute("/this/file/does/not/exist.json");
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Error reading file", messages.getMessage(0).errorType);
    }

    @Test
    public void badOptionsFail() throws IOException {
        Path input = writeTemp("{\"qubits\": 0, \"gates\": []}");
        Assert.assertEquals(1, CompilerMain.execute("--noSuchOption", input.toString()).exitCode);
        Assert.assertEquals(1, CompilerMain.execute("-TNoSuchClass=1", input.toString()).exitCode);
        Assert.assertEquals(1, CompilerMain.execute("-TPeepholeOptimizer=x", input.toString()).exitCode);

        CompilerMessages messages = CompilerMain.execute("--maxIterations", "0", input.toString());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Invalid option", messages.getMessage(0).errorType);

        messages = CompilerMain.execute("-o", input.toString(), input.toString());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.getMessage(0).message.contains("overwrite"));
    }
}
