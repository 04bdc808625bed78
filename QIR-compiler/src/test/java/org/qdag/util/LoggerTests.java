package org.qdag.util;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.errors.CompilationError;
import org.qdag.qirCompiler.compiler.frontend.CircuitBuilder;
import org.qdag.qirCompiler.compiler.optimizer.rules.RemoveConsecutiveH;

public class LoggerTests {
    @After
    public void restore() {
        Logger.INSTANCE.reset();
        Logger.INSTANCE.setDebugStream(System.err);
    }

    @Test
    public void rewritesAreLogged() {
        StringBuilder builder = new StringBuilder();
        Logger.INSTANCE.setDebugStream(builder);
        Logger.INSTANCE.setLoggingLevel("RemoveConsecutiveH", 2);

        QIRCompiler compiler = new QIRCompiler();
        DAGCircuit circuit = new CircuitBuilder(1).h(0).h(0).build();
        new RemoveConsecutiveH(compiler).apply(circuit);
        String log = builder.toString();
        Assert.assertTrue(log, log.contains("RemoveConsecutiveH: "));
        Assert.assertTrue(log, log.contains("rewrote 1 instances"));
    }

    @Test
    public void silentByDefault() {
        StringBuilder builder = new StringBuilder();
        Logger.INSTANCE.setDebugStream(builder);
        QIRCompiler compiler = new QIRCompiler();
        compiler.optimize(new CircuitBuilder(1).h(0).h(0).build());
        Assert.assertEquals("", builder.toString());
        Assert.assertEquals(0, Logger.INSTANCE.getLoggingLevel(RemoveConsecutiveH.class));
    }

    @Test
    public void unknownClass() {
        Assert.assertThrows(CompilationError.class,
                () -> Logger.INSTANCE.setLoggingLevel("NoSuchClass", 1));
    }
}
