package org.qdag.qirCompiler.compiler.optimizer;

import org.junit.Assert;
import org.junit.Test;
import org.qdag.qirCompiler.circuit.CircuitInvariants;
import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.DAGOpNode;
import org.qdag.qirCompiler.circuit.GateKind;
import org.qdag.qirCompiler.compiler.CompilerOptions;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.errors.PipelineNonTerminationException;
import org.qdag.qirCompiler.compiler.frontend.CircuitBuilder;
import org.qdag.qirCompiler.compiler.optimizer.rules.HXHToZ;
import org.qdag.qirCompiler.compiler.optimizer.rules.RemoveConsecutiveH;
import org.qdag.qirCompiler.compiler.optimizer.rules.XHXToHZ;

import java.util.List;

import static org.qdag.qirCompiler.TestUtilities.checkingCompiler;
import static org.qdag.qirCompiler.TestUtilities.program;

public class PipelineTests {
    /** Turns every X into Y and every Y into X, so it never reaches a fixpoint. */
    static class FlipXY extends PeepholeRule {
        FlipXY(QIRCompiler compiler) {
            super(compiler);
        }

        @Override
        protected int rewrite(DAGCircuit circuit) {
            int count = 0;
            for (DAGOpNode node: circuit.topologicalOpNodes()) {
                if (node.is(GateKind.X)) {
                    circuit.substitute(node, GateKind.Y);
                    count++;
                } else if (node.is(GateKind.Y)) {
                    circuit.substitute(node, GateKind.X);
                    count++;
                }
            }
            return count;
        }
    }

    @Test
    public void singlePass() {
        QIRCompiler compiler = checkingCompiler();
        DAGCircuit circuit = new CircuitBuilder(1).h(0).h(0).build();
        PipelineResult result = compiler.optimize(circuit);
        Assert.assertSame(circuit, result.circuit());
        Assert.assertEquals(1, result.iterations());
        Assert.assertFalse(result.converged());
        Assert.assertFalse(result.boundExceeded());
        Assert.assertEquals("", program(circuit));

        result = compiler.optimize(circuit);
        Assert.assertTrue(result.converged());
    }

    @Test
    public void rulesRunInOrder() {
        // HXH -> Z runs before the consecutive H removal, which never sees the pair h h
        QIRCompiler compiler = checkingCompiler();
        DAGCircuit circuit = new CircuitBuilder(1).h(0).x(0).h(0).h(0).build();
        compiler.optimize(circuit);
        Assert.assertEquals("z q[0]; h q[0]", program(circuit));
    }

    @Test
    public void fixpointReachesNormalForm() {
        CompilerOptions options = new CompilerOptions();
        options.optimizerOptions.fixpoint = true;
        options.optimizerOptions.checkInvariants = true;
        QIRCompiler compiler = new QIRCompiler(options);
        // The first pass leaves x h x, which the second pass rewrites
        DAGCircuit circuit = new CircuitBuilder(1).x(0).h(0).h(0).h(0).x(0).build();
        PipelineResult result = compiler.optimize(circuit);
        Assert.assertTrue(result.converged());
        Assert.assertFalse(result.boundExceeded());
        Assert.assertEquals(3, result.iterations());
        Assert.assertEquals("h q[0]; z q[0]", program(result.circuit()));
        Assert.assertEquals(0, compiler.messages.warningCount());
    }

    @Test
    public void fixpointOnOptimalCircuit() {
        CompilerOptions options = new CompilerOptions();
        options.optimizerOptions.fixpoint = true;
        QIRCompiler compiler = new QIRCompiler(options);
        DAGCircuit circuit = new CircuitBuilder(2).h(0).cx(0, 1).build();
        PipelineResult result = compiler.optimize(circuit);
        Assert.assertTrue(result.converged());
        Assert.assertEquals(1, result.iterations());
        Assert.assertEquals("h q[0]; cx q[0], q[1]", program(circuit));
    }

    @Test
    public void nonTerminationIsReported() {
        QIRCompiler compiler = checkingCompiler();
        Repeat repeat = new Repeat(compiler, new FlipXY(compiler), 3);
        DAGCircuit circuit = new CircuitBuilder(1).x(0).build();
        PipelineResult result = repeat.repeat(circuit);
        Assert.assertFalse(result.converged());
        Assert.assertTrue(result.boundExceeded());
        Assert.assertEquals(3, result.iterations());
        Assert.assertNotNull(result.nonTermination());
        Assert.assertEquals(3, result.nonTermination().iterations);
        // Three flips: x -> y -> x -> y
        Assert.assertEquals("y q[0]", program(result.circuit()));
        CircuitInvariants.check(result.circuit());

        Assert.assertEquals(1, compiler.messages.warningCount());
        Assert.assertEquals(0, compiler.messages.errorCount());
        Assert.assertEquals("PipelineNonTermination", compiler.messages.getMessage(0).errorType);
        Assert.assertFalse(compiler.hasErrors());
    }

    @Test
    public void nonTerminationCanThrow() {
        CompilerOptions options = new CompilerOptions();
        options.optimizerOptions.throwOnNonTermination = true;
        QIRCompiler compiler = new QIRCompiler(options);
        Repeat repeat = new Repeat(compiler, new FlipXY(compiler), 2);
        DAGCircuit circuit = new CircuitBuilder(1).y(0).build();
        PipelineNonTerminationException ex = Assert.assertThrows(PipelineNonTerminationException.class,
                () -> repeat.repeat(circuit));
        Assert.assertEquals(2, ex.iterations);
        Assert.assertEquals("y q[0]", program(circuit));
    }

    @Test
    public void boundComesFromOptions() {
        CompilerOptions options = new CompilerOptions();
        options.optimizerOptions.fixpoint = true;
        options.optimizerOptions.maxIterations = 4;
        QIRCompiler compiler = new QIRCompiler(options);
        PeepholeOptimizer optimizer = new PeepholeOptimizer(compiler, List.of(new FlipXY(compiler)));
        PipelineResult result = optimizer.run(new CircuitBuilder(1).x(0).build());
        Assert.assertTrue(result.boundExceeded());
        Assert.assertEquals(4, result.iterations());
        Assert.assertEquals("x q[0]", program(result.circuit()));
    }

    @Test
    public void customRuleList() {
        QIRCompiler compiler = checkingCompiler();
        Passes passes = new Passes("Custom", compiler, new XHXToHZ(compiler), new HXHToZ(compiler));
        passes.add(new RemoveConsecutiveH(compiler));
        Assert.assertEquals(3, passes.passes.size());
        DAGCircuit circuit = new CircuitBuilder(1).x(0).h(0).x(0).h(0).h(0).build();
        circuit = passes.apply(circuit);
        Assert.assertEquals("h q[0]; z q[0]", program(circuit));
    }

    @Test
    public void passesOwnTheirRuleList() {
        QIRCompiler compiler = checkingCompiler();
        List<CircuitTransform> rules = List.of(new XHXToHZ(compiler));
        Passes passes = new Passes("Immutable", compiler, rules);
        passes.add(new RemoveConsecutiveH(compiler));
        Assert.assertEquals(2, passes.passes.size());
        Assert.assertEquals(1, rules.size());

        PeepholeOptimizer optimizer = new PeepholeOptimizer(compiler, rules);
        optimizer.add(new HXHToZ(compiler));
        DAGCircuit circuit = new CircuitBuilder(1).x(0).h(0).x(0).h(0).x(0).h(0).build();
        Assert.assertEquals("h q[0]; z q[0]; z q[0]", program(optimizer.run(circuit).circuit()));
    }
}
