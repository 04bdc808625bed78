package org.qdag.qirCompiler.compiler.frontend;

import org.junit.Assert;
import org.junit.Test;
import org.qdag.qirCompiler.circuit.CircuitInvariants;
import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.compiler.errors.CompilationError;

import java.util.List;

import static org.qdag.qirCompiler.TestUtilities.program;

public class OracleBuilderTests {
    @Test
    public void singleState() {
        // The rightmost bit is wire 0
        DAGCircuit oracle = OracleBuilder.groverOracle("01");
        CircuitInvariants.check(oracle);
        Assert.assertEquals(2, oracle.getQubitCount());
        Assert.assertEquals("x q[1]; mcz q[0], q[1]; x q[1]", program(oracle));
    }

    @Test
    public void allOnesNeedsNoFlips() {
        DAGCircuit oracle = OracleBuilder.groverOracle("111");
        Assert.assertEquals("mcz q[0], q[1], q[2]", program(oracle));
    }

    @Test
    public void severalStates() {
        DAGCircuit oracle = OracleBuilder.groverOracle(List.of("110", "000"));
        CircuitInvariants.check(oracle);
        Assert.assertEquals("x q[0]; mcz q[0], q[1], q[2]; x q[0]; " +
                "x q[0]; x q[1]; x q[2]; mcz q[0], q[1], q[2]; x q[0]; x q[1]; x q[2]", program(oracle));
    }

    @Test
    public void malformedStates() {
        Assert.assertThrows(CompilationError.class, () -> OracleBuilder.groverOracle(List.of()));
        Assert.assertThrows(CompilationError.class, () -> OracleBuilder.groverOracle(""));
        Assert.assertThrows(CompilationError.class, () -> OracleBuilder.groverOracle("01", "011"));
        Assert.assertThrows(CompilationError.class, () -> OracleBuilder.groverOracle("0a"));
    }
}
