package org.qdag.qirCompiler;

import org.junit.Assert;
import org.qdag.qirCompiler.circuit.CircuitInvariants;
import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.GateRecord;
import org.qdag.qirCompiler.compiler.CompilerOptions;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.optimizer.CircuitTransform;

import java.util.List;
import java.util.stream.Collectors;

public class TestUtilities {
    private TestUtilities() {}

    /** A compiler that checks the circuit invariants after every rule. */
    public static QIRCompiler checkingCompiler() {
        CompilerOptions options = new CompilerOptions();
        options.optimizerOptions.checkInvariants = true;
        return new QIRCompiler(options);
    }

    /** The operations of a circuit in program order, separated by semicolons. */
    public static String program(DAGCircuit circuit) {
        return program(circuit.toRecords());
    }

    public static String program(List<GateRecord> records) {
        return records.stream()
                .map(GateRecord::toString)
                .collect(Collectors.joining("; "));
    }

    /** Apply a transform and check that the result is well-formed. */
    public static DAGCircuit applyChecked(CircuitTransform transform, DAGCircuit circuit) {
        DAGCircuit result = transform.apply(circuit);
        CircuitInvariants.check(result);
        return result;
    }

    /** Apply a rule twice; the second application must leave the circuit untouched. */
    public static DAGCircuit applyTwice(CircuitTransform rule, DAGCircuit circuit) {
        DAGCircuit result = applyChecked(rule, circuit);
        long version = result.getVersion();
        String text = result.toString();
        result = applyChecked(rule, result);
        Assert.assertEquals(version, result.getVersion());
        Assert.assertEquals(text, result.toString());
        return result;
    }
}
