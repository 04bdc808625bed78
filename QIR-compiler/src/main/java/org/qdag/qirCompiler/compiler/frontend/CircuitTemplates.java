package org.qdag.qirCompiler.compiler.frontend;

import org.qdag.qirCompiler.circuit.DAGCircuit;

/** Fixed circuits used as replacement templates. */
public final class CircuitTemplates {
    private CircuitTemplates() {}

    /** A 3-qubit decomposition of the Toffoli gate with 4 T gates (after Amy et al.).
     * Wires 0 and 1 are the controls, wire 2 the target. */
    public static DAGCircuit optimizedToffoli() {
        return new CircuitBuilder(3)
                .h(2)
                .t(2)
                .cx(1, 2)
                .tdg(2)
                .cx(0, 2)
                .t(2)
                .cx(1, 2)
                .tdg(2)
                .cx(0, 2)
                .t(1)
                .h(2)
                .build();
    }
}
