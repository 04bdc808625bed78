package org.qdag.qirCompiler.compiler.frontend;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.GateKind;
import org.qdag.qirCompiler.circuit.GateRecord;
import org.qdag.qirCompiler.compiler.errors.CompilationError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Accumulates the operations of a circuit in program order.
 * Each operation is validated when added. */
public class CircuitBuilder {
    public final int qubitCount;
    private final List<GateRecord> records;

    public CircuitBuilder(int qubitCount) {
        if (qubitCount < 0)
            throw new CompilationError("Negative number of qubits: " + qubitCount);
        this.qubitCount = qubitCount;
        this.records = new ArrayList<>();
    }

    /** @throws CompilationError if the record does not fit this circuit. */
    public CircuitBuilder add(GateRecord record) {
        record.validate(this.qubitCount);
        this.records.add(record);
        return this;
    }

    public CircuitBuilder gate(GateKind kind, int... qubits) {
        return this.add(GateRecord.of(kind, qubits));
    }

    public CircuitBuilder id(int qubit) { return this.gate(GateKind.I, qubit); }
    public CircuitBuilder x(int qubit) { return this.gate(GateKind.X, qubit); }
    public CircuitBuilder y(int qubit) { return this.gate(GateKind.Y, qubit); }
    public CircuitBuilder z(int qubit) { return this.gate(GateKind.Z, qubit); }
    public CircuitBuilder h(int qubit) { return this.gate(GateKind.H, qubit); }
    public CircuitBuilder s(int qubit) { return this.gate(GateKind.S, qubit); }
    public CircuitBuilder sdg(int qubit) { return this.gate(GateKind.SDG, qubit); }
    public CircuitBuilder t(int qubit) { return this.gate(GateKind.T, qubit); }
    public CircuitBuilder tdg(int qubit) { return this.gate(GateKind.TDG, qubit); }

    public CircuitBuilder rx(int qubit, double angle) {
        return this.add(GateRecord.rotation(GateKind.RX, qubit, angle));
    }

    public CircuitBuilder ry(int qubit, double angle) {
        return this.add(GateRecord.rotation(GateKind.RY, qubit, angle));
    }

    public CircuitBuilder rz(int qubit, double angle) {
        return this.add(GateRecord.rotation(GateKind.RZ, qubit, angle));
    }

    public CircuitBuilder p(int qubit, double angle) {
        return this.add(GateRecord.rotation(GateKind.P, qubit, angle));
    }

    public CircuitBuilder cx(int control, int target) { return this.gate(GateKind.CX, control, target); }
    public CircuitBuilder cz(int control, int target) { return this.gate(GateKind.CZ, control, target); }
    public CircuitBuilder swap(int a, int b) { return this.gate(GateKind.SWAP, a, b); }

    public CircuitBuilder ccx(int c0, int c1, int target) {
        return this.gate(GateKind.CCX, c0, c1, target);
    }

    public CircuitBuilder ccz(int c0, int c1, int target) {
        return this.gate(GateKind.CCZ, c0, c1, target);
    }

    public CircuitBuilder mcz(int... qubits) {
        return this.gate(GateKind.MCZ, qubits);
    }

    public List<GateRecord> getRecords() {
        return Collections.unmodifiableList(this.records);
    }

    public DAGCircuit build() {
        return DAGCircuit.fromRecords(this.qubitCount, this.records);
    }
}
