package org.qdag.qirCompiler.circuit;

import com.google.common.collect.ImmutableList;
import org.qdag.qirCompiler.compiler.errors.CompilationError;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** One operation of a circuit as a plain value: the gate kind, the indexes
 * of the wires it acts on and its parameters.  This is the form in which
 * circuits enter and leave a {@link DAGCircuit}. */
public record GateRecord(GateKind kind, ImmutableList<Integer> qubits, ImmutableList<Double> params) {
    public GateRecord(GateKind kind, List<Integer> qubits, List<Double> params) {
        this(kind, ImmutableList.copyOf(qubits), ImmutableList.copyOf(params));
    }

    public static GateRecord of(GateKind kind, int... qubits) {
        ImmutableList.Builder<Integer> builder = ImmutableList.builder();
        for (int q: qubits)
            builder.add(q);
        return new GateRecord(kind, builder.build(), ImmutableList.of());
    }

    public static GateRecord rotation(GateKind kind, int qubit, double angle) {
        return new GateRecord(kind, ImmutableList.of(qubit), ImmutableList.of(angle));
    }

    /** Check the record against the gate signature and the number of wires
     * of the circuit it is meant for.
     * @throws CompilationError when the record is malformed. */
    public void validate(int qubitCount) {
        if (!this.kind.acceptsArity(this.qubits.size()))
            throw new CompilationError("Gate " + this.kind + " expects " + this.kind.arity +
                    " operands, got " + this.qubits.size() + ": " + this);
        if (this.params.size() != this.kind.parameterCount)
            throw new CompilationError("Gate " + this.kind + " expects " + this.kind.parameterCount +
                    " parameters, got " + this.params.size() + ": " + this);
        Set<Integer> seen = new HashSet<>();
        for (int q: this.qubits) {
            if (q < 0 || q >= qubitCount)
                throw new CompilationError("Qubit " + q + " out of range for a circuit with " +
                        qubitCount + " qubits: " + this);
            if (!seen.add(q))
                throw new CompilationError("Qubit " + q + " used twice: " + this);
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(this.kind);
        if (!this.params.isEmpty()) {
            builder.append("(");
            for (int i = 0; i < this.params.size(); i++) {
                if (i > 0)
                    builder.append(", ");
                builder.append(this.params.get(i));
            }
            builder.append(")");
        }
        for (int i = 0; i < this.qubits.size(); i++) {
            builder.append(i == 0 ? " " : ", ")
                    .append("q[")
                    .append(this.qubits.get(i))
                    .append("]");
        }
        return builder.toString();
    }
}
