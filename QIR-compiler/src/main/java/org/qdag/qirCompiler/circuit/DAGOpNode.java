package org.qdag.qirCompiler.circuit;

import com.google.common.collect.ImmutableList;
import org.qdag.util.Linq;

import java.util.List;

/** A gate applied to some wires.  The wires never change; the gate
 * and its parameters are replaced by {@link DAGCircuit#substitute}. */
public final class DAGOpNode extends DAGNode {
    private GateKind kind;
    private ImmutableList<Double> params;
    public final ImmutableList<Wire> qubits;

    DAGOpNode(GateKind kind, List<Wire> qubits, List<Double> params) {
        this.kind = kind;
        this.qubits = ImmutableList.copyOf(qubits);
        this.params = ImmutableList.copyOf(params);
    }

    public GateKind getKind() {
        return this.kind;
    }

    public ImmutableList<Double> getParams() {
        return this.params;
    }

    public double getParam(int index) {
        return this.params.get(index);
    }

    public String getName() {
        return this.kind.gateName;
    }

    public boolean is(GateKind kind) {
        return this.kind == kind;
    }

    @Override
    public List<Wire> getWires() {
        return this.qubits;
    }

    void setOperation(GateKind kind, List<Double> params) {
        this.kind = kind;
        this.params = ImmutableList.copyOf(params);
    }

    public GateRecord toRecord() {
        return new GateRecord(this.kind, Linq.map(this.qubits, Wire::index), this.params);
    }

    @Override
    public String toString() {
        return this.id + ":" + this.toRecord();
    }
}
