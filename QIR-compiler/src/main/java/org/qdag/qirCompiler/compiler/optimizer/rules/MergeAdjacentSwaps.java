package org.qdag.qirCompiler.compiler.optimizer.rules;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.DAGNode;
import org.qdag.qirCompiler.circuit.DAGOpNode;
import org.qdag.qirCompiler.circuit.GateKind;
import org.qdag.qirCompiler.circuit.Wire;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.optimizer.PeepholeRule;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/** Removes a SWAP together with a following SWAP that shares exactly one wire with it.
 * Note that this does not preserve the semantics of the circuit. */
public class MergeAdjacentSwaps extends PeepholeRule {
    public MergeAdjacentSwaps(QIRCompiler compiler) {
        super(compiler);
    }

    @Override
    protected int rewrite(DAGCircuit circuit) {
        Set<DAGOpNode> toRemove = new LinkedHashSet<>();
        for (DAGOpNode swap: circuit.opNodes(GateKind.SWAP)) {
            if (toRemove.contains(swap))
                continue;
            for (DAGNode succ: circuit.successors(swap)) {
                DAGOpNode other = succ.as(DAGOpNode.class);
                if (other == null || !other.is(GateKind.SWAP) || toRemove.contains(other))
                    continue;
                Set<Wire> common = new HashSet<>(swap.qubits);
                common.retainAll(other.qubits);
                if (common.size() == 1) {
                    toRemove.add(swap);
                    toRemove.add(other);
                    break;
                }
            }
        }
        return this.removeAll(circuit, toRemove) / 2;
    }
}
