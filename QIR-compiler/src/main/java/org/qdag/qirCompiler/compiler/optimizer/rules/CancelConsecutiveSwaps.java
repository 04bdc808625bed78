package org.qdag.qirCompiler.compiler.optimizer.rules;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.DAGNode;
import org.qdag.qirCompiler.circuit.DAGOpNode;
import org.qdag.qirCompiler.circuit.GateKind;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.optimizer.PeepholeRule;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/** Removes a SWAP immediately followed by a SWAP on the same two wires. */
public class CancelConsecutiveSwaps extends PeepholeRule {
    public CancelConsecutiveSwaps(QIRCompiler compiler) {
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
                if (new HashSet<>(swap.qubits).equals(new HashSet<>(other.qubits))) {
                    toRemove.add(swap);
                    toRemove.add(other);
                    break;
                }
            }
        }
        return this.removeAll(circuit, toRemove) / 2;
    }
}
