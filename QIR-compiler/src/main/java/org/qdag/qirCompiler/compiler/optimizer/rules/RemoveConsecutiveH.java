package org.qdag.qirCompiler.compiler.optimizer.rules;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.DAGOpNode;
import org.qdag.qirCompiler.circuit.GateKind;
import org.qdag.qirCompiler.circuit.Wire;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.optimizer.PeepholeRule;

import java.util.LinkedHashSet;
import java.util.Set;

/** Removes pairs of consecutive H gates on the same qubit with nothing in between.
 * Pairs are collected first and removed afterwards; an H belongs to at most one pair. */
public class RemoveConsecutiveH extends PeepholeRule {
    public RemoveConsecutiveH(QIRCompiler compiler) {
        super(compiler);
    }

    @Override
    protected int rewrite(DAGCircuit circuit) {
        Set<DAGOpNode> toRemove = new LinkedHashSet<>();
        for (DAGOpNode node: circuit.opNodes(GateKind.H)) {
            if (toRemove.contains(node))
                continue;
            Wire qubit = node.qubits.get(0);
            DAGOpNode next = uniqueOpSuccessor(circuit, node);
            if (next != null && next.is(GateKind.H) &&
                    !toRemove.contains(next) &&
                    next.qubits.get(0).equals(qubit)) {
                toRemove.add(node);
                toRemove.add(next);
            }
        }

        return this.removeAll(circuit, toRemove) / 2;
    }
}
