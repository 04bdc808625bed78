package org.qdag.qirCompiler.compiler.optimizer.rules;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.DAGOpNode;
import org.qdag.qirCompiler.circuit.GateKind;
import org.qdag.qirCompiler.circuit.Wire;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.errors.RewriteException;
import org.qdag.qirCompiler.compiler.optimizer.PeepholeRule;
import org.qdag.util.Linq;

import java.util.List;

/**
 * Reduces the T-count around a pair of CX gates.
 * The match starts at a T whose only successor is a CX on the same wire.
 * That CX must be followed by exactly two operations, a CX and a TDG,
 * and the only operation after the second CX must be a T.
 * The trailing T, the second CX and the TDG are removed;
 * the leading T and the first CX stay.
 */
public class TCountTemplateReduction extends PeepholeRule {
    public TCountTemplateReduction(QIRCompiler compiler) {
        super(compiler);
    }

    @Override
    protected int rewrite(DAGCircuit circuit) {
        int rewrites = 0;
        for (DAGOpNode node: circuit.topologicalOpNodes()) {
            if (!circuit.contains(node) || !node.is(GateKind.T))
                continue;
            Wire qubit = node.qubits.get(0);
            DAGOpNode cx1 = uniqueOpSuccessor(circuit, node);
            if (cx1 == null || !cx1.is(GateKind.CX) || !cx1.qubits.contains(qubit))
                continue;
            List<DAGOpNode> next = circuit.opSuccessors(cx1);
            if (next.size() != 2 || !next.get(0).is(GateKind.CX) || !next.get(1).is(GateKind.TDG))
                continue;
            DAGOpNode cx2 = next.get(0);
            DAGOpNode tdg = next.get(1);
            List<DAGOpNode> after = circuit.opSuccessors(cx2);
            if (after.size() != 1 || !after.get(0).is(GateKind.T))
                continue;
            DAGOpNode trailing = after.get(0);
            try {
                for (DAGOpNode removed: Linq.list(trailing, cx2, tdg))
                    circuit.remove(removed);
                this.rewrote(node, "removed " + trailing + ", " + cx2 + ", " + tdg);
                rewrites++;
            } catch (RewriteException ex) {
                this.skipped(node, ex);
            }
        }
        return rewrites;
    }
}
