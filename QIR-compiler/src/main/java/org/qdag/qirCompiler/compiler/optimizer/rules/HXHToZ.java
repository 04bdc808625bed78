package org.qdag.qirCompiler.compiler.optimizer.rules;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.DAGOpNode;
import org.qdag.qirCompiler.circuit.GateKind;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.errors.RewriteException;
import org.qdag.qirCompiler.compiler.optimizer.PeepholeRule;

/** Replace the gate pattern H - X - H with Z. */
public class HXHToZ extends PeepholeRule {
    public HXHToZ(QIRCompiler compiler) {
        super(compiler);
    }

    @Override
    protected int rewrite(DAGCircuit circuit) {
        int rewrites = 0;
        for (DAGOpNode node: circuit.topologicalOpNodes()) {
            if (!circuit.contains(node) || !node.is(GateKind.H))
                continue;
            DAGOpNode x = uniqueOpSuccessor(circuit, node);
            if (x == null || !x.is(GateKind.X))
                continue;
            DAGOpNode h = uniqueOpSuccessor(circuit, x);
            if (h == null || !h.is(GateKind.H))
                continue;
            try {
                circuit.substitute(node, GateKind.Z);
                circuit.remove(x);
                circuit.remove(h);
                this.rewrote(node, "h x h -> z");
                rewrites++;
            } catch (RewriteException ex) {
                this.skipped(node, ex);
            }
        }
        return rewrites;
    }
}
