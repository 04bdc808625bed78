package org.qdag.qirCompiler.compiler.optimizer.rules;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.DAGOpNode;
import org.qdag.qirCompiler.circuit.GateKind;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.errors.RewriteException;
import org.qdag.qirCompiler.compiler.optimizer.PeepholeRule;

/** Replace the gate pattern X - H - X with H - Z.
 * That is, x h x = h z (up to global phase, which doesn't affect measurement). */
public class XHXToHZ extends PeepholeRule {
    public XHXToHZ(QIRCompiler compiler) {
        super(compiler);
    }

    @Override
    protected int rewrite(DAGCircuit circuit) {
        int rewrites = 0;
        for (DAGOpNode node: circuit.topologicalOpNodes()) {
            if (!circuit.contains(node) || !node.is(GateKind.X))
                continue;
            DAGOpNode h = uniqueOpSuccessor(circuit, node);
            if (h == null || !h.is(GateKind.H))
                continue;
            DAGOpNode x = uniqueOpSuccessor(circuit, h);
            if (x == null || !x.is(GateKind.X))
                continue;
            try {
                circuit.substitute(node, GateKind.H);
                circuit.substitute(h, GateKind.Z);
                circuit.remove(x);
                this.rewrote(node, "x h x -> h z");
                rewrites++;
            } catch (RewriteException ex) {
                this.skipped(node, ex);
            }
        }
        return rewrites;
    }
}
