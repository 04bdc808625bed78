package org.qdag.qirCompiler.compiler.optimizer.rules;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.DAGNode;
import org.qdag.qirCompiler.circuit.DAGOpNode;
import org.qdag.qirCompiler.circuit.GateKind;
import org.qdag.qirCompiler.circuit.Wire;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.errors.RewriteException;
import org.qdag.qirCompiler.compiler.optimizer.PeepholeRule;
import org.qdag.util.Linq;
import org.qdag.util.Utilities;

import java.util.List;

/** Merges directly connected rotations of one kind on the same wire
 * into a single rotation by the sum of the angles.  Angles are not
 * normalized. */
public class MergeConsecutiveRotations extends PeepholeRule {
    public final GateKind kind;

    public MergeConsecutiveRotations(QIRCompiler compiler, GateKind kind) {
        super(compiler);
        Utilities.enforce(kind.isRotation() && kind.arity == 1, kind + " is not a single-qubit rotation");
        this.kind = kind;
    }

    @Override
    protected int rewrite(DAGCircuit circuit) {
        int rewrites = 0;
        List<DAGOpNode> rotations = circuit.opNodes(this.kind);
        for (Wire wire: circuit.getWires()) {
            List<DAGOpNode> nodes = Linq.where(rotations, n -> n.qubits.get(0).equals(wire));
            int i = 0;
            while (i < nodes.size() - 1) {
                DAGOpNode current = nodes.get(i);
                DAGOpNode next = nodes.get(i + 1);
                DAGNode predecessor = circuit.predecessors(next).iterator().next();
                if (predecessor != current) {
                    i++;
                    continue;
                }
                double sum = current.getParam(0) + next.getParam(0);
                try {
                    circuit.substitute(current, this.kind, List.of(sum));
                    circuit.remove(next);
                    nodes.remove(i + 1);
                    this.rewrote(current, "merged with " + next);
                    rewrites++;
                } catch (RewriteException ex) {
                    this.skipped(current, ex);
                    i++;
                }
            }
        }
        return rewrites;
    }

    @Override
    public String getName() {
        return "MergeConsecutive" + this.kind.name();
    }
}
