package org.qdag.qirCompiler.compiler.optimizer.rules;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.DAGOpNode;
import org.qdag.qirCompiler.circuit.GateKind;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.frontend.CircuitTemplates;
import org.qdag.qirCompiler.compiler.optimizer.PeepholeRule;
import org.qdag.util.Logger;

/** Prepares the low T-count decomposition for every CCX gate.
 * The decomposition is not spliced in: CCX nodes are left unchanged. */
public class ToffoliTCountReduction extends PeepholeRule {
    public ToffoliTCountReduction(QIRCompiler compiler) {
        super(compiler);
    }

    @Override
    protected int rewrite(DAGCircuit circuit) {
        for (DAGOpNode node: circuit.opNodes(GateKind.CCX)) {
            DAGCircuit template = CircuitTemplates.optimizedToffoli();
            // TODO: splice the template in with circuit.substituteWithSubgraph(node, template)
            Logger.INSTANCE.belowLevel(this, 2)
                    .append(this.getName())
                    .append(": ")
                    .append(node.toString())
                    .append(" has a decomposition with ")
                    .append(template.operationCount())
                    .append(" operations")
                    .newline();
        }
        return 0;
    }
}
