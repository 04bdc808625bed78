package org.qdag.qirCompiler.compiler.optimizer;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.DAGNode;
import org.qdag.qirCompiler.circuit.DAGOpNode;
import org.qdag.qirCompiler.compiler.ICompilerComponent;
import org.qdag.qirCompiler.compiler.QIRCompiler;
import org.qdag.qirCompiler.compiler.errors.RewriteException;
import org.qdag.util.IWritesLogs;
import org.qdag.util.Logger;

import javax.annotation.Nullable;
import java.util.List;

/** Base class for local rewrite rules.  A rule scans the circuit,
 * finds instances of one pattern and rewrites them in place.
 * Rules keep no state between invocations. */
public abstract class PeepholeRule implements CircuitTransform, IWritesLogs, ICompilerComponent {
    static long crtId = 0;
    final QIRCompiler compiler;
    public final long id;

    protected PeepholeRule(QIRCompiler compiler) {
        this.compiler = compiler;
        this.id = crtId++;
    }

    @Override
    public QIRCompiler compiler() {
        return this.compiler;
    }

    /** Rewrite all instances of the pattern.
     * @return The number of rewrites performed. */
    protected abstract int rewrite(DAGCircuit circuit);

    @Override
    public DAGCircuit apply(DAGCircuit circuit) {
        int rewrites = this.rewrite(circuit);
        Logger.INSTANCE.belowLevel(this, 1)
                .append(this.toString())
                .append(" rewrote ")
                .append(rewrites)
                .append(" instances")
                .newline();
        return circuit;
    }

    /** The only operation that follows a node, or null if there are
     * none or several.  Terminals are not counted. */
    @Nullable
    protected static DAGOpNode uniqueOpSuccessor(DAGCircuit circuit, DAGNode node) {
        List<DAGOpNode> successors = circuit.opSuccessors(node);
        if (successors.size() != 1)
            return null;
        return successors.get(0);
    }

    protected void rewrote(DAGNode node, String rewrite) {
        Logger.INSTANCE.belowLevel(this, 2)
                .append(this.getName())
                .append(": ")
                .append(node.toString())
                .append(" ")
                .append(rewrite)
                .newline();
    }

    /** Remove the given nodes, skipping the ones the circuit refuses to remove.
     * @return The number of nodes removed. */
    protected int removeAll(DAGCircuit circuit, Iterable<DAGOpNode> nodes) {
        int removed = 0;
        for (DAGOpNode node: nodes) {
            try {
                circuit.remove(node);
                this.rewrote(node, "removed");
                removed++;
            } catch (RewriteException ex) {
                this.skipped(node, ex);
            }
        }
        return removed;
    }

    /** A mutation was refused; the candidate match is abandoned. */
    protected void skipped(DAGNode candidate, RewriteException ex) {
        Logger.INSTANCE.belowLevel(this, 1)
                .append(this.getName())
                .append(": skipping ")
                .append(candidate.toString())
                .append(": ")
                .append(ex.getErrorKind())
                .append(" ")
                .append(ex.getMessage())
                .newline();
    }

    @Override
    public String getName() {
        return this.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return this.id + " " + this.getName();
    }
}
