package org.qdag.qirCompiler.circuit;

import com.google.common.collect.ImmutableList;
import org.qdag.qirCompiler.compiler.errors.ArityMismatchException;
import org.qdag.qirCompiler.compiler.errors.InvalidRemovalException;
import org.qdag.qirCompiler.compiler.errors.NodeNotFoundException;
import org.qdag.qirCompiler.compiler.errors.TemplateArityMismatchException;
import org.qdag.util.IHasId;
import org.qdag.util.IIndentStream;
import org.qdag.util.Linq;
import org.qdag.util.ToIndentableString;
import org.qdag.util.Utilities;
import org.qdag.util.graph.DiGraph;
import org.qdag.util.graph.Port;
import org.qdag.util.graph.TopologicalOrder;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A circuit represented as a DAG.  Each wire is a path of edges from its
 * {@link DAGInNode} through the {@link DAGOpNode}s using it to its {@link DAGOutNode}.
 * An edge is represented twice: as the successor of its source on the wire
 * and as the predecessor of its destination on the wire.
 *
 * <p>The circuit is mutated in place.  Every mutation checks all its
 * preconditions before touching an edge, so a refused mutation leaves
 * the circuit unchanged.
 */
public class DAGCircuit implements DiGraph<DAGNode>, IHasId, ToIndentableString {
    static long crtId = 0;
    private final long id;
    private final ImmutableList<Wire> wires;
    private final List<DAGInNode> inputs;
    private final List<DAGOutNode> outputs;
    private final Set<DAGNode> nodes = new LinkedHashSet<>();
    private final Map<DAGNode, Map<Wire, DAGNode>> next = new HashMap<>();
    private final Map<DAGNode, Map<Wire, DAGNode>> previous = new HashMap<>();
    /** Incremented by every mutation. */
    private long version = 0;

    public DAGCircuit(int qubitCount) {
        Utilities.enforce(qubitCount >= 0, "Negative qubit count " + qubitCount);
        this.id = crtId++;
        ImmutableList.Builder<Wire> builder = ImmutableList.builder();
        for (int i = 0; i < qubitCount; i++)
            builder.add(new Wire(i));
        this.wires = builder.build();
        this.inputs = new ArrayList<>();
        this.outputs = new ArrayList<>();
        for (Wire wire: this.wires) {
            DAGInNode in = new DAGInNode(wire);
            this.addNode(in);
            this.inputs.add(in);
        }
        for (Wire wire: this.wires) {
            DAGOutNode out = new DAGOutNode(wire);
            this.addNode(out);
            this.outputs.add(out);
            this.link(this.inputs.get(wire.index()), out, wire);
        }
    }

    /** Build a circuit from a list of operations, in program order. */
    public static DAGCircuit fromRecords(int qubitCount, Iterable<GateRecord> records) {
        DAGCircuit result = new DAGCircuit(qubitCount);
        for (GateRecord record: records)
            result.append(record);
        return result;
    }

    @Override
    public long getId() {
        return this.id;
    }

    public long getVersion() {
        return this.version;
    }

    public int getQubitCount() {
        return this.wires.size();
    }

    public List<Wire> getWires() {
        return this.wires;
    }

    public Wire wire(int index) {
        Utilities.enforce(index >= 0 && index < this.wires.size(),
                "Wire " + index + " out of range for circuit with " + this.wires.size() + " wires");
        return this.wires.get(index);
    }

    public DAGInNode inputNode(Wire wire) {
        return this.inputs.get(this.wire(wire.index()).index());
    }

    public DAGOutNode outputNode(Wire wire) {
        return this.outputs.get(this.wire(wire.index()).index());
    }

    /** Number of nodes, terminals included. */
    public int size() {
        return this.nodes.size();
    }

    public int operationCount() {
        return this.nodes.size() - 2 * this.wires.size();
    }

    public boolean contains(DAGNode node) {
        return this.nodes.contains(node);
    }

    private void addNode(DAGNode node) {
        Utilities.enforce(this.nodes.add(node), "Node " + node + " added twice");
        Utilities.putNew(this.next, node, new HashMap<>());
        Utilities.putNew(this.previous, node, new HashMap<>());
    }

    private void link(DAGNode source, DAGNode destination, Wire wire) {
        Utilities.getExists(this.next, source).put(wire, destination);
        Utilities.getExists(this.previous, destination).put(wire, source);
    }

    private void checkNode(DAGNode node) {
        if (!this.nodes.contains(node))
            throw new NodeNotFoundException(node);
    }

    /** Append an operation at the end of all its wires.
     * @throws org.qdag.qirCompiler.compiler.errors.CompilationError if the
     * operation does not fit the gate signature or this circuit. */
    public DAGOpNode append(GateRecord record) {
        record.validate(this.getQubitCount());
        List<Wire> qubits = Linq.map(record.qubits(), this::wire);
        DAGOpNode node = new DAGOpNode(record.kind(), qubits, record.params());
        this.addNode(node);
        for (Wire wire: qubits) {
            DAGOutNode out = this.outputs.get(wire.index());
            DAGNode frontier = Utilities.getExists(this.previous.get(out), wire);
            this.link(frontier, node, wire);
            this.link(node, out, wire);
        }
        this.version++;
        return node;
    }

    ///////////////////////// Traversal

    @Override
    public Iterable<DAGNode> getNodes() {
        return Collections.unmodifiableSet(this.nodes);
    }

    /** One port for each wire of the node that has a successor, in operand order. */
    @Override
    public List<Port<DAGNode>> getSuccessors(DAGNode node) {
        this.checkNode(node);
        Map<Wire, DAGNode> succ = this.next.get(node);
        List<Port<DAGNode>> result = new ArrayList<>();
        for (Wire wire: node.getWires()) {
            DAGNode s = succ.get(wire);
            if (s != null)
                result.add(new Port<>(s, wire.index()));
        }
        return result;
    }

    /** All nodes in program order: a topological order where nodes that
     * are ready at the same time come in insertion order.  The order is
     * recomputed each time the result is iterated. */
    public Iterable<DAGNode> topologicalNodes() {
        return () -> this.computeOrder().iterator();
    }

    private List<DAGNode> computeOrder() {
        TopologicalOrder<DAGNode> order = new TopologicalOrder<>(this, DAGNode.CREATION_ORDER);
        Utilities.enforce(order.isComplete(), "Circuit " + this.id + " has a cycle");
        return order.getOrder();
    }

    /** Operation nodes in program order. */
    public List<DAGOpNode> topologicalOpNodes() {
        return Linq.ofType(this.computeOrder(), DAGOpNode.class);
    }

    /** Operation nodes of the given kind, in program order. */
    public List<DAGOpNode> opNodes(GateKind kind) {
        return Linq.where(this.topologicalOpNodes(), n -> n.is(kind));
    }

    /** Nodes at the other end of the outgoing edges of a node, ordered by the
     * node's operand order, without duplicates. */
    public Set<DAGNode> successors(DAGNode node) {
        this.checkNode(node);
        return this.neighbors(node, this.next.get(node));
    }

    /** Nodes at the other end of the incoming edges of a node, ordered by the
     * node's operand order, without duplicates. */
    public Set<DAGNode> predecessors(DAGNode node) {
        this.checkNode(node);
        return this.neighbors(node, this.previous.get(node));
    }

    private Set<DAGNode> neighbors(DAGNode node, Map<Wire, DAGNode> edges) {
        Set<DAGNode> result = new LinkedHashSet<>();
        for (Wire wire: node.getWires()) {
            DAGNode n = edges.get(wire);
            if (n != null)
                result.add(n);
        }
        return result;
    }

    /** Operation nodes among the successors of a node. */
    public List<DAGOpNode> opSuccessors(DAGNode node) {
        return Linq.ofType(this.successors(node), DAGOpNode.class);
    }

    /** Operation nodes among the predecessors of a node. */
    public List<DAGOpNode> opPredecessors(DAGNode node) {
        return Linq.ofType(this.predecessors(node), DAGOpNode.class);
    }

    /** The successor of a node along one of its wires; null for output terminals. */
    @Nullable
    public DAGNode successor(DAGNode node, Wire wire) {
        this.checkNode(node);
        return this.next.get(node).get(wire);
    }

    /** The predecessor of a node along one of its wires; null for input terminals. */
    @Nullable
    public DAGNode predecessor(DAGNode node, Wire wire) {
        this.checkNode(node);
        return this.previous.get(node).get(wire);
    }

    ///////////////////////// Mutation

    /** Replace the gate of a node, keeping its wires and edges.
     * @throws ArityMismatchException if the new gate does not fit the node. */
    public void substitute(DAGNode node, GateKind kind, List<Double> params) {
        this.checkNode(node);
        DAGOpNode op = node.as(DAGOpNode.class);
        if (op == null)
            throw new ArityMismatchException("Terminal " + node + " cannot be replaced by " + kind, node);
        if (!kind.acceptsArity(op.qubits.size()))
            throw new ArityMismatchException("Cannot replace " + op + " with " + kind +
                    ": " + kind + " takes " + kind.arity + " operands", node);
        if (params.size() != kind.parameterCount)
            throw new ArityMismatchException("Cannot replace " + op + " with " + kind +
                    ": " + kind + " takes " + kind.parameterCount + " parameters, got " + params.size(), node);
        op.setOperation(kind, params);
        this.version++;
    }

    public void substitute(DAGNode node, GateKind kind) {
        this.substitute(node, kind, List.of());
    }

    /** Remove an operation node, connecting its predecessor to its successor on each wire.
     * @throws InvalidRemovalException if the node is a terminal. */
    public void remove(DAGNode node) {
        this.checkNode(node);
        if (!node.is(DAGOpNode.class))
            throw new InvalidRemovalException("Terminal " + node + " cannot be removed", node);
        Map<Wire, DAGNode> pred = this.previous.get(node);
        Map<Wire, DAGNode> succ = this.next.get(node);
        for (Wire wire: node.getWires()) {
            if (pred.get(wire) == null || succ.get(wire) == null)
                throw new InvalidRemovalException("Node " + node + " is not connected on " + wire, node);
        }
        for (Wire wire: node.getWires())
            this.link(pred.get(wire), succ.get(wire), wire);
        this.discard(node);
        this.version++;
    }

    private void discard(DAGNode node) {
        this.nodes.remove(node);
        this.next.remove(node);
        this.previous.remove(node);
    }

    /**
     * Replace an operation node with the operations of a template circuit.
     * Wire i of the template is mapped to operand i of the node.
     * @param node      Node to replace.
     * @param template  Circuit with as many wires as the node has operands.
     * @return          The inserted nodes, in the template's program order.
     * @throws TemplateArityMismatchException if the wire counts differ. */
    public List<DAGOpNode> substituteWithSubgraph(DAGNode node, DAGCircuit template) {
        this.checkNode(node);
        Utilities.enforce(template != this, "Circuit used as a template for itself");
        DAGOpNode op = node.as(DAGOpNode.class);
        if (op == null)
            throw new InvalidRemovalException("Terminal " + node + " cannot be replaced", node);
        if (template.getQubitCount() != op.qubits.size())
            throw new TemplateArityMismatchException("Template with " + template.getQubitCount() +
                    " wires cannot replace " + op, node);

        Map<Wire, DAGNode> frontier = new HashMap<>(this.previous.get(op));
        Map<Wire, DAGNode> exits = new HashMap<>(this.next.get(op));
        this.discard(op);
        List<DAGOpNode> result = new ArrayList<>();
        for (DAGOpNode templateOp: template.topologicalOpNodes()) {
            List<Wire> qubits = Linq.map(templateOp.qubits, w -> op.qubits.get(w.index()));
            DAGOpNode copy = new DAGOpNode(templateOp.getKind(), qubits, templateOp.getParams());
            this.addNode(copy);
            for (Wire wire: qubits) {
                this.link(Utilities.getExists(frontier, wire), copy, wire);
                frontier.put(wire, copy);
            }
            result.add(copy);
        }
        for (Wire wire: op.qubits)
            this.link(Utilities.getExists(frontier, wire), Utilities.getExists(exits, wire), wire);
        this.version++;
        return result;
    }

    ///////////////////////// Egress

    /** The operations in program order. */
    public List<GateRecord> toRecords() {
        return Linq.map(this.topologicalOpNodes(), DAGOpNode::toRecord);
    }

    /** True if the two circuits have the same wires and the same operations
     * connected in the same way. */
    public boolean sameStructure(DAGCircuit other) {
        return CircuitToString.canonical(this).equals(CircuitToString.canonical(other));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return CircuitToString.toString(this, builder);
    }

    @Override
    public String toString() {
        return CircuitToString.canonical(this);
    }
}
