package org.qdag.qirCompiler.circuit;

import org.junit.Assert;
import org.junit.Test;
import org.qdag.qirCompiler.compiler.errors.CompilationError;
import org.qdag.qirCompiler.compiler.errors.NodeNotFoundException;
import org.qdag.qirCompiler.compiler.frontend.CircuitBuilder;
import org.qdag.util.Linq;

import java.util.List;

import static org.qdag.qirCompiler.TestUtilities.program;

public class DAGCircuitTests {
    @Test
    public void emptyCircuit() {
        DAGCircuit circuit = new DAGCircuit(2);
        Assert.assertEquals(4, circuit.size());
        Assert.assertEquals(0, circuit.operationCount());
        Assert.assertTrue(circuit.topologicalOpNodes().isEmpty());
        Wire q0 = circuit.wire(0);
        Assert.assertEquals(circuit.outputNode(q0), circuit.successor(circuit.inputNode(q0), q0));
        Assert.assertNull(circuit.predecessor(circuit.inputNode(q0), q0));
        Assert.assertNull(circuit.successor(circuit.outputNode(q0), q0));
        CircuitInvariants.check(circuit);

        List<DAGNode> nodes = Linq.list(circuit.topologicalNodes());
        Assert.assertEquals(4, nodes.size());
        Assert.assertTrue(nodes.get(0).is(DAGInNode.class));
        Assert.assertTrue(nodes.get(1).is(DAGInNode.class));
    }

    @Test
    public void programOrderIsInsertionOrder() {
        DAGCircuit circuit = new CircuitBuilder(3)
                .x(2)
                .h(0)
                .cx(0, 1)
                .z(2)
                .ccx(2, 1, 0)
                .build();
        CircuitInvariants.check(circuit);
        Assert.assertEquals(5, circuit.operationCount());
        Assert.assertEquals("x q[2]; h q[0]; cx q[0], q[1]; z q[2]; ccx q[2], q[1], q[0]",
                program(circuit));
        // Terminals come first and last on every wire
        List<DAGNode> nodes = Linq.list(circuit.topologicalNodes());
        for (Wire wire: circuit.getWires()) {
            Assert.assertTrue(nodes.indexOf(circuit.inputNode(wire)) <
                    nodes.indexOf(circuit.outputNode(wire)));
        }
    }

    @Test
    public void neighborsFollowOperandOrder() {
        DAGCircuit circuit = new CircuitBuilder(2)
                .x(0)
                .cx(1, 0)
                .build();
        DAGOpNode x = circuit.opNodes(GateKind.X).get(0);
        DAGOpNode cx = circuit.opNodes(GateKind.CX).get(0);
        Wire q0 = circuit.wire(0);
        Wire q1 = circuit.wire(1);

        Assert.assertEquals(List.of(circuit.inputNode(q1), x), Linq.list(circuit.predecessors(cx)));
        Assert.assertEquals(List.of(circuit.outputNode(q1), circuit.outputNode(q0)),
                Linq.list(circuit.successors(cx)));
        Assert.assertEquals(List.of(x), circuit.opPredecessors(cx));
        Assert.assertTrue(circuit.opSuccessors(cx).isEmpty());
        Assert.assertEquals(List.of(cx), circuit.opSuccessors(x));
        Assert.assertEquals(x, circuit.predecessor(cx, q0));
        Assert.assertEquals(2, circuit.getFanout(cx));
    }

    @Test
    public void repeatedTraversalIsDeterministic() {
        DAGCircuit circuit = new CircuitBuilder(4)
                .h(3).h(2).h(1).h(0)
                .cx(0, 3).cx(1, 2)
                .swap(1, 3)
                .build();
        List<DAGNode> first = Linq.list(circuit.topologicalNodes());
        List<DAGNode> second = Linq.list(circuit.topologicalNodes());
        Assert.assertEquals(first, second);

        DAGCircuit same = new CircuitBuilder(4)
                .h(3).h(2).h(1).h(0)
                .cx(0, 3).cx(1, 2)
                .swap(1, 3)
                .build();
        Assert.assertTrue(circuit.sameStructure(same));
        Assert.assertEquals(circuit.toString(), same.toString());
        Assert.assertFalse(circuit.sameStructure(new CircuitBuilder(4).h(3).build()));
    }

    @Test
    public void foreignNodeIsRejected() {
        DAGCircuit circuit = new CircuitBuilder(1).h(0).build();
        DAGCircuit other = new CircuitBuilder(1).h(0).build();
        DAGOpNode foreign = other.topologicalOpNodes().get(0);
        Assert.assertFalse(circuit.contains(foreign));
        Assert.assertThrows(NodeNotFoundException.class, () -> circuit.successors(foreign));
        Assert.assertThrows(NodeNotFoundException.class, () -> circuit.remove(foreign));
        Assert.assertThrows(NodeNotFoundException.class,
                () -> circuit.substitute(foreign, GateKind.X));
    }

    @Test
    public void malformedOperationsAreRejected() {
        DAGCircuit circuit = new DAGCircuit(2);
        Assert.assertThrows(CompilationError.class, () -> circuit.append(GateRecord.of(GateKind.CX, 0)));
        Assert.assertThrows(CompilationError.class, () -> circuit.append(GateRecord.of(GateKind.CX, 0, 0)));
        Assert.assertThrows(CompilationError.class, () -> circuit.append(GateRecord.of(GateKind.H, 2)));
        Assert.assertThrows(CompilationError.class, () -> circuit.append(GateRecord.of(GateKind.RX, 0)));
        Assert.assertThrows(CompilationError.class, () -> circuit.append(GateRecord.of(GateKind.MCZ)));
        Assert.assertEquals(0, circuit.getVersion());
        Assert.assertEquals(0, circuit.operationCount());

        circuit.append(GateRecord.of(GateKind.MCZ, 1, 0));
        Assert.assertEquals("mcz q[1], q[0]", program(circuit));
        Assert.assertEquals(1, circuit.getVersion());
    }
}
