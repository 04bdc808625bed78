package org.qdag.qirCompiler.circuit;

import org.junit.Assert;
import org.junit.Test;
import org.qdag.qirCompiler.compiler.errors.ArityMismatchException;
import org.qdag.qirCompiler.compiler.errors.InvalidRemovalException;
import org.qdag.qirCompiler.compiler.errors.NodeNotFoundException;
import org.qdag.qirCompiler.compiler.errors.TemplateArityMismatchException;
import org.qdag.qirCompiler.compiler.frontend.CircuitBuilder;
import org.qdag.qirCompiler.compiler.frontend.CircuitTemplates;

import java.util.List;

import static org.qdag.qirCompiler.TestUtilities.program;

public class MutationTests {
    @Test
    public void substituteKeepsEdges() {
        DAGCircuit circuit = new CircuitBuilder(1).x(0).h(0).build();
        DAGOpNode x = circuit.opNodes(GateKind.X).get(0);
        long version = circuit.getVersion();
        circuit.substitute(x, GateKind.RZ, List.of(0.25));
        CircuitInvariants.check(circuit);
        Assert.assertEquals("rz(0.25) q[0]; h q[0]", program(circuit));
        Assert.assertEquals(version + 1, circuit.getVersion());
        Assert.assertEquals(0.25, x.getParam(0), 0);
    }

    @Test
    public void substituteChecksArity() {
        DAGCircuit circuit = new CircuitBuilder(2).x(0).cx(0, 1).build();
        DAGOpNode x = circuit.opNodes(GateKind.X).get(0);
        DAGOpNode cx = circuit.opNodes(GateKind.CX).get(0);
        String before = circuit.toString();
        long version = circuit.getVersion();

        ArityMismatchException ex = Assert.assertThrows(ArityMismatchException.class,
                () -> circuit.substitute(x, GateKind.CX));
        Assert.assertEquals("ArityMismatch", ex.getErrorKind());
        Assert.assertSame(x, ex.node);
        Assert.assertThrows(ArityMismatchException.class, () -> circuit.substitute(cx, GateKind.H));
        Assert.assertThrows(ArityMismatchException.class, () -> circuit.substitute(x, GateKind.RX));
        Assert.assertThrows(ArityMismatchException.class,
                () -> circuit.substitute(x, GateKind.H, List.of(1.0)));
        Assert.assertThrows(ArityMismatchException.class,
                () -> circuit.substitute(circuit.inputNode(circuit.wire(0)), GateKind.H));

        Assert.assertEquals(before, circuit.toString());
        Assert.assertEquals(version, circuit.getVersion());
        circuit.substitute(cx, GateKind.SWAP);
        circuit.substitute(cx, GateKind.MCZ);
        Assert.assertEquals("x q[0]; mcz q[0], q[1]", program(circuit));
    }

    @Test
    public void removeRelinksWires() {
        DAGCircuit circuit = new CircuitBuilder(2).h(0).cx(0, 1).z(1).build();
        DAGOpNode cx = circuit.opNodes(GateKind.CX).get(0);
        circuit.remove(cx);
        CircuitInvariants.check(circuit);
        Assert.assertFalse(circuit.contains(cx));
        Assert.assertEquals("h q[0]; z q[1]", program(circuit));
        Wire q1 = circuit.wire(1);
        Assert.assertEquals(circuit.inputNode(q1), circuit.predecessor(circuit.opNodes(GateKind.Z).get(0), q1));
        Assert.assertThrows(NodeNotFoundException.class, () -> circuit.remove(cx));
    }

    @Test
    public void removingTerminalLeavesCircuitUnchanged() {
        DAGCircuit circuit = new CircuitBuilder(2).h(0).cx(0, 1).build();
        DAGCircuit copy = new CircuitBuilder(2).h(0).cx(0, 1).build();
        long version = circuit.getVersion();
        DAGInNode input = circuit.inputNode(circuit.wire(0));

        InvalidRemovalException ex = Assert.assertThrows(InvalidRemovalException.class,
                () -> circuit.remove(input));
        Assert.assertSame(input, ex.node);
        CircuitInvariants.check(circuit);
        Assert.assertTrue(circuit.sameStructure(copy));
        Assert.assertEquals(version, circuit.getVersion());

        Assert.assertThrows(InvalidRemovalException.class,
                () -> circuit.remove(circuit.outputNode(circuit.wire(1))));
        CircuitInvariants.check(circuit);
        Assert.assertTrue(circuit.sameStructure(copy));
    }

    @Test
    public void substituteWithSubgraphMapsWires() {
        DAGCircuit circuit = new CircuitBuilder(2).x(0).cx(1, 0).z(1).build();
        DAGOpNode cx = circuit.opNodes(GateKind.CX).get(0);
        DAGCircuit template = new CircuitBuilder(2).h(0).cx(0, 1).build();

        List<DAGOpNode> inserted = circuit.substituteWithSubgraph(cx, template);
        CircuitInvariants.check(circuit);
        Assert.assertEquals(2, inserted.size());
        Assert.assertFalse(circuit.contains(cx));
        Assert.assertEquals("x q[0]; h q[1]; cx q[1], q[0]; z q[1]", program(circuit));
        // The template is not modified
        Assert.assertEquals("h q[0]; cx q[0], q[1]", program(template));
    }

    @Test
    public void toffoliTemplateSplice() {
        DAGCircuit circuit = new CircuitBuilder(3).ccx(0, 1, 2).build();
        DAGCircuit template = CircuitTemplates.optimizedToffoli();
        circuit.substituteWithSubgraph(circuit.topologicalOpNodes().get(0), template);
        CircuitInvariants.check(circuit);
        Assert.assertEquals(11, circuit.operationCount());
        Assert.assertEquals(program(template), program(circuit));
    }

    @Test
    public void substituteWithSubgraphChecksWireCount() {
        DAGCircuit circuit = new CircuitBuilder(3).ccx(0, 1, 2).build();
        DAGCircuit copy = new CircuitBuilder(3).ccx(0, 1, 2).build();
        DAGOpNode ccx = circuit.topologicalOpNodes().get(0);
        long version = circuit.getVersion();

        TemplateArityMismatchException ex = Assert.assertThrows(TemplateArityMismatchException.class,
                () -> circuit.substituteWithSubgraph(ccx, new CircuitBuilder(2).cx(0, 1).build()));
        Assert.assertEquals("TemplateArityMismatch", ex.getErrorKind());
        Assert.assertThrows(InvalidRemovalException.class,
                () -> circuit.substituteWithSubgraph(circuit.inputNode(circuit.wire(0)), new DAGCircuit(1)));
        CircuitInvariants.check(circuit);
        Assert.assertTrue(circuit.sameStructure(copy));
        Assert.assertEquals(version, circuit.getVersion());
    }

    @Test
    public void emptyTemplateDeletesNode() {
        DAGCircuit circuit = new CircuitBuilder(2).h(0).cx(0, 1).h(1).build();
        circuit.substituteWithSubgraph(circuit.opNodes(GateKind.CX).get(0), new DAGCircuit(2));
        CircuitInvariants.check(circuit);
        Assert.assertEquals("h q[0]; h q[1]", program(circuit));
    }
}
