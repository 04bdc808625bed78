package org.qdag.qirCompiler.compiler.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.GateRecord;

/** Serializes a circuit as JSON, with the operations in program order.
 * The output can be read back with
 * {@link org.qdag.qirCompiler.compiler.frontend.CircuitJsonReader}. */
public class ToJsonCircuit {
    final ObjectMapper mapper;

    public ToJsonCircuit(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode toJson(DAGCircuit circuit) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("qubits", circuit.getQubitCount());
        ArrayNode gates = result.putArray("gates");
        for (GateRecord record: circuit.toRecords()) {
            ObjectNode gate = gates.addObject();
            gate.put("gate", record.kind().gateName);
            ArrayNode qubits = gate.putArray("qubits");
            for (int q: record.qubits())
                qubits.add(q);
            ArrayNode params = gate.putArray("params");
            for (double p: record.params())
                params.add(p);
        }
        return result;
    }

    public static String toJsonString(ObjectMapper mapper, DAGCircuit circuit) {
        return new ToJsonCircuit(mapper).toJson(circuit).toPrettyString();
    }
}
