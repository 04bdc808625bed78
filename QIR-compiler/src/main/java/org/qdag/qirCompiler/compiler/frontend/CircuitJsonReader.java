package org.qdag.qirCompiler.compiler.frontend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.circuit.GateKind;
import org.qdag.qirCompiler.circuit.GateRecord;
import org.qdag.qirCompiler.compiler.errors.CompilationError;
import org.qdag.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a circuit from its JSON representation:
 * <pre>
 * { "qubits": 2,
 *   "gates": [ { "gate": "h", "qubits": [0] },
 *              { "gate": "rx", "qubits": [1], "params": [0.5] } ] }
 * </pre>
 * The "params" field may be omitted for gates without parameters.
 */
public class CircuitJsonReader {
    final ObjectMapper mapper;

    public CircuitJsonReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** @throws CompilationError if the text is not a valid circuit. */
    public DAGCircuit read(String json) {
        JsonNode root;
        try {
            root = this.mapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new CompilationError("Could not parse JSON circuit: " + ex.getOriginalMessage(), ex);
        }
        return this.read(root);
    }

    public DAGCircuit read(JsonNode root) {
        if (root == null || !root.isObject())
            throw new CompilationError("Expected a JSON object describing a circuit");
        int qubits = this.getInt(root, "qubits");
        if (qubits < 0)
            throw new CompilationError("Negative number of qubits: " + qubits);
        JsonNode gates = this.getProperty(root, "gates");
        if (!gates.isArray())
            throw new CompilationError("'gates' must be an array");
        CircuitBuilder builder = new CircuitBuilder(qubits);
        for (JsonNode gate: gates)
            builder.add(this.readGate(gate));
        return builder.build();
    }

    GateRecord readGate(JsonNode gate) {
        if (!gate.isObject())
            throw new CompilationError("Expected a JSON object describing a gate, got " + gate);
        JsonNode name = this.getProperty(gate, "gate");
        if (!name.isTextual())
            throw new CompilationError("Gate name must be a string, got " + name);
        GateKind kind = GateKind.fromName(name.asText());
        List<Integer> qubits = new ArrayList<>();
        for (JsonNode q: this.getArray(gate, "qubits")) {
            if (!q.canConvertToInt() || !q.isIntegralNumber())
                throw new CompilationError("Qubit index must be an integer, got " + q);
            qubits.add(q.asInt());
        }
        List<Double> params = new ArrayList<>();
        if (gate.has("params")) {
            for (JsonNode p: this.getArray(gate, "params")) {
                if (!p.isNumber())
                    throw new CompilationError("Gate parameter must be a number, got " + p);
                params.add(p.asDouble());
            }
        }
        return new GateRecord(kind, qubits, params);
    }

    JsonNode getProperty(JsonNode node, String property) {
        JsonNode result = node.get(property);
        if (result == null)
            throw new CompilationError("Missing property " + Utilities.singleQuote(property) + " in " + node);
        return result;
    }

    JsonNode getArray(JsonNode node, String property) {
        JsonNode result = this.getProperty(node, property);
        if (!result.isArray())
            throw new CompilationError(Utilities.singleQuote(property) + " must be an array, got " + result);
        return result;
    }

    int getInt(JsonNode node, String property) {
        JsonNode result = this.getProperty(node, property);
        if (!result.isIntegralNumber() || !result.canConvertToInt())
            throw new CompilationError(Utilities.singleQuote(property) + " must be an integer, got " + result);
        return result.asInt();
    }
}
