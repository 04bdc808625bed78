package org.qdag.qirCompiler.compiler.frontend;

import org.qdag.qirCompiler.circuit.DAGCircuit;
import org.qdag.qirCompiler.compiler.errors.CompilationError;
import org.qdag.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/** Synthesizes phase oracles marking basis states. */
public final class OracleBuilder {
    private OracleBuilder() {}

    /**
     * Build a Grover phase oracle that flips the sign of each of the given basis states.
     * Each state is a string of '0' and '1' characters; the rightmost character
     * is the value of wire 0.  For each state the zero bits are flipped with X gates,
     * an MCZ is applied over all wires and the X gates are repeated.
     * @param states  Non-empty list of states, all of the same length.
     * @throws CompilationError if the states are malformed.
     */
    public static DAGCircuit groverOracle(List<String> states) {
        if (states.isEmpty())
            throw new CompilationError("Oracle needs at least one marked state");
        int qubits = states.get(0).length();
        if (qubits == 0)
            throw new CompilationError("Marked states cannot be empty");
        CircuitBuilder builder = new CircuitBuilder(qubits);
        int[] all = new int[qubits];
        for (int i = 0; i < qubits; i++)
            all[i] = i;

        for (String state: states) {
            if (state.length() != qubits)
                throw new CompilationError("State " + Utilities.singleQuote(state) +
                        " does not have " + qubits + " bits");
            String reversed = new StringBuilder(state).reverse().toString();
            List<Integer> zeros = new ArrayList<>();
            for (int i = 0; i < reversed.length(); i++) {
                char c = reversed.charAt(i);
                if (c == '0')
                    zeros.add(i);
                else if (c != '1')
                    throw new CompilationError("State " + Utilities.singleQuote(state) +
                            " contains " + Utilities.singleQuote(String.valueOf(c)));
            }
            for (int q: zeros)
                builder.x(q);
            builder.mcz(all);
            for (int q: zeros)
                builder.x(q);
        }
        return builder.build();
    }

    public static DAGCircuit groverOracle(String... states) {
        return groverOracle(List.of(states));
    }
}
