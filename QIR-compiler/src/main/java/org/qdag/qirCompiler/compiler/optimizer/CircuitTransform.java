package org.qdag.qirCompiler.compiler.optimizer;

import org.qdag.qirCompiler.circuit.DAGCircuit;

import java.util.function.Function;

/** A transformation of a circuit.  Transforms mutate the circuit in place
 * and return it. */
public interface CircuitTransform extends Function<DAGCircuit, DAGCircuit> {
    /** Name of the circuit transformation pass */
    String getName();
}
