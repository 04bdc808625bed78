package org.qdag.qirCompiler.circuit;

import org.qdag.qirCompiler.compiler.errors.CompilationError;
import org.qdag.util.Utilities;

import java.util.Locale;

/** The gates that can appear in a circuit. */
public enum GateKind {
    I("id", 1, 0),
    X("x", 1, 0),
    Y("y", 1, 0),
    Z("z", 1, 0),
    H("h", 1, 0),
    S("s", 1, 0),
    SDG("sdg", 1, 0),
    T("t", 1, 0),
    TDG("tdg", 1, 0),
    RX("rx", 1, 1),
    RY("ry", 1, 1),
    RZ("rz", 1, 1),
    P("p", 1, 1),
    CX("cx", 2, 0),
    CZ("cz", 2, 0),
    SWAP("swap", 2, 0),
    CCX("ccx", 3, 0),
    CCZ("ccz", 3, 0),
    // Multi-controlled Z over all its operands; any number of operands
    MCZ("mcz", -1, 0);

    public static final int VARIADIC = -1;

    /** Lowercase mnemonic, used for printing and in JSON. */
    public final String gateName;
    /** Number of operand wires, or {@link #VARIADIC}. */
    public final int arity;
    public final int parameterCount;

    GateKind(String gateName, int arity, int parameterCount) {
        this.gateName = gateName;
        this.arity = arity;
        this.parameterCount = parameterCount;
    }

    /** Rotations of one generator, which compose by adding their angles. */
    public boolean isRotation() {
        return switch (this) {
            case RX, RY, RZ, P -> true;
            default -> false;
        };
    }

    public boolean isVariadic() {
        return this.arity == VARIADIC;
    }

    public boolean acceptsArity(int operands) {
        if (this.isVariadic())
            return operands >= 1;
        return operands == this.arity;
    }

    public static GateKind fromName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (GateKind kind: GateKind.values()) {
            if (kind.gateName.equals(lower))
                return kind;
        }
        throw new CompilationError("Unknown gate " + Utilities.singleQuote(name));
    }

    @Override
    public String toString() {
        return this.gateName;
    }
}
