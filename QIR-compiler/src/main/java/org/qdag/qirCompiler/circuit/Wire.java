package org.qdag.qirCompiler.circuit;

/** One qubit line of a circuit, identified by its index. */
public record Wire(int index) implements Comparable<Wire> {
    @Override
    public int compareTo(Wire other) {
        return Integer.compare(this.index, other.index);
    }

    @Override
    public String toString() {
        return "q[" + this.index + "]";
    }
}
