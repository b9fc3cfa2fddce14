package org.qcircuit.operations;

/**
 * A control qubit of a gate.
 *
 * @param qubit The controlling qubit.
 * @param type  Whether the gate fires on {@code |1>} (positive) or {@code |0>} (negative).
 */
public record Control(int qubit, Type type) {

    public enum Type { POS, NEG }

    public static Control pos(int qubit) {
        return new Control(qubit, Type.POS);
    }

    public static Control neg(int qubit) {
        return new Control(qubit, Type.NEG);
    }

    public boolean isNegative() {
        return type == Type.NEG;
    }
}
