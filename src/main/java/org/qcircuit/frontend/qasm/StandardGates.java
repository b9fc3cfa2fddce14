package org.qcircuit.frontend.qasm;

import org.qcircuit.operations.OpType;

import java.util.Map;
import java.util.Optional;

/**
 * The built-in gate table. The table knows the base gates of {@code qelib1.inc}; any number of
 * leading {@code c} characters add positive controls, so {@code cx}, {@code ccx}, {@code cu1}
 * and {@code cswap} resolve without an entry of their own.
 */
final class StandardGates {

    /**
     * A resolved built-in gate.
     *
     * @param type        The gate kind.
     * @param parameters  The number of parameters the gate takes.
     * @param controls    The number of leading control arguments.
     * @param targets     The number of target arguments.
     */
    record Signature(OpType type, int parameters, int controls, int targets) {
        int arity() {
            return controls + targets;
        }
    }

    private record Base(OpType type, int parameters) {}

    private static final Map<String, Base> BASE_GATES = Map.ofEntries(
            Map.entry("u3", new Base(OpType.U3, 3)),
            Map.entry("u", new Base(OpType.U3, 3)),
            Map.entry("u2", new Base(OpType.U2, 2)),
            Map.entry("u1", new Base(OpType.U1, 1)),
            Map.entry("p", new Base(OpType.PHASE, 1)),
            Map.entry("id", new Base(OpType.I, 0)),
            Map.entry("x", new Base(OpType.X, 0)),
            Map.entry("y", new Base(OpType.Y, 0)),
            Map.entry("z", new Base(OpType.Z, 0)),
            Map.entry("h", new Base(OpType.H, 0)),
            Map.entry("s", new Base(OpType.S, 0)),
            Map.entry("sdg", new Base(OpType.SDAG, 0)),
            Map.entry("t", new Base(OpType.T, 0)),
            Map.entry("tdg", new Base(OpType.TDAG, 0)),
            Map.entry("sx", new Base(OpType.SX, 0)),
            Map.entry("sxdg", new Base(OpType.SXDAG, 0)),
            Map.entry("rx", new Base(OpType.RX, 1)),
            Map.entry("ry", new Base(OpType.RY, 1)),
            Map.entry("rz", new Base(OpType.RZ, 1)),
            Map.entry("swap", new Base(OpType.SWAP, 0)),
            Map.entry("iswap", new Base(OpType.ISWAP, 0)));

    private StandardGates() {}

    /**
     * @param name A gate name as written in the source.
     * @return The signature, or empty if the name is not a built-in gate.
     */
    static Optional<Signature> lookup(String name) {
        int controls = 0;
        while (true) {
            Base base = BASE_GATES.get(name.substring(controls));
            if (base != null) {
                int targets = base.type().isTwoTarget() ? 2 : 1;
                return Optional.of(new Signature(base.type(), base.parameters(), controls, targets));
            }
            if (controls < name.length() - 1 && name.charAt(controls) == 'c') {
                controls++;
            } else {
                return Optional.empty();
            }
        }
    }
}
