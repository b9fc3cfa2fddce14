package org.qcircuit.operations;

import org.qcircuit.backend.RegisterNames;
import org.qcircuit.circuit.Permutation;
import org.qcircuit.dd.DecisionDiagramPackage;
import org.qcircuit.dd.Edge;
import org.qcircuit.dd.GateMatrix;
import org.qcircuit.dd.LineBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A unitary gate with optional positive or negative controls.
 * <p>
 * Single-target kinds apply a 2x2 matrix to their target. The two-target kinds are
 * {@link OpType#SWAP}, {@link OpType#ISWAP} and the Peres gates {@link OpType#P} and
 * {@link OpType#PDAG}; their fragments are composed from single-target fragments that all carry
 * the operation's controls.
 */
public final class StandardOperation implements Operation {

    private static final Logger LOG = LoggerFactory.getLogger(StandardOperation.class);

    private final OpType type;
    private final List<Control> controls;
    private final List<Integer> targets;
    private final double lambda;
    private final double phi;
    private final double theta;
    private int nqubits;

    /**
     * Creates a gate acting on one target.
     *
     * @param nqubits The current circuit width.
     * @param controls The controls, may be empty.
     * @param target The target qubit.
     * @param type The gate kind.
     * @param lambda The lambda parameter (the angle of rotations and phase gates).
     * @param phi The phi parameter.
     * @param theta The theta parameter.
     */
    public StandardOperation(int nqubits, List<Control> controls, int target, OpType type,
                             double lambda, double phi, double theta) {
        this(nqubits, controls, List.of(target), type, lambda, phi, theta);
        if (type.isTwoTarget()) {
            throw new IllegalArgumentException("Gate " + type + " requires two targets");
        }
    }

    /**
     * Creates a gate acting on two targets.
     */
    public StandardOperation(int nqubits, List<Control> controls, int target0, int target1, OpType type,
                             double lambda, double phi, double theta) {
        this(nqubits, controls, List.of(target0, target1), type, lambda, phi, theta);
        if (!type.isTwoTarget()) {
            throw new IllegalArgumentException("Gate " + type + " acts on a single target");
        }
    }

    public StandardOperation(int nqubits, List<Control> controls, int target, OpType type, double lambda) {
        this(nqubits, controls, target, type, lambda, 0, 0);
    }

    public StandardOperation(int nqubits, List<Control> controls, int target, OpType type) {
        this(nqubits, controls, target, type, 0, 0, 0);
    }

    public StandardOperation(int nqubits, Control control, int target, OpType type) {
        this(nqubits, List.of(control), target, type, 0, 0, 0);
    }

    public StandardOperation(int nqubits, int target, OpType type, double lambda) {
        this(nqubits, List.of(), target, type, lambda, 0, 0);
    }

    public StandardOperation(int nqubits, int target, OpType type) {
        this(nqubits, List.of(), target, type, 0, 0, 0);
    }

    /**
     * Creates a (multi-)controlled X gate.
     */
    public StandardOperation(int nqubits, List<Control> controls, int target) {
        this(nqubits, controls, target, OpType.X, 0, 0, 0);
    }

    private StandardOperation(int nqubits, List<Control> controls, List<Integer> targets, OpType type,
                              double lambda, double phi, double theta) {
        Objects.requireNonNull(type, "type");
        if (!type.isUnitary()) {
            throw new IllegalArgumentException("Gate " + type + " is not a unitary gate kind");
        }
        this.nqubits = nqubits;
        this.controls = List.copyOf(controls);
        this.targets = targets;
        this.type = type;
        this.lambda = lambda;
        this.phi = phi;
        this.theta = theta;
    }

    @Override
    public OpType getType() {
        return type;
    }

    @Override
    public int getNqubits() {
        return nqubits;
    }

    @Override
    public void setNqubits(int nqubits) {
        this.nqubits = nqubits;
    }

    @Override
    public List<Control> getControls() {
        return controls;
    }

    @Override
    public List<Integer> getTargets() {
        return targets;
    }

    public double getLambda() {
        return lambda;
    }

    public double getPhi() {
        return phi;
    }

    public double getTheta() {
        return theta;
    }

    @Override
    public boolean isUnitary() {
        return true;
    }

    @Override
    public boolean actsOn(int qubit) {
        if (targets.contains(qubit)) {
            return true;
        }
        for (Control control : controls) {
            if (control.qubit() == qubit) {
                return true;
            }
        }
        return false;
    }

    // --- Decision diagram ---

    @Override
    public Edge getDD(DecisionDiagramPackage dd, LineBuffer line, Permutation permutation) {
        switch (type) {
            case SWAP:
                return swapDD(dd, line, permutation, targets.get(0), targets.get(1));
            case ISWAP: {
                int a = targets.get(0);
                int b = targets.get(1);
                Edge e = gateDD(dd, line, permutation, GateMatrix.PAULI_Z, withControl(Control.pos(a)), b);
                e = dd.multiply(swapDD(dd, line, permutation, a, b), e);
                e = dd.multiply(gateDD(dd, line, permutation, GateMatrix.of(OpType.S, 0, 0, 0), controls, b), e);
                return dd.multiply(gateDD(dd, line, permutation, GateMatrix.of(OpType.S, 0, 0, 0), controls, a), e);
            }
            case P: {
                int t0 = targets.get(0);
                int t1 = targets.get(1);
                Edge e = gateDD(dd, line, permutation, GateMatrix.PAULI_X, withControl(Control.pos(t1)), t0);
                return dd.multiply(gateDD(dd, line, permutation, GateMatrix.PAULI_X, controls, t1), e);
            }
            case PDAG: {
                int t0 = targets.get(0);
                int t1 = targets.get(1);
                Edge e = gateDD(dd, line, permutation, GateMatrix.PAULI_X, controls, t1);
                return dd.multiply(gateDD(dd, line, permutation, GateMatrix.PAULI_X, withControl(Control.pos(t1)), t0), e);
            }
            default:
                return gateDD(dd, line, permutation, GateMatrix.of(type, lambda, phi, theta), controls, targets.get(0));
        }
    }

    private Edge swapDD(DecisionDiagramPackage dd, LineBuffer line, Permutation permutation, int a, int b) {
        Edge e = gateDD(dd, line, permutation, GateMatrix.PAULI_X, withControl(Control.pos(a)), b);
        e = dd.multiply(gateDD(dd, line, permutation, GateMatrix.PAULI_X, withControl(Control.pos(b)), a), e);
        return dd.multiply(gateDD(dd, line, permutation, GateMatrix.PAULI_X, withControl(Control.pos(a)), b), e);
    }

    private Edge gateDD(DecisionDiagramPackage dd, LineBuffer line, Permutation permutation,
                        GateMatrix matrix, List<Control> gateControls, int target) {
        line.reset();
        for (Control control : gateControls) {
            line.set(permutation.get(control.qubit()),
                    control.isNegative() ? LineBuffer.NEGATIVE_CONTROL : LineBuffer.POSITIVE_CONTROL);
        }
        line.set(permutation.get(target), LineBuffer.TARGET);
        Edge e = dd.makeGateDD(matrix, nqubits, line);
        line.reset();
        return e;
    }

    private List<Control> withControl(Control extra) {
        List<Control> result = new ArrayList<>(controls);
        result.add(extra);
        return result;
    }

    // --- OpenQASM ---

    @Override
    public void dumpOpenQasm(StringBuilder out, RegisterNames qregs, RegisterNames cregs) {
        appendNegationsQasm(out, qregs);
        if (type == OpType.P || type == OpType.PDAG) {
            List<String> outer = controlNames(qregs);
            List<String> inner = new ArrayList<>(outer);
            inner.add(qregs.qualified(targets.get(1)));
            String toffoli = qasmStatement("c".repeat(inner.size()) + "x", inner, qregs.qualified(targets.get(0)));
            String cnot = qasmStatement("c".repeat(outer.size()) + "x", outer, qregs.qualified(targets.get(1)));
            if (type == OpType.P) {
                out.append(toffoli).append(cnot);
            } else {
                out.append(cnot).append(toffoli);
            }
        } else {
            List<String> args = controlNames(qregs);
            for (int i = 0; i < targets.size() - 1; i++) {
                args.add(qregs.qualified(targets.get(i)));
            }
            String name = "c".repeat(controls.size()) + qasmGateName();
            out.append(qasmStatement(name, args, qregs.qualified(targets.get(targets.size() - 1))));
        }
        appendNegationsQasm(out, qregs);
    }

    private String qasmGateName() {
        switch (type) {
            case V: return "u3(pi/2,-pi/2,pi/2)";
            case VDAG: return "u3(pi/2,pi/2,-pi/2)";
            case U3: return "u3(" + formatParameter(theta) + "," + formatParameter(phi) + "," + formatParameter(lambda) + ")";
            case U2: return "u2(" + formatParameter(phi) + "," + formatParameter(lambda) + ")";
            case U1:
            case PHASE:
            case RX:
            case RY:
            case RZ: return type.shortName() + "(" + formatParameter(lambda) + ")";
            default: return type.shortName();
        }
    }

    private static String qasmStatement(String name, List<String> leading, String last) {
        StringBuilder sb = new StringBuilder(name).append(' ');
        for (String arg : leading) {
            sb.append(arg).append(", ");
        }
        return sb.append(last).append(";\n").toString();
    }

    private void appendNegationsQasm(StringBuilder out, RegisterNames qregs) {
        for (Control control : controls) {
            if (control.isNegative()) {
                out.append("x ").append(qregs.qualified(control.qubit())).append(";\n");
            }
        }
    }

    // --- Qiskit ---

    @Override
    public void dumpQiskit(StringBuilder out, RegisterNames qregs, RegisterNames cregs, String ancillaRegister) {
        appendNegationsQiskit(out, qregs);
        List<String> ctrl = controlNames(qregs);
        switch (type) {
            case SWAP:
            case ISWAP: {
                String a = qregs.qualified(targets.get(0));
                String b = qregs.qualified(targets.get(1));
                if (ctrl.isEmpty()) {
                    out.append("qc.").append(type.shortName()).append('(').append(a).append(", ").append(b).append(")\n");
                } else if (ctrl.size() == 1 && type == OpType.SWAP) {
                    out.append("qc.cswap(").append(ctrl.get(0)).append(", ").append(a).append(", ").append(b).append(")\n");
                } else {
                    unsupportedQiskit(out);
                }
                break;
            }
            case P:
            case PDAG: {
                String t0 = qregs.qualified(targets.get(0));
                String t1 = qregs.qualified(targets.get(1));
                List<String> inner = new ArrayList<>(ctrl);
                inner.add(t1);
                if (type == OpType.P) {
                    appendQiskitX(out, inner, t0, ancillaRegister);
                    appendQiskitX(out, ctrl, t1, ancillaRegister);
                } else {
                    appendQiskitX(out, ctrl, t1, ancillaRegister);
                    appendQiskitX(out, inner, t0, ancillaRegister);
                }
                break;
            }
            default:
                appendQiskitSingleTarget(out, ctrl, qregs.qualified(targets.get(0)), ancillaRegister);
        }
        appendNegationsQiskit(out, qregs);
    }

    private void appendQiskitSingleTarget(StringBuilder out, List<String> ctrl, String target, String ancillaRegister) {
        if (type == OpType.X) {
            appendQiskitX(out, ctrl, target, ancillaRegister);
            return;
        }
        if (ctrl.isEmpty()) {
            String call = switch (type) {
                case V -> "u3(pi/2, -pi/2, pi/2, ";
                case VDAG -> "u3(pi/2, pi/2, -pi/2, ";
                case U3 -> "u3(" + formatParameter(theta) + ", " + formatParameter(phi) + ", " + formatParameter(lambda) + ", ";
                case U2 -> "u2(" + formatParameter(phi) + ", " + formatParameter(lambda) + ", ";
                case U1, PHASE, RX, RY, RZ -> type.shortName() + "(" + formatParameter(lambda) + ", ";
                default -> type.shortName() + "(";
            };
            out.append("qc.").append(call).append(target).append(")\n");
            return;
        }
        if (type == OpType.I) {
            out.append("qc.id(").append(target).append(")\n");
            return;
        }
        String phase = phaseAngle();
        if (ctrl.size() == 1) {
            String c = ctrl.get(0);
            String call = switch (type) {
                case Y, Z, H, SX -> "c" + type.shortName() + "(";
                case RX, RY, RZ -> "c" + type.shortName() + "(" + formatParameter(lambda) + ", ";
                case PHASE -> "cp(" + formatParameter(lambda) + ", ";
                case S, SDAG, T, TDAG, U1 -> "cu1(" + phase + ", ";
                case U3 -> "cu3(" + formatParameter(theta) + ", " + formatParameter(phi) + ", " + formatParameter(lambda) + ", ";
                case U2 -> "cu3(pi/2, " + formatParameter(phi) + ", " + formatParameter(lambda) + ", ";
                case V -> "cu3(pi/2, -pi/2, pi/2, ";
                case VDAG -> "cu3(pi/2, pi/2, -pi/2, ";
                default -> null;
            };
            if (call == null) {
                unsupportedQiskit(out);
                return;
            }
            out.append("qc.").append(call).append(c).append(", ").append(target).append(")\n");
            return;
        }
        String list = "[" + String.join(", ", ctrl) + "]";
        switch (type) {
            case Z:
                out.append("qc.h(").append(target).append(")\n");
                appendQiskitX(out, ctrl, target, ancillaRegister);
                out.append("qc.h(").append(target).append(")\n");
                break;
            case S:
            case SDAG:
            case T:
            case TDAG:
            case U1:
            case PHASE:
                out.append("qc.mcu1(").append(phase).append(", ").append(list).append(", ").append(target).append(")\n");
                break;
            case RX:
            case RY:
            case RZ:
                out.append("qc.mc").append(type.shortName()).append('(').append(formatParameter(lambda))
                        .append(", ").append(list).append(", ").append(target).append(")\n");
                break;
            default:
                unsupportedQiskit(out);
        }
    }

    private static void appendQiskitX(StringBuilder out, List<String> ctrl, String target, String ancillaRegister) {
        switch (ctrl.size()) {
            case 0 -> out.append("qc.x(").append(target).append(")\n");
            case 1 -> out.append("qc.cx(").append(ctrl.get(0)).append(", ").append(target).append(")\n");
            case 2 -> out.append("qc.ccx(").append(ctrl.get(0)).append(", ").append(ctrl.get(1)).append(", ")
                    .append(target).append(")\n");
            default -> out.append("qc.mct([").append(String.join(", ", ctrl)).append("], ").append(target)
                    .append(", ").append(ancillaRegister).append(", mode='basic')\n");
        }
    }

    private String phaseAngle() {
        return switch (type) {
            case Z -> "pi";
            case S -> "pi/2";
            case SDAG -> "-pi/2";
            case T -> "pi/4";
            case TDAG -> "-pi/4";
            default -> formatParameter(lambda);
        };
    }

    private void unsupportedQiskit(StringBuilder out) {
        LOG.warn("Gate {} with {} controls has no Qiskit equivalent and is skipped", type, controls.size());
        out.append("# unsupported: ").append(type.shortName()).append(" with ").append(controls.size()).append(" controls\n");
    }

    private void appendNegationsQiskit(StringBuilder out, RegisterNames qregs) {
        for (Control control : controls) {
            if (control.isNegative()) {
                out.append("qc.x(").append(qregs.qualified(control.qubit())).append(")\n");
            }
        }
    }

    // --- Helpers ---

    private List<String> controlNames(RegisterNames qregs) {
        List<String> names = new ArrayList<>(controls.size());
        for (Control control : controls) {
            names.add(qregs.qualified(control.qubit()));
        }
        return names;
    }

    /**
     * Formats a gate parameter so that parsing it back yields the same double.
     */
    static String formatParameter(double value) {
        return Double.toString(value);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(String.format("%-8s", type.shortName()));
        for (int q = 0; q < nqubits; q++) {
            char symbol = '|';
            if (targets.contains(q)) {
                symbol = 't';
            } else {
                for (Control control : controls) {
                    if (control.qubit() == q) {
                        symbol = control.isNegative() ? 'n' : 'c';
                    }
                }
            }
            sb.append('\t').append(symbol);
        }
        if (lambda != 0 || phi != 0 || theta != 0) {
            sb.append("\tp: (").append(lambda).append(' ').append(phi).append(' ').append(theta).append(')');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StandardOperation other)) return false;
        return type == other.type && controls.equals(other.controls) && targets.equals(other.targets)
                && Double.compare(lambda, other.lambda) == 0 && Double.compare(phi, other.phi) == 0
                && Double.compare(theta, other.theta) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, controls, targets, lambda, phi, theta);
    }

    /**
     * @return The first target.
     */
    public int getTarget() {
        return targets.get(0);
    }
}
