package org.qcircuit.operations;

import org.qcircuit.backend.RegisterNames;
import org.qcircuit.circuit.CircuitException;
import org.qcircuit.circuit.Permutation;
import org.qcircuit.dd.DecisionDiagramPackage;
import org.qcircuit.dd.Edge;
import org.qcircuit.dd.LineBuffer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Measurements, resets and the marker statements (barrier, snapshot, show-probabilities).
 * <p>
 * Barriers and show-probabilities markers do not act on any qubit, so they never keep a qubit
 * from being stripped as idle.
 */
public final class NonUnitaryOperation implements Operation {

    private final OpType type;
    private final List<Integer> targets;
    private final List<Integer> classics;
    private final int snapshotId;
    private int nqubits;

    private NonUnitaryOperation(int nqubits, OpType type, List<Integer> targets, List<Integer> classics, int snapshotId) {
        this.nqubits = nqubits;
        this.type = type;
        this.targets = List.copyOf(targets);
        this.classics = List.copyOf(classics);
        this.snapshotId = snapshotId;
    }

    /**
     * Measures {@code qubits[i]} into {@code classics[i]}.
     */
    public static NonUnitaryOperation measure(int nqubits, List<Integer> qubits, List<Integer> classics) {
        if (qubits.size() != classics.size()) {
            throw new CircuitException("Measurement of " + qubits.size() + " qubits into "
                    + classics.size() + " classical bits");
        }
        return new NonUnitaryOperation(nqubits, OpType.MEASURE, qubits, classics, -1);
    }

    public static NonUnitaryOperation measure(int nqubits, int qubit, int classic) {
        return measure(nqubits, List.of(qubit), List.of(classic));
    }

    public static NonUnitaryOperation reset(int nqubits, List<Integer> qubits) {
        return new NonUnitaryOperation(nqubits, OpType.RESET, qubits, List.of(), -1);
    }

    public static NonUnitaryOperation barrier(int nqubits, List<Integer> qubits) {
        return new NonUnitaryOperation(nqubits, OpType.BARRIER, qubits, List.of(), -1);
    }

    public static NonUnitaryOperation snapshot(int nqubits, List<Integer> qubits, int snapshotId) {
        return new NonUnitaryOperation(nqubits, OpType.SNAPSHOT, qubits, List.of(), snapshotId);
    }

    public static NonUnitaryOperation showProbabilities(int nqubits) {
        return new NonUnitaryOperation(nqubits, OpType.SHOW_PROBABILITIES, List.of(), List.of(), -1);
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
        return List.of();
    }

    @Override
    public List<Integer> getTargets() {
        return targets;
    }

    /**
     * @return The classical bits written by a measurement, empty for all other kinds.
     */
    public List<Integer> getClassics() {
        return classics;
    }

    public int getSnapshotId() {
        return snapshotId;
    }

    @Override
    public boolean isUnitary() {
        return false;
    }

    @Override
    public boolean actsOn(int qubit) {
        if (type == OpType.BARRIER || type == OpType.SHOW_PROBABILITIES) {
            return false;
        }
        return targets.contains(qubit);
    }

    @Override
    public Edge getDD(DecisionDiagramPackage dd, LineBuffer line, Permutation permutation) {
        throw new CircuitException("No decision diagram for non-unitary operation " + type.shortName());
    }

    @Override
    public void dumpOpenQasm(StringBuilder out, RegisterNames qregs, RegisterNames cregs) {
        switch (type) {
            case MEASURE:
                for (int i = 0; i < targets.size(); i++) {
                    out.append("measure ").append(qregs.qualified(targets.get(i))).append(" -> ")
                            .append(cregs.qualified(classics.get(i))).append(";\n");
                }
                break;
            case RESET:
                for (int target : targets) {
                    out.append("reset ").append(qregs.qualified(target)).append(";\n");
                }
                break;
            case BARRIER:
                out.append("barrier ").append(String.join(", ", names(qregs))).append(";\n");
                break;
            case SNAPSHOT:
                out.append("snapshot(").append(snapshotId).append(") ")
                        .append(String.join(", ", names(qregs))).append(";\n");
                break;
            case SHOW_PROBABILITIES:
                out.append("show_probabilities;\n");
                break;
            default:
                throw new IllegalStateException("Unexpected non-unitary kind " + type);
        }
    }

    @Override
    public void dumpQiskit(StringBuilder out, RegisterNames qregs, RegisterNames cregs, String ancillaRegister) {
        switch (type) {
            case MEASURE:
                for (int i = 0; i < targets.size(); i++) {
                    out.append("qc.measure(").append(qregs.qualified(targets.get(i))).append(", ")
                            .append(cregs.qualified(classics.get(i))).append(")\n");
                }
                break;
            case RESET:
                for (int target : targets) {
                    out.append("qc.reset(").append(qregs.qualified(target)).append(")\n");
                }
                break;
            case BARRIER:
                out.append("qc.barrier(").append(String.join(", ", names(qregs))).append(")\n");
                break;
            case SNAPSHOT:
                out.append("qc.snapshot(\"").append(snapshotId).append("\", qubits=[")
                        .append(String.join(", ", names(qregs))).append("])\n");
                break;
            case SHOW_PROBABILITIES:
                out.append("# show_probabilities\n");
                break;
            default:
                throw new IllegalStateException("Unexpected non-unitary kind " + type);
        }
    }

    private List<String> names(RegisterNames qregs) {
        List<String> names = new ArrayList<>(targets.size());
        for (int target : targets) {
            names.add(qregs.qualified(target));
        }
        return names;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(String.format("%-8s", type.shortName()));
        for (int q = 0; q < nqubits; q++) {
            sb.append('\t').append(targets.contains(q) ? (type == OpType.MEASURE ? 'm' : 'x') : '|');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NonUnitaryOperation other)) return false;
        return type == other.type && snapshotId == other.snapshotId
                && targets.equals(other.targets) && classics.equals(other.classics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, targets, classics, snapshotId);
    }
}
