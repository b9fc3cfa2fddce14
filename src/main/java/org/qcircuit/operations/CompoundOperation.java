package org.qcircuit.operations;

import org.qcircuit.backend.RegisterNames;
import org.qcircuit.circuit.Permutation;
import org.qcircuit.dd.DecisionDiagramPackage;
import org.qcircuit.dd.Edge;
import org.qcircuit.dd.LineBuffer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A sequence of operations appended as one entry, such as the expansion of a user-defined
 * OpenQASM gate or a gate broadcast over a whole register.
 */
public final class CompoundOperation implements Operation {

    private final List<Operation> operations;
    private int nqubits;

    public CompoundOperation(int nqubits, List<Operation> operations) {
        if (operations.isEmpty()) {
            throw new IllegalArgumentException("A compound operation needs at least one operation");
        }
        this.nqubits = nqubits;
        this.operations = new ArrayList<>(operations);
    }

    public List<Operation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    @Override
    public OpType getType() {
        return OpType.NONE;
    }

    @Override
    public int getNqubits() {
        return nqubits;
    }

    @Override
    public void setNqubits(int nqubits) {
        this.nqubits = nqubits;
        for (Operation operation : operations) {
            operation.setNqubits(nqubits);
        }
    }

    @Override
    public List<Control> getControls() {
        return List.of();
    }

    @Override
    public List<Integer> getTargets() {
        Set<Integer> targets = new LinkedHashSet<>();
        for (Operation operation : operations) {
            targets.addAll(operation.getTargets());
        }
        return List.copyOf(targets);
    }

    @Override
    public int getControlCount() {
        int max = 0;
        for (Operation operation : operations) {
            max = Math.max(max, operation.getControlCount());
        }
        return max;
    }

    @Override
    public boolean isUnitary() {
        for (Operation operation : operations) {
            if (!operation.isUnitary()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean actsOn(int qubit) {
        for (Operation operation : operations) {
            if (operation.actsOn(qubit)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Edge getDD(DecisionDiagramPackage dd, LineBuffer line, Permutation permutation) {
        Edge e = operations.get(0).getDD(dd, line, permutation);
        for (int i = 1; i < operations.size(); i++) {
            line.reset();
            e = dd.multiply(operations.get(i).getDD(dd, line, permutation), e);
        }
        return e;
    }

    @Override
    public void dumpOpenQasm(StringBuilder out, RegisterNames qregs, RegisterNames cregs) {
        for (Operation operation : operations) {
            operation.dumpOpenQasm(out, qregs, cregs);
        }
    }

    @Override
    public void dumpQiskit(StringBuilder out, RegisterNames qregs, RegisterNames cregs, String ancillaRegister) {
        for (Operation operation : operations) {
            operation.dumpQiskit(out, qregs, cregs, ancillaRegister);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("compound");
        for (Operation operation : operations) {
            sb.append("\n\t").append(operation);
        }
        return sb.toString();
    }
}
