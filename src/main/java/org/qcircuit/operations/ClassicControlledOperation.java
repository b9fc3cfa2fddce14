package org.qcircuit.operations;

import org.qcircuit.backend.RegisterNames;
import org.qcircuit.circuit.CircuitException;
import org.qcircuit.circuit.Permutation;
import org.qcircuit.dd.DecisionDiagramPackage;
import org.qcircuit.dd.Edge;
import org.qcircuit.dd.LineBuffer;

import java.util.List;

/**
 * An operation that only executes if a classical register holds a given value.
 * <p>
 * The control bit is the absolute classical index {@code register start + expected value}.
 */
public final class ClassicControlledOperation implements Operation {

    private final Operation operation;
    private final String controlRegister;
    private final int expectedValue;
    private final int controlBit;

    /**
     * @param operation The guarded operation.
     * @param controlRegister The name of the tested classical register.
     * @param registerStart The first classical index of the tested register.
     * @param expectedValue The value the register is compared with.
     */
    public ClassicControlledOperation(Operation operation, String controlRegister, int registerStart, int expectedValue) {
        this.operation = operation;
        this.controlRegister = controlRegister;
        this.expectedValue = expectedValue;
        this.controlBit = registerStart + expectedValue;
    }

    public Operation getOperation() {
        return operation;
    }

    public int getControlBit() {
        return controlBit;
    }

    public String getControlRegister() {
        return controlRegister;
    }

    public int getExpectedValue() {
        return expectedValue;
    }

    @Override
    public OpType getType() {
        return operation.getType();
    }

    @Override
    public int getNqubits() {
        return operation.getNqubits();
    }

    @Override
    public void setNqubits(int nqubits) {
        operation.setNqubits(nqubits);
    }

    @Override
    public List<Control> getControls() {
        return operation.getControls();
    }

    @Override
    public List<Integer> getTargets() {
        return operation.getTargets();
    }

    @Override
    public int getControlCount() {
        return operation.getControlCount();
    }

    @Override
    public boolean isUnitary() {
        return false;
    }

    @Override
    public boolean actsOn(int qubit) {
        return operation.actsOn(qubit);
    }

    @Override
    public Edge getDD(DecisionDiagramPackage dd, LineBuffer line, Permutation permutation) {
        throw new CircuitException("No decision diagram for classically controlled operation");
    }

    @Override
    public void dumpOpenQasm(StringBuilder out, RegisterNames qregs, RegisterNames cregs) {
        StringBuilder inner = new StringBuilder();
        operation.dumpOpenQasm(inner, qregs, cregs);
        String prefix = "if(" + controlRegister + "==" + expectedValue + ") ";
        for (String statement : inner.toString().split("\n")) {
            if (!statement.isEmpty()) {
                out.append(prefix).append(statement).append('\n');
            }
        }
    }

    @Override
    public void dumpQiskit(StringBuilder out, RegisterNames qregs, RegisterNames cregs, String ancillaRegister) {
        StringBuilder inner = new StringBuilder();
        operation.dumpQiskit(inner, qregs, cregs, ancillaRegister);
        String condition = ".c_if(" + cregs.register(controlBit) + ", " + expectedValue + ")";
        for (String statement : inner.toString().split("\n")) {
            if (statement.startsWith("qc.")) {
                out.append(statement).append(condition).append('\n');
            } else if (!statement.isEmpty()) {
                out.append(statement).append('\n');
            }
        }
    }

    @Override
    public String toString() {
        return "c_if(" + controlRegister + "==" + expectedValue + ") " + operation;
    }
}
