package org.qcircuit.operations;

import org.qcircuit.backend.RegisterNames;
import org.qcircuit.circuit.Permutation;
import org.qcircuit.dd.DecisionDiagramPackage;
import org.qcircuit.dd.Edge;
import org.qcircuit.dd.LineBuffer;

import java.util.List;

/**
 * An entry of a circuit's operation sequence.
 * <p>
 * The hierarchy is closed: {@link StandardOperation} for gates, {@link NonUnitaryOperation}
 * for measurements and markers, {@link ClassicControlledOperation} for operations guarded by a
 * classical bit and {@link CompoundOperation} for expanded gate definitions.
 */
public sealed interface Operation
        permits StandardOperation, NonUnitaryOperation, ClassicControlledOperation, CompoundOperation {

    OpType getType();

    /**
     * @return The circuit width this operation was last told about.
     */
    int getNqubits();

    /**
     * Informs the operation about a new circuit width.
     * @param nqubits The new number of qubits in the circuit.
     */
    void setNqubits(int nqubits);

    List<Control> getControls();

    List<Integer> getTargets();

    boolean isUnitary();

    /**
     * @param qubit A qubit index.
     * @return true if the operation touches the qubit as control or target.
     */
    boolean actsOn(int qubit);

    /**
     * @return The largest number of controls of any gate contained in this operation.
     */
    default int getControlCount() {
        return getControls().size();
    }

    /**
     * Builds this operation's decision-diagram fragment.
     *
     * @param dd The backend.
     * @param line The caller's scratch line buffer.
     * @param permutation Logical to physical wire mapping in effect.
     * @return The fragment, not retained.
     */
    Edge getDD(DecisionDiagramPackage dd, LineBuffer line, Permutation permutation);

    /**
     * Appends the OpenQASM statement(s) of this operation, each terminated by a newline.
     */
    void dumpOpenQasm(StringBuilder out, RegisterNames qregs, RegisterNames cregs);

    /**
     * Appends the Qiskit call(s) of this operation, each terminated by a newline.
     *
     * @param ancillaRegister The name of the register holding ancillae for multi-controlled gates.
     */
    void dumpQiskit(StringBuilder out, RegisterNames qregs, RegisterNames cregs, String ancillaRegister);
}
