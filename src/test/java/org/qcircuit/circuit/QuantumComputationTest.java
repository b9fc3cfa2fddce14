package org.qcircuit.circuit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.qcircuit.operations.Control;
import org.qcircuit.operations.NonUnitaryOperation;
import org.qcircuit.operations.OpType;
import org.qcircuit.operations.Operation;
import org.qcircuit.operations.StandardOperation;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class QuantumComputationTest {

    @Test
    @DisplayName("Registers are laid out contiguously in declaration order")
    void registersAreContiguous() {
        QuantumComputation qc = new QuantumComputation();
        qc.addQubitRegister(2, "a");
        qc.addQubitRegister(3, "b");

        assertThat(qc.getNqubits()).isEqualTo(5);
        assertThat(qc.getQubitRegisters().get("a")).contains(new Register(0, 2));
        assertThat(qc.getQubitRegisters().get("b")).contains(new Register(2, 3));
        assertThat(qc.getQubitRegisters().names()).containsExactly("a", "b");
        assertThat(qc.getInputPermutation().isBijectionOver(5)).isTrue();
        assertThat(qc.getOutputPermutation().isBijectionOver(5)).isTrue();
    }

    @Test
    @DisplayName("Only the last qubit register can be extended")
    void extendsOnlyLastRegister() {
        QuantumComputation qc = new QuantumComputation();
        qc.addQubitRegister(2, "a");
        qc.addQubitRegister(1, "b");
        qc.addQubitRegister(2, "b");

        assertThat(qc.getQubitRegisters().get("b")).contains(new Register(2, 3));
        assertThatThrownBy(() -> qc.addQubitRegister(1, "a"))
                .isInstanceOf(CircuitException.class)
                .hasMessageContaining("only supported for the last register");
    }

    @Test
    @DisplayName("Classical registers cannot be redeclared")
    void classicalRegisterRedeclarationFails() {
        QuantumComputation qc = new QuantumComputation();
        qc.addClassicalRegister(2, "c");

        assertThatThrownBy(() -> qc.addClassicalRegister(1, "c"))
                .isInstanceOf(CircuitException.class)
                .hasMessageContaining("not supported");
        assertThat(qc.getNclassics()).isEqualTo(2);
    }

    @Test
    @DisplayName("Exceeding the maximum width is rejected")
    void rejectsTooManyQubits() {
        QuantumComputation qc = new QuantumComputation();
        qc.addQubitRegister(QuantumComputation.MAX_QUBITS, "q");

        assertThatThrownBy(() -> qc.addQubitRegister(1, "r"))
                .isInstanceOf(CircuitException.class)
                .hasMessageContaining("too many qubits");
    }

    @Test
    @DisplayName("Growing the circuit tells existing operations the new width")
    void propagatesWidthToOperations() {
        QuantumComputation qc = new QuantumComputation();
        qc.addQubitRegister(1, "q");
        qc.emplaceBack(new StandardOperation(qc.getNqubits(), 0, OpType.H));
        qc.addQubitRegister(2, "r");

        assertThat(qc.getOps()).allSatisfy(op -> assertThat(op.getNqubits()).isEqualTo(3));
    }

    @Test
    @DisplayName("The control maximum tracks the widest operation")
    void tracksMaxControls() {
        QuantumComputation qc = new QuantumComputation(4);
        qc.emplaceBack(new StandardOperation(4, List.of(Control.pos(0), Control.neg(1), Control.pos(2)), 3));
        qc.emplaceBack(new StandardOperation(4, Control.pos(0), 1, OpType.Z));

        assertThat(qc.getMaxControls()).isEqualTo(3);
        assertThat(qc.getIndividualOpCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Stripping removes trailing idle qubits and keeps interior ones")
    void stripsTrailingIdleQubits() {
        QuantumComputation qc = new QuantumComputation();
        qc.addQubitRegister(5, "q");
        qc.emplaceBack(new StandardOperation(5, Control.pos(0), 2, OpType.X));

        qc.stripTrailingIdleQubits();

        assertThat(qc.getNqubits()).isEqualTo(3);
        assertThat(qc.getQubitRegisters().get("q")).contains(new Register(0, 3));
        assertThat(qc.isIdleQubit(1)).isTrue();
        assertThat(qc.getInputPermutation().isBijectionOver(3)).isTrue();
        assertThat(qc.getOps().get(0).getNqubits()).isEqualTo(3);
    }

    @Test
    @DisplayName("Stripping deletes registers that become empty")
    void stripDeletesEmptiedRegisters() {
        QuantumComputation qc = new QuantumComputation();
        qc.addQubitRegister(2, "q");
        qc.addQubitRegister(1, "anc");
        qc.emplaceBack(new StandardOperation(3, 1, OpType.H));

        qc.stripTrailingIdleQubits();

        assertThat(qc.getNqubits()).isEqualTo(2);
        assertThat(qc.getQubitRegisters().contains("anc")).isFalse();
    }

    @Test
    @DisplayName("Barriers do not keep a qubit alive")
    void barrierDoesNotCountAsUse() {
        QuantumComputation qc = new QuantumComputation();
        qc.addQubitRegister(3, "q");
        qc.emplaceBack(new StandardOperation(3, 0, OpType.H));
        qc.emplaceBack(NonUnitaryOperation.barrier(3, List.of(0, 1, 2)));

        qc.stripTrailingIdleQubits();

        assertThat(qc.getNqubits()).isEqualTo(1);
    }

    @Test
    @DisplayName("Stripping a circuit without registers only shrinks the width")
    void stripsWithoutRegisters() {
        QuantumComputation qc = new QuantumComputation();
        qc.setNqubits(4);
        qc.initializeIdentityPermutations();
        qc.emplaceBack(new StandardOperation(4, 1, OpType.T));

        qc.stripTrailingIdleQubits();

        assertThat(qc.getNqubits()).isEqualTo(2);
        assertThat(qc.getOutputPermutation().size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Qubits are located by register and offset")
    void locatesQubits() {
        QuantumComputation qc = new QuantumComputation();
        qc.addQubitRegister(2, "a");
        qc.addQubitRegister(3, "b");
        qc.addClassicalRegister(2, "m");
        qc.addClassicalRegister(2, "n");

        assertThat(qc.getQubitRegister(3)).isEqualTo("b");
        assertThat(qc.getQubitRegisterAndIndex(4)).isEqualTo(new QuantumComputation.RegisterIndex("b", 2));
        assertThat(qc.getIndexFromQubitRegister("b", 1)).isEqualTo(3);
        assertThat(qc.getIndexFromClassicalRegister("n", 1)).isEqualTo(3);
        assertThatThrownBy(() -> qc.getQubitRegister(5)).isInstanceOf(CircuitException.class);
        assertThatThrownBy(() -> qc.getIndexFromQubitRegister("a", 2)).isInstanceOf(CircuitException.class);
        assertThatThrownBy(() -> qc.getIndexFromClassicalRegister("x", 0)).isInstanceOf(CircuitException.class);
    }

    @Test
    @DisplayName("Printing lists permutations and one numbered line per operation")
    void printsOperations() {
        QuantumComputation qc = new QuantumComputation(2);
        qc.emplaceBack(new StandardOperation(2, 0, OpType.H));
        qc.emplaceBack(new StandardOperation(2, Control.pos(0), 1, OpType.X));

        String printed = qc.toString();
        StringBuilder stats = new StringBuilder();
        qc.printStatistics(stats);

        assertThat(printed.split("\n")).hasSize(4);
        assertThat(printed).startsWith("i:").contains("1:\t").contains("2:\t");
        assertThat(stats.toString()).contains("n: 2").contains("m: 2");
    }

    @Test
    @DisplayName("Operations list is read-only")
    void opsAreUnmodifiable() {
        QuantumComputation qc = new QuantumComputation(1);
        List<Operation> ops = qc.getOps();

        assertThatThrownBy(() -> ops.add(new StandardOperation(1, 0, OpType.X)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
