package org.qcircuit.operations;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.qcircuit.backend.RegisterNames;
import org.qcircuit.circuit.QuantumComputation;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class OperationRenderingTest {

    private RegisterNames qregs;
    private RegisterNames cregs;

    @BeforeEach
    void setUp() {
        QuantumComputation qc = new QuantumComputation(3);
        qregs = RegisterNames.create(qc.getQubitRegisters(), 3, "q");
        cregs = RegisterNames.create(qc.getClassicalRegisters(), 3, "c");
    }

    private String qasm(Operation op) {
        StringBuilder out = new StringBuilder();
        op.dumpOpenQasm(out, qregs, cregs);
        return out.toString();
    }

    private String qiskit(Operation op) {
        StringBuilder out = new StringBuilder();
        op.dumpQiskit(out, qregs, cregs, "anc");
        return out.toString();
    }

    @Test
    @DisplayName("Negative controls are wrapped in X gates")
    void negativeControlsQasm() {
        Operation op = new StandardOperation(3, List.of(Control.neg(0), Control.pos(1)), 2);

        assertThat(qasm(op)).isEqualTo("x q[0];\nccx q[0], q[1], q[2];\nx q[0];\n");
        assertThat(qiskit(op)).isEqualTo("qc.x(q[0])\nqc.ccx(q[0], q[1], q[2])\nqc.x(q[0])\n");
    }

    @Test
    @DisplayName("V gates are written as parametrized u3")
    void vGateQasm() {
        assertThat(qasm(new StandardOperation(3, 1, OpType.V))).isEqualTo("u3(pi/2,-pi/2,pi/2) q[1];\n");
    }

    @Test
    @DisplayName("Peres gates decompose into a Toffoli and a CNOT")
    void peresQasm() {
        Operation peres = new StandardOperation(3, List.of(Control.pos(0)), 1, 2, OpType.P, 0, 0, 0);

        assertThat(qasm(peres)).isEqualTo("ccx q[0], q[2], q[1];\ncx q[0], q[2];\n");
    }

    @Test
    @DisplayName("Controlled phase gates use cu1 in Qiskit")
    void controlledPhaseQiskit() {
        assertThat(qiskit(new StandardOperation(3, Control.pos(0), 1, OpType.T))).isEqualTo("qc.cu1(pi/4, q[0], q[1])\n");
        assertThat(qiskit(new StandardOperation(3, List.of(Control.pos(0), Control.pos(1)), 2, OpType.S)))
                .isEqualTo("qc.mcu1(pi/2, [q[0], q[1]], q[2])\n");
    }

    @Test
    @DisplayName("Classically controlled operations prefix every statement with the condition")
    void classicControlled() {
        Operation op = new ClassicControlledOperation(new StandardOperation(3, 0, OpType.X), "c", 0, 1);

        assertThat(qasm(op)).isEqualTo("if(c==1) x q[0];\n");
        assertThat(qiskit(op)).isEqualTo("qc.x(q[0]).c_if(c, 1)\n");
        assertThat(op.isUnitary()).isFalse();
    }

    @Test
    @DisplayName("Non-unitary operations render one statement per qubit where needed")
    void nonUnitary() {
        assertThat(qasm(NonUnitaryOperation.reset(3, List.of(0, 2)))).isEqualTo("reset q[0];\nreset q[2];\n");
        assertThat(qasm(NonUnitaryOperation.barrier(3, List.of(0, 1)))).isEqualTo("barrier q[0], q[1];\n");
        assertThat(qasm(NonUnitaryOperation.snapshot(3, List.of(1), 7))).isEqualTo("snapshot(7) q[1];\n");
        assertThat(qiskit(NonUnitaryOperation.measure(3, 2, 1))).isEqualTo("qc.measure(q[2], c[1])\n");
    }

    @Test
    @DisplayName("Measurements need as many bits as qubits")
    void measureSizeMismatch() {
        assertThatThrownBy(() -> NonUnitaryOperation.measure(3, List.of(0, 1), List.of(0)))
                .hasMessageContaining("Measurement of 2 qubits");
    }

    @Test
    @DisplayName("Compound operations render their parts in order")
    void compound() {
        Operation compound = new CompoundOperation(3, List.of(
                new StandardOperation(3, 0, OpType.H), new StandardOperation(3, 1, OpType.H)));

        assertThat(qasm(compound)).isEqualTo("h q[0];\nh q[1];\n");
        assertThat(compound.getTargets()).containsExactly(0, 1);
        assertThat(compound.isUnitary()).isTrue();
    }

    @Test
    @DisplayName("Listings mark targets and control polarities")
    void listing() {
        Operation op = new StandardOperation(3, List.of(Control.neg(0), Control.pos(2)), 1);

        assertThat(op.toString()).isEqualTo(String.format("%-8s", "x") + "\tn\tt\tc");
    }

    @Test
    @DisplayName("Non-unitary gate kinds cannot build a standard operation")
    void rejectsNonUnitaryKind() {
        assertThatThrownBy(() -> new StandardOperation(3, 0, OpType.MEASURE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
