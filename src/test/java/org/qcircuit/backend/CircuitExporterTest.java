package org.qcircuit.backend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.qcircuit.circuit.CircuitException;
import org.qcircuit.circuit.CircuitFileException;
import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.frontend.CircuitImporter;
import org.qcircuit.frontend.Format;
import org.qcircuit.operations.Control;
import org.qcircuit.operations.NonUnitaryOperation;
import org.qcircuit.operations.OpType;
import org.qcircuit.operations.StandardOperation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CircuitExporterTest {

    private final CircuitExporter exporter = new CircuitExporter();

    private static QuantumComputation bell() {
        QuantumComputation qc = new QuantumComputation(2);
        qc.setName("bell");
        qc.emplaceBack(new StandardOperation(2, 0, OpType.H));
        qc.emplaceBack(new StandardOperation(2, Control.pos(0), 1, OpType.X));
        qc.emplaceBack(NonUnitaryOperation.measure(2, List.of(0, 1), List.of(0, 1)));
        return qc;
    }

    @Test
    @DisplayName("OpenQASM output declares registers and lists every operation")
    void writesOpenQasm(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("bell.qasm");

        assertThat(exporter.dump(bell(), out)).isTrue();

        assertThat(Files.readString(out)).isEqualTo("OPENQASM 2.0;\n"
                + "include \"qelib1.inc\";\n"
                + "qreg q[2];\n"
                + "creg c[2];\n"
                + "h q[0];\n"
                + "cx q[0], q[1];\n"
                + "measure q[0] -> c[0];\n"
                + "measure q[1] -> c[1];\n");
    }

    @Test
    @DisplayName("Exported OpenQASM imports back to the same operations")
    void openQasmRoundTrip(@TempDir Path dir) {
        QuantumComputation original = new QuantumComputation();
        original.addQubitRegister(2, "a");
        original.addQubitRegister(1, "b");
        original.addClassicalRegister(1, "m");
        original.emplaceBack(new StandardOperation(3, List.of(Control.neg(0)), 2, OpType.RZ, 0.25));
        original.emplaceBack(new StandardOperation(3, List.of(Control.pos(1)), 0, 2, OpType.SWAP, 0, 0, 0));
        original.emplaceBack(new StandardOperation(3, 1, OpType.U3, 0.5));
        Path out = dir.resolve("roundtrip.qasm");
        exporter.dump(original, out);

        QuantumComputation imported = new QuantumComputation();
        new CircuitImporter().importFile(imported, out);

        assertThat(imported.getNqubits()).isEqualTo(3);
        assertThat(imported.getQubitRegisters().names()).containsExactly("a", "b");
        assertThat(imported.getOps()).hasSize(5);
        assertThat(imported.getOps().get(1)).isEqualTo(
                new StandardOperation(3, List.of(Control.pos(0)), 2, OpType.RZ, 0.25));
        assertThat(imported.getOps().get(3)).isEqualTo(
                new StandardOperation(3, List.of(Control.pos(1)), 0, 2, OpType.SWAP, 0, 0, 0));
        assertThat(imported.getOps().get(4)).isEqualTo(original.getOps().get(2));
    }

    @Test
    @DisplayName("Qiskit scripts declare an ancilla register for wide Toffolis")
    void writesQiskitWithAncillas(@TempDir Path dir) throws IOException {
        QuantumComputation qc = new QuantumComputation(4);
        qc.emplaceBack(new StandardOperation(4, List.of(Control.pos(0), Control.pos(1), Control.pos(2)), 3));
        Path out = dir.resolve("wide.py");

        assertThat(exporter.dump(qc, out)).isTrue();

        String script = Files.readString(out);
        assertThat(script)
                .contains("from qiskit.test.mock import FakeBurlington\n")
                .contains("anc = QuantumRegister(1, 'anc')\n")
                .contains("qc = QuantumCircuit(q, c, anc)\n")
                .contains("qc.mct([q[0], q[1], q[2]], q[3], anc, mode='basic')\n")
                .contains("for i in range(0, q.size + anc.size):\n")
                .contains(dir.resolve("wide") + "_decomposed.qasm")
                .contains(dir.resolve("wide") + "_transpiled.qasm");
    }

    @Test
    @DisplayName("Qiskit scripts without wide gates have no ancilla register")
    void writesQiskitWithoutAncillas(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("bell.py");

        exporter.dump(bell(), out, Format.QISKIT);

        String script = Files.readString(out);
        assertThat(script).contains("qc = QuantumCircuit(q, c)\n").doesNotContain("anc = ");
        assertThat(script).contains("qc.h(q[0])\n").contains("qc.cx(q[0], q[1])\n");
    }

    @Test
    @DisplayName("Circuits beyond the Qiskit limit are refused without writing")
    void refusesTooWideQiskit(@TempDir Path dir) {
        QuantumComputation qc = new QuantumComputation(54);
        Path out = dir.resolve("wide.py");

        assertThat(exporter.dump(qc, out)).isFalse();
        assertThat(out).doesNotExist();
    }

    @Test
    @DisplayName("Ancillas count towards the Qiskit limit")
    void ancillasCountTowardsLimit() {
        QuantumComputation qc = new QuantumComputation(52);
        qc.emplaceBack(new StandardOperation(52, List.of(Control.pos(0), Control.pos(1), Control.pos(2)), 3));

        assertThat(QiskitScriptEmitter.totalQubits(qc)).isEqualTo(53);
        assertThat(new QiskitScriptEmitter(ExportSettings.defaults()).supports(qc)).isTrue();
        qc.emplaceBack(new StandardOperation(52, List.of(Control.pos(0), Control.pos(1), Control.pos(2),
                Control.pos(4)), 3));
        assertThat(new QiskitScriptEmitter(ExportSettings.defaults()).supports(qc)).isFalse();
    }

    @Test
    @DisplayName("REAL and GRCS output is not supported")
    void unsupportedFormats(@TempDir Path dir) {
        Path out = dir.resolve("bell.real");

        assertThat(exporter.dump(bell(), out)).isFalse();
        assertThat(exporter.dump(bell(), dir.resolve("bell.txt"), Format.GRCS)).isFalse();
        assertThat(out).doesNotExist();
    }

    @Test
    @DisplayName("Unknown extensions are rejected")
    void unknownExtension(@TempDir Path dir) {
        assertThatThrownBy(() -> exporter.dump(bell(), dir.resolve("bell.xyz")))
                .isInstanceOf(CircuitException.class)
                .hasMessage("Extension xyz not recognized.");
    }

    @Test
    @DisplayName("An unwritable destination is a file error")
    void unwritableDestination(@TempDir Path dir) {
        Path out = dir.resolve("missing").resolve("bell.qasm");

        assertThatThrownBy(() -> exporter.dump(bell(), out))
                .isInstanceOf(CircuitFileException.class)
                .satisfies(e -> assertThat(((CircuitException) e).exitCode()).isEqualTo(3));
    }
}
