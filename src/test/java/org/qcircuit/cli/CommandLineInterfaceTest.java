package org.qcircuit.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CommandLineInterfaceTest {

    private static final String BELL = "OPENQASM 2.0;\ninclude \"qelib1.inc\";\n"
            + "qreg q[3];\ncreg c[3];\nh q[0];\ncx q[0], q[1];\nmeasure q[0] -> c[0];\n";

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }

    @Test
    @DisplayName("convert writes OpenQASM and reports the circuit size")
    void convertsToQasm() throws IOException {
        Path input = write("bell.qasm", BELL);
        Path output = dir.resolve("copy.qasm");

        int exitCode = run("convert", "-i", input.toString(), "-o", output.toString(), "--strip-idle");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("(2 qubits, 3 operations)");
        assertThat(Files.readString(output)).contains("qreg q[2];").contains("cx q[0], q[1];");
    }

    @Test
    @DisplayName("convert honours explicit formats")
    void convertsWithExplicitFormats() throws IOException {
        Path input = write("toffoli.circuit", ".numvars 3\n.variables a b c\n.begin\nt3 a b c\n.end\n");
        Path output = dir.resolve("toffoli.script");

        int exitCode = run("convert", "-i", input.toString(), "--from", "real", "-o", output.toString(), "--to", "qiskit");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).contains("qc.ccx(q[0], q[1], q[2])");
    }

    @Test
    @DisplayName("convert fails with exit code 3 for a missing input file")
    void missingInput() {
        int exitCode = run("convert", "-i", dir.resolve("absent.qasm").toString(), "-o", dir.resolve("x.qasm").toString());

        assertThat(exitCode).isEqualTo(3);
        assertThat(err.toString()).contains("Error opening/reading from file");
    }

    @Test
    @DisplayName("convert fails with exit code 1 for malformed input")
    void malformedInput() throws IOException {
        Path input = write("broken.qasm", "OPENQASM 2.0;\nqreg q[1];\nfoo q[0];\n");

        int exitCode = run("convert", "-i", input.toString(), "-o", dir.resolve("x.qasm").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Undefined gate 'foo'");
    }

    @Test
    @DisplayName("convert fails with exit code 1 when the output format is not writable")
    void unsupportedOutputFormat() throws IOException {
        Path input = write("bell.qasm", BELL);
        Path output = dir.resolve("bell.real");

        int exitCode = run("convert", "-i", input.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("convert rejects unknown format names")
    void unknownFormatName() throws IOException {
        Path input = write("bell.qasm", BELL);

        int exitCode = run("convert", "-i", input.toString(), "-o", dir.resolve("x.qasm").toString(), "--to", "quil");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown format: quil");
    }

    @Test
    @DisplayName("info prints statistics, registers and the operation listing")
    void printsInfo() throws IOException {
        Path input = write("bell.qasm", BELL);

        int exitCode = run("info", "-i", input.toString(), "--print");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Circuit: bell")
                .contains("n: 3")
                .contains("m: 3")
                .contains("Max controls:      2")
                .contains("  q[3] at 0")
                .contains("  c[3] at 0")
                .contains("o:");
    }

    @Test
    @DisplayName("A missing explicit config file is an error")
    void missingConfigFile() throws IOException {
        Path input = write("bell.qasm", BELL);

        int exitCode = run("--config", dir.resolve("none.conf").toString(), "info", "-i", input.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Configuration file not found");
    }

    @Test
    @DisplayName("A config file changes the exported register names")
    void configOverridesRegisterNames() throws IOException {
        Path config = write("custom.conf", "qcircuit.export.default-qreg = wires\nqcircuit.export.default-creg = bits\n");
        Path input = write("grid.txt", "2\n0 h 0\n1 cz 0 1\n");
        Path output = dir.resolve("grid.qasm");

        int exitCode = run("--config", config.toString(), "convert", "-i", input.toString(), "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).contains("qreg wires[2];").contains("creg bits[0];").contains("cz wires[0], wires[1];");
    }
}
