package org.qcircuit.cli.commands;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.qcircuit.backend.CircuitExporter;
import org.qcircuit.backend.ExportSettings;
import org.qcircuit.circuit.CircuitException;
import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.cli.CommandLineInterface;
import org.qcircuit.diagnostics.DiagnosticsEngine;
import org.qcircuit.frontend.CircuitImporter;
import org.qcircuit.frontend.Format;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that imports a circuit file and writes it in another format.
 * <p>
 * Formats default to the file extensions. The exit code is the one of the failure class:
 * 1 for malformed input or a refused export, 3 for file access problems.
 */
@Command(
    name = "convert",
    description = "Convert a circuit file to OpenQASM or a Qiskit script"
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ConvertCommand.class);

    @Option(names = {"-i", "--input"}, required = true, description = "Input circuit file (.real, .qasm, .txt)")
    private Path input;

    @Option(names = {"-o", "--output"}, required = true, description = "Output file (.qasm, .py)")
    private Path output;

    @Option(names = {"--from"}, description = "Input format, overrides the extension: real, qasm, grcs")
    private String from;

    @Option(names = {"--to"}, description = "Output format, overrides the extension: qasm, qiskit")
    private String to;

    @Option(names = {"--strip-idle"}, description = "Remove trailing qubits no operation acts on")
    private boolean stripIdle;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            ExportSettings settings = ExportSettings.fromConfig(parent.getConfig());
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            QuantumComputation qc = new QuantumComputation();

            CircuitImporter importer = new CircuitImporter(diagnostics);
            if (from != null) {
                importer.importFile(qc, input, Format.parse(from));
            } else {
                importer.importFile(qc, input);
            }
            if (stripIdle) {
                qc.stripTrailingIdleQubits();
            }
            if (!diagnostics.getDiagnostics().isEmpty()) {
                err.print(diagnostics.summary());
            }

            CircuitExporter exporter = new CircuitExporter(settings);
            boolean written = to != null ? exporter.dump(qc, output, Format.parse(to)) : exporter.dump(qc, output);
            if (!written) {
                err.println("Error: circuit '" + qc.getName() + "' could not be written to " + output);
                return CircuitException.EXIT_CODE;
            }

            out.printf("Converted %s (%d qubits, %d operations) to %s%n", input, qc.getNqubits(), qc.size(), output);
            return 0;

        } catch (CircuitException e) {
            LOG.error("Conversion failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return e.exitCode();
        } catch (IllegalArgumentException | ConfigException e) {
            LOG.error("Conversion failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return CircuitException.EXIT_CODE;
        }
    }
}
