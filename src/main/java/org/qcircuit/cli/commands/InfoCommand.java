package org.qcircuit.cli.commands;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.qcircuit.circuit.CircuitException;
import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.circuit.Register;
import org.qcircuit.circuit.RegisterMap;
import org.qcircuit.cli.CommandLineInterface;
import org.qcircuit.diagnostics.DiagnosticsEngine;
import org.qcircuit.frontend.CircuitImporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that imports a circuit file and prints its statistics and registers.
 */
@Command(
    name = "info",
    description = "Print statistics of a circuit file"
)
public class InfoCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(InfoCommand.class);

    @Option(names = {"-i", "--input"}, required = true, description = "Input circuit file (.real, .qasm, .txt)")
    private Path input;

    @Option(names = {"--print"}, description = "Also print permutations and every operation")
    private boolean print;

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
            parent.getConfig();
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            QuantumComputation qc = new QuantumComputation();
            new CircuitImporter(diagnostics).importFile(qc, input);
            if (stripIdle) {
                qc.stripTrailingIdleQubits();
            }

            out.printf("Circuit: %s%n", qc.getName());
            qc.printStatistics(out);
            out.printf("Classical bits:    %d%n", qc.getNclassics());
            out.printf("Max controls:      %d%n", qc.getMaxControls());
            out.printf("Individual ops:    %d%n", qc.getIndividualOpCount());
            printRegisters(out, "Qubit registers:", qc.getQubitRegisters());
            printRegisters(out, "Classical registers:", qc.getClassicalRegisters());
            if (print) {
                out.println();
                qc.print(out);
            }
            if (!diagnostics.getDiagnostics().isEmpty()) {
                err.print(diagnostics.summary());
            }
            out.flush();
            return 0;

        } catch (CircuitException e) {
            LOG.error("Import failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return e.exitCode();
        } catch (IllegalArgumentException | ConfigException e) {
            LOG.error("Import failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return CircuitException.EXIT_CODE;
        }
    }

    private static void printRegisters(java.io.PrintWriter out, String title, RegisterMap registers) {
        out.println(title);
        for (Map.Entry<String, Register> entry : registers.asMap().entrySet()) {
            out.printf("  %s[%d] at %d%n", entry.getKey(), entry.getValue().size(), entry.getValue().start());
        }
    }
}
