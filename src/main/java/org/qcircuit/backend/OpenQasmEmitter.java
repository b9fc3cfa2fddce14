package org.qcircuit.backend;

import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.circuit.Register;
import org.qcircuit.circuit.RegisterMap;
import org.qcircuit.operations.Operation;

import java.util.Map;

/**
 * Renders a circuit as OpenQASM 2.0.
 */
public class OpenQasmEmitter {

    private final ExportSettings settings;

    public OpenQasmEmitter(ExportSettings settings) {
        this.settings = settings;
    }

    /**
     * @param qc The circuit.
     * @return The OpenQASM program.
     */
    public String emit(QuantumComputation qc) {
        StringBuilder out = new StringBuilder();
        out.append("OPENQASM 2.0;\n");
        out.append("include \"qelib1.inc\";\n");
        declare(out, "qreg", qc.getQubitRegisters(), settings.qubitRegister(), qc.getNqubits());
        declare(out, "creg", qc.getClassicalRegisters(), settings.classicalRegister(), qc.getNclassics());

        RegisterNames qregs = RegisterNames.create(qc.getQubitRegisters(), qc.getNqubits(), settings.qubitRegister());
        RegisterNames cregs = RegisterNames.create(qc.getClassicalRegisters(), qc.getNclassics(), settings.classicalRegister());
        for (Operation op : qc.getOps()) {
            op.dumpOpenQasm(out, qregs, cregs);
        }
        return out.toString();
    }

    private static void declare(StringBuilder out, String keyword, RegisterMap registers, String defaultName, int width) {
        if (registers.isEmpty()) {
            out.append(keyword).append(' ').append(defaultName).append('[').append(width).append("];\n");
            return;
        }
        for (Map.Entry<String, Register> register : registers.asMap().entrySet()) {
            out.append(keyword).append(' ').append(register.getKey())
                    .append('[').append(register.getValue().size()).append("];\n");
        }
    }
}
