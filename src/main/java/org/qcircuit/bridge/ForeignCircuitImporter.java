package org.qcircuit.bridge;

import org.qcircuit.circuit.CircuitException;
import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.diagnostics.DiagnosticsEngine;
import org.qcircuit.operations.Control;
import org.qcircuit.operations.NonUnitaryOperation;
import org.qcircuit.operations.OpType;
import org.qcircuit.operations.StandardOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates circuits of a foreign circuit model into a {@link QuantumComputation}.
 * <p>
 * Instructions with a known name become operations directly. Any other instruction is replaced
 * by its definition, whose formal bits are remapped onto the call's actual bits. An instruction
 * without a usable definition is reported to the {@link DiagnosticsEngine} and skipped.
 */
public class ForeignCircuitImporter {

    private static final Logger LOG = LoggerFactory.getLogger(ForeignCircuitImporter.class);

    private static final Map<String, OpType> NATIVE_GATES = Map.ofEntries(
            Map.entry("i", OpType.I),
            Map.entry("id", OpType.I),
            Map.entry("iden", OpType.I),
            Map.entry("x", OpType.X),
            Map.entry("cx", OpType.X),
            Map.entry("ccx", OpType.X),
            Map.entry("mcx_gray", OpType.X),
            Map.entry("mcx_recursive", OpType.X),
            Map.entry("mcx_vchain", OpType.X),
            Map.entry("y", OpType.Y),
            Map.entry("cy", OpType.Y),
            Map.entry("z", OpType.Z),
            Map.entry("cz", OpType.Z),
            Map.entry("h", OpType.H),
            Map.entry("ch", OpType.H),
            Map.entry("s", OpType.S),
            Map.entry("sdg", OpType.SDAG),
            Map.entry("t", OpType.T),
            Map.entry("tdg", OpType.TDAG),
            Map.entry("rx", OpType.RX),
            Map.entry("crx", OpType.RX),
            Map.entry("mcrx", OpType.RX),
            Map.entry("ry", OpType.RY),
            Map.entry("cry", OpType.RY),
            Map.entry("mcry", OpType.RY),
            Map.entry("rz", OpType.RZ),
            Map.entry("crz", OpType.RZ),
            Map.entry("mcrz", OpType.RZ),
            Map.entry("p", OpType.PHASE),
            Map.entry("u1", OpType.PHASE),
            Map.entry("cp", OpType.PHASE),
            Map.entry("cu1", OpType.PHASE),
            Map.entry("mcphase", OpType.PHASE),
            Map.entry("sx", OpType.SX),
            Map.entry("csx", OpType.SX),
            Map.entry("sxdg", OpType.SXDAG),
            Map.entry("u2", OpType.U2),
            Map.entry("u", OpType.U3),
            Map.entry("u3", OpType.U3),
            Map.entry("cu3", OpType.U3),
            Map.entry("swap", OpType.SWAP),
            Map.entry("cswap", OpType.SWAP),
            Map.entry("iswap", OpType.ISWAP));

    private final DiagnosticsEngine diagnostics;

    public ForeignCircuitImporter(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Declares the foreign circuit's registers, names the circuit after it and translates its
     * instruction stream.
     *
     * @param qc The circuit to populate, normally empty.
     * @param circuit The foreign circuit.
     * @throws CircuitException if a register cannot be declared or a bit cannot be resolved.
     */
    public void importCircuit(QuantumComputation qc, ForeignCircuit circuit) {
        qc.setName(circuit.name());
        for (ForeignRegister register : circuit.qregs()) {
            qc.addQubitRegister(register.size(), register.name());
        }
        for (ForeignRegister register : circuit.cregs()) {
            qc.addClassicalRegister(register.size(), register.name());
        }
        for (InstructionCall call : circuit.data()) {
            emplaceOperation(qc, call.instruction(), call.qargs(), call.cargs());
        }
        LOG.debug("Imported foreign circuit '{}' with {} operations", circuit.name(), qc.size());
    }

    /**
     * Translates one instruction applied to the given bits and appends the result.
     *
     * @param qc The circuit whose registers the bits are resolved against.
     * @param instruction The instruction.
     * @param qargs The qubits the instruction is applied to, already in the circuit's registers.
     * @param cargs The classical bits, already in the circuit's registers.
     * @throws CircuitException if a bit cannot be resolved.
     */
    public void emplaceOperation(QuantumComputation qc, ForeignInstruction instruction,
                                 List<ForeignBit> qargs, List<ForeignBit> cargs) {
        String name = instruction.name();
        if ("measure".equals(name)) {
            requireArguments(name, qargs, 1);
            requireArguments(name, cargs, 1);
            int qubit = qubitIndex(qc, qargs.get(0));
            int clbit = qc.getIndexFromClassicalRegister(cargs.get(0).registerName(), cargs.get(0).index());
            qc.emplaceBack(NonUnitaryOperation.measure(qc.getNqubits(), qubit, clbit));
            return;
        }
        if ("barrier".equals(name)) {
            List<Integer> targets = new ArrayList<>(qargs.size());
            for (ForeignBit qubit : qargs) {
                targets.add(qubitIndex(qc, qubit));
            }
            qc.emplaceBack(NonUnitaryOperation.barrier(qc.getNqubits(), targets));
            return;
        }

        OpType type = NATIVE_GATES.get(name);
        if (type == null) {
            importDefinition(qc, instruction, qargs, cargs);
            return;
        }

        List<ForeignBit> arguments = qargs;
        if ("mcx_recursive".equals(name) && qargs.size() > 5) {
            // the last argument is an ancilla
            arguments = qargs.subList(0, qargs.size() - 1);
        } else if ("mcx_vchain".equals(name)) {
            int controls = (qargs.size() + 2) / 2;
            int ancillas = Math.max(0, controls - 2);
            arguments = qargs.subList(0, qargs.size() - ancillas);
        }
        addStandardOperation(qc, type, arguments, instruction.params(), name);
    }

    private void importDefinition(QuantumComputation qc, ForeignInstruction instruction,
                                  List<ForeignBit> qargs, List<ForeignBit> cargs) {
        Optional<ForeignCircuit> definition;
        try {
            definition = instruction.definition();
        } catch (ForeignCircuitException e) {
            LOG.debug("Definition of '{}' unavailable", instruction.name(), e);
            diagnostics.reportError("Failed to import instruction " + instruction.name() + ": " + e.getMessage(),
                    qc.getName(), 0);
            return;
        }
        if (definition.isEmpty()) {
            diagnostics.reportError("Failed to import instruction " + instruction.name() + ": no definition available",
                    qc.getName(), 0);
            return;
        }

        ForeignCircuit circuit = definition.get();
        Map<ForeignBit, ForeignBit> qubitMap = remap(circuit.qubits(), qargs);
        Map<ForeignBit, ForeignBit> clbitMap = remap(circuit.clbits(), cargs);
        for (InstructionCall call : circuit.data()) {
            emplaceOperation(qc, call.instruction(), mapAll(call.qargs(), qubitMap, instruction.name()),
                    mapAll(call.cargs(), clbitMap, instruction.name()));
        }
    }

    private static Map<ForeignBit, ForeignBit> remap(List<ForeignBit> formal, List<ForeignBit> actual) {
        Map<ForeignBit, ForeignBit> map = new HashMap<>();
        for (int i = 0; i < Math.min(formal.size(), actual.size()); i++) {
            map.put(formal.get(i), actual.get(i));
        }
        return map;
    }

    private static List<ForeignBit> mapAll(List<ForeignBit> bits, Map<ForeignBit, ForeignBit> map, String enclosing) {
        List<ForeignBit> mapped = new ArrayList<>(bits.size());
        for (ForeignBit bit : bits) {
            ForeignBit actual = map.get(bit);
            if (actual == null) {
                throw new CircuitException("Bit " + bit + " of the definition of '" + enclosing + "' is not bound");
            }
            mapped.add(actual);
        }
        return mapped;
    }

    private static void addStandardOperation(QuantumComputation qc, OpType type, List<ForeignBit> qargs,
                                             List<Double> params, String name) {
        int targetCount = type.isTwoTarget() ? 2 : 1;
        requireArguments(name, qargs, targetCount);

        List<Integer> qubits = new ArrayList<>(qargs.size());
        for (ForeignBit qubit : qargs) {
            qubits.add(qubitIndex(qc, qubit));
        }
        List<Control> controls = new ArrayList<>();
        for (int qubit : qubits.subList(0, qubits.size() - targetCount)) {
            controls.add(Control.pos(qubit));
        }

        double lambda = 0;
        double phi = 0;
        double theta = 0;
        if (params.size() == 1) {
            lambda = params.get(0);
        } else if (params.size() == 2) {
            phi = params.get(0);
            lambda = params.get(1);
        } else if (params.size() == 3) {
            theta = params.get(0);
            phi = params.get(1);
            lambda = params.get(2);
        }

        int n = qc.getNqubits();
        int last = qubits.get(qubits.size() - 1);
        if (targetCount == 2) {
            qc.emplaceBack(new StandardOperation(n, controls, qubits.get(qubits.size() - 2), last, type, lambda, phi, theta));
        } else {
            qc.emplaceBack(new StandardOperation(n, controls, last, type, lambda, phi, theta));
        }
    }

    private static int qubitIndex(QuantumComputation qc, ForeignBit qubit) {
        return qc.getIndexFromQubitRegister(qubit.registerName(), qubit.index());
    }

    private static void requireArguments(String name, List<ForeignBit> arguments, int minimum) {
        if (arguments.size() < minimum) {
            throw new CircuitException("Instruction '" + name + "' needs at least " + minimum
                    + " arguments but got " + arguments.size());
        }
    }
}
