package org.qcircuit.circuit;

import org.qcircuit.operations.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The canonical in-memory model of a quantum circuit.
 * <p>
 * Holds the qubit and classical registers, the input and output permutations (logical qubit to
 * physical wire at the start and at the end of the circuit) and the operation sequence in
 * application order. The register methods keep indices, register membership and permutations
 * consistent: whenever the qubit count changes, every operation already in the sequence is told
 * the new width.
 * <p>
 * Not thread-safe.
 */
public class QuantumComputation {

    private static final Logger LOG = LoggerFactory.getLogger(QuantumComputation.class);

    /** The widest circuit supported. */
    public static final int MAX_QUBITS = 128;

    private final RegisterMap qregs = new RegisterMap();
    private final RegisterMap cregs = new RegisterMap();
    private final Permutation inputPermutation = new Permutation();
    private final Permutation outputPermutation = new Permutation();
    private final List<Operation> ops = new ArrayList<>();
    private int nqubits;
    private int nclassics;
    private int maxControls;
    private String name = "";

    public QuantumComputation() {
    }

    /**
     * Creates a circuit with a single qubit register {@code q} and classical register {@code c}.
     * @param nqubits The number of qubits.
     */
    public QuantumComputation(int nqubits) {
        addQubitRegister(nqubits, "q");
        addClassicalRegister(nqubits, "c");
    }

    // --- Operation sequence ---

    /**
     * Appends an operation and records its control count.
     * @param operation The operation, built for the current width.
     */
    public void emplaceBack(Operation operation) {
        ops.add(operation);
        updateMaxControls(operation.getControlCount());
    }

    public List<Operation> getOps() {
        return Collections.unmodifiableList(ops);
    }

    public int size() {
        return ops.size();
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    public void updateMaxControls(int controls) {
        maxControls = Math.max(maxControls, controls);
    }

    public int getMaxControls() {
        return maxControls;
    }

    /**
     * @return The number of targets summed over all operations.
     */
    public long getIndividualOpCount() {
        long count = 0;
        for (Operation op : ops) {
            count += op.getTargets().size();
        }
        return count;
    }

    // --- Registers ---

    /**
     * Adds qubits to the circuit.
     * <p>
     * If {@code registerName} names the last register (the one ending at the current width) that
     * register grows; otherwise a new register starting at the current width is created. New
     * indices are mapped to themselves in both permutations and every existing operation is told
     * the new width.
     *
     * @param count The number of qubits to add.
     * @param registerName The register to create or extend.
     * @throws CircuitException if the width would exceed {@link #MAX_QUBITS} or the register exists
     *                          but is not the last one.
     */
    public void addQubitRegister(int count, String registerName) {
        if (nqubits + count > MAX_QUBITS) {
            throw new CircuitException("Adding additional qubits results in too many qubits: "
                    + (nqubits + count) + " vs. " + MAX_QUBITS);
        }
        Register existing = qregs.get(registerName).orElse(null);
        if (existing != null) {
            if (existing.end() != nqubits) {
                throw new CircuitException("Augmenting existing qubit registers is only supported for the last register in a circuit: "
                        + registerName);
            }
            qregs.put(registerName, existing.grow(count));
        } else {
            qregs.put(registerName, new Register(nqubits, count));
        }

        for (int i = 0; i < count; i++) {
            int j = nqubits + i;
            inputPermutation.put(j, j);
            outputPermutation.put(j, j);
        }
        nqubits += count;
        propagateQubitCount();
    }

    /**
     * Adds a classical register at the end of the classical index space.
     * @param count The number of bits.
     * @param registerName The register name.
     * @throws CircuitException if the register already exists.
     */
    public void addClassicalRegister(int count, String registerName) {
        if (cregs.contains(registerName)) {
            throw new CircuitException("Augmenting existing classical registers is currently not supported: " + registerName);
        }
        cregs.put(registerName, new Register(nclassics, count));
        nclassics += count;
    }

    /**
     * @param qubit A global qubit index.
     * @return The name of the register containing the qubit.
     * @throws CircuitException if no register contains the qubit.
     */
    public String getQubitRegister(int qubit) {
        return qregs.findOwner(qubit)
                .orElseThrow(() -> new CircuitException("Qubit index " + qubit + " not found in any register"));
    }

    /**
     * @param qubit A global qubit index.
     * @return The owning register and the qubit's offset inside it.
     */
    public RegisterIndex getQubitRegisterAndIndex(int qubit) {
        String registerName = getQubitRegister(qubit);
        Register register = qregs.get(registerName).orElseThrow();
        return new RegisterIndex(registerName, qubit - register.start());
    }

    /**
     * @param registerName The name of a qubit register.
     * @param index The offset inside the register.
     * @return The global qubit index.
     */
    public int getIndexFromQubitRegister(String registerName, int index) {
        return resolve(qregs, "qubit", registerName, index);
    }

    /**
     * @param registerName The name of a classical register.
     * @param index The offset inside the register.
     * @return The global classical bit index.
     */
    public int getIndexFromClassicalRegister(String registerName, int index) {
        return resolve(cregs, "classical", registerName, index);
    }

    private static int resolve(RegisterMap registers, String kind, String registerName, int index) {
        Register register = registers.get(registerName)
                .orElseThrow(() -> new CircuitException("Unknown " + kind + " register " + registerName));
        if (index < 0 || index >= register.size()) {
            throw new CircuitException("Index " + index + " out of range for " + kind + " register "
                    + registerName + "[" + register.size() + "]");
        }
        return register.start() + index;
    }

    /**
     * @param qubit A global qubit index.
     * @return true if no operation acts on the qubit.
     */
    public boolean isIdleQubit(int qubit) {
        for (Operation op : ops) {
            if (op.actsOn(qubit)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Removes idle qubits from the top of the index space.
     * <p>
     * Scans downwards from the highest index and stops at the first qubit some operation acts
     * on. Idle qubits below that one stay in the circuit. Each removed qubit leaves both
     * permutations and its register; emptied registers are deleted.
     */
    public void stripTrailingIdleQubits() {
        int removed = 0;
        for (int i = nqubits - 1; i >= 0; i--) {
            if (!isIdleQubit(i)) {
                break;
            }
            inputPermutation.remove(i);
            outputPermutation.remove(i);
            nqubits--;
            // grid benchmarks declare no registers
            String registerName = qregs.findOwner(i).orElse(null);
            if (registerName != null) {
                Register register = qregs.get(registerName).orElseThrow();
                if (register.size() == 1) {
                    qregs.remove(registerName);
                } else {
                    qregs.put(registerName, new Register(register.start(), register.size() - 1));
                }
            }
            removed++;
        }
        propagateQubitCount();
        if (removed > 0) {
            LOG.debug("Stripped {} trailing idle qubits, {} remaining", removed, nqubits);
        }
    }

    private void propagateQubitCount() {
        for (Operation op : ops) {
            op.setNqubits(nqubits);
        }
    }

    // --- Low level access for importers ---

    /**
     * Sets the qubit count directly and propagates it to all operations. Registers and
     * permutations are left untouched; importers complete them before returning.
     */
    public void setNqubits(int nqubits) {
        if (nqubits > MAX_QUBITS) {
            throw new CircuitException("Circuit with " + nqubits + " qubits exceeds the maximum of " + MAX_QUBITS);
        }
        this.nqubits = nqubits;
        propagateQubitCount();
    }

    public void setNclassics(int nclassics) {
        this.nclassics = nclassics;
    }

    /**
     * Resets both permutations to the identity over the current qubit count.
     */
    public void initializeIdentityPermutations() {
        inputPermutation.resetToIdentity(nqubits);
        outputPermutation.resetToIdentity(nqubits);
    }

    public RegisterMap getQubitRegisters() {
        return qregs;
    }

    public RegisterMap getClassicalRegisters() {
        return cregs;
    }

    public Permutation getInputPermutation() {
        return inputPermutation;
    }

    public Permutation getOutputPermutation() {
        return outputPermutation;
    }

    public int getNqubits() {
        return nqubits;
    }

    public int getNclassics() {
        return nclassics;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    // --- Printing ---

    /**
     * Writes the input permutation, one numbered line per operation and the output permutation.
     * @param out The destination.
     */
    public void print(Appendable out) {
        int width = String.valueOf(ops.size()).length();
        try {
            out.append(pad("i", width)).append(":\t\t\t");
            appendPermutation(out, inputPermutation);
            int i = 0;
            for (Operation op : ops) {
                out.append(pad(String.valueOf(++i), width)).append(":\t").append(op.toString()).append('\n');
            }
            out.append(pad("o", width)).append(":\t\t\t");
            appendPermutation(out, outputPermutation);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Writes the qubit and operation counts.
     * @param out The destination.
     */
    public void printStatistics(Appendable out) {
        try {
            out.append("QC Statistics:\n");
            out.append("\tn: ").append(String.valueOf(nqubits)).append('\n');
            out.append("\tm: ").append(String.valueOf(ops.size())).append('\n');
            out.append("--------------\n");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void appendPermutation(Appendable out, Permutation permutation) throws IOException {
        for (int q = 0; q < nqubits; q++) {
            out.append(permutation.contains(q) ? String.valueOf(permutation.get(q)) : "-").append('\t');
        }
        out.append('\n');
    }

    private static String pad(String text, int width) {
        return " ".repeat(Math.max(0, width - text.length())) + text;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }

    /**
     * A qubit located by register name and offset.
     *
     * @param register The register name.
     * @param index The offset inside the register.
     */
    public record RegisterIndex(String register, int index) {}
}
