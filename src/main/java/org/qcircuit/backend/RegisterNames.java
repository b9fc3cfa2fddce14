package org.qcircuit.backend;

import org.qcircuit.circuit.Register;
import org.qcircuit.circuit.RegisterMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Textual names of every qubit or classical bit, indexed by global index, used when operations
 * render themselves.
 */
public final class RegisterNames {

    /**
     * @param register  The register name, e.g. {@code q}.
     * @param qualified The indexed name, e.g. {@code q[3]}.
     */
    public record Entry(String register, String qualified) {}

    private final List<Entry> entries;

    private RegisterNames(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    /**
     * Builds the name array for a register table.
     * <p>
     * With declared registers every index is named after its register ({@code a[0]},
     * {@code b[1]}). Without registers {@code defaultCount} indices are named after
     * {@code defaultName}. With {@code fuse} set, the declared registers are first flattened into
     * one register called {@code defaultName} addressed by global index, so that index {@code i}
     * of the result is {@code defaultName[i]}; the per-register names follow after that.
     *
     * @param registers The declared registers.
     * @param defaultCount The width to name when no register is declared.
     * @param defaultName The default register name.
     * @param fuse Whether to put fused global names first.
     * @return The names.
     */
    public static RegisterNames create(RegisterMap registers, int defaultCount, String defaultName, boolean fuse) {
        List<Entry> entries = new ArrayList<>();
        if (registers.isEmpty()) {
            for (int i = 0; i < defaultCount; i++) {
                entries.add(new Entry(defaultName, defaultName + "[" + i + "]"));
            }
            return new RegisterNames(entries);
        }
        if (fuse) {
            for (Register register : registers.asMap().values()) {
                for (int i = 0; i < register.size(); i++) {
                    entries.add(new Entry(defaultName, defaultName + "[" + (register.start() + i) + "]"));
                }
            }
        }
        for (Map.Entry<String, Register> register : registers.asMap().entrySet()) {
            for (int i = 0; i < register.getValue().size(); i++) {
                entries.add(new Entry(register.getKey(), register.getKey() + "[" + i + "]"));
            }
        }
        return new RegisterNames(entries);
    }

    /**
     * Builds the name array for a register table without fusing.
     */
    public static RegisterNames create(RegisterMap registers, int defaultCount, String defaultName) {
        return create(registers, defaultCount, defaultName, false);
    }

    /**
     * @param index The global index.
     * @return The qualified name, e.g. {@code q[3]}.
     */
    public String qualified(int index) {
        return entries.get(index).qualified();
    }

    /**
     * @param index The global index.
     * @return The name of the register the index belongs to.
     */
    public String register(int index) {
        return entries.get(index).register();
    }

    public int size() {
        return entries.size();
    }
}
