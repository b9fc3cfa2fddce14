package org.qcircuit.circuit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named registers of one kind (quantum or classical), kept in declaration order.
 */
public class RegisterMap {

    private final Map<String, Register> registers = new LinkedHashMap<>();

    public void put(String name, Register register) {
        registers.put(name, register);
    }

    public Optional<Register> get(String name) {
        return Optional.ofNullable(registers.get(name));
    }

    public boolean contains(String name) {
        return registers.containsKey(name);
    }

    public void remove(String name) {
        registers.remove(name);
    }

    public boolean isEmpty() {
        return registers.isEmpty();
    }

    public int size() {
        return registers.size();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(registers.keySet());
    }

    /**
     * @return An unmodifiable view of all registers in declaration order.
     */
    public Map<String, Register> asMap() {
        return Collections.unmodifiableMap(registers);
    }

    /**
     * Finds the register containing a global index.
     * @param index The global index.
     * @return The name of the owning register, or empty if no register contains the index.
     */
    public Optional<String> findOwner(int index) {
        for (Map.Entry<String, Register> entry : registers.entrySet()) {
            if (entry.getValue().contains(index)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public void clear() {
        registers.clear();
    }
}
