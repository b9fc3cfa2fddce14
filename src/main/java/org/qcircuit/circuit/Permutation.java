package org.qcircuit.circuit;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Mapping from logical qubit index to physical wire index.
 */
public class Permutation {

    private final TreeMap<Integer, Integer> mapping = new TreeMap<>();

    /**
     * @param nqubits The number of qubits.
     * @return The identity over {@code [0, nqubits)}.
     */
    public static Permutation identity(int nqubits) {
        Permutation permutation = new Permutation();
        permutation.resetToIdentity(nqubits);
        return permutation;
    }

    public void put(int logical, int physical) {
        mapping.put(logical, physical);
    }

    /**
     * @param logical The logical qubit.
     * @return The physical wire of the qubit.
     * @throws CircuitException if the qubit is not mapped.
     */
    public int get(int logical) {
        Integer physical = mapping.get(logical);
        if (physical == null) {
            throw new CircuitException("Qubit " + logical + " is not part of the permutation");
        }
        return physical;
    }

    public boolean contains(int logical) {
        return mapping.containsKey(logical);
    }

    public void remove(int logical) {
        mapping.remove(logical);
    }

    public int size() {
        return mapping.size();
    }

    /**
     * Replaces the whole mapping by the identity over {@code [0, nqubits)}.
     * @param nqubits The number of qubits.
     */
    public void resetToIdentity(int nqubits) {
        mapping.clear();
        for (int i = 0; i < nqubits; i++) {
            mapping.put(i, i);
        }
    }

    /**
     * @param nqubits The number of qubits.
     * @return true if the mapping is a bijection from {@code [0, nqubits)} onto itself.
     */
    public boolean isBijectionOver(int nqubits) {
        if (mapping.size() != nqubits) {
            return false;
        }
        Set<Integer> images = new HashSet<>();
        for (Map.Entry<Integer, Integer> entry : mapping.entrySet()) {
            int logical = entry.getKey();
            int physical = entry.getValue();
            if (logical < 0 || logical >= nqubits || physical < 0 || physical >= nqubits || !images.add(physical)) {
                return false;
            }
        }
        return true;
    }

    public Map<Integer, Integer> asMap() {
        return Collections.unmodifiableMap(mapping);
    }

    @Override
    public String toString() {
        return mapping.toString();
    }
}
