package org.qcircuit.circuit;

/**
 * A contiguous range of qubit or classical bit indices.
 *
 * @param start The first global index of the register.
 * @param size  The number of indices.
 */
public record Register(int start, int size) {

    /**
     * @return The index one past the last index of the register.
     */
    public int end() {
        return start + size;
    }

    public boolean contains(int index) {
        return index >= start && index < end();
    }

    /**
     * @param additional The number of indices to append.
     * @return A register with the same start and a larger size.
     */
    public Register grow(int additional) {
        return new Register(start, size + additional);
    }
}
