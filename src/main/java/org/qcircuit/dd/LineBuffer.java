package org.qcircuit.dd;

import java.util.Arrays;

/**
 * Scratch buffer communicating the role of every wire (untouched, control, target) to the
 * backend while a single gate fragment is built.
 * <p>
 * One buffer is owned by one build or simulation call and reused for every operation. It must
 * be {@link #reset()} before each fragment, otherwise roles from the previous operation leak
 * into the next one.
 */
public final class LineBuffer {

    public static final short UNUSED = -1;
    public static final short NEGATIVE_CONTROL = 0;
    public static final short POSITIVE_CONTROL = 1;
    public static final short TARGET = 2;

    private final short[] lines;

    /**
     * @param capacity The maximum number of wires, at least the circuit width.
     */
    public LineBuffer(int capacity) {
        this.lines = new short[capacity];
        reset();
    }

    /**
     * Marks every wire as unused.
     */
    public void reset() {
        Arrays.fill(lines, UNUSED);
    }

    public void set(int wire, short role) {
        if (wire < 0 || wire >= lines.length) {
            throw new IndexOutOfBoundsException("Wire " + wire + " exceeds line buffer capacity " + lines.length);
        }
        lines[wire] = role;
    }

    public short get(int wire) {
        return lines[wire];
    }

    public int capacity() {
        return lines.length;
    }

    /**
     * @return true if no wire carries a role.
     */
    public boolean isClear() {
        for (short role : lines) {
            if (role != UNUSED) {
                return false;
            }
        }
        return true;
    }
}
