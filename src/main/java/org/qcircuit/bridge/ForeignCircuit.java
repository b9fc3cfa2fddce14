package org.qcircuit.bridge;

import java.util.List;

/**
 * A circuit built against a foreign, object-style circuit API. Instruction definitions are
 * foreign circuits as well; their {@link #qubits()} and {@link #clbits()} are the formal
 * arguments that calls map their actual arguments onto.
 */
public interface ForeignCircuit {

    String name();

    /**
     * @return The quantum registers in declaration order.
     */
    List<ForeignRegister> qregs();

    /**
     * @return The classical registers in declaration order.
     */
    List<ForeignRegister> cregs();

    /**
     * @return All qubits in order.
     */
    List<ForeignBit> qubits();

    /**
     * @return All classical bits in order.
     */
    List<ForeignBit> clbits();

    /**
     * @return The instruction stream, earliest first.
     */
    List<InstructionCall> data();
}
