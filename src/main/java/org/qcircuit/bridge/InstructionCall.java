package org.qcircuit.bridge;

import java.util.List;

/**
 * One entry of a foreign circuit's instruction stream.
 *
 * @param instruction The applied instruction.
 * @param qargs       The qubits it is applied to.
 * @param cargs       The classical bits it writes.
 */
public record InstructionCall(ForeignInstruction instruction, List<ForeignBit> qargs, List<ForeignBit> cargs) {

    public InstructionCall {
        qargs = List.copyOf(qargs);
        cargs = List.copyOf(cargs);
    }
}
