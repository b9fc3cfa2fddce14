package org.qcircuit.bridge;

import java.util.List;
import java.util.Optional;

/**
 * An instruction of a foreign circuit model, e.g. a gate, a measurement or a composite gate.
 */
public interface ForeignInstruction {

    /**
     * @return The instruction name, e.g. {@code cx} or {@code measure}.
     */
    String name();

    /**
     * @return The numeric parameters in the model's order.
     */
    List<Double> params();

    /**
     * Returns the decomposition of a composite instruction.
     *
     * @return The sub-circuit, or empty if the instruction has no decomposition.
     * @throws ForeignCircuitException if the model fails to produce the decomposition.
     */
    Optional<ForeignCircuit> definition() throws ForeignCircuitException;
}
