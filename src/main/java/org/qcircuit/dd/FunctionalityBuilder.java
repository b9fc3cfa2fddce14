package org.qcircuit.dd;

import org.qcircuit.circuit.CircuitException;
import org.qcircuit.circuit.QuantumComputation;
import org.qcircuit.operations.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds a circuit's operation sequence into a single decision-diagram edge.
 * <p>
 * Every operation contributes a fragment that is multiplied onto a running accumulator. The
 * accumulator is retained while it is live; it is released exactly once when it is superseded,
 * and the package's garbage collector runs after every folded operation. The returned edge is
 * still retained and owned by the caller.
 */
public final class FunctionalityBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionalityBuilder.class);

    private FunctionalityBuilder() {}

    /**
     * Builds the unitary of the whole circuit.
     *
     * @param qc The circuit.
     * @param dd The decision-diagram package.
     * @return The retained functionality edge, or the package's terminal one-edge for an empty
     *         circuit.
     * @throws CircuitException if the circuit contains a non-unitary operation.
     */
    public static Edge buildFunctionality(QuantumComputation qc, DecisionDiagramPackage dd) {
        if (qc.getNqubits() == 0) {
            return dd.one();
        }
        dd.useMatrixNormalization(true);
        try {
            return fold(qc, dd, dd.makeIdent(qc.getNqubits()));
        } finally {
            dd.useMatrixNormalization(false);
        }
    }

    /**
     * Applies the circuit to an input state.
     *
     * @param qc The circuit.
     * @param in The input state edge. It is retained by this call for the duration of the fold.
     * @param dd The decision-diagram package.
     * @return The retained output state edge.
     * @throws CircuitException if the circuit contains a non-unitary operation, measurements
     *                          and resets included.
     */
    public static Edge simulate(QuantumComputation qc, Edge in, DecisionDiagramPackage dd) {
        return fold(qc, dd, in);
    }

    private static Edge fold(QuantumComputation qc, DecisionDiagramPackage dd, Edge initial) {
        LineBuffer line = new LineBuffer(QuantumComputation.MAX_QUBITS);
        RetainedEdge accumulator = RetainedEdge.retain(dd, initial);
        try {
            int step = 0;
            for (Operation op : qc.getOps()) {
                if (!op.isUnitary()) {
                    throw new CircuitException("Functionality not unitary.");
                }
                line.reset();
                Edge fragment = op.getDD(dd, line, qc.getOutputPermutation());
                RetainedEdge next = RetainedEdge.retain(dd, dd.multiply(fragment, accumulator.edge()));
                accumulator.close();
                accumulator = next;
                dd.garbageCollect();
                step++;
            }
            LOG.debug("Folded {} operations of circuit '{}'", step, qc.getName());
            return accumulator.detach();
        } finally {
            accumulator.close();
        }
    }
}
