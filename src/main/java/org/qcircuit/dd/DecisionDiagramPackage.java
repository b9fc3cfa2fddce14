package org.qcircuit.dd;

/**
 * The decision-diagram backend consumed by the functionality builder and by operations
 * building their own fragments.
 * <p>
 * Implementations own node storage, complex number canonicalization and the multiplication
 * algorithms. Edges returned by this interface are only guaranteed to survive a call to
 * {@link #garbageCollect()} if their reference count has been raised with {@link #incRef(Edge)}.
 */
public interface DecisionDiagramPackage {

    /**
     * @return The terminal edge with weight one.
     */
    Edge one();

    /**
     * Builds the identity over {@code nqubits} qubits.
     * @param nqubits The number of qubits.
     * @return The identity edge.
     */
    Edge makeIdent(int nqubits);

    /**
     * Builds the fragment of a single-target gate.
     * @param matrix The 2x2 matrix applied to the target.
     * @param nqubits The total number of qubits.
     * @param line The role of every wire, see {@link LineBuffer}.
     * @return The gate edge.
     */
    Edge makeGateDD(GateMatrix matrix, int nqubits, LineBuffer line);

    /**
     * Multiplies two edges. The result applies {@code right} first, then {@code left}.
     * @param left The left operand.
     * @param right The right operand.
     * @return The product edge.
     */
    Edge multiply(Edge left, Edge right);

    void incRef(Edge edge);

    void decRef(Edge edge);

    /**
     * Frees all nodes that are no longer referenced.
     */
    void garbageCollect();

    /**
     * Switches matrix normalization on or off.
     * @param enabled true to normalize matrix edges.
     */
    void useMatrixNormalization(boolean enabled);

    boolean isTerminal(Edge edge);
}
